package com.yang.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.model.Statement;

/**
 * Loads YANG module files and follows their {@code import} statements through the
 * configured search directories.
 *
 * Diagnostics are written to ToolDiagnostics (not to models).
 */
public class ModuleResolver {
    private static final Logger log = LoggerFactory.getLogger(ModuleResolver.class);

    private static final String YANG_EXTENSION = ".yang";

    private final List<Path> searchDirs;

    /** Parsed modules by module name, in load order. */
    private final Map<String, Statement> parsedModules = new LinkedHashMap<>();

    public ModuleResolver(List<Path> searchDirs) {
        this.searchDirs = (searchDirs != null) ? searchDirs : List.of();
    }

    /**
     * Load and parse the given files, then load every module they import (transitively).
     *
     * @return module statements in load order: requested files first, imports after
     */
    public List<Statement> loadModules(List<Path> files, ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(diagnostics, "diagnostics");

        List<Statement> requested = new ArrayList<>();
        for (Path file : files) {
            Statement module = loadModule(file, diagnostics);
            if (module != null) {
                requested.add(module);
            }
        }

        for (Statement module : requested) {
            resolveImports(module, diagnostics);
        }

        return new ArrayList<>(parsedModules.values());
    }

    /**
     * Load and parse a single module file. Uses cache if the module was already parsed.
     * Submodules are reported and skipped.
     */
    public Statement loadModule(Path path, ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(path, "path");

        String content = Files.readString(path);
        String fileName = path.getFileName().toString();

        log.info("Parsing module file: {}", fileName);
        Statement root = YangParser.parse(content, fileName);

        if ("submodule".equals(root.getKeyword())) {
            diagnostics.warn("Submodule " + root.getArgument() + " (" + fileName
                    + ") is not supported and was skipped");
            return null;
        }

        Statement cached = parsedModules.get(root.getArgument());
        if (cached != null) {
            log.debug("Module {} already loaded, ignoring {}", root.getArgument(), fileName);
            return cached;
        }

        parsedModules.put(root.getArgument(), root);
        return root;
    }

    /**
     * Resolve {@code import} statements for a module. Recursively parses missing modules.
     */
    private void resolveImports(Statement module, ToolDiagnostics diagnostics) throws IOException {
        for (Statement imp : module.findAll("import")) {
            String importedName = imp.getArgument();
            if (importedName == null || importedName.isBlank()) {
                diagnostics.warn("import with blank module name at " + imp.location());
                continue;
            }
            if (parsedModules.containsKey(importedName)) {
                continue;
            }

            Path resolvedPath = findModule(importedName);
            if (resolvedPath == null) {
                String msg = String.format(
                        "Imported module '%s' referenced from %s was not found. Provide it with --path",
                        importedName, imp.location());
                diagnostics.warn(msg);
                log.warn(msg);
                continue;
            }

            Statement referenced = loadModule(resolvedPath, diagnostics);
            log.info("Resolved import {} -> {}", importedName, resolvedPath);
            if (referenced != null) {
                resolveImports(referenced, diagnostics);
            }
        }
    }

    /**
     * Find a module file by name in the search directories. {@code name.yang} is preferred;
     * otherwise the latest {@code name@revision.yang}.
     */
    public Path findModule(String name) throws IOException {
        if (name == null || name.isBlank()) return null;

        for (Path dir : searchDirs) {
            Path found = searchDirectory(dir, name);
            if (found != null) return found;
        }
        return null;
    }

    private Path searchDirectory(Path dir, String name) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            return null;
        }

        Path exact = dir.resolve(name + YANG_EXTENSION);
        if (Files.exists(exact)) return exact;

        String revisionPrefix = name + "@";
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String fileName = p.getFileName().toString();
                        return fileName.startsWith(revisionPrefix) && fileName.endsWith(YANG_EXTENSION);
                    })
                    .max((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .orElse(null);
        }
    }
}
