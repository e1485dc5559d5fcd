package com.yang.generator.codegen.yang.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.model.YangModule;

import lombok.NoArgsConstructor;

/**
 * Orders modules so that each one follows everything it imports, and builds the prefix
 * alias map used for cross-module lookups.
 *
 * Traversal is depth-first, starting from the modules sorted by name, following imports in
 * statement order. The result therefore depends only on the import graph.
 */
@NoArgsConstructor
public class ModuleDependencyResolverService {
    private static final Logger log = LoggerFactory.getLogger(ModuleDependencyResolverService.class);

    public ModuleDependencies resolve(List<YangModule> modules,
                                      Collection<String> excludedModules,
                                      ToolDiagnostics diagnostics) {
        Map<String, YangModule> byName = new LinkedHashMap<>();
        Map<String, YangModule> byPrefix = new LinkedHashMap<>();
        for (YangModule module : modules) {
            byName.put(module.getName(), module);
            YangModule previous = byPrefix.putIfAbsent(module.getPrefix(), module);
            if (previous != null) {
                diagnostics.warn("Modules " + previous.getName() + " and " + module.getName()
                        + " share the prefix '" + module.getPrefix() + "'");
            }
        }

        List<YangModule> roots = new ArrayList<>(modules);
        roots.sort(Comparator.comparing(YangModule::getName));

        List<YangModule> order = new ArrayList<>();
        Set<YangModule> visited = new HashSet<>();
        LinkedHashSet<YangModule> inProgress = new LinkedHashSet<>();
        Set<String> reportedMissing = new HashSet<>();

        for (YangModule root : roots) {
            visit(root, byName, visited, inProgress, order, reportedMissing, diagnostics);
        }

        List<YangModule> emission = order.stream()
                .filter(m -> excludedModules == null || !excludedModules.contains(m.getName()))
                .toList();

        Map<String, String> aliases = new LinkedHashMap<>();
        Map<String, Set<String>> aliasesByModule = new LinkedHashMap<>();
        for (YangModule module : order) {
            registerAlias(aliases, aliasesByModule, module.getPrefix(), module, diagnostics);
        }
        for (YangModule module : order) {
            module.getImports().forEach((alias, importedName) -> {
                YangModule imported = byName.get(importedName);
                if (imported != null) {
                    registerAlias(aliases, aliasesByModule, alias, imported, diagnostics);
                }
            });
        }

        log.info("Module resolution order: {}", order.stream().map(YangModule::getName).toList());
        log.info("Module emission order: {}", emission.stream().map(YangModule::getName).toList());

        return ModuleDependencies.builder()
                .resolutionOrder(List.copyOf(order))
                .emissionOrder(emission)
                .aliases(aliases)
                .aliasesByModule(aliasesByModule)
                .modulesByName(byName)
                .modulesByPrefix(byPrefix)
                .build();
    }

    private void visit(YangModule module,
                       Map<String, YangModule> byName,
                       Set<YangModule> visited,
                       LinkedHashSet<YangModule> inProgress,
                       List<YangModule> order,
                       Set<String> reportedMissing,
                       ToolDiagnostics diagnostics) {
        if (visited.contains(module)) {
            return;
        }
        if (inProgress.contains(module)) {
            throw new SchemaResolutionException("Cyclic import detected: " + describeCycle(inProgress, module));
        }

        inProgress.add(module);
        for (String importedName : module.getImports().values()) {
            YangModule imported = byName.get(importedName);
            if (imported == null) {
                if (reportedMissing.add(module.getName() + "->" + importedName)) {
                    diagnostics.warn("Module " + module.getName() + " imports " + importedName
                            + " which was not loaded; its definitions are unavailable");
                }
                continue;
            }
            if (imported != module) {
                visit(imported, byName, visited, inProgress, order, reportedMissing, diagnostics);
            }
        }
        inProgress.remove(module);

        visited.add(module);
        order.add(module);
    }

    private static String describeCycle(LinkedHashSet<YangModule> inProgress, YangModule repeated) {
        List<String> names = new ArrayList<>();
        boolean inCycle = false;
        for (YangModule m : inProgress) {
            if (m == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                names.add(m.getName());
            }
        }
        names.add(repeated.getName());
        return String.join(" -> ", names);
    }

    private static void registerAlias(Map<String, String> aliases,
                                      Map<String, Set<String>> aliasesByModule,
                                      String alias,
                                      YangModule module,
                                      ToolDiagnostics diagnostics) {
        String existing = aliases.putIfAbsent(alias, module.getPrefix());
        if (existing != null && !existing.equals(module.getPrefix())) {
            String msg = "Prefix alias '" + alias + "' names both '" + existing + "' and '"
                    + module.getPrefix() + "'; keeping '" + existing + "' for global lookups";
            diagnostics.warn(msg);
            log.warn(msg);
        }
        aliasesByModule.computeIfAbsent(module.getName(), k -> new LinkedHashSet<>()).add(alias);
    }
}
