package com.yang.generator.codegen;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.mapper.YangToRustTypeMapper;
import com.yang.generator.codegen.model.core.context.GenerationStats;
import com.yang.generator.codegen.model.core.context.GeneratorConfig;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.rust.RustTypeGenerator;
import com.yang.generator.codegen.util.FileWriteUtil;
import com.yang.generator.codegen.yang.service.SchemaTreeBuilderService;
import com.yang.generator.model.Statement;
import com.yang.generator.model.YangModule;
import com.yang.generator.parser.ModuleResolver;

/**
 * Runs a full generation: load modules, build schema trees, generate Rust, write output.
 */
public class RustBindingGenerator {
    private static final Logger log = LoggerFactory.getLogger(RustBindingGenerator.class);

    private final GeneratorConfig config;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    public RustBindingGenerator(GeneratorConfig config) {
        this.config = config;
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting Rust type generation...");

            // Step 1: Load modules
            log.info("Step 1: Loading YANG modules...");
            ModuleResolver resolver = new ModuleResolver(config.getSearchDirs());
            List<Statement> statements = resolver.loadModules(config.getInputFiles(), diagnostics);
            if (statements.isEmpty()) {
                return GeneratorResult.failure("No YANG modules loaded from " + config.getInputFiles(),
                        diagnostics.getWarnings());
            }

            // Step 2: Build schema trees
            log.info("Step 2: Building schema trees for {} modules...", statements.size());
            List<YangModule> modules = new SchemaTreeBuilderService(diagnostics).build(statements);

            // Step 3: Generate Rust source
            log.info("Step 3: Generating Rust types (type tables v{})...", YangToRustTypeMapper.TABLE_VERSION);
            RustTypeGenerator generator = new RustTypeGenerator(config, diagnostics);
            String content = generator.generate(modules);
            GenerationStats stats = generator.getLastStats();

            if (config.isFailOnWarnings() && diagnostics.hasWarnings()) {
                return GeneratorResult.failure(diagnostics.getWarnings().size()
                        + " warning(s) reported and --fail-on-warnings is set", diagnostics.getWarnings());
            }

            // Step 4: Write output
            Path outputPath = config.getOutputFile();
            if (outputPath != null) {
                log.info("Step 4: Writing {}...", outputPath);
                if (Files.exists(outputPath) && !config.isForce()) {
                    return GeneratorResult.failure("Output file already exists: " + outputPath
                            + ". Use --force to overwrite.", diagnostics.getWarnings());
                }
                FileWriteUtil.writeReplacing(outputPath, content);
            }

            log.info("Rust type generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .content(content)
                    .modulesLoaded(modules.size())
                    .enumsGenerated(stats.getEnumCount())
                    .aliasesGenerated(stats.getAliasCount())
                    .structsGenerated(stats.getStructCount())
                    .definitionsSkipped(stats.getSkippedCount())
                    .generationTimeMillis(stats.getGenerationTimeMillis())
                    .warnings(diagnostics.getWarnings())
                    .build();

        } catch (Exception e) {
            log.error("Generation failed", e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            diagnostics.error(reason);
            return GeneratorResult.failure(reason, diagnostics.getWarnings());
        }
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
