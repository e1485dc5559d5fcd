package com.yang.generator.codegen.rust;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.model.core.context.GenerationStats;
import com.yang.generator.codegen.model.core.context.GeneratorConfig;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.resolver.TypeResolver;
import com.yang.generator.codegen.yang.service.DefinitionRegistrationService;
import com.yang.generator.codegen.yang.service.ModuleDependencies;
import com.yang.generator.codegen.yang.service.ModuleDependencyResolverService;
import com.yang.generator.codegen.yang.service.SchemaPathNavigator;
import com.yang.generator.codegen.yang.service.SchemaTreeVisitorService;
import com.yang.generator.model.YangModule;

/**
 * Translates linked YANG modules into Rust source text.
 *
 * Every call builds a fresh {@link GenerationContext}; nothing is shared between calls.
 */
public class RustTypeGenerator {
    private static final Logger log = LoggerFactory.getLogger(RustTypeGenerator.class);

    private final GeneratorConfig config;
    private final ToolDiagnostics diagnostics;
    private final ModuleDependencyResolverService dependencyResolver = new ModuleDependencyResolverService();
    private final DefinitionRegistrationService registrationService = new DefinitionRegistrationService();
    private final SchemaTreeVisitorService visitorService = new SchemaTreeVisitorService();
    private final HeaderGenerator headerGenerator = new HeaderGenerator();

    private GenerationStats lastStats;

    public RustTypeGenerator(GeneratorConfig config, ToolDiagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public String generate(List<YangModule> modules) {
        long start = System.currentTimeMillis();

        ModuleDependencies dependencies = dependencyResolver.resolve(modules, config.getExcludedModules(), diagnostics);
        GenerationContext ctx = GenerationContext.builder()
                .config(config)
                .diagnostics(diagnostics)
                .dependencies(dependencies)
                .navigator(new SchemaPathNavigator(dependencies.getModulesByName()))
                .build();

        for (YangModule module : dependencies.getResolutionOrder()) {
            registrationService.registerModule(module, ctx);
        }
        for (YangModule module : dependencies.getEmissionOrder()) {
            visitorService.visitModule(module, ctx);
        }
        log.info("Registered {} struct candidates", ctx.getStructRegistry().size());

        RustEmitter emitter = new RustEmitter(ctx, new TypeResolver(ctx), headerGenerator);
        String output = emitter.emit();

        lastStats = emitter.stats(modules.size()).toBuilder()
                .generationTimeMillis(System.currentTimeMillis() - start)
                .build();
        return output;
    }

    /** Statistics of the most recent {@link #generate} call, or null. */
    public GenerationStats getLastStats() {
        return lastStats;
    }
}
