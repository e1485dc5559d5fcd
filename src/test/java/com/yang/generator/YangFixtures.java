package com.yang.generator;

import java.util.ArrayList;
import java.util.List;

import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.model.core.context.GeneratorConfig;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.rust.RustTypeGenerator;
import com.yang.generator.codegen.yang.service.DefinitionRegistrationService;
import com.yang.generator.codegen.yang.service.ModuleDependencies;
import com.yang.generator.codegen.yang.service.ModuleDependencyResolverService;
import com.yang.generator.codegen.yang.service.SchemaPathNavigator;
import com.yang.generator.codegen.yang.service.SchemaTreeBuilderService;
import com.yang.generator.codegen.yang.service.SchemaTreeVisitorService;
import com.yang.generator.model.Statement;
import com.yang.generator.model.YangModule;
import com.yang.generator.parser.YangParser;

/**
 * Shared helpers for tests that start from inline YANG text.
 */
public final class YangFixtures {

    /** Minimal stand-in for the IETF inet types module. */
    public static final String INET_TYPES = """
            module ietf-inet-types {
              namespace "urn:ietf:params:xml:ns:yang:ietf-inet-types";
              prefix inet;

              typedef as-number {
                type uint32;
              }
              typedef ip-address {
                type union {
                  type string;
                }
              }
              typedef port-number {
                type uint16;
              }
              typedef domain-name {
                type string;
              }
              typedef ip-version {
                type enumeration {
                  enum unknown;
                  enum ipv4;
                  enum ipv6;
                }
              }
            }
            """;

    private YangFixtures() {
    }

    public static List<Statement> parse(String... sources) {
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            statements.add(YangParser.parse(sources[i], "fixture-" + i + ".yang"));
        }
        return statements;
    }

    public static List<YangModule> build(ToolDiagnostics diagnostics, String... sources) {
        return new SchemaTreeBuilderService(diagnostics).build(parse(sources));
    }

    public static GeneratorConfig config() {
        return GeneratorConfig.builder().copyrightYear(2024).build();
    }

    /**
     * Context with registries filled the way a generation run fills them, ready for
     * resolution and emission.
     */
    public static GenerationContext prepare(List<YangModule> modules, GeneratorConfig config,
                                            ToolDiagnostics diagnostics) {
        ModuleDependencies dependencies = new ModuleDependencyResolverService()
                .resolve(modules, config.getExcludedModules(), diagnostics);
        GenerationContext ctx = GenerationContext.builder()
                .config(config)
                .diagnostics(diagnostics)
                .dependencies(dependencies)
                .navigator(new SchemaPathNavigator(dependencies.getModulesByName()))
                .build();

        DefinitionRegistrationService registration = new DefinitionRegistrationService();
        for (YangModule module : dependencies.getResolutionOrder()) {
            registration.registerModule(module, ctx);
        }
        SchemaTreeVisitorService visitor = new SchemaTreeVisitorService();
        for (YangModule module : dependencies.getEmissionOrder()) {
            visitor.visitModule(module, ctx);
        }
        return ctx;
    }

    public static GenerationContext prepare(ToolDiagnostics diagnostics, String... sources) {
        return prepare(build(diagnostics, sources), config(), diagnostics);
    }

    public static String generate(ToolDiagnostics diagnostics, String... sources) {
        return new RustTypeGenerator(config(), diagnostics).generate(build(diagnostics, sources));
    }
}
