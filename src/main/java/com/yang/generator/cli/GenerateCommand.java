package com.yang.generator.cli;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.cli.exception.OptionsValidationException;
import com.yang.generator.cli.model.GenerateOptions;
import com.yang.generator.cli.model.ValidatedGenerateOptions;
import com.yang.generator.cli.output.GenerateResultsPrinter;
import com.yang.generator.cli.validation.GenerateOptionsValidator;
import com.yang.generator.codegen.GeneratorResult;
import com.yang.generator.codegen.RustBindingGenerator;
import com.yang.generator.codegen.model.core.context.GeneratorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command translating YANG modules into serde-annotated Rust types.
 */
@Command(
        name = "yang2rust",
        mixinStandardHelpOptions = true,
        version = "yang-rust-generator 1.0.0",
        description = "Generates Rust structs, enums and type aliases (serde) from YANG modules."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            GeneratorResult result = new RustBindingGenerator(toConfig(validated)).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            if (validated.getOutputFile() == null) {
                PrintWriter out = spec.commandLine().getOut();
                out.print(result.getContent());
                out.flush();
            }
            printer.printSuccess(validated, result);
            return 0;

        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private GeneratorConfig toConfig(ValidatedGenerateOptions v) {
        return GeneratorConfig.builder()
                .inputFiles(v.getInputFiles())
                .searchDirs(v.getSearchDirs())
                .outputFile(v.getOutputFile())
                .force(options.isForce())
                .failOnWarnings(options.isFailOnWarnings())
                .excludedModules(merge(GeneratorConfig.DEFAULT_EXCLUDED_MODULES, options.getExcludedModules()))
                .excludedPaths(merge(GeneratorConfig.DEFAULT_EXCLUDED_PATHS, options.getExcludedPaths()))
                .excludedTypedefs(merge(GeneratorConfig.DEFAULT_EXCLUDED_TYPEDEFS, options.getExcludedTypedefs()))
                .copyrightHolder(options.getCopyrightHolder())
                .copyrightYear(v.getCopyrightYear())
                .build();
    }

    private static List<String> merge(List<String> defaults, List<String> extra) {
        List<String> merged = new ArrayList<>(defaults);
        for (String value : extra) {
            if (!merged.contains(value)) {
                merged.add(value);
            }
        }
        return merged;
    }
}
