package com.yang.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.cli.model.GenerateOptions;
import com.yang.generator.cli.model.ValidatedGenerateOptions;
import com.yang.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the generate command.
 * No validation, no execution. Everything goes through the logger (stderr), so generated
 * code on standard output stays clean.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("YANG to Rust Type Generator");
        log.info("=================================================");
        log.info("Modules: {}", v.getInputFiles());
        log.info("Search Directories: {}", v.getSearchDirs());
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        if (!o.getExcludedModules().isEmpty()) {
            log.info("Extra Excluded Modules: {}", o.getExcludedModules());
        }
        if (!o.getExcludedPaths().isEmpty()) {
            log.info("Extra Excluded Paths: {}", o.getExcludedPaths());
        }
        if (!o.getExcludedTypedefs().isEmpty()) {
            log.info("Extra Excluded Typedefs: {}", o.getExcludedTypedefs());
        }
        log.info("Copyright: {} {}", v.getCopyrightYear(), o.getCopyrightHolder());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        log.info("Modules Loaded: {}", result.getModulesLoaded());
        log.info("Enums Generated: {}", result.getEnumsGenerated());
        log.info("Type Aliases Generated: {}", result.getAliasesGenerated());
        log.info("Structs Generated: {}", result.getStructsGenerated());
        if (result.getDefinitionsSkipped() > 0) {
            log.info("Duplicate Definitions Skipped: {}", result.getDefinitionsSkipped());
        }
        log.info("Generation Time: {} ms", result.getGenerationTimeMillis());
        printWarnings(result);
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        printWarnings(result);
    }

    private void printWarnings(GeneratorResult result) {
        if (result.getWarnings() == null || result.getWarnings().isEmpty()) {
            return;
        }
        log.warn("");
        log.warn("Warnings ({}):", result.getWarnings().size());
        for (String warning : result.getWarnings()) {
            log.warn("  {}", warning);
        }
    }
}
