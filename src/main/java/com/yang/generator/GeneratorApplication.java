package com.yang.generator;

import com.yang.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point of the YANG to Rust type generator.
 * Reads YANG modules and writes serde-annotated Rust structs, enums and type aliases.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
