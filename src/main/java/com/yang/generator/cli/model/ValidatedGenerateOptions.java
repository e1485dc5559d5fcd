package com.yang.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Options after validation: absolute paths, search directories completed with the module
 * directories, copyright year resolved.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    List<Path> inputFiles;
    List<Path> searchDirs;

    /** Normalized output file, or null for standard output. */
    Path outputFile;

    int copyrightYear;
}
