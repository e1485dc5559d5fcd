package com.yang.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    /** Written file, or null when the code went to standard output. */
    private Path outputPath;

    /** Generated Rust source. */
    private String content;

    private int modulesLoaded;
    private int enumsGenerated;
    private int aliasesGenerated;
    private int structsGenerated;
    private int definitionsSkipped;
    private long generationTimeMillis;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult failure(String errorMessage, List<String> warnings) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .warnings(new ArrayList<>(warnings))
                .build();
    }
}
