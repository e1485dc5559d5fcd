package com.yang.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int moduleCount;
    int enumCount;
    int aliasCount;
    int structCount;
    int skippedCount;

    long generationTimeMillis;
}
