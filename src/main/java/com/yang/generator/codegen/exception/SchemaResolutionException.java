package com.yang.generator.codegen.exception;

/**
 * A reference in the schema could not be resolved: unknown typedef, identity, grouping,
 * struct key or leafref target, or a cyclic import graph. Terminates the run.
 */
public class SchemaResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaResolutionException(String message) {
        super(message);
    }
}
