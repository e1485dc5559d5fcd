package com.yang.generator.codegen.exception;

/**
 * Output could not be produced (template or IO failure).
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
