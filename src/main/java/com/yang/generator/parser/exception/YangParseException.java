package com.yang.generator.parser.exception;

/**
 * Raised when YANG text does not follow the statement grammar.
 */
public class YangParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public YangParseException(String message) {
        super(message);
    }

    public YangParseException(String fileName, int line, String message) {
        super(fileName + ":" + line + ": " + message);
    }
}
