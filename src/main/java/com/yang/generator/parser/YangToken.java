package com.yang.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the YANG tokenizer.
 */
@Data
@AllArgsConstructor
public class YangToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        /** Unquoted string: keywords and simple arguments. */
        STRING,
        QUOTED_STRING,
        PLUS,
        LBRACE,
        RBRACE,
        SEMICOLON,
        EOF
    }

    public boolean is(TokenType t) {
        return type == t;
    }
}
