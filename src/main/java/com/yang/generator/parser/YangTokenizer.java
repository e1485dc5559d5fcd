package com.yang.generator.parser;

import com.yang.generator.parser.YangToken.TokenType;
import com.yang.generator.parser.exception.YangParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for YANG module source files.
 */
public class YangTokenizer {
    private static final Logger log = LoggerFactory.getLogger(YangTokenizer.class);

    private static final int TAB_WIDTH = 8;

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public YangTokenizer(String source, String fileName) {
        this.source = source.replace("\r\n", "\n");
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file.
     */
    public List<YangToken> tokenize() {
        List<YangToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new YangToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {}: {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                int startLine = line;
                advance();
                advance();
                while (pos < source.length() && !(source.charAt(pos) == '*' && peekAt(1) == '/')) {
                    advance();
                }
                if (pos >= source.length()) {
                    throw new YangParseException(fileName, startLine, "unterminated block comment");
                }
                advance();
                advance();
            } else {
                break;
            }
        }
    }

    private YangToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '{' -> {
                advance();
                return new YangToken(TokenType.LBRACE, "{", startLine, startCol);
            }
            case '}' -> {
                advance();
                return new YangToken(TokenType.RBRACE, "}", startLine, startCol);
            }
            case ';' -> {
                advance();
                return new YangToken(TokenType.SEMICOLON, ";", startLine, startCol);
            }
            case '"' -> {
                return readDoubleQuoted(startLine, startCol);
            }
            case '\'' -> {
                return readSingleQuoted(startLine, startCol);
            }
            default -> {
                if (c == '+' && isConcatenationPlus()) {
                    advance();
                    return new YangToken(TokenType.PLUS, "+", startLine, startCol);
                }
                return readUnquoted(startLine, startCol);
            }
        }
    }

    private boolean isConcatenationPlus() {
        char next = peekAt(1);
        return next == '\0' || Character.isWhitespace(next) || next == '"' || next == '\'';
    }

    private YangToken readUnquoted(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == ';' || c == '{' || c == '}' || c == '"' || c == '\'') {
                break;
            }
            sb.append(c);
            advance();
        }
        return new YangToken(TokenType.STRING, sb.toString(), startLine, startCol);
    }

    private YangToken readSingleQuoted(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advance();
        while (pos < source.length() && source.charAt(pos) != '\'') {
            sb.append(source.charAt(pos));
            advance();
        }
        if (pos >= source.length()) {
            throw new YangParseException(fileName, startLine, "unterminated single-quoted string");
        }
        advance();
        return new YangToken(TokenType.QUOTED_STRING, sb.toString(), startLine, startCol);
    }

    /**
     * Double-quoted strings: escapes are decoded, whitespace before a line break is dropped
     * and continuation lines lose their indentation up to the column of the opening quote.
     */
    private YangToken readDoubleQuoted(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        int quoteColumn = startCol;
        advance();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '"') {
                advance();
                return new YangToken(TokenType.QUOTED_STRING, sb.toString(), startLine, startCol);
            }

            if (c == '\\') {
                char next = peekAt(1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> throw new YangParseException(fileName, line, "illegal escape sequence \\" + next);
                }
                advance();
                advance();
                continue;
            }

            if (c == '\n') {
                stripTrailingBlanks(sb);
                sb.append('\n');
                advance();
                skipIndentation(quoteColumn);
                continue;
            }

            sb.append(c);
            advance();
        }

        throw new YangParseException(fileName, startLine, "unterminated double-quoted string");
    }

    private void skipIndentation(int quoteColumn) {
        while (pos < source.length() && column <= quoteColumn) {
            char c = source.charAt(pos);
            if (c != ' ' && c != '\t') {
                return;
            }
            advance();
        }
    }

    private static void stripTrailingBlanks(StringBuilder sb) {
        int len = sb.length();
        while (len > 0 && (sb.charAt(len - 1) == ' ' || sb.charAt(len - 1) == '\t')) {
            len--;
        }
        sb.setLength(len);
    }

    private char peekAt(int offset) {
        int idx = pos + offset;
        return idx < source.length() ? source.charAt(idx) : '\0';
    }

    private void advance() {
        char c = source.charAt(pos);
        pos++;
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\t') {
            column += TAB_WIDTH - ((column - 1) % TAB_WIDTH);
        } else {
            column++;
        }
    }
}
