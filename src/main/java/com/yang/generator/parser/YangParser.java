package com.yang.generator.parser;

import com.yang.generator.model.Statement;
import com.yang.generator.parser.YangToken.TokenType;
import com.yang.generator.parser.exception.YangParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parser for YANG files.
 * Converts tokens into a generic statement tree.
 *
 * Parsing only: it does not link imports, expand groupings or interpret types.
 */
public class YangParser {
    private static final Logger log = LoggerFactory.getLogger(YangParser.class);

    private final List<YangToken> tokens;
    private final String fileName;
    private int pos = 0;

    public YangParser(List<YangToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    /**
     * Convenience entry point: tokenize and parse YANG text.
     */
    public static Statement parse(String source, String fileName) {
        List<YangToken> tokens = new YangTokenizer(source, fileName).tokenize();
        return new YangParser(tokens, fileName).parse();
    }

    /**
     * Parse exactly one top-level {@code module} or {@code submodule} statement.
     */
    public Statement parse() {
        if (check(TokenType.EOF)) {
            throw new YangParseException(fileName, peek().getLine(), "empty YANG file");
        }

        Statement root = parseStatement(null);
        if (!"module".equals(root.getKeyword()) && !"submodule".equals(root.getKeyword())) {
            throw new YangParseException(fileName, root.getLine(),
                    "expected 'module' or 'submodule' but found '" + root.getKeyword() + "'");
        }
        if (!check(TokenType.EOF)) {
            throw new YangParseException(fileName, peek().getLine(),
                    "unexpected content after " + root.getKeyword() + " " + root.getArgument());
        }

        log.debug("Parsed {} {} from {}", root.getKeyword(), root.getArgument(), fileName);
        return root;
    }

    private Statement parseStatement(Statement parent) {
        YangToken keywordToken = advance();
        if (!keywordToken.is(TokenType.STRING)) {
            throw new YangParseException(fileName, keywordToken.getLine(),
                    "expected a keyword but found '" + keywordToken.getValue() + "'");
        }

        Statement stmt = Statement.builder()
                .keyword(keywordToken.getValue())
                .sourceFile(fileName)
                .line(keywordToken.getLine())
                .build();
        if (parent != null) {
            parent.addSubstatement(stmt);
        }

        if (check(TokenType.STRING) || check(TokenType.QUOTED_STRING)) {
            stmt.setArgument(parseArgument());
        }

        if (match(TokenType.SEMICOLON)) {
            return stmt;
        }

        if (match(TokenType.LBRACE)) {
            while (!check(TokenType.RBRACE)) {
                if (check(TokenType.EOF)) {
                    throw new YangParseException(fileName, keywordToken.getLine(),
                            "missing '}' for " + stmt.getKeyword() + " " + nullToEmpty(stmt.getArgument()));
                }
                parseStatement(stmt);
            }
            advance();
            return stmt;
        }

        throw new YangParseException(fileName, peek().getLine(),
                "expected ';' or '{' after " + stmt.getKeyword() + " but found '" + peek().getValue() + "'");
    }

    private String parseArgument() {
        YangToken first = advance();
        if (first.is(TokenType.STRING)) {
            return first.getValue();
        }

        StringBuilder sb = new StringBuilder(first.getValue());
        while (match(TokenType.PLUS)) {
            YangToken next = advance();
            if (!next.is(TokenType.QUOTED_STRING)) {
                throw new YangParseException(fileName, next.getLine(), "expected a quoted string after '+'");
            }
            sb.append(next.getValue());
        }
        return sb.toString();
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private YangToken peek() {
        return tokens.get(pos);
    }

    private YangToken advance() {
        YangToken token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
