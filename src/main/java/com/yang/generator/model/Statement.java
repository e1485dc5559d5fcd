package com.yang.generator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A raw YANG statement: keyword, optional argument and nested substatements.
 * Produced by the parser; the schema tree builder turns it into {@link SchemaNode}s.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(of = {"keyword", "argument", "line"})
public class Statement {
    private String keyword;
    private String argument;
    private List<Statement> substatements = new ArrayList<>();
    private Statement parent;
    private String sourceFile;
    private int line;

    @Builder
    public Statement(String keyword, String argument, List<Statement> substatements,
                     Statement parent, String sourceFile, int line) {
        this.keyword = keyword;
        this.argument = argument;
        this.substatements = substatements != null ? substatements : new ArrayList<>();
        this.parent = parent;
        this.sourceFile = sourceFile;
        this.line = line;
    }

    public void addSubstatement(Statement child) {
        substatements.add(child);
        child.setParent(this);
    }

    public Optional<Statement> findFirst(String kw) {
        for (Statement s : substatements) {
            if (kw.equals(s.getKeyword())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public List<Statement> findAll(String kw) {
        List<Statement> result = new ArrayList<>();
        for (Statement s : substatements) {
            if (kw.equals(s.getKeyword())) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * Argument of the first substatement with the given keyword, or null.
     */
    public String argumentOf(String kw) {
        return findFirst(kw).map(Statement::getArgument).orElse(null);
    }

    /**
     * The enclosing module (or submodule) statement.
     */
    public Statement root() {
        Statement current = this;
        while (current.getParent() != null) {
            current = current.getParent();
        }
        return current;
    }

    public String location() {
        return (sourceFile != null ? sourceFile : "<unknown>") + ":" + line;
    }
}
