package com.yang.generator.model;

import java.util.Optional;

/**
 * Schema node kinds the generator understands.
 */
public enum NodeKind {
    CONTAINER("container"),
    LIST("list"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    CHOICE("choice"),
    CASE("case"),
    TYPEDEF("typedef"),
    IDENTITY("identity");

    private final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Data definition kinds that may appear inside a container, list or case.
     */
    public boolean isDataDefinition() {
        return this == CONTAINER || this == LIST || this == LEAF || this == LEAF_LIST || this == CHOICE;
    }

    public static Optional<NodeKind> fromKeyword(String keyword) {
        for (NodeKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
