package com.yang.generator.model;

/**
 * Visitor over {@link SchemaNode} kinds. Unhandled kinds fall back to {@link #visitDefault}.
 */
public interface SchemaNodeVisitor<R> {

    R visitDefault(SchemaNode node);

    default R visitContainer(SchemaNode container) {
        return visitDefault(container);
    }

    default R visitList(SchemaNode list) {
        return visitDefault(list);
    }

    default R visitLeaf(SchemaNode leaf) {
        return visitDefault(leaf);
    }

    default R visitLeafList(SchemaNode leafList) {
        return visitDefault(leafList);
    }

    default R visitChoice(SchemaNode choice) {
        return visitDefault(choice);
    }

    default R visitCase(SchemaNode caseNode) {
        return visitDefault(caseNode);
    }

    default R visitTypedef(SchemaNode typedef) {
        return visitDefault(typedef);
    }

    default R visitIdentity(SchemaNode identity) {
        return visitDefault(identity);
    }
}
