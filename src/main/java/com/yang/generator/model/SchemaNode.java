package com.yang.generator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the expanded schema tree.
 *
 * <p>{@code module} is the module the node is instantiated in (the module whose tree
 * contains it); {@code originModule} is the module whose text declared the statement.
 * They differ for nodes expanded from another module's grouping or added by an augment.
 *
 * <p>Nodes are not annotated during generation: derived facts live in
 * {@code GenerationContext} keyed by node identity. Equality is identity.
 */
@Getter
@Setter
@ToString(of = {"kind", "name"})
public class SchemaNode {
    private NodeKind kind;
    private String name;
    private YangModule module;
    private YangModule originModule;
    private SchemaNode parent;
    private List<SchemaNode> children = new ArrayList<>();
    private TypeStatement type;
    private String description;
    private String key;
    private List<String> bases = new ArrayList<>();
    private String defaultValue;
    private Statement statement;

    @Builder
    public SchemaNode(NodeKind kind, String name, YangModule module, YangModule originModule,
                      SchemaNode parent, TypeStatement type, String description, String key,
                      List<String> bases, String defaultValue, Statement statement) {
        this.kind = kind;
        this.name = name;
        this.module = module;
        this.originModule = originModule != null ? originModule : module;
        this.parent = parent;
        this.type = type;
        this.description = description;
        this.key = key;
        this.bases = bases != null ? bases : new ArrayList<>();
        this.defaultValue = defaultValue;
        this.statement = statement;
    }

    public void addChild(SchemaNode child) {
        children.add(child);
        child.setParent(this);
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Key leaf names of a list, in declaration order.
     */
    public List<String> getKeyNames() {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        return List.of(key.trim().split("\\s+"));
    }

    public <R> R accept(SchemaNodeVisitor<R> visitor) {
        return switch (kind) {
            case CONTAINER -> visitor.visitContainer(this);
            case LIST -> visitor.visitList(this);
            case LEAF -> visitor.visitLeaf(this);
            case LEAF_LIST -> visitor.visitLeafList(this);
            case CHOICE -> visitor.visitChoice(this);
            case CASE -> visitor.visitCase(this);
            case TYPEDEF -> visitor.visitTypedef(this);
            case IDENTITY -> visitor.visitIdentity(this);
        };
    }
}
