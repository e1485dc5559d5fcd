package com.yang.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;

import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;

import lombok.Builder;
import lombok.Data;

/**
 * Facts derived for a schema node while visiting it.
 */
@Data
@Builder
public class NodeFacts {

    /** Name after the config/state and graceful-restart disambiguation rules. */
    private String uniqueName;

    /** Structural path, {@code /prefix:name/...}. */
    private String path;

    /** Rust type name for containers, lists and choices. */
    private String typeName;

    /** Prefix of the module whose text declared the node. */
    private String originPrefix;

    /** Children as fields: a choice's cases are flattened away. */
    @Builder.Default
    private List<SchemaNode> effectiveChildren = new ArrayList<>();

    /** True when every flattened child of a choice is an {@code empty} leaf. */
    private boolean enumChoice;

    public boolean hasSoleListChild() {
        return effectiveChildren.size() == 1
                && effectiveChildren.get(0).is(NodeKind.LIST);
    }
}
