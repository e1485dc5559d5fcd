package com.yang.generator.codegen.registry;

import com.yang.generator.codegen.model.NodeFacts;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;

import lombok.Value;

/**
 * A container, list or non-collapsed choice registered as a struct.
 */
@Value
public class StructCandidate {
    StructKey key;
    SchemaNode node;
    NodeFacts facts;

    public int childCount() {
        return facts.getEffectiveChildren().size();
    }

    /**
     * A container or choice whose sole child is a list is inlined at its use sites as a
     * sequence of the list type. Lists are always emitted.
     */
    public boolean isElided() {
        return !node.is(NodeKind.LIST) && facts.hasSoleListChild();
    }

    public String getTypeName() {
        return facts.getTypeName();
    }
}
