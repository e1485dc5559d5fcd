package com.yang.generator.codegen.registry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.yang.generator.model.SchemaNode;

import lombok.Getter;

/**
 * Identity registry entry with the identities derived directly from it.
 */
@Getter
public class IdentityDefinition {
    private final String name;
    private final String typeName;
    private final String prefix;
    private final SchemaNode node;
    private final List<IdentityDefinition> derived = new ArrayList<>();

    public IdentityDefinition(String name, String typeName, String prefix, SchemaNode node) {
        this.name = name;
        this.typeName = typeName;
        this.prefix = prefix;
        this.node = node;
    }

    public void addDerived(IdentityDefinition identity) {
        if (!derived.contains(identity)) {
            derived.add(identity);
        }
    }

    /**
     * All identities derived from this one, directly or not: depth first, each once.
     */
    public List<IdentityDefinition> descendants() {
        Set<IdentityDefinition> result = new LinkedHashSet<>();
        collect(this, result);
        return new ArrayList<>(result);
    }

    private static void collect(IdentityDefinition identity, Set<IdentityDefinition> into) {
        for (IdentityDefinition d : identity.derived) {
            if (into.add(d)) {
                collect(d, into);
            }
        }
    }

    @Override
    public String toString() {
        return prefix + ":" + name;
    }
}
