package com.yang.generator.codegen.registry;

import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.TypeKind;

import lombok.Builder;
import lombok.Value;

/**
 * Entry of the typedef registry: a module typedef, an enumeration embedded in a leaf, or
 * a choice collapsed into an enumeration.
 */
@Value
@Builder
public class TypedefDefinition {

    public enum Kind {
        TYPEDEF,
        EMBEDDED_ENUM,
        CHOICE_ENUM
    }

    Kind kind;

    /** YANG name (typedef, leaf or choice name). */
    String name;

    String typeName;

    /** Canonical prefix of the registering module. */
    String prefix;

    SchemaNode node;

    /** Structural path, matched against the typedef exclusion list. */
    String path;

    public boolean isEnumeration() {
        return kind != Kind.TYPEDEF || node.getType().isKind(TypeKind.ENUMERATION);
    }
}
