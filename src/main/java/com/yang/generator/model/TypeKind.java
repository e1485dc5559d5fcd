package com.yang.generator.model;

import java.util.Set;

/**
 * Classification of a {@code type} statement.
 */
public enum TypeKind {
    IDENTITYREF,
    LEAFREF,
    ENUMERATION,
    UNION,
    /** Any other YANG built-in type keyword. */
    BUILTIN,
    /** Reference to a typedef, possibly prefixed. */
    DERIVED;

    private static final Set<String> YANG_BUILTINS = Set.of(
            "binary", "bits", "boolean", "decimal64", "empty", "enumeration",
            "identityref", "instance-identifier", "int8", "int16", "int32", "int64",
            "leafref", "string", "uint8", "uint16", "uint32", "uint64", "union"
    );

    public static TypeKind of(String typeName) {
        if (typeName == null) {
            return DERIVED;
        }
        return switch (typeName) {
            case "identityref" -> IDENTITYREF;
            case "leafref" -> LEAFREF;
            case "enumeration" -> ENUMERATION;
            case "union" -> UNION;
            default -> YANG_BUILTINS.contains(typeName) ? BUILTIN : DERIVED;
        };
    }
}
