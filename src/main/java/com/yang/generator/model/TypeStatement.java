package com.yang.generator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * A parsed {@code type} statement attached to a leaf, leaf-list or typedef.
 */
@Getter
@Builder
@ToString(of = {"name", "path", "base"})
public class TypeStatement {

    /** Type name exactly as written, e.g. {@code uint32} or {@code inet:ip-address}. */
    private final String name;

    /** Module whose text contains this statement; prefixes are resolved against its imports. */
    private final YangModule sourceModule;

    @Singular
    private final List<EnumValue> enumValues;

    @Singular
    private final List<TypeStatement> unionMembers;

    /** Leafref path. */
    private final String path;

    /** Identityref base. */
    private final String base;

    private final String description;

    public TypeKind getKind() {
        return TypeKind.of(name);
    }

    public boolean isKind(TypeKind kind) {
        return getKind() == kind;
    }

    /**
     * Prefix part of the name, or null when unqualified.
     */
    public String getPrefix() {
        return prefixOf(name);
    }

    public String getLocalName() {
        return localNameOf(name);
    }

    public static String prefixOf(String qualified) {
        if (qualified == null) {
            return null;
        }
        int idx = qualified.indexOf(':');
        return idx < 0 ? null : qualified.substring(0, idx);
    }

    public static String localNameOf(String qualified) {
        if (qualified == null) {
            return null;
        }
        int idx = qualified.lastIndexOf(':');
        return idx < 0 ? qualified : qualified.substring(idx + 1);
    }
}
