package com.yang.generator.codegen.resolver;

import com.yang.generator.codegen.registry.TypedefDefinition;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of resolving a leaf, leaf-list or typedef type.
 */
@Value
@Builder
public class FieldType {

    /** Rust type name; null when the field is dropped. */
    String rustType;

    /** YANG type name the Rust type was translated from, or null. */
    String translatedFrom;

    /** Typedef the Rust type refers to, when it is an emitted alias or enum (on demand included). */
    TypedefDefinition typedef;

    /** The field is a redundant {@code ../config} leafref and must not be emitted. */
    boolean dropped;

    public static FieldType of(String rustType) {
        return FieldType.builder().rustType(rustType).build();
    }

    public static FieldType droppedField() {
        return FieldType.builder().dropped(true).build();
    }
}
