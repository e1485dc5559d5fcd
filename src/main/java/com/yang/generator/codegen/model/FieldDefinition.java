package com.yang.generator.codegen.model;

import com.yang.generator.codegen.registry.StructCandidate;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.yang.util.RustNamingUtil;

import lombok.Builder;
import lombok.Value;

/**
 * One field of a generated struct. Every field is emitted as {@code Option<T>}.
 */
@Value
@Builder
public class FieldDefinition {

    /** Wire name. */
    String tag;

    /** Rust identifier, possibly raw ({@code r#type}). */
    String identifier;

    /** TypeCase name of the field, {@code List} suffixed for sequences. */
    String derivedName;

    String rustType;

    CollectionKind collectionKind;

    /** Key leaf of a keyed collection. */
    String key;

    /** {@code prefix:unique-name} of the schema node the field comes from. */
    String origin;

    /** Comment line noting the YANG type a translated type came from, or null. */
    String translationNote;

    String description;

    /** Struct that has to be emitted before the one owning this field, or null. */
    StructCandidate dependency;

    /** Typedef that has to be emitted before the owning struct, or null. */
    TypedefDefinition typedefDependency;

    public boolean isOptional() {
        return true;
    }

    public boolean needsRename() {
        return RustNamingUtil.needsRename(tag, identifier);
    }
}
