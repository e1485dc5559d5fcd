package com.yang.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A struct ready to be rendered.
 */
@Value
@Builder
public class StructDefinition {
    String uniqueName;
    String typeName;
    String prefix;

    /** Declared YANG name of the container, list or choice. */
    String yangName;

    String description;

    @Singular
    List<FieldDefinition> fields;
}
