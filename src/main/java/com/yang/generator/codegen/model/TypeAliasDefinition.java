package com.yang.generator.codegen.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TypeAliasDefinition {
    String aliasName;
    String prefix;
    String yangName;
    String targetType;

    /** YANG type the target was translated from, or null. */
    String originalType;

    String description;
}
