package com.yang.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EnumDefinition {

    public enum Origin {
        IDENTITY,
        TYPEDEF,
        EMBEDDED_LEAF,
        COLLAPSED_CHOICE
    }

    String typeName;
    String prefix;
    String yangName;
    Origin origin;
    String description;

    @Singular
    List<EnumVariant> variants;
}
