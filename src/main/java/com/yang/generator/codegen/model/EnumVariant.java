package com.yang.generator.codegen.model;

import lombok.Value;

/**
 * Enum variant: CamelCase identifier plus the lower-cased wire string it parses from.
 */
@Value
public class EnumVariant {
    String identifier;
    String wireValue;
}
