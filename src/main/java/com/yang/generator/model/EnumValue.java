package com.yang.generator.model;

import lombok.Value;

/**
 * One {@code enum} substatement of an enumeration type.
 */
@Value
public class EnumValue {
    String name;
    String description;
}
