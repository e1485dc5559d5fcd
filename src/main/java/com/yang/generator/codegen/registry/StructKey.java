package com.yang.generator.codegen.registry;

import lombok.Value;

/**
 * Registry key of a struct: origin module prefix plus unique name.
 */
@Value
public class StructKey {
    String prefix;
    String uniqueName;

    @Override
    public String toString() {
        return prefix + ":" + uniqueName;
    }
}
