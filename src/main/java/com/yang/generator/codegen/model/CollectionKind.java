package com.yang.generator.codegen.model;

/**
 * Shape of a struct field on the wire.
 */
public enum CollectionKind {
    SCALAR,
    SEQUENCE,
    KEYED_COLLECTION
}
