package com.yang.generator.codegen.mapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Fixed YANG → Rust type tables. New mappings are added here and nowhere else.
 *
 * <p>The translation table covers wire types whose Rust form is not their YANG name
 * (presence markers, addresses, AS numbers, opaque byte blobs). It is consulted before the
 * builtin table, and before typedef lookup, so a typedef sharing one of its names is never
 * emitted as an alias target.
 */
@UtilityClass
public class YangToRustTypeMapper {

    /** Bumped whenever an entry of either table changes. */
    public final String TABLE_VERSION = "2";

    private final Map<String, String> TRANSLATIONS = table(
            "union", "String",
            "decimal64", "f64",
            "boolean", "bool",
            "empty", "bool",
            "inet:ip-address", "String",
            "inet:ip-prefix", "String",
            "inet:ipv4-address", "String",
            "inet:as-number", "u32",
            "bgp-set-community-option-type", "String",
            "inet:port-number", "u16",
            "yang:timeticks", "i64",
            "yang:counter64", "u64",
            "ptypes:install-protocol-type", "String",
            "binary", "Vec<u8>",
            "route-family", "u32",
            "bgp-capability", "Vec<u8>",
            "bgp-open-message", "Vec<u8>"
    );

    private final Map<String, String> BUILTINS = table(
            "union", "String",
            "int8", "i8",
            "int16", "i16",
            "int32", "i32",
            "int64", "i64",
            "string", "String",
            "uint8", "u8",
            "uint16", "u16",
            "uint32", "u32",
            "uint64", "u64"
    );

    /**
     * Translated Rust type for a literal YANG type name, e.g. {@code inet:as-number}.
     */
    Optional<String> translate(String yangType) {
        return Optional.ofNullable(TRANSLATIONS.get(yangType));
    }

    /**
     * Translated Rust type, trying the literal name first and then the name qualified with
     * the canonical prefix of the module that declares it.
     */
    public Optional<String> translate(String yangType, String canonicalPrefix, String localName) {
        Optional<String> direct = translate(yangType);
        if (direct.isPresent()) {
            return direct;
        }
        if (canonicalPrefix == null || localName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TRANSLATIONS.get(canonicalPrefix + ":" + localName));
    }

    public Optional<String> builtin(String yangType) {
        return Optional.ofNullable(BUILTINS.get(yangType));
    }

    boolean isBuiltin(String yangType) {
        return BUILTINS.containsKey(yangType);
    }

    public String sequenceOf(String elementType) {
        return "Vec<" + elementType + ">";
    }

    private Map<String, String> table(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
