package com.yang.generator.codegen.mapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for YangToRustTypeMapper.
 */
class YangToRustTypeMapperTest {

    @ParameterizedTest
    @CsvSource({
            "uint8, u8",
            "uint16, u16",
            "uint32, u32",
            "uint64, u64",
            "int8, i8",
            "int64, i64",
            "string, String"
    })
    void testBuiltinMapping(String yangType, String rustType) {
        assertThat(YangToRustTypeMapper.builtin(yangType)).contains(rustType);
        assertThat(YangToRustTypeMapper.isBuiltin(yangType)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "boolean, bool",
            "empty, bool",
            "decimal64, f64",
            "inet:as-number, u32",
            "inet:port-number, u16",
            "yang:timeticks, i64",
            "yang:counter64, u64",
            "binary, Vec<u8>"
    })
    void testTranslationTable(String yangType, String rustType) {
        assertThat(YangToRustTypeMapper.translate(yangType)).contains(rustType);
    }

    @Test
    void testTranslationByCanonicalPrefix() {
        // Module imported under a different alias
        assertThat(YangToRustTypeMapper.translate("ip:as-number", "inet", "as-number")).contains("u32");
        assertThat(YangToRustTypeMapper.translate("ip:as-number", null, "as-number")).isEmpty();
        assertThat(YangToRustTypeMapper.translate("my-type", "m", "my-type")).isEmpty();
    }

    @Test
    void testUnknownTypes() {
        assertThat(YangToRustTypeMapper.builtin("bits")).isEmpty();
        assertThat(YangToRustTypeMapper.translate("string")).isEmpty();
        assertThat(YangToRustTypeMapper.isBuiltin("boolean")).isFalse();
    }

    @Test
    void testSequenceOf() {
        assertThat(YangToRustTypeMapper.sequenceOf("Neighbor")).isEqualTo("Vec<Neighbor>");
    }
}
