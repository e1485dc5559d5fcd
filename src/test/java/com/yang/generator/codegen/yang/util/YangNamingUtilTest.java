package com.yang.generator.codegen.yang.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for YANG and Rust naming conventions.
 */
class YangNamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "bgp-neighbor-state, BgpNeighborState",
            "neighbor, Neighbor",
            "afi-safi, AfiSafi",
            "mp-graceful-restart, MpGracefulRestart",
            "ipv4-unicast, Ipv4Unicast",
            "BGP, Bgp"
    })
    void testToTypeName(String input, String expected) {
        assertThat(YangNamingUtil.toTypeName(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "foo-bar, FooBar",
            "INTERNAL, Internal",
            "l3vpn-ipv4-unicast, L3VpnIpv4Unicast",
            "as_path, AsPath",
            "ipv6, Ipv6",
            "none, None"
    })
    void testToCamelCase(String input, String expected) {
        assertThat(YangNamingUtil.toCamelCase(input)).isEqualTo(expected);
    }

    @Test
    void testToConstantName() {
        assertThat(YangNamingUtil.toConstantName("as-path-set")).isEqualTo("AS_PATH_SET");
        assertThat(YangNamingUtil.toConstantName("ipv4-unicast")).isEqualTo("IPV4_UNICAST");
    }

    @Test
    void testNullAndEmptyNames() {
        assertThat(YangNamingUtil.toTypeName(null)).isNull();
        assertThat(YangNamingUtil.toTypeName("")).isEmpty();
        assertThat(YangNamingUtil.toCamelCase("")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "local-as, local_as",
            "neighbor-address, neighbor_address",
            "as, r#as",
            "type, r#type",
            "match, r#match",
            "self, self_",
            "crate, crate_",
            "4byte-as, _4byte_as",
            "enabled, enabled"
    })
    void testToFieldIdentifier(String tag, String expected) {
        assertThat(RustNamingUtil.toFieldIdentifier(tag)).isEqualTo(expected);
    }

    @Test
    void testNeedsRename() {
        assertThat(RustNamingUtil.needsRename("local-as", "local_as")).isTrue();
        assertThat(RustNamingUtil.needsRename("as", "r#as")).isFalse();
        assertThat(RustNamingUtil.needsRename("enabled", "enabled")).isFalse();
        assertThat(RustNamingUtil.needsRename("self", "self_")).isTrue();
    }
}
