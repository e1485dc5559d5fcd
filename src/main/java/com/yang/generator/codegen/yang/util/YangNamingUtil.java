package com.yang.generator.codegen.yang.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Naming conventions for identifiers derived from YANG names.
 */
public class YangNamingUtil {

    private YangNamingUtil() {
        // Utility class
    }

    /**
     * Converts a hyphenated YANG name to TypeCase: {@code bgp-neighbor-state} becomes
     * {@code BgpNeighborState}. Each hyphen-separated part keeps only its first letter upper
     * case. Dots are kept as separators.
     */
    public static String toTypeName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("\\.", -1))
                .map(segment -> Arrays.stream(segment.split("-", -1))
                        .map(YangNamingUtil::capitalize)
                        .collect(Collectors.joining("")))
                .collect(Collectors.joining("."));
    }

    /**
     * Converts a name to CONSTANT_CASE: {@code as-path-set} becomes {@code AS_PATH_SET}.
     */
    static String toConstantName(String name) {
        if (name == null) {
            return null;
        }
        return name.replace('-', '_').toUpperCase(Locale.ROOT);
    }

    /**
     * Converts an enum value or identity name to a CamelCase variant name.
     * Splits on {@code -} and {@code _}; inside each part a letter following a non-letter
     * is upper case, every other letter lower case ({@code l3vpn-ipv4} becomes {@code L3VpnIpv4}).
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[_-]", -1))
                .map(YangNamingUtil::titleCase)
                .collect(Collectors.joining(""));
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String titleCase(String str) {
        StringBuilder sb = new StringBuilder(str.length());
        boolean previousWasLetter = false;
        for (char c : str.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousWasLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousWasLetter = true;
            } else {
                sb.append(c);
                previousWasLetter = false;
            }
        }
        return sb.toString();
    }
}
