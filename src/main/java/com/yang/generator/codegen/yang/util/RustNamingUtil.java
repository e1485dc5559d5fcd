package com.yang.generator.codegen.yang.util;

import java.util.Locale;
import java.util.Set;

/**
 * Rust identifier rules for struct fields.
 */
public class RustNamingUtil {

    /** Strict and reserved keywords of Rust 2018/2021. */
    private static final Set<String> KEYWORDS = Set.of(
            "as", "async", "await", "break", "const", "continue", "dyn", "else", "enum",
            "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match",
            "mod", "move", "mut", "pub", "ref", "return", "static", "struct", "trait",
            "true", "type", "unsafe", "use", "where", "while",
            "abstract", "become", "box", "do", "final", "macro", "override", "priv",
            "try", "typeof", "unsized", "virtual", "yield"
    );

    /** Keywords that cannot be written as raw identifiers. */
    private static final Set<String> NON_RAW_KEYWORDS = Set.of("self", "Self", "super", "crate");

    private RustNamingUtil() {
        // Utility class
    }

    /**
     * Field identifier for a wire tag: {@code local-as} becomes {@code local_as},
     * {@code as} becomes {@code r#as}, {@code self} becomes {@code self_}.
     */
    public static String toFieldIdentifier(String tag) {
        String ident = tag.toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
        if (!ident.isEmpty() && Character.isDigit(ident.charAt(0))) {
            ident = "_" + ident;
        }
        if (NON_RAW_KEYWORDS.contains(ident)) {
            return ident + "_";
        }
        if (KEYWORDS.contains(ident)) {
            return "r#" + ident;
        }
        return ident;
    }

    /**
     * True when serde would not derive {@code tag} from the field identifier, so an explicit
     * {@code #[serde(rename = "...")]} is needed. serde strips the {@code r#} prefix itself.
     */
    public static boolean needsRename(String tag, String identifier) {
        String unraw = identifier.startsWith("r#") ? identifier.substring(2) : identifier;
        return !unraw.equals(tag);
    }
}
