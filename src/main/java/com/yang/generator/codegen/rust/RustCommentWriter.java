package com.yang.generator.codegen.rust;

import lombok.experimental.UtilityClass;

/**
 * Line comments for schema descriptions.
 */
@UtilityClass
public class RustCommentWriter {

    /**
     * Append {@code description} as {@code //} lines. The text is trimmed and always ends
     * with a period. Nothing is written for a null or blank description.
     */
    public void appendDescription(StringBuilder sb, String description) {
        if (description == null || description.isBlank()) {
            return;
        }
        String text = description.strip();
        if (!text.endsWith(".")) {
            text = text + ".";
        }
        for (String line : text.split("\n", -1)) {
            String trimmed = line.stripTrailing();
            sb.append(trimmed.isEmpty() ? "//" : "// " + trimmed).append('\n');
        }
    }

    public void appendLine(StringBuilder sb, String comment) {
        sb.append("// ").append(comment).append('\n');
    }
}
