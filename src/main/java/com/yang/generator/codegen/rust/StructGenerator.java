package com.yang.generator.codegen.rust;

import com.yang.generator.codegen.model.FieldDefinition;
import com.yang.generator.codegen.model.StructDefinition;

/**
 * Renders structs. Unknown wire fields are rejected; every field is optional.
 */
public class StructGenerator {

    public String render(StructDefinition def) {
        StringBuilder sb = new StringBuilder();
        RustCommentWriter.appendLine(sb, "struct for container " + def.getPrefix() + ":" + def.getYangName() + ".");
        RustCommentWriter.appendDescription(sb, def.getDescription());
        sb.append("#[derive(Deserialize, Debug, Default)]\n");
        sb.append("#[serde(deny_unknown_fields)]\n");
        sb.append("pub(crate) struct ").append(def.getTypeName()).append(" {\n");
        for (FieldDefinition field : def.getFields()) {
            renderField(sb, field);
        }
        sb.append("}\n\n");
        return sb.toString();
    }

    private void renderField(StringBuilder sb, FieldDefinition field) {
        RustCommentWriter.appendLine(sb, "original -> " + field.getOrigin());
        if (field.getTranslationNote() != null) {
            RustCommentWriter.appendLine(sb, field.getTranslationNote());
        }
        RustCommentWriter.appendDescription(sb, field.getDescription());
        if (field.needsRename()) {
            sb.append("#[serde(rename = \"").append(field.getTag()).append("\")]\n");
        }
        sb.append("pub(crate) ").append(field.getIdentifier())
                .append(":Option<").append(field.getRustType()).append(">,\n");
    }
}
