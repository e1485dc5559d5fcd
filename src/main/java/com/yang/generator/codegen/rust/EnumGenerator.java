package com.yang.generator.codegen.rust;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.EnumDefinition;
import com.yang.generator.codegen.model.EnumVariant;
import com.yang.generator.codegen.model.core.context.ToolDiagnostics;
import com.yang.generator.codegen.registry.IdentityDefinition;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.yang.util.YangNamingUtil;
import com.yang.generator.model.EnumValue;
import com.yang.generator.model.SchemaNode;

/**
 * Builds and renders closed Rust enums for identities, enumeration typedefs, embedded
 * enumerations and collapsed choices.
 *
 * Each enum deserializes from a string through {@code TryFrom<String>}: input is
 * lower-cased before matching, unknown values produce a descriptive {@code Err}.
 */
public class EnumGenerator {
    private static final Logger log = LoggerFactory.getLogger(EnumGenerator.class);

    /** Variant standing for "no case selected" in a collapsed choice. */
    static final String NO_CHOICE_VARIANT = "none";

    private final ToolDiagnostics diagnostics;

    public EnumGenerator(ToolDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public EnumDefinition fromIdentity(IdentityDefinition identity) {
        List<String> values = new ArrayList<>();
        for (IdentityDefinition d : identity.descendants()) {
            values.add(d.getName());
        }
        return build(identity.getTypeName(), identity.getPrefix(), identity.getName(),
                EnumDefinition.Origin.IDENTITY, identity.getNode().getDescription(), values);
    }

    /**
     * Enum for an enumeration typedef, an embedded enumeration or a collapsed choice.
     */
    public EnumDefinition fromTypedef(TypedefDefinition typedef) {
        SchemaNode node = typedef.getNode();
        List<String> values = new ArrayList<>();
        EnumDefinition.Origin origin;

        switch (typedef.getKind()) {
            case CHOICE_ENUM -> {
                origin = EnumDefinition.Origin.COLLAPSED_CHOICE;
                values.add(NO_CHOICE_VARIANT);
                for (SchemaNode caseNode : node.getChildren()) {
                    values.add(caseNode.getName());
                }
            }
            case EMBEDDED_ENUM -> {
                origin = EnumDefinition.Origin.EMBEDDED_LEAF;
                node.getType().getEnumValues().stream().map(EnumValue::getName).forEach(values::add);
            }
            default -> {
                origin = EnumDefinition.Origin.TYPEDEF;
                node.getType().getEnumValues().stream().map(EnumValue::getName).forEach(values::add);
            }
        }
        return build(typedef.getTypeName(), typedef.getPrefix(), typedef.getName(), origin,
                node.getDescription(), values);
    }

    private EnumDefinition build(String typeName, String prefix, String yangName,
                                 EnumDefinition.Origin origin, String description, List<String> values) {
        EnumDefinition.EnumDefinitionBuilder builder = EnumDefinition.builder()
                .typeName(typeName)
                .prefix(prefix)
                .yangName(yangName)
                .origin(origin)
                .description(description);

        Set<String> identifiers = new HashSet<>();
        Set<String> wireValues = new HashSet<>();
        for (String value : values) {
            String identifier = YangNamingUtil.toCamelCase(value);
            String wire = value.toLowerCase(Locale.ROOT);
            if (!identifiers.add(identifier) || !wireValues.add(wire)) {
                String msg = prefix + ":" + yangName + ": enum value " + value
                        + " duplicates an earlier variant and was skipped";
                diagnostics.warn(msg);
                log.warn(msg);
                continue;
            }
            builder.variant(new EnumVariant(identifier, wire));
        }
        return builder.build();
    }

    public String render(EnumDefinition def) {
        StringBuilder sb = new StringBuilder();
        RustCommentWriter.appendLine(sb, "typedef for identity " + def.getPrefix() + ":" + def.getYangName() + ".");
        RustCommentWriter.appendDescription(sb, def.getDescription());
        sb.append("#[derive(Deserialize, Debug)]\n");
        sb.append("#[serde(try_from = \"String\")]\n");
        sb.append("pub(crate) enum ").append(def.getTypeName()).append(" {\n");
        for (EnumVariant v : def.getVariants()) {
            sb.append(v.getIdentifier()).append(",\n");
        }
        sb.append("}\n\n");

        sb.append("impl TryFrom<String> for ").append(def.getTypeName()).append(" {\n");
        sb.append("type Error = String;\n");
        sb.append("fn try_from(s: String)->Result<Self, Self::Error> {\n");
        sb.append("match s.to_lowercase().as_str() {\n");
        for (EnumVariant v : def.getVariants()) {
            sb.append('"').append(escape(v.getWireValue())).append("\" => Ok(Self::")
                    .append(v.getIdentifier()).append("),\n");
        }
        sb.append("_ => Err(format!(\"invalid parameter (").append(def.getTypeName()).append(") {}\",s)),\n");
        sb.append("}\n}\n}\n\n");
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
