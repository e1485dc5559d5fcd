package com.yang.generator.codegen.rust;

import com.yang.generator.codegen.model.TypeAliasDefinition;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.resolver.FieldType;
import com.yang.generator.codegen.resolver.TypeResolver;
import com.yang.generator.model.TypeKind;

/**
 * {@code type X = ...;} aliases for non-enumeration typedefs.
 */
public class TypeAliasGenerator {

    private static final String UNION_TARGET = "String";

    private final TypeResolver typeResolver;

    public TypeAliasGenerator(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    public TypeAliasDefinition build(TypedefDefinition typedef) {
        TypeAliasDefinition.TypeAliasDefinitionBuilder builder = TypeAliasDefinition.builder()
                .aliasName(typedef.getTypeName())
                .prefix(typedef.getPrefix())
                .yangName(typedef.getName())
                .description(typedef.getNode().getDescription());

        if (typedef.getNode().getType().isKind(TypeKind.UNION)) {
            return builder.targetType(UNION_TARGET).build();
        }

        FieldType target = typeResolver.resolveTypedefTarget(typedef);
        return builder.targetType(target.getRustType())
                .originalType(target.getTranslatedFrom())
                .build();
    }

    public String render(TypeAliasDefinition def) {
        StringBuilder sb = new StringBuilder();
        RustCommentWriter.appendLine(sb, "typedef for typedef " + def.getPrefix() + ":" + def.getYangName() + ".");
        if (def.getOriginalType() != null) {
            RustCommentWriter.appendLine(sb, def.getPrefix() + ":" + def.getYangName()
                    + "'s original type is " + def.getOriginalType() + ".");
        }
        RustCommentWriter.appendDescription(sb, def.getDescription());
        sb.append("type ").append(def.getAliasName()).append(" = ").append(def.getTargetType()).append(";\n\n");
        return sb.toString();
    }
}
