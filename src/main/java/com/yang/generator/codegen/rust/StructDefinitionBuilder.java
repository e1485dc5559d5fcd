package com.yang.generator.codegen.rust;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.mapper.YangToRustTypeMapper;
import com.yang.generator.codegen.model.CollectionKind;
import com.yang.generator.codegen.model.FieldDefinition;
import com.yang.generator.codegen.model.NodeFacts;
import com.yang.generator.codegen.model.StructDefinition;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.registry.StructCandidate;
import com.yang.generator.codegen.registry.StructKey;
import com.yang.generator.codegen.resolver.FieldType;
import com.yang.generator.codegen.resolver.TypeResolver;
import com.yang.generator.codegen.yang.service.SchemaPathNavigator;
import com.yang.generator.codegen.yang.util.RustNamingUtil;
import com.yang.generator.codegen.yang.util.YangNamingUtil;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.TypeKind;

/**
 * Builds the field list of a registered struct from its effective children.
 */
public class StructDefinitionBuilder {
    private static final Logger log = LoggerFactory.getLogger(StructDefinitionBuilder.class);

    private static final String LIST_TAG_SUFFIX = "-list";
    private static final String LIST_NAME_SUFFIX = "List";

    private final GenerationContext ctx;
    private final TypeResolver typeResolver;

    public StructDefinitionBuilder(GenerationContext ctx, TypeResolver typeResolver) {
        this.ctx = ctx;
        this.typeResolver = typeResolver;
    }

    public StructDefinition build(StructCandidate candidate) {
        NodeFacts facts = candidate.getFacts();
        SchemaNode node = candidate.getNode();

        StructDefinition.StructDefinitionBuilder builder = StructDefinition.builder()
                .uniqueName(facts.getUniqueName())
                .typeName(facts.getTypeName())
                .prefix(facts.getOriginPrefix())
                .yangName(node.getName())
                .description(node.getDescription());

        Set<String> tags = new HashSet<>();
        for (SchemaNode child : facts.getEffectiveChildren()) {
            NodeFacts childFacts = ctx.factsOf(child);
            if (ctx.getConfig().getExcludedPaths().contains(childFacts.getPath())) {
                log.debug("Skipping excluded path {}", childFacts.getPath());
                continue;
            }

            Optional<FieldDefinition> field = buildField(child, childFacts, facts.getTypeName());
            if (field.isEmpty()) {
                continue;
            }
            if (!tags.add(field.get().getTag())) {
                String msg = "struct " + facts.getTypeName() + ": duplicate field tag '" + field.get().getTag()
                        + "' from " + field.get().getOrigin() + " skipped";
                ctx.getDiagnostics().warn(msg);
                log.warn(msg);
                continue;
            }
            builder.field(field.get());
        }
        return builder.build();
    }

    private Optional<FieldDefinition> buildField(SchemaNode child, NodeFacts childFacts, String enclosingType) {
        String origin = childFacts.getOriginPrefix() + ":" + childFacts.getUniqueName();
        String tag = childFacts.getUniqueName().toLowerCase(Locale.ROOT);
        String derivedName = YangNamingUtil.toTypeName(child.getName());

        FieldDefinition.FieldDefinitionBuilder field = FieldDefinition.builder()
                .origin(origin)
                .description(child.getDescription())
                .collectionKind(CollectionKind.SCALAR);

        switch (child.getKind()) {
            case LEAF -> {
                FieldType type = typeResolver.resolveField(child);
                if (type.isDropped()) {
                    log.debug("Dropping redundant config leafref {}", childFacts.getPath());
                    return Optional.empty();
                }
                field.rustType(type.getRustType()).typedefDependency(type.getTypedef());
                if (type.getTranslatedFrom() != null) {
                    field.translationNote(origin + "'s original type is " + type.getTranslatedFrom() + ".");
                }
            }
            case LEAF_LIST -> {
                FieldType type = typeResolver.resolveField(child);
                if (type.isDropped()) {
                    log.debug("Dropping redundant config leafref {}", childFacts.getPath());
                    return Optional.empty();
                }
                tag += LIST_TAG_SUFFIX;
                derivedName += LIST_NAME_SUFFIX;
                field.rustType(YangToRustTypeMapper.sequenceOf(type.getRustType()))
                        .collectionKind(CollectionKind.SEQUENCE)
                        .typedefDependency(type.getTypedef());
                if (type.getTranslatedFrom() != null) {
                    field.translationNote("original type is list of " + type.getTranslatedFrom());
                }
            }
            case CHOICE, CONTAINER -> {
                if (childFacts.isEnumChoice()) {
                    field.rustType(childFacts.getTypeName());
                    break;
                }
                StructCandidate target = lookupStruct(child, childFacts);
                if (target.isElided()) {
                    SchemaNode list = target.getFacts().getEffectiveChildren().get(0);
                    StructCandidate listStruct = lookupStruct(list, ctx.factsOf(list));
                    field.rustType(YangToRustTypeMapper.sequenceOf(listStruct.getTypeName()))
                            .collectionKind(CollectionKind.KEYED_COLLECTION)
                            .key(collectionKey(list))
                            .dependency(listStruct);
                } else {
                    field.rustType(target.getTypeName()).dependency(target);
                }
                derivedName = target.getTypeName();

                if (child.is(NodeKind.CONTAINER)) {
                    String rustType = target.isElided() ? null : target.getTypeName();
                    if ((enclosingType + "Config").equals(rustType)) {
                        tag = "config";
                        derivedName = "Config";
                    } else if ((enclosingType + "State").equals(rustType)) {
                        tag = "state";
                        derivedName = "State";
                    }
                }
            }
            case LIST -> {
                StructCandidate target = lookupStruct(child, childFacts);
                tag += LIST_TAG_SUFFIX;
                derivedName += LIST_NAME_SUFFIX;
                field.rustType(YangToRustTypeMapper.sequenceOf(target.getTypeName()))
                        .collectionKind(CollectionKind.KEYED_COLLECTION)
                        .key(child.getKey())
                        .dependency(target);
            }
            default -> {
                return Optional.empty();
            }
        }

        return Optional.of(field
                .tag(tag)
                .identifier(RustNamingUtil.toFieldIdentifier(tag))
                .derivedName(derivedName)
                .build());
    }

    private StructCandidate lookupStruct(SchemaNode node, NodeFacts facts) {
        StructKey key = new StructKey(facts.getOriginPrefix(), facts.getUniqueName());
        return ctx.getStructRegistry().find(key)
                .orElseThrow(() -> new SchemaResolutionException("struct " + key + " (" + facts.getPath()
                        + ") was never registered"));
    }

    /**
     * Key of a keyed collection; {@code config.}-qualified when the key leaf is a redundant
     * leafref into the sibling config container.
     */
    private static String collectionKey(SchemaNode list) {
        String key = list.getKey();
        if (key == null || list.getKeyNames().isEmpty()) {
            return key;
        }
        String keyLeaf = list.getKeyNames().get(0);
        for (SchemaNode child : SchemaPathNavigator.dataChildren(list)) {
            if (child.getName().equals(keyLeaf) && child.getType() != null
                    && child.getType().isKind(TypeKind.LEAFREF)
                    && TypeResolver.isRedundantConfigRef(child.getType())) {
                return "config." + key;
            }
        }
        return key;
    }
}
