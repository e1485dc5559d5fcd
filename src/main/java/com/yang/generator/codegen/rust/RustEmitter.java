package com.yang.generator.codegen.rust;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.EnumDefinition;
import com.yang.generator.codegen.model.FieldDefinition;
import com.yang.generator.codegen.model.StructDefinition;
import com.yang.generator.codegen.model.TypeAliasDefinition;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.model.core.context.GenerationStats;
import com.yang.generator.codegen.registry.IdentityDefinition;
import com.yang.generator.codegen.registry.StructCandidate;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.resolver.FieldType;
import com.yang.generator.codegen.resolver.TypeResolver;
import com.yang.generator.model.TypeKind;
import com.yang.generator.model.YangModule;

/**
 * Writes the generated file from fully populated registries.
 *
 * Order: header; per emitted module its typedef enums and aliases, then its identity enums;
 * then structs in reverse discovery order. A definition referenced by a struct or alias
 * that has not been written yet is written first, so nothing refers forward. Enumeration
 * typedefs of excluded modules or paths are written only that way.
 */
public class RustEmitter {
    private static final Logger log = LoggerFactory.getLogger(RustEmitter.class);

    private final GenerationContext ctx;
    private final TypeResolver typeResolver;
    private final HeaderGenerator headerGenerator;
    private final EnumGenerator enumGenerator;
    private final TypeAliasGenerator aliasGenerator;
    private final StructGenerator structGenerator = new StructGenerator();
    private final StructDefinitionBuilder structBuilder;

    private final Set<TypedefDefinition> handledTypedefs = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<StructCandidate> handledStructs = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<StructCandidate> structsInProgress = Collections.newSetFromMap(new IdentityHashMap<>());

    private int enumCount;
    private int aliasCount;
    private int structCount;
    private int skippedCount;

    public RustEmitter(GenerationContext ctx, TypeResolver typeResolver, HeaderGenerator headerGenerator) {
        this.ctx = ctx;
        this.typeResolver = typeResolver;
        this.headerGenerator = headerGenerator;
        this.enumGenerator = new EnumGenerator(ctx.getDiagnostics());
        this.aliasGenerator = new TypeAliasGenerator(typeResolver);
        this.structBuilder = new StructDefinitionBuilder(ctx, typeResolver);
    }

    public String emit() {
        StringBuilder out = new StringBuilder();
        out.append(headerGenerator.render(ctx.getConfig()));

        for (YangModule module : ctx.getDependencies().getEmissionOrder()) {
            for (TypedefDefinition typedef : ctx.getTypedefRegistry().forPrefix(module.getPrefix())) {
                emitTypedef(typedef, out, false);
            }
            for (IdentityDefinition identity : ctx.getIdentityRegistry().forPrefix(module.getPrefix())) {
                emitIdentity(identity, out);
            }
        }

        List<StructCandidate> structs = new ArrayList<>(ctx.getStructRegistry().candidates());
        Collections.reverse(structs);
        for (StructCandidate candidate : structs) {
            emitStruct(candidate, out);
        }

        log.info("Emitted {} enums, {} aliases, {} structs ({} skipped)", enumCount, aliasCount, structCount, skippedCount);
        return out.toString();
    }

    public GenerationStats stats(int moduleCount) {
        return GenerationStats.builder()
                .moduleCount(moduleCount)
                .enumCount(enumCount)
                .aliasCount(aliasCount)
                .structCount(structCount)
                .skippedCount(skippedCount)
                .build();
    }

    /**
     * @param requested the typedef is referenced by a definition being written, so an
     *                  enumeration left out of regular emission is written anyway
     */
    private void emitTypedef(TypedefDefinition typedef, StringBuilder out, boolean requested) {
        boolean onDemand = requested && typeResolver.isEmittedOnDemand(typedef);
        if (typedef.getKind() == TypedefDefinition.Kind.TYPEDEF && !typeResolver.isEmitted(typedef) && !onDemand) {
            log.debug("Typedef {}:{} is not emitted", typedef.getPrefix(), typedef.getName());
            return;
        }
        if (!handledTypedefs.add(typedef)) {
            return;
        }

        if (typedef.isEnumeration()) {
            EnumDefinition def = enumGenerator.fromTypedef(typedef);
            if (claim(def.getTypeName(), typedef.getPrefix(), typedef.getName())) {
                out.append(enumGenerator.render(def));
                enumCount++;
            }
            return;
        }

        if (!typedef.getNode().getType().isKind(TypeKind.UNION)) {
            FieldType target = typeResolver.resolveTypedefTarget(typedef);
            TypedefDefinition dependency = target.getTypedef();
            if (dependency != null && dependency != typedef
                    && (dependency.getPrefix().equals(typedef.getPrefix()) || typeResolver.isEmittedOnDemand(dependency))) {
                emitTypedef(dependency, out, true);
            }
        }

        TypeAliasDefinition alias = aliasGenerator.build(typedef);
        if (claim(alias.getAliasName(), typedef.getPrefix(), typedef.getName())) {
            out.append(aliasGenerator.render(alias));
            aliasCount++;
        }
    }

    private void emitIdentity(IdentityDefinition identity, StringBuilder out) {
        if (!typeResolver.hasEnum(identity)) {
            return;
        }
        EnumDefinition def = enumGenerator.fromIdentity(identity);
        if (claim(def.getTypeName(), identity.getPrefix(), identity.getName())) {
            out.append(enumGenerator.render(def));
            enumCount++;
        }
    }

    private void emitStruct(StructCandidate candidate, StringBuilder out) {
        if (candidate.isElided() || handledStructs.contains(candidate) || !structsInProgress.add(candidate)) {
            return;
        }

        StructDefinition def;
        try {
            def = structBuilder.build(candidate);
            for (FieldDefinition field : def.getFields()) {
                if (field.getDependency() != null) {
                    emitStruct(field.getDependency(), out);
                }
                if (field.getTypedefDependency() != null) {
                    emitTypedef(field.getTypedefDependency(), out, true);
                }
            }
        } finally {
            structsInProgress.remove(candidate);
        }
        handledStructs.add(candidate);

        if (claim(def.getTypeName(), def.getPrefix(), def.getUniqueName())) {
            out.append(structGenerator.render(def));
            structCount++;
        }
    }

    private boolean claim(String typeName, String prefix, String yangName) {
        if (ctx.claimTypeName(typeName, prefix + ":" + yangName)) {
            return true;
        }
        skippedCount++;
        log.warn("{}:{}: type {} has already been emitted", prefix, yangName, typeName);
        return false;
    }
}
