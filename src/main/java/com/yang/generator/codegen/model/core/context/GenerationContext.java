package com.yang.generator.codegen.model.core.context;

import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.model.NodeFacts;
import com.yang.generator.codegen.registry.IdentityRegistry;
import com.yang.generator.codegen.registry.StructRegistry;
import com.yang.generator.codegen.registry.TypedefRegistry;
import com.yang.generator.codegen.yang.service.ModuleDependencies;
import com.yang.generator.codegen.yang.service.SchemaPathNavigator;
import com.yang.generator.model.SchemaNode;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * State of one generation run. Created per invocation and dropped after emission.
 */
@Getter
@Builder
public final class GenerationContext {

    @NonNull
    private final GeneratorConfig config;

    @NonNull
    private final ToolDiagnostics diagnostics;

    @NonNull
    private final ModuleDependencies dependencies;

    @NonNull
    private final SchemaPathNavigator navigator;

    @Builder.Default
    private final TypedefRegistry typedefRegistry = new TypedefRegistry();

    @Builder.Default
    private final IdentityRegistry identityRegistry = new IdentityRegistry();

    @Builder.Default
    private final StructRegistry structRegistry = new StructRegistry();

    /** Derived node facts, keyed by node identity. */
    @Builder.Default
    private final Map<SchemaNode, NodeFacts> facts = new IdentityHashMap<>();

    /** Emitted type name → {@code prefix:yang-name} of the definition that claimed it. */
    @Builder.Default
    private final Map<String, String> emittedTypeNames = new LinkedHashMap<>();

    @Builder.Default
    private final Instant startedAt = Instant.now();

    public NodeFacts factsOf(SchemaNode node) {
        NodeFacts f = facts.get(node);
        if (f == null) {
            throw new SchemaResolutionException("schema node " + node.getName() + " in module "
                    + node.getModule().getName() + " was never visited");
        }
        return f;
    }

    /**
     * Claim a type name for emission. Returns false (and records a warning) when the name
     * was already claimed.
     */
    public boolean claimTypeName(String typeName, String claimedBy) {
        String previous = emittedTypeNames.putIfAbsent(typeName, claimedBy);
        if (previous != null) {
            diagnostics.warn(claimedBy + ": type " + typeName
                    + " has already been emitted from " + previous);
            return false;
        }
        return true;
    }
}
