package com.yang.generator.codegen.resolver;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.exception.SchemaResolutionException;
import com.yang.generator.codegen.mapper.YangToRustTypeMapper;
import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.registry.IdentityDefinition;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.yang.util.YangNamingUtil;
import com.yang.generator.model.NodeKind;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.TypeKind;
import com.yang.generator.model.TypeStatement;
import com.yang.generator.model.YangModule;

/**
 * Computes Rust type names for YANG types.
 *
 * Precedence: identityref, leafref (followed to a concrete type), enumeration, translation
 * table, builtin table, typedef reference. A resolved name always denotes a definition that
 * the emitter writes.
 */
public class TypeResolver {
    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private static final String REDUNDANT_CONFIG_PATH = "../config";
    private static final int MAX_LEAFREF_CHAIN = 32;
    private static final String FALLBACK_TYPE = "String";

    private final GenerationContext ctx;

    /** Typedef → name other definitions use to refer to it. */
    private final Map<TypedefDefinition, FieldType> referenceCache = new HashMap<>();
    private final Set<TypedefDefinition> resolving = new HashSet<>();

    public TypeResolver(GenerationContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Type of a leaf or leaf-list field (the element type for leaf-lists). A leafref whose
     * path starts with {@code ../config} yields a dropped field.
     */
    public FieldType resolveField(SchemaNode leaf) {
        TypeStatement type = requireType(leaf);
        if (type.isKind(TypeKind.LEAFREF) && isRedundantConfigRef(type)) {
            return FieldType.droppedField();
        }
        return resolve(leaf, type);
    }

    /**
     * Target of a typedef alias, as written on the right-hand side of {@code type X = ...;}.
     */
    public FieldType resolveTypedefTarget(TypedefDefinition typedef) {
        SchemaNode node = typedef.getNode();
        TypeStatement type = requireType(node);
        if (type.isKind(TypeKind.LEAFREF) && !isAbsolute(type.getPath())) {
            String msg = "typedef " + typedef.getPrefix() + ":" + typedef.getName()
                    + " is a relative leafref (" + type.getPath() + "); using " + FALLBACK_TYPE;
            ctx.getDiagnostics().warn(msg);
            log.warn(msg);
            return FieldType.of(FALLBACK_TYPE);
        }
        return resolve(node, type);
    }

    public static boolean isRedundantConfigRef(TypeStatement type) {
        return type.getPath() != null && type.getPath().trim().startsWith(REDUNDANT_CONFIG_PATH);
    }

    /**
     * @param owner the leaf, leaf-list or typedef carrying the type; enumerations are named after it
     */
    FieldType resolve(SchemaNode owner, TypeStatement type) {
        return switch (type.getKind()) {
            case IDENTITYREF -> FieldType.of(resolveIdentityref(type));
            case LEAFREF -> resolveLeafref(owner, type);
            case ENUMERATION -> FieldType.of(YangNamingUtil.toTypeName(owner.getName()));
            default -> resolveNamed(owner, type);
        };
    }

    private String resolveIdentityref(TypeStatement type) {
        String base = type.getBase();
        if (base == null) {
            throw new SchemaResolutionException("identityref without base in module "
                    + type.getSourceModule().getName());
        }
        String prefix = canonicalPrefix(type.getSourceModule(), TypeStatement.prefixOf(base), base);
        String local = TypeStatement.localNameOf(base);
        IdentityDefinition identity = ctx.getIdentityRegistry().find(prefix, local)
                .orElseThrow(() -> new SchemaResolutionException("identity " + base + " referenced from module "
                        + type.getSourceModule().getName() + " is not defined"));
        if (!hasEnum(identity)) {
            String msg = "identityref base " + identity + " has no enum (no derived identities or module "
                    + "excluded); using " + FALLBACK_TYPE;
            ctx.getDiagnostics().warn(msg);
            log.warn(msg);
            return FALLBACK_TYPE;
        }
        return identity.getTypeName();
    }

    /**
     * An identity is written as an enum when its module is emitted and something derives from it.
     */
    public boolean hasEnum(IdentityDefinition identity) {
        return !identity.getDerived().isEmpty()
                && ctx.getDependencies().isEmitted(identity.getNode().getModule());
    }

    private FieldType resolveLeafref(SchemaNode owner, TypeStatement type) {
        SchemaNode target = ctx.getNavigator().resolveLeafref(dataContext(owner), type);
        int hops = 1;
        while (target.getType() != null && target.getType().isKind(TypeKind.LEAFREF)) {
            if (++hops > MAX_LEAFREF_CHAIN) {
                throw new SchemaResolutionException("leafref chain starting at " + type.getPath()
                        + " is longer than " + MAX_LEAFREF_CHAIN + " (cycle?)");
            }
            target = ctx.getNavigator().resolveLeafref(target, target.getType());
        }
        log.debug("leafref {} resolved to {} after {} hop(s)", type.getPath(), target.getName(), hops);
        return resolve(target, requireType(target));
    }

    private FieldType resolveNamed(SchemaNode owner, TypeStatement type) {
        String name = type.getName();
        YangModule source = type.getSourceModule();
        String prefix = type.getPrefix();
        String canonical = prefix == null ? source.getPrefix()
                : ctx.getDependencies().canonicalPrefix(source, prefix).orElse(null);

        Optional<String> translated = YangToRustTypeMapper.translate(name, canonical, type.getLocalName());
        if (translated.isPresent()) {
            return FieldType.builder().rustType(translated.get()).translatedFrom(name).build();
        }

        Optional<String> builtin = YangToRustTypeMapper.builtin(name);
        if (builtin.isPresent()) {
            return FieldType.of(builtin.get());
        }

        if (type.isKind(TypeKind.BUILTIN)) {
            String msg = "YANG type " + name + " of " + owner.getName() + " has no Rust mapping; using " + FALLBACK_TYPE;
            ctx.getDiagnostics().warn(msg);
            log.warn(msg);
            return FieldType.of(FALLBACK_TYPE);
        }

        if (canonical == null) {
            throw new SchemaResolutionException("type " + name + " referenced from module " + source.getName()
                    + " uses unknown prefix '" + prefix + "'");
        }
        TypedefDefinition typedef = ctx.getTypedefRegistry().find(canonical, type.getLocalName())
                .filter(d -> d.getKind() == TypedefDefinition.Kind.TYPEDEF)
                .orElseThrow(() -> new SchemaResolutionException("typedef " + name + " referenced from module "
                        + source.getName() + " is not defined"));
        return referenceTo(typedef);
    }

    /**
     * How other definitions refer to a typedef: by its own name when it is emitted, by its
     * resolved target otherwise.
     */
    public FieldType referenceTo(TypedefDefinition typedef) {
        FieldType cached = referenceCache.get(typedef);
        if (cached != null) {
            return cached;
        }

        FieldType result;
        if (isEmitted(typedef) || isEmittedOnDemand(typedef)) {
            result = FieldType.builder().rustType(typedef.getTypeName()).typedef(typedef).build();
        } else {
            if (!resolving.add(typedef)) {
                throw new SchemaResolutionException("typedef " + typedef.getPrefix() + ":" + typedef.getName()
                        + " refers to itself");
            }
            try {
                result = resolveTypedefTarget(typedef);
            } finally {
                resolving.remove(typedef);
            }
        }
        referenceCache.put(typedef, result);
        return result;
    }

    /**
     * A typedef gets its own alias or enum unless its module is excluded, its path is on the
     * exclusion list or it is an identityref.
     */
    public boolean isEmitted(TypedefDefinition typedef) {
        YangModule module = typedef.getNode().getModule();
        if (!ctx.getDependencies().isEmitted(module)) {
            return false;
        }
        if (ctx.getConfig().getExcludedTypedefs().contains(typedef.getPath())) {
            return false;
        }
        return !requireType(typedef.getNode()).isKind(TypeKind.IDENTITYREF);
    }

    /**
     * Enumeration typedef left out of regular emission. Its enum is still written, right
     * before the first definition that refers to it.
     */
    public boolean isEmittedOnDemand(TypedefDefinition typedef) {
        return typedef.getKind() == TypedefDefinition.Kind.TYPEDEF
                && !isEmitted(typedef)
                && requireType(typedef.getNode()).isKind(TypeKind.ENUMERATION);
    }

    private String canonicalPrefix(YangModule source, String prefix, String reference) {
        return ctx.getDependencies().canonicalPrefix(source, prefix)
                .orElseThrow(() -> new SchemaResolutionException(reference + " referenced from module "
                        + source.getName() + " uses unknown prefix '" + prefix + "'"));
    }

    private static SchemaNode dataContext(SchemaNode owner) {
        return owner.is(NodeKind.TYPEDEF) ? null : owner;
    }

    private static boolean isAbsolute(String path) {
        return path != null && path.trim().startsWith("/");
    }

    private static TypeStatement requireType(SchemaNode node) {
        if (node.getType() == null) {
            throw new SchemaResolutionException(node.getKind().getKeyword() + " " + node.getName()
                    + " in module " + node.getModule().getName() + " has no type");
        }
        return node.getType();
    }
}
