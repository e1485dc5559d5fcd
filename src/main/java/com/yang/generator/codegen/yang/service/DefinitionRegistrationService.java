package com.yang.generator.codegen.yang.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yang.generator.codegen.model.core.context.GenerationContext;
import com.yang.generator.codegen.registry.IdentityDefinition;
import com.yang.generator.codegen.registry.IdentityRegistry;
import com.yang.generator.codegen.registry.TypedefDefinition;
import com.yang.generator.codegen.yang.util.YangNamingUtil;
import com.yang.generator.model.SchemaNode;
import com.yang.generator.model.TypeStatement;
import com.yang.generator.model.YangModule;

import lombok.NoArgsConstructor;

/**
 * Fills the typedef and identity registries for one module. Modules must be registered in
 * resolution order so that base identities of imported modules are already known.
 */
@NoArgsConstructor
public class DefinitionRegistrationService {
    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistrationService.class);

    public void registerModule(YangModule module, GenerationContext ctx) {
        int typedefs = registerTypedefs(module, ctx);
        int identities = registerIdentities(module, ctx);
        log.debug("Module {}: registered {} typedefs, {} identities", module.getName(), typedefs, identities);
    }

    private int registerTypedefs(YangModule module, GenerationContext ctx) {
        int count = 0;
        for (SchemaNode typedef : module.getTypedefs()) {
            TypedefDefinition def = TypedefDefinition.builder()
                    .kind(TypedefDefinition.Kind.TYPEDEF)
                    .name(typedef.getName())
                    .typeName(YangNamingUtil.toTypeName(typedef.getName()))
                    .prefix(module.getPrefix())
                    .node(typedef)
                    .path("/" + module.getPrefix() + ":" + typedef.getName())
                    .build();
            if (ctx.getTypedefRegistry().register(def)) {
                count++;
            } else {
                log.debug("Typedef {}:{} declared more than once, keeping the first",
                        module.getPrefix(), typedef.getName());
            }
        }
        return count;
    }

    private int registerIdentities(YangModule module, GenerationContext ctx) {
        IdentityRegistry registry = ctx.getIdentityRegistry();
        List<IdentityDefinition> registered = new ArrayList<>();

        for (SchemaNode identity : module.getIdentities()) {
            IdentityDefinition def = new IdentityDefinition(identity.getName(),
                    YangNamingUtil.toTypeName(identity.getName()), module.getPrefix(), identity);
            if (registry.register(def)) {
                registered.add(def);
            }
        }

        for (IdentityDefinition def : registered) {
            for (String base : def.getNode().getBases()) {
                String basePrefix = ctx.getDependencies()
                        .canonicalPrefix(module, TypeStatement.prefixOf(base))
                        .orElse(null);
                IdentityDefinition baseDef = basePrefix == null ? null
                        : registry.find(basePrefix, TypeStatement.localNameOf(base)).orElse(null);
                if (baseDef == null) {
                    String msg = "Identity " + def + " derives from unknown base " + base;
                    ctx.getDiagnostics().warn(msg);
                    log.warn(msg);
                    continue;
                }
                baseDef.addDerived(def);
            }
        }
        return registered.size();
    }
}
