package com.yang.generator.codegen.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identity registry keyed by (canonical module prefix, name).
 */
public class IdentityRegistry {

    private final Map<String, Map<String, IdentityDefinition>> byPrefix = new LinkedHashMap<>();

    public boolean register(IdentityDefinition identity) {
        Map<String, IdentityDefinition> defs = byPrefix.computeIfAbsent(identity.getPrefix(), k -> new LinkedHashMap<>());
        return defs.putIfAbsent(identity.getName(), identity) == null;
    }

    public Optional<IdentityDefinition> find(String prefix, String name) {
        Map<String, IdentityDefinition> defs = byPrefix.get(prefix);
        return defs == null ? Optional.empty() : Optional.ofNullable(defs.get(name));
    }

    public List<IdentityDefinition> forPrefix(String prefix) {
        Map<String, IdentityDefinition> defs = byPrefix.get(prefix);
        return defs == null ? List.of() : new ArrayList<>(defs.values());
    }
}
