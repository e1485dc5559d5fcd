package com.yang.generator.codegen.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typedef registry keyed by (canonical module prefix, name). First registration of a name wins.
 */
public class TypedefRegistry {

    private final Map<String, Map<String, TypedefDefinition>> byPrefix = new LinkedHashMap<>();

    /**
     * @return false when the name was already registered for the prefix
     */
    public boolean register(TypedefDefinition definition) {
        Map<String, TypedefDefinition> defs = byPrefix.computeIfAbsent(definition.getPrefix(), k -> new LinkedHashMap<>());
        return defs.putIfAbsent(definition.getName(), definition) == null;
    }

    public Optional<TypedefDefinition> find(String prefix, String name) {
        Map<String, TypedefDefinition> defs = byPrefix.get(prefix);
        return defs == null ? Optional.empty() : Optional.ofNullable(defs.get(name));
    }

    /** Definitions of one module, in registration order. */
    public List<TypedefDefinition> forPrefix(String prefix) {
        Map<String, TypedefDefinition> defs = byPrefix.get(prefix);
        return defs == null ? List.of() : new ArrayList<>(defs.values());
    }
}
