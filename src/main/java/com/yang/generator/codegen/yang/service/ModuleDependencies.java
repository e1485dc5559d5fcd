package com.yang.generator.codegen.yang.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.yang.generator.model.YangModule;

import lombok.Builder;
import lombok.Value;

/**
 * Result of module dependency resolution.
 */
@Value
@Builder
public class ModuleDependencies {

    /** Every module after all modules it imports. */
    List<YangModule> resolutionOrder;

    /** {@link #resolutionOrder} without excluded modules. */
    List<YangModule> emissionOrder;

    /** Own prefix or import alias → canonical prefix of the module it names. */
    Map<String, String> aliases;

    /** Module name → every alias the module is known by (own prefix first). */
    Map<String, Set<String>> aliasesByModule;

    Map<String, YangModule> modulesByName;

    Map<String, YangModule> modulesByPrefix;

    /**
     * Module named by {@code alias} as seen from {@code from}. The referencing module's own
     * import table wins; the global alias map is the fallback. A null alias means {@code from}.
     */
    public Optional<YangModule> moduleFor(YangModule from, String alias) {
        if (alias == null) {
            return Optional.ofNullable(from);
        }
        if (from != null) {
            Optional<String> name = from.moduleNameFor(alias);
            if (name.isPresent() && modulesByName.containsKey(name.get())) {
                return Optional.of(modulesByName.get(name.get()));
            }
        }
        String canonical = aliases.get(alias);
        return canonical == null ? Optional.empty() : Optional.ofNullable(modulesByPrefix.get(canonical));
    }

    public Optional<String> canonicalPrefix(YangModule from, String alias) {
        return moduleFor(from, alias).map(YangModule::getPrefix);
    }

    public boolean isEmitted(YangModule module) {
        return emissionOrder.contains(module);
    }
}
