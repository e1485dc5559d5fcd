package com.yang.generator.codegen.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered struct registry. Iteration order is discovery order of each key; a merge replaces
 * the value but keeps the position.
 */
public class StructRegistry {
    private static final Logger log = LoggerFactory.getLogger(StructRegistry.class);

    private final Map<StructKey, StructCandidate> candidates = new LinkedHashMap<>();

    /**
     * Register a candidate, or merge it into the live one for the same key: the candidate
     * with strictly more effective children wins. Returns the live candidate.
     */
    public StructCandidate registerOrMerge(StructCandidate candidate) {
        StructCandidate existing = candidates.get(candidate.getKey());
        if (existing == null) {
            candidates.put(candidate.getKey(), candidate);
            return candidate;
        }
        if (candidate.childCount() > existing.childCount()) {
            log.debug("Struct {} replaced: {} -> {} children", candidate.getKey(),
                    existing.childCount(), candidate.childCount());
            candidates.put(candidate.getKey(), candidate);
            return candidate;
        }
        return existing;
    }

    public Optional<StructCandidate> find(StructKey key) {
        return Optional.ofNullable(candidates.get(key));
    }

    /** Live candidates in discovery order. */
    public List<StructCandidate> candidates() {
        return new ArrayList<>(candidates.values());
    }

    public int size() {
        return candidates.size();
    }
}
