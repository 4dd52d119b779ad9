package com.learnflow.learnflow_backend.job;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable conceptId to key assignment for one job. A null key means the
 * concept's units run on the fallback provider.
 */
public final class KeyAllocation {

    private final Map<String, String> assignments;
    private final int poolSize;

    KeyAllocation(Map<String, String> assignments, int poolSize) {
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.poolSize = poolSize;
    }

    public String keyFor(String conceptId) {
        return assignments.get(conceptId);
    }

    public Map<String, String> assignments() {
        return assignments;
    }

    public int poolSize() {
        return poolSize;
    }

    public int unitsWithKey() {
        return (int) assignments.values().stream().filter(Objects::nonNull).count();
    }

    public int unitsWithoutKey() {
        return assignments.size() - unitsWithKey();
    }

    public int uniqueKeysUsed() {
        return new HashSet<>(assignments.values().stream().filter(Objects::nonNull).toList()).size();
    }

    public double allocationRate() {
        return assignments.isEmpty() ? 0.0 : (double) unitsWithKey() / assignments.size();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("concepts", assignments.size());
        stats.put("withKey", unitsWithKey());
        stats.put("withoutKey", unitsWithoutKey());
        stats.put("uniqueKeysUsed", uniqueKeysUsed());
        stats.put("poolSize", poolSize);
        stats.put("allocationRate", allocationRate());
        return stats;
    }
}
