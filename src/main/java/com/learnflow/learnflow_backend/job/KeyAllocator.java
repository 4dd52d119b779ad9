package com.learnflow.learnflow_backend.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Spreads the credential pool over a job's concepts with exactly one pool read
 * per call. Keys are handed out round-robin from the richest down; a key may
 * serve many concepts (soft over-subscription, no per-key lock).
 */
@Slf4j
@Component
public class KeyAllocator {

    private final CredentialPool pool;

    public KeyAllocator(CredentialPool pool) {
        this.pool = pool;
    }

    public KeyAllocation allocate(Collection<String> conceptIds, int minQuota) {
        // Duplicates collapse; every unit of a concept shares its key
        List<String> concepts = new ArrayList<>(new LinkedHashSet<>(conceptIds));
        Map<String, String> assignments = new LinkedHashMap<>();

        List<KeyLease> usable;
        try {
            usable = pool.listKeys(minQuota).stream()
                    .filter(k -> k.apiKey() != null && k.remainingQuota() >= minQuota)
                    .sorted(Comparator.comparingInt(KeyLease::remainingQuota).reversed())
                    .toList();
        } catch (RuntimeException e) {
            log.error("[KEY-ALLOC] Credential pool read failed, {} concepts fall back: {}", concepts.size(), e.getMessage());
            concepts.forEach(c -> assignments.put(c, null));
            return new KeyAllocation(assignments, 0);
        }

        if (usable.isEmpty()) {
            log.warn("[KEY-ALLOC] No key with quota >= {}, {} concepts fall back", minQuota, concepts.size());
            concepts.forEach(c -> assignments.put(c, null));
            return new KeyAllocation(assignments, 0);
        }

        for (int i = 0; i < concepts.size(); i++) {
            assignments.put(concepts.get(i), usable.get(i % usable.size()).apiKey());
        }

        KeyAllocation allocation = new KeyAllocation(assignments, usable.size());
        log.info("[KEY-ALLOC] concepts={} pool={} uniqueKeysUsed={} topKey={} quota={}",
                concepts.size(), usable.size(), allocation.uniqueKeysUsed(),
                usable.get(0).redacted(), usable.get(0).remainingQuota());
        return allocation;
    }
}
