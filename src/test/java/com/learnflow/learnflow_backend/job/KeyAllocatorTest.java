package com.learnflow.learnflow_backend.job;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyAllocatorTest {

    private final AtomicInteger reads = new AtomicInteger();

    private KeyAllocator allocator(List<KeyLease> keys) {
        return new KeyAllocator(minQuota -> {
            reads.incrementAndGet();
            return keys;
        });
    }

    private static List<String> concepts(int n) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ids.add("roadmap:c" + i);
        }
        return ids;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 10, 1000})
    void readsThePoolExactlyOnce(int conceptCount) {
        KeyAllocation allocation = allocator(List.of(new KeyLease("tvly-aaaa", 50), new KeyLease("tvly-bbbb", 20)))
                .allocate(concepts(conceptCount), 4);

        assertEquals(1, reads.get());
        assertEquals(conceptCount, allocation.unitsWithKey());
    }

    @Test
    void keysAreHandedOutRoundRobinFromTheRichest() {
        KeyAllocation allocation = allocator(List.of(
                new KeyLease("tvly-low", 5),
                new KeyLease("tvly-high", 90),
                new KeyLease("tvly-mid", 30)))
                .allocate(concepts(5), 4);

        assertEquals("tvly-high", allocation.keyFor("roadmap:c0"));
        assertEquals("tvly-mid", allocation.keyFor("roadmap:c1"));
        assertEquals("tvly-low", allocation.keyFor("roadmap:c2"));
        assertEquals("tvly-high", allocation.keyFor("roadmap:c3"));
        assertEquals(3, allocation.uniqueKeysUsed());
    }

    @Test
    void keysBelowMinimumQuotaAreIgnored() {
        KeyAllocation allocation = allocator(List.of(new KeyLease("tvly-empty", 3), new KeyLease("tvly-ok", 4)))
                .allocate(concepts(3), 4);

        assertEquals(1, allocation.uniqueKeysUsed());
        assertEquals("tvly-ok", allocation.keyFor("roadmap:c2"));
    }

    @Test
    void emptyPoolFallsBackForEveryConcept() {
        KeyAllocation allocation = allocator(List.of()).allocate(concepts(4), 4);

        assertEquals(4, allocation.unitsWithoutKey());
        assertNull(allocation.keyFor("roadmap:c0"));
        assertEquals(0.0, allocation.allocationRate());
    }

    @Test
    void poolReadFailureFallsBackInsteadOfFailingTheJob() {
        KeyAllocator allocator = new KeyAllocator(minQuota -> {
            throw new IllegalStateException("credential table locked");
        });

        KeyAllocation allocation = allocator.allocate(concepts(2), 4);

        assertEquals(2, allocation.unitsWithoutKey());
    }

    @Test
    void everyUnitOfAConceptSharesItsKey() {
        List<String> ids = new ArrayList<>(concepts(2));
        ids.add("roadmap:c0");
        ids.add("roadmap:c0");

        KeyAllocation allocation = allocator(List.of(new KeyLease("tvly-a", 10), new KeyLease("tvly-b", 9)))
                .allocate(ids, 4);

        assertEquals(2, allocation.assignments().size());
        assertTrue(allocation.stats().containsKey("uniqueKeysUsed"));
    }
}
