package com.sgw.common;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionPartitionerTest {

    @Test
    void sameIdAlwaysLandsOnSameWorker() {
        for (int i = 0; i < 200; i++) {
            String id = "session-" + i;
            int first = SessionPartitioner.partition(id, 7);
            for (int repeat = 0; repeat < 5; repeat++) {
                assertEquals(first, SessionPartitioner.partition(id, 7), id);
            }
        }
    }

    @Test
    void resultIsAlwaysInRange() {
        for (int i = 0; i < 1_000; i++) {
            int p = SessionPartitioner.partition(Integer.toString(i), 5);
            assertTrue(p >= 0 && p < 5, "out of range: " + p);
        }
    }

    @Test
    void spreadsIdsAcrossAllWorkers() {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            seen.add(SessionPartitioner.partition("user-" + i, 4));
        }
        assertEquals(4, seen.size());
    }

    @Test
    void singleWorkerAlwaysZero() {
        assertEquals(0, SessionPartitioner.partition("anything", 1));
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThrows(IllegalArgumentException.class, () -> SessionPartitioner.partition("a", 0));
    }
}
