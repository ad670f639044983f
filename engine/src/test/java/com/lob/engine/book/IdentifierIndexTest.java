package com.lob.engine.book;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierIndexTest {

    @Test
    void testFindMissingReturnsNull() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        assertNull(index.find(42));
        assertNull(index.erase(42));
    }

    @Test
    void testBucketCountRoundedToPowerOfTwo() {
        assertEquals(16, new IdentifierIndex<String>("test", 10, 100).bucketCount());
        assertEquals(1, new IdentifierIndex<String>("test", 1, 100).bucketCount());
    }

    @Test
    void testInsertFindErase() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        index.insert(7, "seven");
        assertEquals("seven", index.find(7));

        assertEquals("seven", index.erase(7));
        assertNull(index.find(7), "Erased entry is no longer visible");
        assertNull(index.erase(7), "Second erase finds nothing");
    }

    // -----------------------------------------------------------------------
    // Duplicate keys: newest first, one entry cleared per erase
    // -----------------------------------------------------------------------
    @Test
    void testDuplicateKeysNewestVisitedFirst() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        index.insert(5, "old");
        index.insert(5, "new");

        assertEquals("new", index.find(5));
        assertEquals("new", index.erase(5));
        assertEquals("old", index.find(5), "Older duplicate is uncovered");
        assertEquals("old", index.erase(5));
        assertNull(index.find(5));
    }

    @Test
    void testCollidingKeysShareBucket() {
        // Single bucket: every key chains together
        IdentifierIndex<Long> index = new IdentifierIndex<>("test", 1, 100);
        for (long k = 0; k < 10; k++) index.insert(k, k * 10);
        for (long k = 0; k < 10; k++) assertEquals(k * 10, index.find(k));

        index.erase(4);
        assertNull(index.find(4));
        assertEquals(50L, index.find(5), "Neighbours in the chain unaffected");
    }

    // -----------------------------------------------------------------------
    // Logical deletion: entries are never reclaimed
    // -----------------------------------------------------------------------
    @Test
    void testEraseIsLogical() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        for (int round = 0; round < 5; round++) {
            index.insert(1, "v" + round);
            index.erase(1);
        }
        assertEquals(5, index.entryCount(), "Chain grows under erase/reinsert churn");
        assertEquals(0, index.liveCount());
    }

    @Test
    void testCapacityBudgetCountsPhysicalEntries() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 4, 2);
        index.insert(1, "a");
        index.erase(1);
        index.insert(2, "b");

        CapacityExceededException e = assertThrows(CapacityExceededException.class, () -> index.insert(3, "c"));
        assertEquals(2, e.limit());
        assertEquals("test index entries", e.resource());
        assertEquals(2, index.entryCount(), "Failed insert does not consume budget");
        assertNull(index.find(3));
    }

    @Test
    void testNullValueRejected() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 4, 10);
        assertThrows(IllegalArgumentException.class, () -> index.insert(1, null));
        assertThrows(IllegalArgumentException.class, () -> index.insertIfAbsent(1, null));
    }

    // -----------------------------------------------------------------------
    // insertIfAbsent
    // -----------------------------------------------------------------------
    @Test
    void testInsertIfAbsent() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        assertNull(index.insertIfAbsent(9, "first"));
        assertEquals("first", index.insertIfAbsent(9, "second"), "Existing live value returned");
        assertEquals("first", index.find(9));
        assertEquals(1, index.entryCount(), "Rejected insert leaves no entry");

        index.erase(9);
        assertNull(index.insertIfAbsent(9, "third"), "Key reusable after erase");
        assertEquals("third", index.find(9));
    }

    @Test
    void testRemoveOnlyMatchingValue() {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 16, 100);
        String first = "first";
        index.insert(4, first);
        index.erase(4);
        index.insert(4, "reused");

        assertFalse(index.remove(4, first), "Stale value no longer present");
        assertEquals("reused", index.find(4));
        assertTrue(index.remove(4, index.find(4)));
        assertNull(index.find(4));
        assertEquals(0, index.liveCount());
    }

    @Test
    void testConcurrentInsertIfAbsentSingleWinner() throws Exception {
        IdentifierIndex<Integer> index = new IdentifierIndex<>("test", 2, 10_000);
        int threads = 8;
        int keys = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> wins = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int me = t;
                wins.add(pool.submit(() -> {
                    start.await();
                    int won = 0;
                    for (long k = 0; k < keys; k++) {
                        if (index.insertIfAbsent(k, me) == null) won++;
                    }
                    return won;
                }));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> f : wins) total += f.get(30, TimeUnit.SECONDS);
            assertEquals(keys, total, "Exactly one insert wins per key");
            assertEquals(keys, index.liveCount());
            assertEquals(keys, index.entryCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testConcurrentEraseClearsOnce() throws Exception {
        IdentifierIndex<String> index = new IdentifierIndex<>("test", 8, 100);
        index.insert(3, "only");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return index.erase(3);
                }));
            }
            start.countDown();
            int hits = 0;
            for (Future<String> f : results) {
                if (f.get(30, TimeUnit.SECONDS) != null) hits++;
            }
            assertEquals(1, hits, "Only one eraser receives the value");
        } finally {
            pool.shutdownNow();
        }
    }
}
