package com.bsl.dimrank.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bsl.dimrank.MutableClock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    @Test
    void entryIsHitJustBeforeTtlAndMissJustAfter() {
        MutableClock clock = new MutableClock(1_000L);
        TtlCache<Double> cache = new TtlCache<>(10, 60_000L, clock);
        cache.put("k", 0.42);

        clock.set(1_000L + 60_000L - 1L);
        assertEquals(0.42, cache.get("k").orElseThrow().getValue(), 1e-9);

        clock.set(1_000L + 60_000L + 1L);
        assertFalse(cache.get("k").isPresent());
        assertEquals(0, cache.size());
    }

    @Test
    void readsDoNotExtendLifetime() {
        MutableClock clock = new MutableClock(0L);
        TtlCache<String> cache = new TtlCache<>(10, 100L, clock);
        cache.put("k", "v");

        for (int i = 0; i < 5; i++) {
            clock.advance(20L);
            assertTrue(cache.get("k").isPresent());
        }
        clock.advance(20L);
        assertFalse(cache.get("k").isPresent());
    }

    @Test
    void evictsOldestInsertionWhenFull() {
        MutableClock clock = new MutableClock(0L);
        TtlCache<Integer> cache = new TtlCache<>(2, 10_000L, clock);
        cache.put("a", 1);
        clock.advance(1L);
        cache.put("b", 2);
        clock.advance(1L);
        cache.get("a");
        cache.put("c", 3);

        assertFalse(cache.get("a").isPresent());
        assertTrue(cache.get("b").isPresent());
        assertTrue(cache.get("c").isPresent());
        assertEquals(2, cache.size());
    }

    @Test
    void reinsertingKeyRestartsItsLifetime() {
        MutableClock clock = new MutableClock(0L);
        TtlCache<Integer> cache = new TtlCache<>(4, 100L, clock);
        cache.put("a", 1);
        clock.advance(80L);
        cache.put("a", 2);
        clock.advance(80L);

        assertEquals(2, cache.get("a").orElseThrow().getValue());
        for (int i = 0; i < 50; i++) {
            cache.put("a", i);
        }
        assertEquals(1, cache.size());
    }

    @Test
    void invalidateAllDropsEverything() {
        TtlCache<Integer> cache = new TtlCache<>(4, 100L, new MutableClock(0L));
        cache.put("a", 1);
        cache.put("b", 2);

        cache.invalidateAll();

        assertEquals(0, cache.size());
        assertFalse(cache.get("a").isPresent());
    }

    @Test
    void concurrentInsertsNeverExceedCapacity() throws Exception {
        TtlCache<Integer> cache = new TtlCache<>(50, 60_000L, new MutableClock(0L));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    cache.put("t" + thread + "-" + i, i);
                    cache.get("t" + thread + "-" + (i / 2));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertTrue(cache.size() <= 50);
    }
}
