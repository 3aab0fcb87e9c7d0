package com.conveyal.sweep.cache;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyedCacheTest {

    /** Ticker whose time only moves when the test says so. */
    private static class FakeTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read () {
            return nanos.get();
        }

        void advance (long seconds) {
            nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
        }
    }

    @Test
    void cachedKeyIsNotRecomputed () {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10);
        AtomicInteger calls = new AtomicInteger();
        assertEquals("A", cache.resolve("a", () -> { calls.incrementAndGet(); return "A"; }));
        KeyedCache.Lookup<String> second = cache.lookup("a", () -> { calls.incrementAndGet(); return "other"; });
        assertEquals("A", second.value);
        assertEquals(KeyedCache.Source.CACHED, second.source);
        assertTrue(second.shared());
        assertEquals(1, calls.get());
    }

    /**
     * Many threads ask for the same key while the first computation is blocked. Exactly one computation must run,
     * and every caller must get its value.
     */
    @Test
    void concurrentRequestsShareOneComputation () throws Exception {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        int nThreads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(nThreads);
        try {
            List<Future<KeyedCache.Lookup<String>>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> cache.lookup("k", () -> {
                calls.incrementAndGet();
                computing.countDown();
                release.await();
                return "value";
            })));
            assertTrue(computing.await(5, TimeUnit.SECONDS));
            for (int i = 1; i < nThreads; i++) {
                futures.add(pool.submit(() -> cache.lookup("k", () -> {
                    calls.incrementAndGet();
                    return "duplicate";
                })));
            }
            // Wait until the other callers are queued up behind the first computation (or found nothing to wait for).
            Thread.sleep(200);
            assertEquals(1, cache.inFlightCount());
            release.countDown();
            int computed = 0;
            for (Future<KeyedCache.Lookup<String>> future : futures) {
                KeyedCache.Lookup<String> lookup = future.get(5, TimeUnit.SECONDS);
                assertEquals("value", lookup.value);
                if (!lookup.shared()) computed += 1;
            }
            assertEquals(1, calls.get());
            assertEquals(1, computed);
            assertEquals(0, cache.inFlightCount());
            assertEquals(1, cache.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void leastRecentlyUsedIsEvicted () {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 2);
        cache.resolve("a", () -> "A");
        cache.resolve("b", () -> "B");
        // Touch a, so b becomes the least recently used entry.
        assertEquals("A", cache.resolve("a", () -> "recomputed"));
        cache.resolve("c", () -> "C");
        assertEquals(2, cache.size());
        assertNull(cache.getIfPresent("b"));
        assertEquals("A", cache.getIfPresent("a"));
        assertEquals("C", cache.getIfPresent("c"));
    }

    @Test
    void entriesExpireAfterTimeToLive () {
        FakeTicker ticker = new FakeTicker();
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10, 60, ticker);
        AtomicInteger calls = new AtomicInteger();
        cache.resolve("a", () -> "A" + calls.incrementAndGet());
        ticker.advance(59);
        assertEquals("A1", cache.resolve("a", () -> "A" + calls.incrementAndGet()));
        ticker.advance(2);
        assertEquals("A2", cache.resolve("a", () -> "A" + calls.incrementAndGet()));
        assertEquals(2, calls.get());
    }

    /** A thrown exception reaches the caller but leaves nothing behind, so the next call tries again. */
    @Test
    void exceptionsAreNotCached () {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10);
        UncheckedIOException thrown = assertThrows(UncheckedIOException.class, () -> cache.resolve("a", () -> {
            throw new UncheckedIOException(new IOException("connection reset"));
        }));
        assertEquals("connection reset", thrown.getCause().getMessage());
        assertEquals(0, cache.size());
        assertEquals(0, cache.inFlightCount());
        KeyedCache.Lookup<String> retry = cache.lookup("a", () -> "A");
        assertEquals("A", retry.value);
        assertFalse(retry.shared());
    }

    @Test
    void waitersSeeTheSameException () throws Exception {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10);
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        IllegalStateException failure = new IllegalStateException("upstream gone");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> first = pool.submit(() -> cache.resolve("k", () -> {
                computing.countDown();
                release.await();
                throw failure;
            }));
            assertTrue(computing.await(5, TimeUnit.SECONDS));
            Future<String> second = pool.submit(() -> cache.resolve("k", () -> "should not run"));
            Thread.sleep(200);
            release.countDown();
            for (Future<String> future : List.of(first, second)) {
                ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
                assertSame(failure, e.getCause());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void checkedExceptionsAreWrapped () {
        KeyedCache<String, String> cache = new KeyedCache<>("test", 10);
        RuntimeException thrown = assertThrows(RuntimeException.class, () -> cache.resolve("a", () -> {
            throw new IOException("timeout");
        }));
        assertTrue(thrown.getCause() instanceof IOException);
    }

}
