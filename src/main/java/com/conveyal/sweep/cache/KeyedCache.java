package com.conveyal.sweep.cache;

import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Memoizes the results of slow upstream calls by key, and collapses concurrent requests for the same key into a
 * single call. Our requirements are:
 * A key already in the cache is answered without calling the upstream, and becomes the most recently used entry.
 * While a value for some key is being computed, other callers asking for that key wait for the same computation.
 * At most one computation per key is ever running across all threads.
 * The number of entries is bounded, evicting the least recently used one when a new entry would exceed the bound.
 *
 * Completed values live in a Guava Cache with a single segment, which makes its size-based eviction strictly LRU.
 * Computations in flight are tracked separately as futures. All checks and mutations of the two maps happen while
 * holding one lock, so no caller can see a key that is neither in flight nor cached while its value is being
 * published. The computation itself runs outside the lock, on the thread of the first caller.
 *
 * Whatever compute() returns is cached, including values representing upstream errors. This is what keeps repeated
 * failing queries from reaching the upstream over and over. An exception thrown by compute() is not cached: it is
 * rethrown to the first caller and to every caller waiting on the same key.
 */
public class KeyedCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedCache.class);

    /** Where the value returned by lookup() came from. */
    public enum Source {
        // Found in the cache
        CACHED,
        // Another thread was already computing it, and this caller waited for that result
        ATTACHED,
        // Computed by this caller
        COMPUTED
    }

    /** A value along with how it was obtained, mostly for diagnostics. */
    public static class Lookup<V> {
        public final V value;
        public final Source source;

        private Lookup (V value, Source source) {
            this.value = value;
            this.source = source;
        }

        /** True if the upstream was not called on behalf of this caller. */
        public boolean shared () {
            return source != Source.COMPUTED;
        }
    }

    /** The display name used to distinguish between different KeyedCaches in log messages. */
    public final String logName;

    private final Lock lock = new ReentrantLock();

    private final Cache<K, V> completed;

    private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();

    public KeyedCache (String logName, int maximumSize) {
        this(logName, maximumSize, 0, Ticker.systemTicker());
    }

    /**
     * @param ttlSeconds if positive, entries also expire this many seconds after being stored. Zero disables expiry.
     * @param ticker time source for expiry, replaceable in tests.
     */
    public KeyedCache (String logName, int maximumSize, int ttlSeconds, Ticker ticker) {
        checkArgument(maximumSize >= 1, "Cache must hold at least one entry.");
        checkArgument(ttlSeconds >= 0, "Time to live must not be negative.");
        this.logName = logName;
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(maximumSize)
                .ticker(ticker);
        if (ttlSeconds > 0) {
            builder.expireAfterWrite(ttlSeconds, TimeUnit.SECONDS);
        }
        this.completed = builder.build();
    }

    /**
     * Return the value for the key, calling compute() only if it is neither cached nor already being computed.
     * Blocks until the value is available.
     */
    public V resolve (K key, Callable<V> compute) {
        return lookup(key, compute).value;
    }

    public Lookup<V> lookup (K key, Callable<V> compute) {
        checkNotNull(key);
        CompletableFuture<V> future;
        boolean computeHere = false;
        lock.lock();
        try {
            V cached = completed.getIfPresent(key);
            if (cached != null) {
                LOG.debug("{} hit for key {}.", logName, key);
                return new Lookup<>(cached, Source.CACHED);
            }
            future = inFlight.get(key);
            if (future == null) {
                future = new CompletableFuture<>();
                inFlight.put(key, future);
                computeHere = true;
            }
        } finally {
            lock.unlock();
        }
        if (computeHere) {
            LOG.debug("{} miss for key {}, computing.", logName, key);
            return new Lookup<>(computeAndPublish(key, compute, future), Source.COMPUTED);
        }
        LOG.debug("{} attaching to computation in flight for key {}.", logName, key);
        try {
            return new Lookup<>(future.join(), Source.ATTACHED);
        } catch (CompletionException e) {
            throw propagate(e.getCause());
        }
    }

    private V computeAndPublish (K key, Callable<V> compute, CompletableFuture<V> future) {
        V value;
        try {
            value = checkNotNull(compute.call(), "Cached computations must not return null.");
        } catch (Throwable t) {
            lock.lock();
            try {
                inFlight.remove(key);
            } finally {
                lock.unlock();
            }
            LOG.warn("{} computation failed for key {}: {}", logName, key, t.toString());
            future.completeExceptionally(t);
            throw propagate(t);
        }
        lock.lock();
        try {
            completed.put(key, value);
            inFlight.remove(key);
        } finally {
            lock.unlock();
        }
        future.complete(value);
        return value;
    }

    private static RuntimeException propagate (Throwable t) {
        Throwables.throwIfUnchecked(t);
        return new UncheckedExecutionException(t);
    }

    /** Peek at a cached value without computing it. Counts as an access for recency. */
    public V getIfPresent (K key) {
        lock.lock();
        try {
            return completed.getIfPresent(key);
        } finally {
            lock.unlock();
        }
    }

    public long size () {
        lock.lock();
        try {
            completed.cleanUp();
            return completed.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount () {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public void invalidateAll () {
        lock.lock();
        try {
            completed.invalidateAll();
        } finally {
            lock.unlock();
        }
    }

}
