package space.ketterling.agriweather.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.error.BackendUnavailableException;
import space.ketterling.agriweather.error.RepositoryTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * TTL cache with one in-flight load per key.
 *
 * <p>
 * State is sharded by location id: each shard has its own entries, in-flight
 * loads and a generation counter, and only the shard monitor is taken when a
 * load is registered, completed or invalidated. Unrelated locations never
 * contend.
 * </p>
 *
 * <p>
 * Loads run on the executor passed with each call so every caller, including the one that
 * started the load, can give up at its own deadline while the load carries
 * on for the others. A load that started before an invalidation still
 * answers its waiters but is not stored.
 * </p>
 *
 * <p>
 * Storing a value purges the expired entries of its shard. When stale
 * entries may be served, the most recently loaded expired entry of the shard
 * is kept back for that purpose.
 * </p>
 *
 * @param <T> type of the cached values
 */
public final class SingleFlightCache<T> {
    private static final Logger log = LoggerFactory.getLogger(SingleFlightCache.class);

    private final Map<String, Shard<T>> shards = new ConcurrentHashMap<>();
    private final Clock clock;
    private final boolean serveStaleOnBackendFailure;

    private final LongAdder hits = new LongAdder();
    private final LongAdder loads = new LongAdder();
    private final LongAdder joins = new LongAdder();
    private final LongAdder staleServed = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder invalidations = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public SingleFlightCache(Clock clock, boolean serveStaleOnBackendFailure) {
        this.clock = clock;
        this.serveStaleOnBackendFailure = serveStaleOnBackendFailure;
    }

    /**
     * Returns the cached value for the key, loading it at most once across
     * concurrent callers when missing or expired.
     *
     * @throws RepositoryTimeoutException   when {@code timeout} elapses first
     * @throws BackendUnavailableException when the load fails and no stale
     *                                      entry may be served
     */
    public Fetched<T> get(CacheKey key, Duration ttl, Duration timeout, Executor executor, Supplier<T> loader) {
        if (timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        Shard<T> shard = shards.computeIfAbsent(key.locationId(), k -> new Shard<>());

        Entry<T> cached = shard.entries.get(key);
        if (cached != null && cached.isFresh(clock.instant())) {
            hits.increment();
            return fetched(cached, false);
        }

        Flight<T> flight;
        boolean leader = false;
        synchronized (shard) {
            // a load may have finished between the lock-free check and here
            Entry<T> again = shard.entries.get(key);
            if (again != null && again.isFresh(clock.instant())) {
                hits.increment();
                return fetched(again, false);
            }
            flight = shard.inflight.get(key);
            if (flight == null) {
                flight = new Flight<>(new CompletableFuture<>(), shard.generation);
                shard.inflight.put(key, flight);
                leader = true;
            }
        }

        if (leader) {
            loads.increment();
            log.debug("cache miss, loading {}", key);
            start(executor, shard, key, ttl, flight, loader);
        } else {
            joins.increment();
            log.debug("cache miss, joining in-flight load {}", key);
        }

        return await(shard, key, flight, deadlineNanos, timeout);
    }

    /**
     * Drops every entry and in-flight registration for the location. Loads
     * already running finish for their current waiters but are not cached.
     */
    public void invalidate(String locationId) {
        Shard<T> shard = shards.get(locationId);
        if (shard == null)
            return;
        synchronized (shard) {
            shard.generation++;
            shard.entries.clear();
            shard.inflight.clear();
        }
        invalidations.increment();
        log.debug("cache invalidated for location {}", locationId);
    }

    public CacheStats stats() {
        return new CacheStats(hits.sum(), loads.sum(), joins.sum(), staleServed.sum(), timeouts.sum(),
                invalidations.sum(), evictions.sum());
    }

    /**
     * Entries currently held, fresh or expired.
     */
    public int size() {
        int n = 0;
        for (Shard<T> shard : shards.values())
            n += shard.entries.size();
        return n;
    }

    private void start(Executor executor, Shard<T> shard, CacheKey key, Duration ttl, Flight<T> flight,
            Supplier<T> loader) {
        try {
            executor.execute(() -> {
                try {
                    T value = loader.get();
                    complete(shard, key, ttl, flight, value);
                } catch (Throwable t) {
                    fail(shard, key, flight, t);
                }
            });
        } catch (RejectedExecutionException e) {
            fail(shard, key, flight, new BackendUnavailableException("cache loader pool is shut down", e));
        }
    }

    private void complete(Shard<T> shard, CacheKey key, Duration ttl, Flight<T> flight, T value) {
        Instant now = clock.instant();
        synchronized (shard) {
            if (shard.generation == flight.generation) {
                shard.entries.put(key, new Entry<>(value, now, now.plus(ttl)));
                evictExpired(shard, now);
            } else {
                log.debug("discarding load for {} started before invalidation", key);
            }
            shard.inflight.remove(key, flight);
        }
        flight.future.complete(value);
    }

    /**
     * Drops expired entries, keeping the newest one when stale serving is on.
     * Caller holds the shard monitor.
     */
    private void evictExpired(Shard<T> shard, Instant now) {
        CacheKey keptKey = null;
        Entry<T> kept = null;
        Iterator<Map.Entry<CacheKey, Entry<T>>> it = shard.entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<CacheKey, Entry<T>> e = it.next();
            Entry<T> entry = e.getValue();
            if (entry.isFresh(now))
                continue;
            if (serveStaleOnBackendFailure && (kept == null || entry.loadedAt.isAfter(kept.loadedAt))) {
                if (keptKey != null) {
                    shard.entries.remove(keptKey);
                    evictions.increment();
                }
                keptKey = e.getKey();
                kept = entry;
            } else {
                it.remove();
                evictions.increment();
            }
        }
    }

    private void fail(Shard<T> shard, CacheKey key, Flight<T> flight, Throwable t) {
        synchronized (shard) {
            shard.inflight.remove(key, flight);
        }
        flight.future.completeExceptionally(t);
    }

    private Fetched<T> await(Shard<T> shard, CacheKey key, Flight<T> flight, long deadlineNanos,
            Duration timeout) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            T value = flight.future.get(remaining, TimeUnit.NANOSECONDS);
            return new Fetched<>(value, false, clock.instant());
        } catch (TimeoutException e) {
            timeouts.increment();
            throw new RepositoryTimeoutException("no result for " + key + " within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryTimeoutException("interrupted while waiting for " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendUnavailableException && serveStaleOnBackendFailure) {
                Entry<T> stale = shard.entries.get(key);
                if (stale != null) {
                    staleServed.increment();
                    log.warn("Backend unavailable, serving stale {} loaded at {}", key, stale.loadedAt);
                    return fetched(stale, true);
                }
            }
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new BackendUnavailableException("load failed for " + key, cause);
        }
    }

    private static <T> Fetched<T> fetched(Entry<T> e, boolean stale) {
        return new Fetched<>(e.value, stale, e.loadedAt);
    }

    private static final class Shard<T> {
        final Map<CacheKey, Entry<T>> entries = new ConcurrentHashMap<>();
        final Map<CacheKey, Flight<T>> inflight = new ConcurrentHashMap<>();
        long generation; // guarded by this
    }

    private static final class Flight<T> {
        final CompletableFuture<T> future;
        final long generation;

        Flight(CompletableFuture<T> future, long generation) {
            this.future = future;
            this.generation = generation;
        }
    }

    private static final class Entry<T> {
        final T value;
        final Instant loadedAt;
        final Instant expiresAt;

        Entry(T value, Instant loadedAt, Instant expiresAt) {
            this.value = value;
            this.loadedAt = loadedAt;
            this.expiresAt = expiresAt;
        }

        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
