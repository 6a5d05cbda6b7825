package space.ketterling.congestion.forecast;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.error.ErrorKind;
import space.ketterling.congestion.metrics.ForecastMetrics;
import space.ketterling.congestion.model.ForecastSet;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Keeps one multi-horizon forecast per location and hour.
 *
 * <p>
 * Entries expire a fixed time after they were written, independent of the
 * hour bucket. Concurrent misses on the same key run the computation once
 * and all callers receive the same instance. The computation runs on the
 * first caller's thread with no lock held, so other keys are never held up
 * by it. Thrown computations and empty results are never stored. If the
 * cache itself misbehaves the forecast is computed directly.
 * </p>
 */
public final class ForecastCache {
    private static final Logger log = LoggerFactory.getLogger(ForecastCache.class);

    private final Cache<ForecastKey, ForecastSet> cache;
    private final ConcurrentMap<ForecastKey, CompletableFuture<ForecastSet>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    public ForecastCache(Duration ttl, long maxEntries) {
        this(ttl, maxEntries, Ticker.systemTicker());
    }

    public ForecastCache(Duration ttl, long maxEntries, Ticker ticker) {
        this(Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .recordStats()
                .build());
    }

    ForecastCache(Cache<ForecastKey, ForecastSet> cache) {
        this.cache = cache;
    }

    /**
     * (location, hour bucket) cache key.
     */
    public record ForecastKey(String locationId, Instant hourBucket) {
        public static ForecastKey of(String locationId, Instant asOf) {
            return new ForecastKey(locationId, asOf.truncatedTo(ChronoUnit.HOURS));
        }
    }

    public ForecastSet getOrCompute(String locationId, Instant asOf, Supplier<ForecastSet> compute) {
        return getOrCompute(locationId, asOf, s -> true, compute);
    }

    /**
     * Returns the cached set for the key when {@code usable} accepts it,
     * otherwise computes, stores and returns a fresh one.
     *
     * <p>
     * A caller that arrives while the same key is being computed waits for
     * that result. If the result does not satisfy its own {@code usable}
     * check it starts another computation once the first is finished.
     * </p>
     */
    public ForecastSet getOrCompute(String locationId, Instant asOf, Predicate<ForecastSet> usable,
            Supplier<ForecastSet> compute) {
        ForecastKey key = ForecastKey.of(locationId, asOf);

        ForecastSet hit;
        try {
            hit = cache.getIfPresent(key);
        } catch (RuntimeException e) {
            return degraded(key, e, compute);
        }
        if (hit != null && usable.test(hit))
            return hit;

        while (true) {
            CompletableFuture<ForecastSet> mine = new CompletableFuture<>();
            CompletableFuture<ForecastSet> running = inFlight.putIfAbsent(key, mine);
            if (running == null)
                return computeAndStore(key, mine, usable, compute);

            ForecastSet shared = await(running);
            if (shared != null && usable.test(shared))
                return shared;
        }
    }

    private ForecastSet computeAndStore(ForecastKey key, CompletableFuture<ForecastSet> mine,
            Predicate<ForecastSet> usable, Supplier<ForecastSet> compute) {
        try {
            ForecastSet stored = peek(key);
            if (stored != null && usable.test(stored)) {
                mine.complete(stored);
                return stored;
            }

            long gen = generation.get();
            ForecastSet fresh;
            try {
                fresh = compute.get();
            } catch (RuntimeException e) {
                mine.completeExceptionally(e);
                throw e;
            }
            if (fresh != null && !fresh.isEmpty() && gen == generation.get())
                store(key, fresh);
            mine.complete(fresh);
            return fresh;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private void store(ForecastKey key, ForecastSet fresh) {
        try {
            cache.put(key, fresh);
            ForecastMetrics.record(ForecastMetrics.CACHE, true);
        } catch (RuntimeException e) {
            ForecastMetrics.record(ForecastMetrics.CACHE, false);
            log.warn("{}: could not store forecast for {}: {}", ErrorKind.CACHE_UNAVAILABLE.wireName(), key,
                    e.toString());
        }
    }

    private static ForecastSet await(CompletableFuture<ForecastSet> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re)
                throw re;
            throw e;
        }
    }

    private ForecastSet peek(ForecastKey key) {
        try {
            return cache.asMap().get(key);
        } catch (RuntimeException e) {
            log.debug("Cache lookup for {} failed: {}", key, e.toString());
            return null;
        }
    }

    private ForecastSet degraded(ForecastKey key, RuntimeException e, Supplier<ForecastSet> compute) {
        ForecastMetrics.record(ForecastMetrics.CACHE, false);
        log.warn("{}: computing {} without cache: {}", ErrorKind.CACHE_UNAVAILABLE.wireName(), key, e.toString());
        return compute.get();
    }

    /**
     * The stored set for the location's current hour bucket, if any. Does not
     * count as a hit or a miss.
     */
    public Optional<ForecastSet> peek(String locationId, Instant asOf) {
        return Optional.ofNullable(peek(ForecastKey.of(locationId, asOf)));
    }

    /**
     * Drops every entry, e.g. after a new model is installed. Computations
     * already running when this is called do not store their result.
     */
    public void invalidateAll() {
        generation.incrementAndGet();
        cache.invalidateAll();
    }

    public void invalidate(String locationId, Instant asOf) {
        cache.invalidate(ForecastKey.of(locationId, asOf));
    }

    public CacheStats stats() {
        var s = cache.stats();
        return new CacheStats(cache.estimatedSize(), s.hitCount(), s.missCount(), s.hitRate(), s.evictionCount());
    }

    public record CacheStats(long size, long hits, long misses, double hitRate, long evictions) {
    }
}
