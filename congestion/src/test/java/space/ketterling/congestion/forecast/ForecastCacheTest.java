package space.ketterling.congestion.forecast;

import com.github.benmanes.caffeine.cache.Cache;
import org.junit.jupiter.api.Test;

import space.ketterling.congestion.model.ForecastPoint;
import space.ketterling.congestion.model.ForecastSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ForecastCacheTest {
    private static final Instant AS_OF = Instant.parse("2024-03-04T10:15:00Z");

    static ForecastSet set(String loc, Instant asOf, Integer... horizons) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int h : horizons)
            points.add(new ForecastPoint(asOf.plusSeconds(h * 3600L), h, 40, 3, 0.9, 0.8, "ensemble"));
        return new ForecastSet(loc, asOf, List.of(horizons), points, List.of());
    }

    @Test
    void getOrCompute_shouldServeHitWithinTtl() {
        AtomicLong nanos = new AtomicLong();
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100, nanos::get);
        AtomicInteger calls = new AtomicInteger();

        ForecastSet first = cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1, 3);
        });
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(29));
        ForecastSet second = cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1, 3);
        });

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, cache.stats().hits());
    }

    @Test
    void getOrCompute_shouldRecomputeAfterTtl() {
        AtomicLong nanos = new AtomicLong();
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100, nanos::get);
        AtomicInteger calls = new AtomicInteger();

        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(31));
        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });

        assertEquals(2, calls.get());
    }

    @Test
    void getOrCompute_shouldKeySeparateHourBuckets() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        AtomicInteger calls = new AtomicInteger();
        Instant sameHour = AS_OF.plusSeconds(20 * 60);
        Instant nextHour = AS_OF.plusSeconds(50 * 60);

        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });
        cache.getOrCompute("loc-1", sameHour, () -> {
            calls.incrementAndGet();
            return set("loc-1", sameHour, 1);
        });
        assertEquals(1, calls.get());

        cache.getOrCompute("loc-1", nextHour, () -> {
            calls.incrementAndGet();
            return set("loc-1", nextHour, 1);
        });
        cache.getOrCompute("loc-2", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-2", AS_OF, 1);
        });
        assertEquals(3, calls.get());
    }

    @Test
    void getOrCompute_shouldRunConcurrentMissOnce() throws Exception {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<ForecastSet>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute("loc-1", AS_OF, () -> {
                        calls.incrementAndGet();
                        try {
                            Thread.sleep(200);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return set("loc-1", AS_OF, 1, 3);
                    });
                }));
            }
            start.countDown();
            ForecastSet first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<ForecastSet> f : results)
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void getOrCompute_shouldNotStoreFailures() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        IllegalStateException boom = new IllegalStateException("db down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute("loc-1", AS_OF, () -> {
                    throw boom;
                }));
        assertSame(boom, thrown);

        AtomicInteger calls = new AtomicInteger();
        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });
        assertEquals(1, calls.get());
    }

    @Test
    void getOrCompute_shouldReturnButNotStoreEmptySet() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        ForecastSet empty = set("loc-1", AS_OF);

        assertSame(empty, cache.getOrCompute("loc-1", AS_OF, () -> empty));
        assertEquals(0, cache.stats().size());

        AtomicInteger calls = new AtomicInteger();
        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });
        assertEquals(1, calls.get());
    }

    @Test
    void getOrCompute_shouldRecomputeWhenCachedSetDoesNotCoverRequest() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        cache.getOrCompute("loc-1", AS_OF, () -> set("loc-1", AS_OF, 1, 3));

        List<Integer> wanted = List.of(1, 6);
        ForecastSet wider = cache.getOrCompute("loc-1", AS_OF, s -> s.covers(wanted),
                () -> set("loc-1", AS_OF, 1, 6));

        assertEquals(List.of(1, 6), wider.requestedHorizons());
        assertSame(wider, cache.getOrCompute("loc-1", AS_OF, s -> s.covers(wanted),
                () -> fail("should be cached")));
    }

    @Test
    void invalidateAll_shouldDropEntries() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        cache.getOrCompute("loc-1", AS_OF, () -> set("loc-1", AS_OF, 1));
        cache.invalidateAll();

        AtomicInteger calls = new AtomicInteger();
        cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return set("loc-1", AS_OF, 1);
        });
        assertEquals(1, calls.get());
    }

    @Test
    void getOrCompute_shouldNotHoldUpOtherLocationsWhileOneComputes() throws Exception {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 1000);
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ForecastSet> slow = pool.submit(() -> cache.getOrCompute("loc-slow", AS_OF, () -> {
                slowStarted.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return set("loc-slow", AS_OF, 1);
            }));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                for (int i = 0; i < 64; i++) {
                    String loc = "loc-" + i;
                    ForecastSet s = cache.getOrCompute(loc, AS_OF, () -> set(loc, AS_OF, 1));
                    assertEquals(loc, s.locationId());
                }
            });

            release.countDown();
            assertEquals("loc-slow", slow.get(5, TimeUnit.SECONDS).locationId());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void getOrCompute_shouldComputeAgainAfterInFlightFailure() throws Exception {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ForecastSet> owner = pool.submit(() -> cache.getOrCompute("loc-1", AS_OF, () -> {
                calls.incrementAndGet();
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IllegalStateException("db down");
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            release.countDown();

            ExecutionException ee = assertThrows(ExecutionException.class, () -> owner.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, ee.getCause());

            ForecastSet next = cache.getOrCompute("loc-1", AS_OF, () -> {
                calls.incrementAndGet();
                return set("loc-1", AS_OF, 1);
            });
            assertEquals(List.of(1), next.requestedHorizons());
            assertEquals(2, calls.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void getOrCompute_shouldComputeDirectlyWhenLookupFails() {
        @SuppressWarnings("unchecked")
        Cache<ForecastCache.ForecastKey, ForecastSet> broken = mock(Cache.class);
        when(broken.getIfPresent(any())).thenThrow(new IllegalStateException("cache down"));
        ForecastCache cache = new ForecastCache(broken);
        AtomicInteger calls = new AtomicInteger();
        ForecastSet expected = set("loc-1", AS_OF, 1);

        ForecastSet got = cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return expected;
        });

        assertSame(expected, got);
        assertEquals(1, calls.get());
        verify(broken, never()).put(any(), any());
    }

    @Test
    void getOrCompute_shouldReturnComputedSetWhenStoreFails() {
        @SuppressWarnings("unchecked")
        Cache<ForecastCache.ForecastKey, ForecastSet> broken = mock(Cache.class);
        when(broken.asMap()).thenReturn(new ConcurrentHashMap<>());
        doThrow(new IllegalStateException("cache down")).when(broken).put(any(), any());
        ForecastCache cache = new ForecastCache(broken);
        AtomicInteger calls = new AtomicInteger();
        ForecastSet expected = set("loc-1", AS_OF, 1);

        ForecastSet got = cache.getOrCompute("loc-1", AS_OF, () -> {
            calls.incrementAndGet();
            return expected;
        });

        assertSame(expected, got);
        assertEquals(1, calls.get());
        verify(broken).put(ForecastCache.ForecastKey.of("loc-1", AS_OF), expected);
    }

    @Test
    void invalidateAll_shouldKeepRunningComputationFromStoringStaleResult() throws Exception {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ForecastSet> old = pool.submit(() -> cache.getOrCompute("loc-1", AS_OF, () -> {
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return set("loc-1", AS_OF, 1);
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            cache.invalidateAll();
            release.countDown();
            old.get(5, TimeUnit.SECONDS);

            assertTrue(cache.peek("loc-1", AS_OF).isEmpty());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void peek_shouldReturnStoredSetWithoutCountingStats() {
        ForecastCache cache = new ForecastCache(Duration.ofMinutes(30), 100);
        assertTrue(cache.peek("loc-1", AS_OF).isEmpty());

        ForecastSet stored = cache.getOrCompute("loc-1", AS_OF, () -> set("loc-1", AS_OF, 1, 3));
        long hits = cache.stats().hits();

        assertSame(stored, cache.peek("loc-1", AS_OF.plusSeconds(600)).orElseThrow());
        assertEquals(hits, cache.stats().hits());
    }
}
