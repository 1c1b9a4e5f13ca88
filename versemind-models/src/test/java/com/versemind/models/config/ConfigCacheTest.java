package com.versemind.models.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.versemind.common.config.CatalogSettings;
import com.versemind.models.backend.BackendException;
import com.versemind.models.backend.ConfigSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfigCacheTest {

    private static BackendConfig remoteConfig() {
        return BackendConfig.fromTree(Map.of(
                "embedding_models", Map.of("ollama", List.of(Map.of("id", "nomic-embed-text", "dimensions", 768))),
                "vector_databases", Map.of("chroma", Map.of("name", "Chroma"))),
                new ObjectMapper());
    }

    /**
     * Config source whose fetches stay pending until completed by the test.
     */
    private static final class PendingSource implements ConfigSource {
        final AtomicInteger calls = new AtomicInteger();
        final List<CompletableFuture<BackendConfig>> fetches = new ArrayList<>();

        @Override
        public synchronized CompletableFuture<BackendConfig> fetchConfig() {
            calls.incrementAndGet();
            CompletableFuture<BackendConfig> fetch = new CompletableFuture<>();
            fetches.add(fetch);
            return fetch;
        }

        synchronized CompletableFuture<BackendConfig> last() {
            return fetches.get(fetches.size() - 1);
        }
    }

    /** Clock advanced by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public java.time.ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void load_concurrentCallersShareOneFetch() throws Exception {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CompletableFuture<BackendConfig>>> submitted = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                submitted.add(pool.submit(() -> {
                    start.await();
                    return cache.load();
                }));
            }
            start.countDown();
            List<CompletableFuture<BackendConfig>> results = new ArrayList<>();
            for (Future<CompletableFuture<BackendConfig>> f : submitted) {
                results.add(f.get(5, TimeUnit.SECONDS));
            }

            assertEquals(1, source.calls.get());
            assertTrue(results.stream().noneMatch(CompletableFuture::isDone));

            BackendConfig remote = remoteConfig();
            source.last().complete(remote);

            for (CompletableFuture<BackendConfig> r : results) {
                assertSame(remote, r.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void load_cancelledCallerDoesNotAffectOthers() {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);
        CompletableFuture<BackendConfig> abandoned = cache.load();
        CompletableFuture<BackendConfig> waiting = cache.load();

        abandoned.cancel(true);
        BackendConfig remote = remoteConfig();
        source.last().complete(remote);

        assertTrue(abandoned.isCancelled());
        assertFalse(waiting.isCancelled());
        assertSame(remote, waiting.join());
        assertEquals(1, source.calls.get());
        assertSame(remote, cache.load().join());
    }

    @Test
    void load_timedOutCallerDoesNotAffectOthers() {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);
        CompletableFuture<BackendConfig> impatient = cache.load().orTimeout(10, TimeUnit.MILLISECONDS);
        CompletableFuture<BackendConfig> patient = cache.load();

        assertThrows(CompletionException.class, impatient::join);
        BackendConfig remote = remoteConfig();
        source.last().complete(remote);

        assertSame(remote, patient.join());
        assertFalse(cache.isFallback());
    }

    @Test
    void load_callerCompletingItsFutureDoesNotLeak() {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);
        CompletableFuture<BackendConfig> first = cache.load();
        CompletableFuture<BackendConfig> second = cache.load();

        first.complete(BackendConfigDefaults.create());
        BackendConfig remote = remoteConfig();
        source.last().complete(remote);

        assertSame(remote, second.join());
        assertSame(remote, cache.peek().orElseThrow());
    }

    @Test
    void load_cachedValueNeedsNoFurtherFetch() {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);
        CompletableFuture<BackendConfig> first = cache.load();
        BackendConfig remote = remoteConfig();
        source.last().complete(remote);

        CompletableFuture<BackendConfig> second = cache.load();

        assertTrue(second.isDone());
        assertSame(remote, first.join());
        assertSame(remote, second.join());
        assertEquals(1, source.calls.get());
        assertFalse(cache.isFallback());
        assertEquals(remote, cache.peek().orElseThrow());
    }

    @Test
    void load_failureFallsBackToSameDefaultForever() {
        AtomicInteger calls = new AtomicInteger();
        ConfigCache cache = new ConfigCache(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        });

        BackendConfig first = cache.load().join();
        BackendConfig second = cache.load().join();
        BackendConfig third = cache.load().join();

        assertSame(cache.getFallbackConfig(), first);
        assertSame(first, second);
        assertSame(first, third);
        assertEquals(1, calls.get());
        assertTrue(cache.isFallback());
    }

    @Test
    void load_waitersOfFailedFetchAllGetDefault() {
        PendingSource source = new PendingSource();
        ConfigCache cache = new ConfigCache(source);

        CompletableFuture<BackendConfig> a = cache.load();
        CompletableFuture<BackendConfig> b = cache.load();
        source.last().completeExceptionally(new BackendException(500, "Backend error 500"));

        assertSame(cache.getFallbackConfig(), a.join());
        assertSame(a.join(), b.join());
        assertFalse(a.isCompletedExceptionally());
        assertEquals(1, source.calls.get());
    }

    @Test
    void load_sourceThrowingSynchronously_fallsBack() {
        ConfigCache cache = new ConfigCache(() -> {
            throw new IllegalArgumentException("bad url");
        });

        assertSame(cache.getFallbackConfig(), cache.load().join());
    }

    @Test
    void load_nullPayload_fallsBack() {
        ConfigCache cache = new ConfigCache(() -> CompletableFuture.completedFuture(null));

        assertSame(cache.getFallbackConfig(), cache.load().join());
        assertTrue(cache.isFallback());
    }

    @Test
    void load_defaultContainsEmbeddingModelsAndVectorDatabases() {
        ConfigCache cache = new ConfigCache(() -> CompletableFuture.failedFuture(new IOException("down")));

        BackendConfig config = cache.load().join();

        assertEquals(1024, config.embeddingModelsFor("ollama").get(0).dimensions());
        assertTrue(config.getVectorDatabases().containsKey("faiss"));
        assertTrue(config.getVectorDatabases().containsKey("chroma"));
    }

    @Test
    void load_fallbackRetriedAfterConfiguredDelay() {
        PendingSource source = new PendingSource();
        MutableClock clock = new MutableClock();
        ConfigCache cache = new ConfigCache(source, BackendConfigDefaults.create(), Duration.ofMinutes(5), clock);

        CompletableFuture<BackendConfig> first = cache.load();
        source.last().completeExceptionally(new IOException("down"));
        assertSame(cache.getFallbackConfig(), first.join());

        clock.advance(Duration.ofMinutes(1));
        assertSame(cache.getFallbackConfig(), cache.load().join());
        assertEquals(1, source.calls.get());

        clock.advance(Duration.ofMinutes(5));
        CompletableFuture<BackendConfig> retry = cache.load();
        CompletableFuture<BackendConfig> joined = cache.load();
        assertEquals(2, source.calls.get());

        BackendConfig remote = remoteConfig();
        source.last().complete(remote);
        assertSame(remote, retry.join());
        assertSame(remote, joined.join());
        assertFalse(cache.isFallback());

        clock.advance(Duration.ofDays(1));
        assertSame(remote, cache.load().join());
        assertEquals(2, source.calls.get());
    }

    @Test
    void create_readsRetrySetting() {
        CatalogSettings settings = new CatalogSettings();
        settings.setFallbackRetryAfterMs(0L);
        AtomicInteger calls = new AtomicInteger();
        ConfigCache cache = ConfigCache.create(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("down"));
        }, settings);

        cache.load().join();
        cache.load().join();

        assertEquals(1, calls.get());
        assertEquals(1, cache.getFetchCount());
    }
}
