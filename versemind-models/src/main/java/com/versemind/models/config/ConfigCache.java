package com.versemind.models.config;

import com.versemind.common.config.CatalogSettings;
import com.versemind.common.infra.ErrorUtils;
import com.versemind.models.backend.ConfigSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single-flight cache in front of the backend configuration fetch.
 *
 * <p>
 * At most one fetch is outstanding at any time: callers arriving while a
 * fetch runs share its future. A successful result is cached for the life
 * of the cache. A failed fetch is never surfaced; the built-in default is
 * cached and returned instead, and by default the backend is not asked
 * again. With a {@code fallbackRetryAfter} duration, a cached fallback older
 * than that duration is dropped and the next {@link #load()} fetches again.
 * </p>
 *
 * <p>
 * One instance is meant to be created at startup and shared.
 * </p>
 */
@Slf4j
public class ConfigCache {

    private final ConfigSource source;
    private final BackendConfig fallbackConfig;
    private final Duration fallbackRetryAfter;
    private final Clock clock;

    private final Object lock = new Object();
    private final CacheState state = new CacheState();

    public ConfigCache(ConfigSource source) {
        this(source, BackendConfigDefaults.create(), null, Clock.systemUTC());
    }

    public ConfigCache(ConfigSource source, BackendConfig fallbackConfig, Duration fallbackRetryAfter, Clock clock) {
        this.source = source;
        this.fallbackConfig = fallbackConfig;
        this.fallbackRetryAfter = fallbackRetryAfter;
        this.clock = clock;
    }

    /**
     * Create a cache configured from {@link CatalogSettings}.
     */
    public static ConfigCache create(ConfigSource source, CatalogSettings settings) {
        Long retryMs = settings.getFallbackRetryAfterMs();
        Duration retryAfter = retryMs != null && retryMs > 0 ? Duration.ofMillis(retryMs) : null;
        return new ConfigCache(source, BackendConfigDefaults.create(), retryAfter, Clock.systemUTC());
    }

    /**
     * Load the configuration. Never completes exceptionally.
     * <p>
     * Each caller gets its own dependent copy of the shared fetch, so
     * cancelling or completing it leaves the other waiters untouched.
     */
    public CompletableFuture<BackendConfig> load() {
        CompletableFuture<BackendConfig> flight;
        synchronized (lock) {
            if (state.cachedConfig != null && !fallbackExpired()) {
                return CompletableFuture.completedFuture(state.cachedConfig);
            }
            if (state.inFlight != null) {
                return state.inFlight.copy();
            }
            flight = new CompletableFuture<>();
            state.inFlight = flight;
            state.fetchCount++;
        }
        startFetch(flight);
        return flight.copy();
    }

    /**
     * The cached configuration, without fetching.
     */
    public Optional<BackendConfig> peek() {
        synchronized (lock) {
            return Optional.ofNullable(state.cachedConfig);
        }
    }

    /**
     * Whether the cached value is the built-in default.
     */
    public boolean isFallback() {
        synchronized (lock) {
            return state.cachedConfig != null && state.fallback;
        }
    }

    public long getFetchCount() {
        synchronized (lock) {
            return state.fetchCount;
        }
    }

    public BackendConfig getFallbackConfig() {
        return fallbackConfig;
    }

    private void startFetch(CompletableFuture<BackendConfig> flight) {
        log.debug("[config-cache] Requesting backend configuration");
        CompletableFuture<BackendConfig> fetch;
        try {
            fetch = source.fetchConfig();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.failedFuture(new IllegalStateException("Config source returned no result"));
        }

        fetch.whenComplete((config, err) -> {
            if (err == null && config != null) {
                log.info("[config-cache] Backend configuration loaded");
                resolve(flight, config, false);
            } else {
                String reason = err != null ? ErrorUtils.formatErrorMessage(err) : "empty payload";
                log.warn("[config-cache] Error loading backend config ({}), using default config", reason);
                resolve(flight, fallbackConfig, true);
            }
        });
    }

    private void resolve(CompletableFuture<BackendConfig> flight, BackendConfig config, boolean fallback) {
        synchronized (lock) {
            state.cachedConfig = config;
            state.fallback = fallback;
            state.resolvedAtMs = clock.millis();
            state.inFlight = null;
        }
        flight.complete(config);
    }

    private boolean fallbackExpired() {
        return state.fallback
                && fallbackRetryAfter != null
                && clock.millis() - state.resolvedAtMs >= fallbackRetryAfter.toMillis();
    }
}
