package com.versemind.models.config;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable state behind {@link ConfigCache}. All fields are guarded by the
 * owning cache's lock.
 */
final class CacheState {

    BackendConfig cachedConfig;
    CompletableFuture<BackendConfig> inFlight;
    boolean fallback;
    long resolvedAtMs;
    /** Number of fetches started over the life of the cache. */
    long fetchCount;
}
