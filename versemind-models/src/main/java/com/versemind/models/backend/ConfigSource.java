package com.versemind.models.backend;

import com.versemind.models.config.BackendConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Source of the shared backend configuration.
 */
@FunctionalInterface
public interface ConfigSource {

    /**
     * Fetch the configuration. Transport, status and payload errors complete
     * the future exceptionally.
     */
    CompletableFuture<BackendConfig> fetchConfig();
}
