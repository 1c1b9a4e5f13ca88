package com.versemind.common.config;

import lombok.Data;

/**
 * Client-side settings for the model catalog: where the backend lives,
 * how long to wait for it, and optional catalog overrides.
 */
@Data
public class CatalogSettings {

    public static final String DEFAULT_API_BASE_URL = "http://localhost:8200";
    public static final String DEFAULT_CONFIG_PATH = "/api/config";
    public static final String DEFAULT_MODELS_PATH = "/api/generate/models";
    public static final String DEFAULT_INSTALL_PATH = "/api/generate/install-model";
    public static final String DEFAULT_DISCOVERABLE_PROVIDER = "ollama";

    /** Backend base URL, without trailing slash. */
    private String apiBaseUrl = DEFAULT_API_BASE_URL;

    private String configPath = DEFAULT_CONFIG_PATH;
    private String modelsPath = DEFAULT_MODELS_PATH;
    private String installPath = DEFAULT_INSTALL_PATH;

    private long connectTimeoutMs = 5_000;
    private long readTimeoutMs = 30_000;

    /** Provider whose installed models are discovered at runtime. */
    private String discoverableProvider = DEFAULT_DISCOVERABLE_PROVIDER;

    /**
     * Raw JSON array of model entries. When set, it replaces both the
     * default catalog and discovery.
     */
    private String envModels;

    /**
     * Age after which a cached fallback configuration is dropped so the
     * next load retries the backend. Null keeps the fallback for the life
     * of the process.
     */
    private Long fallbackRetryAfterMs;

    /**
     * Resolve an endpoint path against {@link #apiBaseUrl}.
     */
    public String endpoint(String path) {
        String base = apiBaseUrl != null ? apiBaseUrl.trim() : "";
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (path == null || path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
