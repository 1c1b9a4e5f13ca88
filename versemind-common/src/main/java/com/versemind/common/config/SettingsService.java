package com.versemind.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches {@link CatalogSettings} from a JSON file, with
 * environment variable substitution and overrides.
 */
@Slf4j
public class SettingsService {

    public static final String ENV_API_BASE_URL = "VERSEMIND_API_BASE_URL";
    public static final String ENV_MODELS = "VERSEMIND_MODELS";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, CatalogSettings> cache;
    private final Path settingsPath;
    private final Map<String, String> env;

    public SettingsService(Path settingsPath) {
        this(settingsPath, DEFAULT_CACHE_TTL);
    }

    public SettingsService(Path settingsPath, Duration cacheTtl) {
        this(settingsPath, cacheTtl, System.getenv());
    }

    SettingsService(Path settingsPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = settingsPath.toString();
        if (pathStr.startsWith("~")) {
            settingsPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.settingsPath = settingsPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load settings with caching.
     */
    public CatalogSettings loadSettings() {
        return cache.get(settingsPath.toString(), key -> doLoadSettings());
    }

    /**
     * Force reload, bypassing the cache.
     */
    public CatalogSettings reloadSettings() {
        cache.invalidateAll();
        return loadSettings();
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    private CatalogSettings doLoadSettings() {
        CatalogSettings settings;
        if (!Files.exists(settingsPath)) {
            log.info("Settings file not found: {}, using defaults", settingsPath);
            settings = new CatalogSettings();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(settingsPath));
                settings = objectMapper.readValue(raw, CatalogSettings.class);
                log.info("Settings loaded from: {}", settingsPath);
            } catch (IOException e) {
                log.error("Failed to load settings from: {}", settingsPath, e);
                settings = new CatalogSettings();
            }
        }
        return applyEnvOverrides(settings);
    }

    CatalogSettings applyEnvOverrides(CatalogSettings settings) {
        String baseUrl = env.get(ENV_API_BASE_URL);
        if (baseUrl != null && !baseUrl.isBlank()) {
            settings.setApiBaseUrl(baseUrl.trim());
        }
        String models = env.get(ENV_MODELS);
        if (models != null && !models.isBlank()) {
            settings.setEnvModels(models);
        }
        if (settings.getApiBaseUrl() == null || settings.getApiBaseUrl().isBlank()) {
            settings.setApiBaseUrl(CatalogSettings.DEFAULT_API_BASE_URL);
        }
        if (settings.getDiscoverableProvider() == null || settings.getDiscoverableProvider().isBlank()) {
            settings.setDiscoverableProvider(CatalogSettings.DEFAULT_DISCOVERABLE_PROVIDER);
        }
        return settings;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
