package com.versemind.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.versemind.common.config.CatalogSettings;
import com.versemind.common.infra.ErrorUtils;
import com.versemind.models.backend.BackendClient;
import com.versemind.models.backend.InstallResult;
import com.versemind.models.config.BackendConfig;
import com.versemind.models.config.ConfigCache;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the rest of the application: effective model list,
 * shared backend configuration and model installation.
 *
 * <p>
 * Model list precedence: a catalog supplied through settings
 * ({@code VERSEMIND_MODELS}) wins outright; otherwise discovered models are
 * merged into the default catalog; otherwise the default catalog is used.
 * </p>
 */
@Slf4j
public class ModelCatalogService {

    private static final TypeReference<List<ModelEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final CatalogSettings settings;
    private final ConfigCache configCache;
    private final BackendClient backendClient;
    private final ModelDiscovery discovery;
    private final CatalogMerger merger;
    private final List<ModelEntry> defaults;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ModelCatalogService(CatalogSettings settings, ConfigCache configCache, BackendClient backendClient) {
        this(settings, configCache, backendClient, DefaultCatalog.MODELS, ModelClassifier.defaults());
    }

    public ModelCatalogService(CatalogSettings settings, ConfigCache configCache, BackendClient backendClient,
            List<ModelEntry> defaults, ModelClassifier classifier) {
        this.settings = settings;
        this.configCache = configCache;
        this.backendClient = backendClient;
        this.defaults = List.copyOf(defaults);
        this.merger = new CatalogMerger(settings.getDiscoverableProvider());
        this.discovery = new ModelDiscovery(backendClient, classifier, settings.getDiscoverableProvider());
    }

    /**
     * Shared backend configuration; see {@link ConfigCache#load()}.
     */
    public CompletableFuture<BackendConfig> loadConfig() {
        return configCache.load();
    }

    public CompletableFuture<List<ModelEntry>> getAvailableModels() {
        return getAvailableModels(true, null);
    }

    /**
     * @param fetchDynamic whether to ask the discoverable provider for its installed models
     * @param type         keep only models of this type; null keeps all
     * @return a new list owned by the caller; never completes exceptionally
     */
    public CompletableFuture<List<ModelEntry>> getAvailableModels(boolean fetchDynamic, ModelType type) {
        Optional<List<ModelEntry>> configured = configuredModels();
        if (configured.isPresent()) {
            return CompletableFuture.completedFuture(CatalogMerger.filterByType(configured.get(), type));
        }
        if (!fetchDynamic) {
            return CompletableFuture.completedFuture(CatalogMerger.filterByType(defaults, type));
        }
        return discovery.discover()
                .thenApply(discovered -> merger.merge(defaults, discovered))
                .exceptionally(err -> {
                    log.error("[model-catalog] Error getting dynamic models: {}", ErrorUtils.formatErrorMessage(err));
                    return new ArrayList<>(defaults);
                })
                .thenApply(models -> CatalogMerger.filterByType(models, type));
    }

    public Map<String, List<ModelEntry>> groupModelsByProvider(List<ModelEntry> models) {
        return CatalogMerger.groupByProvider(models);
    }

    /**
     * Ask the backend to download a model; failures are reported in the result.
     */
    public CompletableFuture<InstallResult> installModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return CompletableFuture.completedFuture(new InstallResult(false, "Failed to install model: no model name given"));
        }
        return backendClient.installModel(modelName.trim());
    }

    public List<ModelEntry> getDefaults() {
        return defaults;
    }

    /**
     * Catalog supplied through settings, if any and if it parses.
     */
    Optional<List<ModelEntry>> configuredModels() {
        String raw = settings.getEnvModels();
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            List<ModelEntry> models = objectMapper.readValue(raw, ENTRY_LIST);
            if (models == null) {
                return Optional.empty();
            }
            return Optional.of(models.stream().filter(m -> m != null && m.hasUsableId()).toList());
        } catch (JsonProcessingException e) {
            log.error("[model-catalog] Error parsing configured models: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
