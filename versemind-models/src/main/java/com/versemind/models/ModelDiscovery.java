package com.versemind.models;

import com.versemind.common.infra.ErrorUtils;
import com.versemind.models.backend.ModelSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Discovers the models installed on the discoverable provider and turns
 * them into catalog entries. Failures yield an empty list.
 */
@Slf4j
public class ModelDiscovery {

    private final ModelSource source;
    private final ModelClassifier classifier;
    private final String provider;

    public ModelDiscovery(ModelSource source) {
        this(source, ModelClassifier.defaults(), Provider.OLLAMA.id());
    }

    public ModelDiscovery(ModelSource source, ModelClassifier classifier, String provider) {
        this.source = source;
        this.classifier = classifier;
        this.provider = provider;
    }

    /**
     * Never completes exceptionally.
     */
    public CompletableFuture<List<ModelEntry>> discover() {
        CompletableFuture<List<DiscoveredModel>> fetch;
        try {
            fetch = source.fetchModels(provider);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return fetch
                .thenApply(this::toEntries)
                .exceptionally(err -> {
                    log.warn("[model-catalog] Failed to fetch {} models: {}", provider, ErrorUtils.formatErrorMessage(err));
                    return List.of();
                });
    }

    List<ModelEntry> toEntries(List<DiscoveredModel> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        List<ModelEntry> entries = new ArrayList<>(rows.size());
        for (DiscoveredModel row : rows) {
            if (row == null || row.id() == null || row.id().isBlank()) {
                log.debug("[model-catalog] Skipping discovered {} model without id: {}", provider, row);
                continue;
            }
            String id = row.id().trim();
            ModelClassifier.Classification classification = classifier.classify(id);
            String name = row.description() != null && !row.description().isBlank()
                    ? row.description()
                    : classification.displayName();
            entries.add(ModelEntry.of(id, name, provider, classification.type()));
        }
        return entries;
    }
}
