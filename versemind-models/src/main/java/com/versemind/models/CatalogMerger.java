package com.versemind.models;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the curated default catalog with the models discovered on the
 * discoverable provider.
 *
 * <p>
 * Curated entries of other providers always stay. A discovered model that
 * the curated catalog already knows (by id or alias) is dropped, unless the
 * curated entry asks for its own display name to win, in which case the
 * curated entry is listed in its place. Unknown discovered models are
 * appended in discovery order. Output order is insertion order only.
 * </p>
 */
@Slf4j
public final class CatalogMerger {

    private final String discoverableProvider;

    public CatalogMerger() {
        this(Provider.OLLAMA.id());
    }

    public CatalogMerger(String discoverableProvider) {
        this.discoverableProvider = discoverableProvider;
    }

    public String getDiscoverableProvider() {
        return discoverableProvider;
    }

    /**
     * @return a new list owned by the caller
     */
    public List<ModelEntry> merge(List<ModelEntry> defaults, List<ModelEntry> discovered) {
        List<ModelEntry> curated = defaults != null ? defaults : List.of();
        List<ModelEntry> usable = usableEntries(discovered);
        if (usable.isEmpty()) {
            return new ArrayList<>(curated);
        }

        AliasIndex index = AliasIndex.of(curated);
        Map<String, ModelEntry> byId = new LinkedHashMap<>();
        Set<ModelEntry> placedDefaults = new HashSet<>();

        // 1. Curated entries of non-discoverable providers
        for (ModelEntry entry : curated) {
            if (!entry.hasUsableId()) {
                log.debug("[model-catalog] Skipping default entry without id: {}", entry);
                continue;
            }
            if (!isDiscoverable(entry)) {
                byId.putIfAbsent(AliasIndex.normalize(entry.id()), entry);
                placedDefaults.add(entry);
            }
        }

        // 2. Discovered entries
        for (ModelEntry model : usable) {
            String key = AliasIndex.normalize(model.id());
            Optional<ModelEntry> match = index.resolve(model.id());
            if (match.isEmpty()) {
                byId.put(key, model);
                continue;
            }
            ModelEntry curatedMatch = match.get();
            if (curatedMatch.displayNameOverride() && isDiscoverable(curatedMatch)
                    && placedDefaults.add(curatedMatch)) {
                byId.putIfAbsent(key, curatedMatch);
            }
        }

        return new ArrayList<>(byId.values());
    }

    /**
     * Keep entries of {@code type}, preserving order. A null type keeps all.
     */
    public static List<ModelEntry> filterByType(List<ModelEntry> models, ModelType type) {
        if (models == null)
            return new ArrayList<>();
        if (type == null)
            return new ArrayList<>(models.stream().filter(Objects::nonNull).toList());
        return new ArrayList<>(models.stream()
                .filter(m -> m != null && m.type() == type)
                .toList());
    }

    /**
     * Bucket entries by provider; buckets and their contents keep first-seen order.
     */
    public static Map<String, List<ModelEntry>> groupByProvider(List<ModelEntry> models) {
        Map<String, List<ModelEntry>> grouped = new LinkedHashMap<>();
        if (models == null)
            return grouped;
        for (ModelEntry model : models) {
            if (model == null)
                continue;
            grouped.computeIfAbsent(model.provider(), k -> new ArrayList<>()).add(model);
        }
        return grouped;
    }

    private static List<ModelEntry> usableEntries(List<ModelEntry> discovered) {
        List<ModelEntry> usable = new ArrayList<>();
        if (discovered == null)
            return usable;
        for (ModelEntry model : discovered) {
            if (model == null || !model.hasUsableId()) {
                log.debug("[model-catalog] Skipping discovered entry without id: {}", model);
                continue;
            }
            usable.add(model);
        }
        return usable;
    }

    private boolean isDiscoverable(ModelEntry entry) {
        return discoverableProvider != null && discoverableProvider.equalsIgnoreCase(entry.provider());
    }
}
