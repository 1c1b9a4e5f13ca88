package com.versemind.models.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.versemind.common.config.ConfigValues;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared backend configuration, as served by the backend's config endpoint.
 *
 * <p>
 * The payload is kept as an opaque tree. Only {@code model_groups},
 * {@code embedding_models} and {@code vector_databases} get typed views.
 * Instances are deeply unmodifiable so one value can be shared by all
 * callers.
 * </p>
 */
@Getter
public final class BackendConfig {

    public static final String MODEL_GROUPS = "model_groups";
    public static final String EMBEDDING_MODELS = "embedding_models";
    public static final String VECTOR_DATABASES = "vector_databases";

    private static final TypeReference<LinkedHashMap<String, Object>> TREE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, List<ModelOption>>> MODEL_GROUPS_TYPE =
            new TypeReference<>() {
            };
    private static final TypeReference<LinkedHashMap<String, List<EmbeddingModelOption>>> EMBEDDING_TYPE =
            new TypeReference<>() {
            };
    private static final TypeReference<LinkedHashMap<String, VectorDatabase>> VECTOR_DB_TYPE =
            new TypeReference<>() {
            };

    private final Map<String, Object> raw;
    private final Map<String, List<ModelOption>> modelGroups;
    private final Map<String, List<EmbeddingModelOption>> embeddingModels;
    private final Map<String, VectorDatabase> vectorDatabases;

    private BackendConfig(Map<String, Object> raw,
            Map<String, List<ModelOption>> modelGroups,
            Map<String, List<EmbeddingModelOption>> embeddingModels,
            Map<String, VectorDatabase> vectorDatabases) {
        this.raw = raw;
        this.modelGroups = modelGroups;
        this.embeddingModels = embeddingModels;
        this.vectorDatabases = vectorDatabases;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelOption(String id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingModelOption(String id, String name, Integer dimensions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VectorDatabase(String name, String description, boolean local) {
    }

    /**
     * Parse a JSON payload.
     *
     * @throws JsonProcessingException  if the payload is not a JSON object
     * @throws IllegalArgumentException if a typed section has the wrong shape
     */
    public static BackendConfig parse(String json, ObjectMapper mapper) throws JsonProcessingException {
        Map<String, Object> tree = mapper.readValue(json, TREE);
        if (tree == null) {
            throw new IllegalArgumentException("Configuration payload is empty");
        }
        return fromTree(tree, mapper);
    }

    /**
     * Build from an already-parsed tree.
     *
     * @throws IllegalArgumentException if a typed section has the wrong shape
     */
    public static BackendConfig fromTree(Map<String, Object> tree, ObjectMapper mapper) {
        Map<String, List<ModelOption>> groups = section(tree, MODEL_GROUPS, MODEL_GROUPS_TYPE, mapper);
        Map<String, List<EmbeddingModelOption>> embeddings = section(tree, EMBEDDING_MODELS, EMBEDDING_TYPE, mapper);
        Map<String, VectorDatabase> vectorDbs = section(tree, VECTOR_DATABASES, VECTOR_DB_TYPE, mapper);

        return new BackendConfig(
                freezeMap(tree),
                freezeLists(groups),
                freezeLists(embeddings),
                Collections.unmodifiableMap(vectorDbs));
    }

    /**
     * Embedding models offered for {@code provider}, in configured order.
     */
    public List<EmbeddingModelOption> embeddingModelsFor(String provider) {
        return embeddingModels.getOrDefault(provider, List.of());
    }

    /**
     * Dotted-path lookup in the raw payload (e.g. {@code "vector_databases.faiss.name"}).
     */
    public Object getValue(String path, Object defaultValue) {
        return ConfigValues.get(raw, path, defaultValue);
    }

    private static <T extends Map<String, ?>> T section(Map<String, Object> tree, String key,
            TypeReference<T> type, ObjectMapper mapper) {
        Object value = tree.get(key);
        if (value == null) {
            return mapper.convertValue(Map.of(), type);
        }
        return mapper.convertValue(value, type);
    }

    private static <V> Map<String, List<V>> freezeLists(Map<String, List<V>> map) {
        Map<String, List<V>> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k, v == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(v))));
        return Collections.unmodifiableMap(out);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(freeze(item));
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    private static Map<String, Object> freezeMap(Map<String, Object> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k, freeze(v)));
        return Collections.unmodifiableMap(out);
    }
}
