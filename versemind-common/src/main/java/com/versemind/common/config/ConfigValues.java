package com.versemind.common.config;

import java.util.Map;

/**
 * Dotted-path lookup into nested maps, as produced by Jackson for untyped
 * JSON (e.g. {@code "embedding_models.ollama"}).
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    /**
     * Resolve {@code path} against {@code root}.
     *
     * @return the value at the path, or {@code defaultValue} when any segment
     *         is missing or the root is null
     */
    public static Object get(Object root, String path, Object defaultValue) {
        if (root == null || path == null || path.isEmpty()) {
            return defaultValue;
        }
        Object value = root;
        for (String key : path.split("\\.")) {
            if (value instanceof Map<?, ?> map && map.containsKey(key)) {
                value = map.get(key);
            } else {
                return defaultValue;
            }
        }
        return value;
    }

    /**
     * Typed variant of {@link #get(Object, String, Object)}; a value of the
     * wrong type also yields the default.
     */
    public static <T> T get(Object root, String path, Class<T> type, T defaultValue) {
        Object value = get(root, path, null);
        return type.isInstance(value) ? type.cast(value) : defaultValue;
    }
}
