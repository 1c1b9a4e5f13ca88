package com.versemind.models;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Known model providers. Entries keep the provider as a plain string so
 * catalogs may name providers outside this set; this table only carries
 * the per-provider rules.
 */
public enum Provider {
    OLLAMA("ollama", true, null),
    OPENAI("openai", false, null),
    DEEPSEEK("deepseek", false,
            new ModelFamily("deepseek", "DeepSeek Chat", "r1", "DeepSeek Reasoner")),
    SILICONFLOW("siliconflow", false, null);

    private static final Map<String, Provider> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Provider::id, Function.identity()));

    private final String id;
    private final boolean discoverable;
    private final ModelFamily family;

    Provider(String id, boolean discoverable, ModelFamily family) {
        this.id = id;
        this.discoverable = discoverable;
        this.family = family;
    }

    public String id() {
        return id;
    }

    /** Whether installed models are listed at runtime rather than curated. */
    public boolean discoverable() {
        return discoverable;
    }

    public Optional<ModelFamily> family() {
        return Optional.ofNullable(family);
    }

    public static Optional<Provider> find(String id) {
        if (id == null)
            return Optional.empty();
        return Optional.ofNullable(BY_ID.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Display-name families of all known providers, in declaration order.
     */
    public static List<ModelFamily> families() {
        return Arrays.stream(values())
                .map(p -> p.family)
                .filter(Objects::nonNull)
                .toList();
    }
}
