package com.versemind.models;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from model ids and aliases to curated catalog entries.
 *
 * <p>
 * A candidate matches an entry when it equals the entry's id, or when the
 * candidate or its tag-stripped base equals one of the entry's aliases; all
 * comparisons ignore case. When several entries match, the one listed first
 * in the catalog wins.
 * </p>
 */
public final class AliasIndex {

    private final List<ModelEntry> entries;
    /** lower-case id -> position of the first entry with that id */
    private final Map<String, Integer> idPositions = new HashMap<>();
    /** lower-case alias -> position of the first entry declaring it */
    private final Map<String, Integer> aliasPositions = new HashMap<>();

    private AliasIndex(List<ModelEntry> entries) {
        this.entries = List.copyOf(entries);
        for (int i = 0; i < this.entries.size(); i++) {
            ModelEntry entry = this.entries.get(i);
            if (entry.hasUsableId()) {
                idPositions.putIfAbsent(normalize(entry.id()), i);
            }
            for (String alias : entry.aliases()) {
                if (!alias.isBlank()) {
                    aliasPositions.putIfAbsent(normalize(alias), i);
                }
            }
        }
    }

    public static AliasIndex of(List<ModelEntry> defaults) {
        return new AliasIndex(defaults == null ? List.of() : defaults);
    }

    /**
     * One-shot lookup of {@code candidateId} in {@code defaults}.
     */
    public static Optional<ModelEntry> resolve(String candidateId, List<ModelEntry> defaults) {
        return of(defaults).resolve(candidateId);
    }

    public Optional<ModelEntry> resolve(String candidateId) {
        if (candidateId == null || candidateId.isBlank())
            return Optional.empty();
        String key = normalize(candidateId);
        String base = ModelClassifier.baseName(key);

        int best = first(Integer.MAX_VALUE, idPositions.get(key));
        best = first(best, aliasPositions.get(key));
        best = first(best, aliasPositions.get(base));

        return best == Integer.MAX_VALUE ? Optional.empty() : Optional.of(entries.get(best));
    }

    public int size() {
        return entries.size();
    }

    private static int first(int current, Integer candidate) {
        return candidate != null && candidate < current ? candidate : current;
    }

    static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
