package com.versemind.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies bare model identifiers as chat or embedding models and derives
 * a display name for them. Instances are immutable and thread-safe.
 */
public final class ModelClassifier {

    /** Known embedding-model naming patterns, matched case-insensitively. */
    public static final List<Pattern> DEFAULT_EMBEDDING_PATTERNS = List.of(
            Pattern.compile("bge[-\\s]?m3", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bge[-\\s]?large", Pattern.CASE_INSENSITIVE),
            Pattern.compile("all-mini", Pattern.CASE_INSENSITIVE),
            Pattern.compile("all-MiniLM", Pattern.CASE_INSENSITIVE),
            Pattern.compile("e5-", Pattern.CASE_INSENSITIVE),
            Pattern.compile("embedding", Pattern.CASE_INSENSITIVE),
            Pattern.compile("embed-", Pattern.CASE_INSENSITIVE));

    private static final ModelClassifier DEFAULT =
            new ModelClassifier(DEFAULT_EMBEDDING_PATTERNS, Provider.families());

    private final List<Pattern> embeddingPatterns;
    private final List<ModelFamily> families;

    public ModelClassifier(List<Pattern> embeddingPatterns, List<ModelFamily> families) {
        this.embeddingPatterns = List.copyOf(embeddingPatterns);
        this.families = List.copyOf(families);
    }

    public static ModelClassifier defaults() {
        return DEFAULT;
    }

    /**
     * Result of {@link #classify(String)}.
     */
    public record Classification(ModelType type, String displayName) {
    }

    /**
     * Return a copy that additionally recognises {@code regex} as an
     * embedding-model pattern.
     */
    public ModelClassifier withEmbeddingPattern(String regex) {
        List<Pattern> patterns = new ArrayList<>(embeddingPatterns);
        patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        return new ModelClassifier(patterns, families);
    }

    public ModelClassifier withFamily(ModelFamily family) {
        List<ModelFamily> next = new ArrayList<>(families);
        next.add(family);
        return new ModelClassifier(embeddingPatterns, next);
    }

    public Classification classify(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return new Classification(ModelType.CHAT, "");
        }
        return new Classification(
                isEmbedding(rawId) ? ModelType.EMBEDDING : ModelType.CHAT,
                displayName(rawId));
    }

    public boolean isEmbedding(String rawId) {
        if (rawId == null)
            return false;
        for (Pattern pattern : embeddingPatterns) {
            if (pattern.matcher(rawId).find())
                return true;
        }
        return false;
    }

    public String displayName(String rawId) {
        if (rawId == null || rawId.isBlank())
            return "";
        String lowerId = rawId.toLowerCase(Locale.ROOT);
        for (ModelFamily family : families) {
            if (family.matches(lowerId)) {
                return family.labelFor(rawId);
            }
        }
        String base = baseName(rawId.trim());
        if (base.isEmpty())
            return base;
        return Character.toUpperCase(base.charAt(0)) + base.substring(1);
    }

    /**
     * Strip a trailing {@code :tag} (e.g. ":latest", ":14b").
     */
    public static String baseName(String id) {
        int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(0, colon) : id;
    }
}
