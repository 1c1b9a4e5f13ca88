package com.versemind.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Capability class of a model.
 */
public enum ModelType {
    CHAT("chat"),
    EMBEDDING("embedding");

    private final String id;

    ModelType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Parse the JSON form; unknown or blank values yield null.
     */
    @JsonCreator
    public static ModelType fromId(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ModelType type : values()) {
            if (type.id.equals(normalized))
                return type;
        }
        return null;
    }
}
