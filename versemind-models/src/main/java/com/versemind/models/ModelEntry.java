package com.versemind.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * One model of the catalog.
 *
 * @param id                  identifier, case-insensitively unique within a merged catalog
 * @param name                display name
 * @param provider            provider id (e.g. "ollama", "openai")
 * @param type                chat or embedding; defaults to chat
 * @param aliases             extra case-insensitive identifiers resolving to this entry
 * @param displayNameOverride whether this curated entry replaces a discovered one of the same model
 * @param size                download size as shown to users, nullable
 * @param modified            last-modified hint as shown to users, nullable
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ModelEntry(
        String id,
        String name,
        String provider,
        ModelType type,
        List<String> aliases,
        boolean displayNameOverride,
        String size,
        String modified) {

    public ModelEntry {
        if (type == null) {
            type = ModelType.CHAT;
        }
        aliases = aliases == null
                ? List.of()
                : aliases.stream().filter(Objects::nonNull).toList();
    }

    public static ModelEntry of(String id, String name, String provider, ModelType type) {
        return new ModelEntry(id, name, provider, type, List.of(), false, null, null);
    }

    public boolean hasUsableId() {
        return id != null && !id.isBlank();
    }
}
