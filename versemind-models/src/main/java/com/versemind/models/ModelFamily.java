package com.versemind.models;

import java.util.Locale;

/**
 * Display-name rule for a family of models sharing an id marker.
 *
 * @param marker          lower-case substring identifying the family
 * @param chatLabel       label for plain chat models of the family
 * @param reasoningMarker lower-case substring identifying reasoning variants, nullable
 * @param reasoningLabel  label for reasoning variants, nullable
 */
public record ModelFamily(String marker, String chatLabel, String reasoningMarker, String reasoningLabel) {

    public boolean matches(String lowerId) {
        return lowerId.contains(marker);
    }

    /**
     * Label for an id already known to belong to this family.
     */
    public String labelFor(String rawId) {
        String lowerId = rawId.toLowerCase(Locale.ROOT);
        if (reasoningMarker != null && reasoningLabel != null && lowerId.contains(reasoningMarker)) {
            return reasoningLabel;
        }
        return chatLabel;
    }
}
