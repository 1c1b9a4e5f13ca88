package com.versemind.models;

/**
 * A row reported by the model-discovery collaborator.
 *
 * @param id          model identifier as installed (e.g. "mistral:latest"), may be null
 * @param description optional human-readable name
 */
public record DiscoveredModel(String id, String description) {
}
