package com.versemind.models.backend;

import com.versemind.models.DiscoveredModel;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the models currently installed on a provider.
 */
@FunctionalInterface
public interface ModelSource {

    CompletableFuture<List<DiscoveredModel>> fetchModels(String provider);
}
