package com.versemind.models.backend;

import java.util.concurrent.CompletableFuture;

/**
 * The VerseMind backend as seen by the model catalog.
 */
public interface BackendClient extends ConfigSource, ModelSource {

    /**
     * Ask the backend to download a model on the local provider. Never
     * completes exceptionally; failures are reported in the result.
     */
    CompletableFuture<InstallResult> installModel(String modelName);
}
