package com.versemind.models.backend;

/**
 * Outcome of a model install request.
 */
public record InstallResult(boolean success, String message) {
}
