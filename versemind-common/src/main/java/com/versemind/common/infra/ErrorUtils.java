package com.versemind.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities for log lines and user-facing messages.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture}.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        Throwable root = unwrap(err);
        if (root == null)
            return "Error";
        String msg = root.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return root.getClass().getSimpleName();
    }
}
