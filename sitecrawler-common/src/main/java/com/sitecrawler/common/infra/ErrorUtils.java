package com.sitecrawler.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture} and
     * {@code Future.get()} so callers see the failure that actually happened.
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
        if (err == null)
            return "Error";
        Throwable cause = unwrap(err);
        String msg = cause.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return cause.getClass().getSimpleName();
    }
}
