package com.ryuqq.viewstore.core.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link java.util.concurrent.CompletableFuture} failure helpers.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} wrappers.
     *
     * @param error the error seen by a completion stage
     * @return the underlying cause
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrows an error from inside a completion stage without adding another wrapper level.
     *
     * @param error the error
     * @return never returns normally
     */
    public static RuntimeException propagate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new CompletionException(cause);
    }
}
