package com.ryuqq.viewstore.core.error;

/**
 * Base type of every failure the store reports through a failed future.
 *
 * <p>Unchecked, so that it can travel through {@link java.util.concurrent.CompletableFuture}
 * stages unchanged. Callers calling {@code join()} receive it as the cause of a
 * {@link java.util.concurrent.CompletionException}.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * @param kind failure category
     * @param message description
     * @throws IllegalArgumentException if kind is null
     */
    public StoreException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * @param kind failure category
     * @param message description
     * @param cause underlying failure
     * @throws IllegalArgumentException if kind is null
     */
    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * Failure category.
     *
     * @return the error kind (never null)
     */
    public ErrorKind getKind() {
        return kind;
    }
}
