package com.ryuqq.viewstore.core.spi;

/**
 * Handle returned by {@code subscribe}. Closing it stops delivery; closing twice is a no-op.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
