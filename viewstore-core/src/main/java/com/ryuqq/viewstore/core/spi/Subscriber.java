package com.ryuqq.viewstore.core.spi;

import com.ryuqq.viewstore.core.update.Update;

import java.util.List;

/**
 * Receives the events of each mutation call, in order.
 *
 * <p>One call of {@link #onUpdate(List)} carries every event of one store call: the added items
 * of an {@code add}, or a single {@link com.ryuqq.viewstore.core.update.BatchUpdate} for a
 * transaction. Exceptions thrown here are logged by the publisher and do not reach other
 * subscribers or the caller.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscriber<T> {

    void onUpdate(List<Update<T>> updates);
}
