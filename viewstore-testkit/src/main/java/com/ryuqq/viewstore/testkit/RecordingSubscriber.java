package com.ryuqq.viewstore.testkit;

import com.ryuqq.viewstore.core.spi.Subscriber;
import com.ryuqq.viewstore.core.update.Update;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscriber that records every delivery.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public class RecordingSubscriber<T> implements Subscriber<T> {

    private final List<List<Update<T>>> calls = new ArrayList<>();

    @Override
    public synchronized void onUpdate(List<Update<T>> updates) {
        calls.add(List.copyOf(updates));
    }

    /**
     * Deliveries in order, one list per {@code onUpdate} call.
     *
     * @return recorded calls
     */
    public synchronized List<List<Update<T>>> calls() {
        return List.copyOf(calls);
    }

    public synchronized int callCount() {
        return calls.size();
    }

    /**
     * @return the list of the latest delivery
     * @throws IllegalStateException if nothing was delivered
     */
    public synchronized List<Update<T>> lastCall() {
        if (calls.isEmpty()) {
            throw new IllegalStateException("no update delivered");
        }
        return calls.get(calls.size() - 1);
    }

    /**
     * Leaf events of every call, flattened.
     *
     * @return leaves in delivery order
     */
    public synchronized List<Update<T>> leaves() {
        List<Update<T>> leaves = new ArrayList<>();
        for (List<Update<T>> call : calls) {
            for (Update<T> update : call) {
                leaves.addAll(update.leaves());
            }
        }
        return leaves;
    }
}
