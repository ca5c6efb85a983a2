package com.ryuqq.viewstore.application.propagation;

import com.ryuqq.viewstore.core.spi.Subscriber;
import com.ryuqq.viewstore.core.spi.Subscription;
import com.ryuqq.viewstore.core.update.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers the events of one store call to subscribers and tracking views.
 *
 * <p><strong>Delivery order:</strong></p>
 * <ol>
 *   <li>every subscriber, in registration order</li>
 *   <li>every tracking view, in registration order</li>
 * </ol>
 *
 * <p>Each receiver gets the whole ordered list in one call. A receiver that throws is logged
 * and skipped; delivery to the others continues and the mutation itself is unaffected.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class UpdatePropagator<T> {

    private static final Logger log = LoggerFactory.getLogger(UpdatePropagator.class);

    private final String owner;
    private final List<Registration<T>> subscribers = new CopyOnWriteArrayList<>();
    private final List<Registration<T>> trackers = new CopyOnWriteArrayList<>();

    /**
     * Creates a propagator.
     *
     * @param owner name of the owning store, used in log lines
     */
    public UpdatePropagator(String owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        this.owner = owner;
    }

    /**
     * Registers a plain subscriber.
     *
     * @param subscriber receiver of every published list
     * @return handle that unsubscribes when closed
     * @throws IllegalArgumentException if subscriber is null
     */
    public Subscription subscribe(Subscriber<T> subscriber) {
        return register(subscribers, subscriber);
    }

    /**
     * Registers a tracking view. Views are notified after plain subscribers.
     *
     * @param view the view's event handler
     * @return handle that stops tracking when closed
     */
    public Subscription track(Subscriber<T> view) {
        return register(trackers, view);
    }

    /**
     * Publishes the events of one store call.
     *
     * @param updates ordered events (an empty list is not delivered)
     */
    public void publish(List<Update<T>> updates) {
        if (updates == null || updates.isEmpty()) {
            return;
        }
        List<Update<T>> delivered = List.copyOf(updates);
        log.debug("{} publishing {} event(s) to {} subscriber(s) and {} tracking view(s)",
            owner, delivered.size(), subscriberCount(), trackerCount());
        deliver(subscribers, delivered);
        deliver(trackers, delivered);
    }

    int subscriberCount() {
        return subscribers.size();
    }

    int trackerCount() {
        return trackers.size();
    }

    private void deliver(List<Registration<T>> receivers, List<Update<T>> updates) {
        for (Registration<T> registration : receivers) {
            try {
                registration.subscriber.onUpdate(updates);
            } catch (Exception e) {
                log.error("{} failed to deliver {} event(s) to {}", owner, updates.size(), registration.subscriber, e);
            }
        }
    }

    private Subscription register(List<Registration<T>> receivers, Subscriber<T> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        Registration<T> registration = new Registration<>(subscriber);
        receivers.add(registration);
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                receivers.remove(registration);
            }
        };
    }

    private static final class Registration<T> {
        private final Subscriber<T> subscriber;

        private Registration(Subscriber<T> subscriber) {
            this.subscriber = subscriber;
        }
    }
}
