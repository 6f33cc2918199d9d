package com.aejis.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for job and pool events.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-job subscribers keyed by jobId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AejisEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event, pool events included. */
    private final CopyOnWriteArrayList<Consumer<AejisEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AejisEvent event) {
        log.debug("Publishing event: {} for job {}", event.eventType(), event.jobId());

        if (event.jobId() != null) {
            List<Consumer<AejisEvent>> jobSubs = jobSubscribers.get(event.jobId());
            if (jobSubs != null) {
                for (Consumer<AejisEvent> subscriber : jobSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<AejisEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific job.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<AejisEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to job {}", jobId);
        return () -> {
            CopyOnWriteArrayList<Consumer<AejisEvent>> subs = jobSubscribers.get(jobId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    jobSubscribers.remove(jobId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<AejisEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AejisEvent> subscriber, AejisEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
