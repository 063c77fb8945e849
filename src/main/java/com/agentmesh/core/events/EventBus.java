package com.agentmesh.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of {@link MeshEvent}s.
 * <p>
 * A subscriber may be scoped to one orchestration, to an event-type prefix such as {@code "agent."},
 * to both, or to nothing. Subscribers run on the publishing thread in subscription order; one that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(MeshEvent event) {
        int delivered = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                subscriber.deliver(event);
                delivered++;
            }
        }
        log.debug("Event {} [{}] delivered to {} subscriber(s)", event.eventType(), event.orchestrationId(), delivered);
    }

    /** Events of one orchestration. Pool-level events carry no orchestration and never match. */
    public Subscription subscribe(String orchestrationId, Consumer<MeshEvent> consumer) {
        return add(new Subscriber(orchestrationId, null, consumer));
    }

    /** Events whose type starts with {@code typePrefix}, from any orchestration. */
    public Subscription subscribeTypes(String typePrefix, Consumer<MeshEvent> consumer) {
        return add(new Subscriber(null, typePrefix, consumer));
    }

    public Subscription subscribeAll(Consumer<MeshEvent> consumer) {
        return add(new Subscriber(null, null, consumer));
    }

    int subscriberCount() {
        return subscribers.size();
    }

    private Subscription add(Subscriber subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // identity equality so two subscriptions of the same consumer stay distinct
    private static final class Subscriber {

        private final String orchestrationId;
        private final String typePrefix;
        private final Consumer<MeshEvent> consumer;

        Subscriber(String orchestrationId, String typePrefix, Consumer<MeshEvent> consumer) {
            this.orchestrationId = orchestrationId;
            this.typePrefix = typePrefix;
            this.consumer = consumer;
        }

        boolean accepts(MeshEvent event) {
            if (orchestrationId != null && !orchestrationId.equals(event.orchestrationId())) {
                return false;
            }
            return typePrefix == null || (event.eventType() != null && event.eventType().startsWith(typePrefix));
        }

        void deliver(MeshEvent event) {
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for {}: {}", event.eventType(), event.orchestrationId(),
                        e.getMessage(), e);
            }
        }
    }
}
