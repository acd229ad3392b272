package com.conductor.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fan-out of health monitor events to in-process listeners.
 * <p>
 * A listener registers with a filter: one service, a set of event types, or
 * everything. Events reach matching listeners in registration order, on the
 * publishing thread (a monitor check or restart worker), so listeners should
 * return quickly. A listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(MonitorEvent event) {
        log.debug("Publishing {} for {}", event.type(), event.serviceId());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Events about one service, including cascades it triggered.
     */
    public Subscription subscribe(String serviceId, Consumer<MonitorEvent> consumer) {
        return add(event -> serviceId.equals(event.serviceId()), consumer, "service " + serviceId);
    }

    /**
     * Events of the given types, for every service.
     */
    public Subscription subscribe(Set<MonitorEventType> types, Consumer<MonitorEvent> consumer) {
        Set<MonitorEventType> wanted = types.isEmpty()
                ? EnumSet.noneOf(MonitorEventType.class)
                : EnumSet.copyOf(types);
        return add(event -> wanted.contains(event.type()), consumer, "types " + wanted);
    }

    public Subscription subscribeAll(Consumer<MonitorEvent> consumer) {
        return add(event -> true, consumer, "all events");
    }

    public int listenerCount() {
        return listeners.size();
    }

    private Subscription add(Predicate<MonitorEvent> filter, Consumer<MonitorEvent> consumer, String description) {
        Listener listener = new Listener(filter, consumer);
        listeners.add(listener);
        log.debug("Listener registered for {}", description);
        return () -> listeners.remove(listener);
    }

    private void deliver(Listener listener, MonitorEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for {}: {}", event.type(), event.serviceId(), e.getMessage(), e);
        }
    }

    /**
     * Handle returned by every subscribe method. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // identity semantics: the same consumer may be registered under several filters
    private static final class Listener {
        private final Predicate<MonitorEvent> filter;
        private final Consumer<MonitorEvent> consumer;

        Listener(Predicate<MonitorEvent> filter, Consumer<MonitorEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        Predicate<MonitorEvent> filter() {
            return filter;
        }

        Consumer<MonitorEvent> consumer() {
            return consumer;
        }
    }
}
