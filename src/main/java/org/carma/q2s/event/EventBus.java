package org.carma.q2s.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers sweep progress events to typed subscribers.
 *
 * Dispatch is synchronous on the publishing thread, so handlers registered
 * for {@link Event.ScenarioEvaluatedEvent} run on the sweep's worker threads
 * and must be thread-safe. A handler that throws is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> handlers = new ConcurrentHashMap<>();

    public <T extends Event> void subscribe(Class<T> eventType, Consumer<? super T> handler) {
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept(eventType.cast(event)));
    }

    public void publish(Event event) {
        for (Consumer<? super Event> handler : handlers.getOrDefault(event.getClass(), List.of())) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.warn("Handler for {} failed: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }
}
