package com.trendsentinel.core.bus;

import com.trendsentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe. Handlers run on the publishing thread, in
 * registration order: typed handlers first, then catch-all handlers. A failing handler is
 * reported to the error callback and never stops delivery to the remaining handlers.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> typedHandlers = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> catchAllHandlers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " failed", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        typedHandlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(Consumer<Event> handler) {
        catchAllHandlers.add(handler);
    }

    public void publish(Event event) {
        for (Consumer<? extends Event> handler : typedHandlers.getOrDefault(event.getClass(), List.of())) {
            deliver(handler, event);
        }
        for (Consumer<Event> handler : catchAllHandlers) {
            deliver(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void deliver(Consumer<? extends Event> handler, Event event) {
        try {
            ((Consumer<T>) handler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
