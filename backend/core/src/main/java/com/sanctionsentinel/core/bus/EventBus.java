package com.sanctionsentinel.core.bus;

import com.sanctionsentinel.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process fan-out of pipeline events. Handlers run on the publishing thread in
 * subscription order. A subscription to a type also receives its subtypes, so subscribing to
 * {@link Event} sees everything. A failing handler is reported to the error callback and never
 * stops the others.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong handlerFailures = new AtomicLong();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<? super T> handler) {
        Registration<T> registration = new Registration<>(type, handler);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public Subscription subscribeAll(Consumer<Event> handler) {
        return subscribe(Event.class, handler);
    }

    public void publish(Event event) {
        for (Registration<?> registration : registrations) {
            try {
                registration.deliver(event);
            } catch (Exception ex) {
                handlerFailures.incrementAndGet();
                onHandlerError.accept(event, ex);
            }
        }
    }

    /** Handler exceptions seen since the bus was created. */
    public long handlerFailures() {
        return handlerFailures.get();
    }

    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private static final class Registration<T extends Event> {
        private final Class<T> type;
        private final Consumer<? super T> handler;

        Registration(Class<T> type, Consumer<? super T> handler) {
            this.type = type;
            this.handler = handler;
        }

        void deliver(Event event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }
}
