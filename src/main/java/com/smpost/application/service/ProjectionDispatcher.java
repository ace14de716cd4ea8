package com.smpost.application.service;

import com.smpost.domain.error.UnknownEventTypeException;
import com.smpost.domain.event.DomainEvent;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Routes each event to the single handler registered for its concrete kind.
 *
 * <p>The table is fixed when built. For a sealed event family, {@link Builder#build()} refuses a
 * table that leaves any permitted kind without a handler, so a missing registration fails at
 * startup instead of in the middle of a stream.
 *
 * @param <E> event family
 */
public final class ProjectionDispatcher<E extends DomainEvent> {

    private final Map<Class<? extends E>, Consumer<E>> handlers;

    private ProjectionDispatcher(Map<Class<? extends E>, Consumer<E>> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
    }

    public static <E extends DomainEvent> Builder<E> builder(Class<E> family) {
        return new Builder<>(family);
    }

    /**
     * @throws UnknownEventTypeException if no handler is bound to the event's kind
     */
    public void dispatch(E event) {
        Consumer<E> handler = handlers.get(event.getClass());
        if (handler == null) {
            throw new UnknownEventTypeException(event.eventType());
        }
        handler.accept(event);
    }

    public boolean handles(Class<?> eventClass) {
        return handlers.containsKey(eventClass);
    }

    public static final class Builder<E extends DomainEvent> {

        private final Class<E> family;
        private final Map<Class<? extends E>, Consumer<E>> handlers = new LinkedHashMap<>();

        private Builder(Class<E> family) {
            this.family = family;
        }

        public <T extends E> Builder<E> on(Class<T> eventClass, Consumer<? super T> handler) {
            if (handlers.containsKey(eventClass)) {
                throw new IllegalStateException("Handler already registered for " + eventClass.getSimpleName());
            }
            handlers.put(eventClass, event -> handler.accept(eventClass.cast(event)));
            return this;
        }

        /**
         * @throws IllegalStateException if a permitted kind of a sealed family has no handler
         */
        public ProjectionDispatcher<E> build() {
            Class<?>[] permitted = family.getPermittedSubclasses();
            if (permitted != null) {
                List<String> missing = Arrays.stream(permitted)
                    .filter(kind -> !handlers.containsKey(kind))
                    .map(Class::getSimpleName)
                    .toList();
                if (!missing.isEmpty()) {
                    throw new IllegalStateException(
                        "No projection handler registered for " + family.getSimpleName() + " kinds: " + missing);
                }
            }
            return new ProjectionDispatcher<>(new LinkedHashMap<>(handlers));
        }
    }
}
