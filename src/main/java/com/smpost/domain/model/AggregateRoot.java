package com.smpost.domain.model;

import com.smpost.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>State only changes by folding events through the reducer, either historical ones in
 * {@link #replay(List)} or new ones in {@link #raiseEvent(DomainEvent)}. The version is always the
 * number of events folded so far, so a fresh instance replaying the same stream ends up in the
 * same state at the same version.
 *
 * @param <S> immutable state type
 * @param <E> event family this aggregate understands
 */
public abstract class AggregateRoot<S, E extends DomainEvent> {

    private final BiFunction<S, E, S> reducer;
    private final List<E> uncommittedEvents = new ArrayList<>();
    private S state;
    private long version;
    private boolean replayed;

    protected AggregateRoot(S initialState, BiFunction<S, E, S> reducer) {
        this.state = initialState;
        this.reducer = reducer;
    }

    /**
     * Rebuilds state from a stored stream. Only legal once, on a fresh instance.
     *
     * @throws IllegalStateException if the aggregate already holds events or the stream has a gap
     */
    public void replay(List<? extends E> history) {
        if (replayed || version != 0 || !uncommittedEvents.isEmpty()) {
            throw new IllegalStateException("Replay requires a fresh aggregate, current version is " + version);
        }
        replayed = true;
        for (E event : history) {
            fold(event);
        }
    }

    /**
     * Applies a new event and buffers it for the next append.
     * Callers validate business rules before raising; the reducer only transitions state.
     */
    protected void raiseEvent(E event) {
        fold(event);
        uncommittedEvents.add(event);
    }

    private void fold(E event) {
        if (event.version() != version + 1) {
            throw new IllegalStateException(
                "Event " + event.eventType() + " is at position " + event.version() + ", expected " + (version + 1));
        }
        state = reducer.apply(state, event);
        version++;
    }

    public List<E> uncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public void markCommitted() {
        uncommittedEvents.clear();
    }

    public long version() {
        return version;
    }

    /**
     * Stream length this aggregate was loaded at: the guard value for the next append.
     */
    public long expectedVersion() {
        return version - uncommittedEvents.size();
    }

    protected long nextVersion() {
        return version + 1;
    }

    protected S state() {
        return state;
    }
}
