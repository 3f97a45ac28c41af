package com.threadmail.domain;

import com.threadmail.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Version counter plus the list of events not yet handed to storage.
 * Owned by an aggregate, which calls {@link #record} once per committed change.
 *
 * @param <E> event type produced by the owning aggregate
 */
public final class EventRecorder<E extends DomainEvent> {

    private final List<E> uncommitted = new ArrayList<>();
    private long version;

    public EventRecorder() {
        this(0L);
    }

    public EventRecorder(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative: " + version);
        }
        this.version = version;
    }

    public long version() {
        return version;
    }

    public long nextVersion() {
        return version + 1;
    }

    /**
     * Advance the version for a freshly produced event and keep it as uncommitted
     */
    public void record(E event) {
        advance(event);
        uncommitted.add(event);
    }

    /**
     * Advance the version for an event that is already stored (replay)
     */
    public void advance(E event) {
        if (event.version() != version + 1) {
            throw new IllegalStateException("Out of order event " + event.eventName() + " for "
                    + event.aggregateId() + ": expected version " + (version + 1) + " but was " + event.version());
        }
        version = event.version();
    }

    public List<E> uncommittedEvents() {
        return List.copyOf(uncommitted);
    }

    public boolean hasUncommittedEvents() {
        return !uncommitted.isEmpty();
    }

    public void clearUncommittedEvents() {
        uncommitted.clear();
    }
}
