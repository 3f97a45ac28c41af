package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable fact recorded against one aggregate instance.
 * {@code (aggregateId, version)} identifies an event; version equals the
 * aggregate version right after the event was applied.
 */
public interface DomainEvent {

    String aggregateId();

    long version();

    Instant occurredAt();

    /**
     * Stable event name used in the log and on the wire (e.g. "ThreadCreated")
     */
    String eventName();

    /**
     * Name-specific payload for audit trails and projections
     */
    Map<String, Object> eventData();
}
