package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

/**
 * Thread moved out of the inbox
 */
public record ThreadArchived(String threadId, long version, Instant occurredAt) implements ThreadEvent {

    public static final String NAME = "ThreadArchived";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of();
    }
}
