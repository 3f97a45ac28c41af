package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

public record ThreadUnarchived(String threadId, long version, Instant occurredAt) implements ThreadEvent {

    public static final String NAME = "ThreadUnarchived";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of();
    }
}
