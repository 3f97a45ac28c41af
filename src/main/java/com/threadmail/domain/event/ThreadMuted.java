package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

public record ThreadMuted(String threadId, long version, Instant occurredAt) implements ThreadEvent {

    public static final String NAME = "ThreadMuted";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of();
    }
}
