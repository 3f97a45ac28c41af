package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

public record MessageRemoved(String threadId, long version, Instant occurredAt, String messageId) implements ThreadEvent {

    public static final String NAME = "MessageRemoved";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of("messageId", messageId);
    }
}
