package com.threadmail.domain.event;

import java.time.Instant;
import java.util.Map;

/**
 * Label is stored normalized (trimmed, lower case)
 */
public record MessageLabelRemoved(String threadId, long version, Instant occurredAt,
                                  String messageId, String label) implements ThreadEvent {

    public static final String NAME = "MessageLabelRemoved";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of("messageId", messageId, "label", label);
    }
}
