package com.threadmail.domain.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Every unread message of the thread was marked read.
 * {@code messageIds} lists only the messages whose state changed.
 */
public record ThreadMarkedRead(String threadId, long version, Instant occurredAt,
                               List<String> messageIds) implements ThreadEvent {

    public static final String NAME = "ThreadMarkedRead";

    public ThreadMarkedRead {
        messageIds = List.copyOf(messageIds);
    }

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        return Map.of("messageIds", messageIds);
    }
}
