package com.threadmail.domain.event;

import com.threadmail.domain.MailMessage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message was admitted to the thread. Carries the full message snapshot.
 */
public record MessageAdded(String threadId, long version, Instant occurredAt,
                           MailMessage message) implements ThreadEvent {

    public static final String NAME = "MessageAdded";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", message.getId());
        data.put("from", message.getFrom().address());
        data.put("sentAt", message.getSentAt().toString());
        return data;
    }
}
