package com.threadmail.domain.event;

import com.threadmail.domain.MailMessage;
import com.threadmail.domain.Subject;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * First event of every thread. Carries the founding message snapshot.
 */
public record ThreadCreated(String threadId, long version, Instant occurredAt,
                            Subject subject, MailMessage foundingMessage) implements ThreadEvent {

    public static final String NAME = "ThreadCreated";

    @Override
    public String eventName() {
        return NAME;
    }

    @Override
    public Map<String, Object> eventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("subject", subject.raw());
        data.put("initialMessageId", foundingMessage.getId());
        data.put("createdBy", foundingMessage.getFrom().address());
        return data;
    }
}
