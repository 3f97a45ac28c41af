package com.threadmail.queue;

import com.threadmail.config.ThreadMailProperties;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.util.ThreadJson;
import jakarta.jms.TextMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes committed thread events to the event queue
 * - JSON envelope body (see {@link ThreadJson#toEnvelope})
 * - threadId / eventName / version as message properties for selectors
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadEventPublisher {

    private final JmsTemplate jmsTemplate;
    private final ThreadMailProperties properties;

    public void publish(List<? extends ThreadEvent> events) {
        if (!properties.getQueue().isPublishEvents()) {
            return;
        }
        String destination = properties.getQueue().getEventDestination();
        for (ThreadEvent event : events) {
            String body = ThreadJson.toEnvelope(event);
            jmsTemplate.send(destination, session -> {
                TextMessage message = session.createTextMessage(body);
                message.setStringProperty("threadId", event.threadId());
                message.setStringProperty("eventName", event.eventName());
                message.setLongProperty("version", event.version());
                return message;
            });
            log.debug("Event published: {} v{} {}", event.threadId(), event.version(), event.eventName());
        }
    }
}
