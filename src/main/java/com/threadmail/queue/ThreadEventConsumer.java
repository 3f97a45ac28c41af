package com.threadmail.queue;

import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.projection.InboxProjection;
import com.threadmail.util.ThreadJson;
import jakarta.jms.Message;
import jakarta.jms.TextMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

/**
 * Feeds published thread events into the inbox read model
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadEventConsumer {

    private final InboxProjection inboxProjection;

    @JmsListener(destination = "${threadmail.queue.event-destination:thread.event.queue}")
    public void onEvent(Message message) {
        try {
            if (!(message instanceof TextMessage textMessage)) {
                log.warn("Unexpected message type in event queue");
                return;
            }
            ThreadEvent event = ThreadJson.fromEnvelope(textMessage.getText());
            if (!inboxProjection.apply(event)) {
                log.debug("Event already applied: {} v{}", event.threadId(), event.version());
            }
        } catch (Exception e) {
            log.error("Error processing thread event message", e);
        }
    }
}
