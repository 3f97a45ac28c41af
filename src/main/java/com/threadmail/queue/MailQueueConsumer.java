package com.threadmail.queue;

import com.threadmail.service.MessageIngestionService;
import jakarta.jms.BytesMessage;
import jakarta.jms.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

/**
 * Inbound mail queue consumer
 * - BytesMessage body is a raw EML
 * - Parsed, threaded and stored through the ingestion service
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailQueueConsumer {

    private final MessageIngestionService ingestionService;

    @JmsListener(destination = "${threadmail.queue.inbound-destination:mail.inbound.queue}",
            containerFactory = "inboundListenerContainerFactory")
    public void processInbound(Message message) {
        try {
            if (!(message instanceof BytesMessage bytesMessage)) {
                log.warn("Unexpected message type in inbound queue");
                return;
            }

            byte[] emlData = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(emlData);

            String threadId = ingestionService.ingestEml(emlData);
            log.info("Inbound mail ({} bytes) stored in thread {}", emlData.length, threadId);

        } catch (Exception e) {
            log.error("Error processing inbound queue message", e);
        }
    }
}
