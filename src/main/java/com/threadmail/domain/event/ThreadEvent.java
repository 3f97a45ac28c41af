package com.threadmail.domain.event;

/**
 * Event emitted by a {@link com.threadmail.domain.MailThread}
 */
public interface ThreadEvent extends DomainEvent {

    String threadId();

    @Override
    default String aggregateId() {
        return threadId();
    }
}
