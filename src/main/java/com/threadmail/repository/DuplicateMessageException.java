package com.threadmail.repository;

import lombok.Getter;

/**
 * A message with the same Message-ID header is already stored.
 * Raised inside the save transaction, so nothing of the failed write is kept.
 */
@Getter
public class DuplicateMessageException extends RuntimeException {

    private final String externalMessageId;
    private final String existingThreadId;   // null when only the unique index caught it

    public DuplicateMessageException(String externalMessageId, String existingThreadId) {
        this(externalMessageId, existingThreadId, null);
    }

    public DuplicateMessageException(String externalMessageId, String existingThreadId, Throwable cause) {
        super("Message " + externalMessageId + " is already stored"
                + (existingThreadId != null ? " in thread " + existingThreadId : ""), cause);
        this.externalMessageId = externalMessageId;
        this.existingThreadId = existingThreadId;
    }
}
