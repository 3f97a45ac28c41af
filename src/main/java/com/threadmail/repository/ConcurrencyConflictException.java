package com.threadmail.repository;

import lombok.Getter;

/**
 * Another writer advanced the stored thread past the version this writer loaded.
 * The caller should reload the thread and retry the operation.
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

    private final String threadId;
    private final long expectedVersion;
    private final Long actualVersion;     // null when the thread row is missing

    public ConcurrencyConflictException(String threadId, long expectedVersion, Long actualVersion) {
        super("Concurrency conflict on thread " + threadId + ": expected version " + expectedVersion
                + ", but stored version is " + actualVersion);
        this.threadId = threadId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
