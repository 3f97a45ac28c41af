package com.threadmail.domain;

import lombok.Getter;

/**
 * A thread operation was rejected because it would break an aggregate rule.
 * The aggregate is left unchanged and no event is emitted.
 */
@Getter
public class InvariantViolationException extends IllegalStateException {

    public enum Violation {
        DUPLICATE_MESSAGE,
        NOT_PART_OF_THREAD,
        MESSAGE_NOT_FOUND,
        LAST_MESSAGE_PROTECTED,
        ALREADY_IN_STATE
    }

    private final Violation violation;
    private final String operation;
    private final String threadId;
    private final String targetId;    // Offending message id, or the thread id for thread-level state

    public InvariantViolationException(Violation violation, String operation, String threadId,
                                       String targetId, String message) {
        super(operation + " rejected on thread " + threadId + " (" + violation + "): " + message);
        this.violation = violation;
        this.operation = operation;
        this.threadId = threadId;
        this.targetId = targetId;
    }
}
