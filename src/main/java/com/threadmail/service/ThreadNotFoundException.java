package com.threadmail.service;

import lombok.Getter;

@Getter
public class ThreadNotFoundException extends RuntimeException {

    private final String threadId;

    public ThreadNotFoundException(String threadId) {
        super("Thread not found: " + threadId);
        this.threadId = threadId;
    }
}
