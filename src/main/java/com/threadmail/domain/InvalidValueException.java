package com.threadmail.domain;

/**
 * Raised when a value object or entity is constructed from malformed input
 * (bad address syntax, empty subject or content, negative size...).
 */
public class InvalidValueException extends IllegalArgumentException {

    public InvalidValueException(String message) {
        super(message);
    }
}
