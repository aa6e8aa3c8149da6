package com.productvideo.matching.shared.events;

/** A payload that is missing a required field or has the wrong shape. Never retried. */
public class InvalidEventException extends RuntimeException {
    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
