package com.productvideo.matching.shared.bus;

/**
 * Marks a handler failure as transient. The delivery handler re-queues the
 * message with backoff instead of dead-lettering it straight away.
 */
public class RetryableException extends RuntimeException {
    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
