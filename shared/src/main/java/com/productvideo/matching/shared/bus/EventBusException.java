package com.productvideo.matching.shared.bus;

public class EventBusException extends RuntimeException {
    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
