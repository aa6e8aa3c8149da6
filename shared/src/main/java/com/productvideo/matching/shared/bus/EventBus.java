package com.productvideo.matching.shared.bus;

/**
 * Topic bus shared by every service. Delivery is at-least-once: handlers must
 * tolerate redelivered messages.
 */
public interface EventBus {
    /**
     * Publishes {@code payload} (serialised to JSON) on {@code topic}.
     *
     * @param correlationId tracing id carried with the message; a fresh one is
     *                      generated when {@code null}
     */
    void publish(String topic, Object payload, String correlationId);

    default void publish(String topic, Object payload) {
        publish(topic, payload, null);
    }

    /**
     * Registers {@code handler} for every message routed with {@code topic}.
     * An exception thrown by the handler is retried or dead-lettered by the bus.
     */
    void subscribe(String topic, EventHandler handler);
}
