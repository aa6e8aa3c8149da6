package com.productvideo.matching.shared.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous single-process bus. Handlers run on the publishing thread and
 * their exceptions surface to the publisher.
 */
public class InMemoryEventBus implements EventBus {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, List<EventHandler>> handlersByTopic = new ConcurrentHashMap<>();
    private final Map<String, List<JsonNode>> publishedByTopic = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, Object payload, String correlationId) {
        Objects.requireNonNull(topic, "topic is null");
        Objects.requireNonNull(payload, "payload is null");
        ObjectNode message = objectMapper.valueToTree(payload);
        ObjectNode metadata = message.putObject("_metadata");
        metadata.put("timestamp", Instant.now().toString());
        metadata.put("correlation_id", correlationId != null ? correlationId : UUID.randomUUID().toString());
        metadata.put("topic", topic);

        publishedByTopic
                .computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>())
                .add(message);

        List<EventHandler> handlers = handlersByTopic.get(topic);
        if (handlers == null) {
            return;
        }
        for (EventHandler handler : handlers) {
            try {
                handler.handle(message.deepCopy());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new EventBusException("Handler failed for topic " + topic, e);
            }
        }
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        Objects.requireNonNull(topic, "topic is null");
        Objects.requireNonNull(handler, "handler is null");
        handlersByTopic
                .computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>())
                .add(handler);
    }

    /** Messages published on {@code topic} so far, oldest first. */
    public List<JsonNode> getPublished(String topic) {
        List<JsonNode> published = publishedByTopic.get(topic);
        return published == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(published));
    }

    public void clearPublished() {
        publishedByTopic.clear();
    }
}
