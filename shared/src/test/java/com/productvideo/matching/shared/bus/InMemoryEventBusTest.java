package com.productvideo.matching.shared.bus;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.productvideo.matching.shared.events.AssetReadyEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryEventBusTest {

    @Test
    void publish_deliversToTopicSubscribersWithMetadata() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<JsonNode> received = new ArrayList<>();
        bus.subscribe("image.embedding.ready", received::add);
        bus.subscribe("video.embedding.ready", node -> fail("wrong topic"));

        bus.publish("image.embedding.ready", new AssetReadyEvent("J1", "img_1", "E1"), "corr-1");

        assertEquals(1, received.size());
        JsonNode message = received.get(0);
        assertEquals("img_1", message.get("asset_id").asText());
        assertEquals("corr-1", message.get("_metadata").get("correlation_id").asText());
        assertEquals("image.embedding.ready", message.get("_metadata").get("topic").asText());
        assertEquals(1, bus.getPublished("image.embedding.ready").size());
    }

    @Test
    void publish_generatesCorrelationIdWhenMissing() {
        InMemoryEventBus bus = new InMemoryEventBus();

        bus.publish("t", Map.of("job_id", "J1"));

        assertFalse(bus.getPublished("t").get(0).get("_metadata").get("correlation_id").asText().isBlank());
    }

    @Test
    void handlerFailure_surfacesToPublisher() {
        InMemoryEventBus bus = new InMemoryEventBus();
        bus.subscribe("t", node -> {
            throw new IOException("disk full");
        });

        EventBusException e = assertThrows(EventBusException.class, () -> bus.publish("t", Map.of("a", 1)));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void clearPublished_forgetsHistory() {
        InMemoryEventBus bus = new InMemoryEventBus();
        bus.publish("t", Map.of("a", 1));

        bus.clearPublished();

        assertTrue(bus.getPublished("t").isEmpty());
    }
}
