package com.productvideo.matching.shared.bus;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.productvideo.matching.shared.events.InvalidEventException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeliveryHandlerTest {
    private static final String QUEUE = "queue.embedding.products.image.masked";
    private static final String TOPIC = "products.image.masked";
    private static final byte[] BODY = "{\"job_id\":\"J1\"}".getBytes(StandardCharsets.UTF_8);

    @Mock
    private Channel channel;

    @Mock
    private ScheduledExecutorService scheduler;

    private final List<JsonNode> handled = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(30));

    @BeforeEach
    void setUp() {
        handled.clear();
    }

    private static Delivery delivery(byte[] body, Map<String, Object> headers) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .correlationId("corr-1")
                .headers(headers)
                .build();
        return new Delivery(new Envelope(42L, false, "pvm", TOPIC), props, body);
    }

    // ── Success ────────────────────────────────────────────────────────────────

    @Test
    void success_acksMessage() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, handled::add, policy, scheduler);

        handler.handle(delivery(BODY, null));

        assertEquals(1, handled.size());
        assertEquals("J1", handled.get(0).get("job_id").asText());
        verify(channel).basicAck(42L, false);
        verify(channel, never()).basicPublish(any(), any(), any(), any());
    }

    // ── Retry ──────────────────────────────────────────────────────────────────

    @Test
    void retryableFailure_republishesToOwnQueueAfterBackoff() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, node -> {
            throw new RetryableException("db busy");
        }, policy, scheduler);

        handler.handle(delivery(BODY, Map.of("x-retry-count", 1)));

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(2000L), eq(TimeUnit.MILLISECONDS));
        verify(channel, never()).basicAck(anyLong(), anyBoolean());

        task.getValue().run();

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq(QUEUE), props.capture(), eq(BODY));
        verify(channel).basicAck(42L, false);
        assertEquals(2, props.getValue().getHeaders().get("x-retry-count"));
        assertEquals("RetryableException", props.getValue().getHeaders().get("x-error-type"));
        assertEquals("db busy", props.getValue().getHeaders().get("x-last-error"));
        assertEquals(2, props.getValue().getDeliveryMode());
    }

    @Test
    void failedRepublish_requeuesOriginal() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, node -> {
            throw new IOException("timeout");
        }, policy, scheduler);
        doThrow(new IOException("channel closed")).when(channel).basicPublish(eq(""), eq(QUEUE), any(), any());

        handler.handle(delivery(BODY, null));
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(1000L), eq(TimeUnit.MILLISECONDS));
        task.getValue().run();

        verify(channel).basicNack(42L, false, true);
    }

    // ── Dead letter ────────────────────────────────────────────────────────────

    @Test
    void exhaustedRetries_goToDeadLetterQueue() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, node -> {
            throw new RetryableException("still busy");
        }, policy, scheduler);

        handler.handle(delivery(BODY, Map.of("x-retry-count", 2)));

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq(QUEUE + ".dlq"), props.capture(), eq(BODY));
        verify(channel).basicAck(42L, false);
        verifyNoInteractions(scheduler);
        Map<String, Object> headers = props.getValue().getHeaders();
        assertEquals(TOPIC, headers.get("x-original-topic"));
        assertEquals("still busy", headers.get("x-failure-reason"));
        assertEquals(2, headers.get("x-retry-count"));
        assertEquals("true", headers.get("x-is-retryable"));
    }

    @Test
    void invalidPayload_deadLetteredWithoutRetry() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, handled::add, policy, scheduler);
        byte[] garbage = "not json".getBytes(StandardCharsets.UTF_8);

        handler.handle(delivery(garbage, null));

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq(QUEUE + ".dlq"), props.capture(), eq(garbage));
        assertEquals("InvalidEventException", props.getValue().getHeaders().get("x-error-type"));
        assertEquals("false", props.getValue().getHeaders().get("x-is-retryable"));
        assertTrue(handled.isEmpty());
        verifyNoInteractions(scheduler);
    }

    @Test
    void handlerRejectingPayload_isFatal() throws IOException {
        DeliveryHandler handler = new DeliveryHandler(channel, QUEUE, TOPIC, node -> {
            throw new InvalidEventException("missing required field 'image_id'");
        }, policy, scheduler);

        handler.handle(delivery(BODY, null));

        verify(channel).basicPublish(eq(""), eq(QUEUE + ".dlq"), any(), eq(BODY));
        verifyNoInteractions(scheduler);
    }

    @Test
    void retryCountOf_readsNumericAndTextHeaders() {
        assertEquals(0, DeliveryHandler.retryCountOf(null));
        assertEquals(3, DeliveryHandler.retryCountOf(new AMQP.BasicProperties.Builder()
                .headers(Map.of("x-retry-count", 3L)).build()));
        assertEquals(1, DeliveryHandler.retryCountOf(new AMQP.BasicProperties.Builder()
                .headers(Map.of("x-retry-count", "1")).build()));
    }
}
