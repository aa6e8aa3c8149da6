package com.productvideo.matching.shared.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.productvideo.matching.shared.events.InvalidEventException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wraps one subscription's handler with JSON decoding, manual acknowledgement,
 * bounded retry with exponential backoff, and dead-lettering.
 *
 * <p>Retries are re-published straight to the consuming queue through the default
 * exchange so that other services bound to the same topic do not see them twice.
 */
public class DeliveryHandler {
    private static final Logger logger = LogManager.getLogger(DeliveryHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String RETRY_COUNT_HEADER = "x-retry-count";
    private static final int MAX_ERROR_LENGTH = 500;

    private final Channel channel;
    private final String queue;
    private final String deadLetterQueue;
    private final String topic;
    private final EventHandler handler;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService retryScheduler;

    public DeliveryHandler(
            Channel channel,
            String queue,
            String topic,
            EventHandler handler,
            RetryPolicy retryPolicy,
            ScheduledExecutorService retryScheduler
    ) {
        this.channel = Objects.requireNonNull(channel, "channel is null");
        this.queue = Objects.requireNonNull(queue, "queue is null");
        this.deadLetterQueue = queue + ".dlq";
        this.topic = Objects.requireNonNull(topic, "topic is null");
        this.handler = Objects.requireNonNull(handler, "handler is null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler is null");
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public void handle(Delivery delivery) throws IOException {
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        AMQP.BasicProperties properties = delivery.getProperties();
        String correlationId = properties == null ? null : properties.getCorrelationId();
        int retryCount = retryCountOf(properties);

        try {
            JsonNode payload = decode(delivery.getBody());
            logger.info("Received event topic={} correlationId={}", topic, correlationId);
            handler.handle(payload);
            ack(deliveryTag);
            logger.info("Processed event topic={} correlationId={}", topic, correlationId);
        } catch (Exception e) {
            logger.error("Failed to process event topic={} correlationId={}: {}",
                    topic, correlationId, e.getMessage(), e);
            onFailure(delivery, deliveryTag, correlationId, retryCount, e);
        }
    }

    private void onFailure(Delivery delivery, long deliveryTag, String correlationId, int retryCount, Exception error)
            throws IOException {
        boolean retryable = retryPolicy.isRetryable(error);
        if (retryPolicy.shouldRetry(error, retryCount)) {
            Duration delay = retryPolicy.backoff(retryCount);
            Map<String, Object> headers = new HashMap<>();
            headers.put(RETRY_COUNT_HEADER, retryCount + 1);
            headers.put("x-error-type", error.getClass().getSimpleName());
            headers.put("x-last-error", truncate(error.getMessage()));
            retryScheduler.schedule(
                    () -> republish(delivery.getBody(), deliveryTag, correlationId, headers),
                    delay.toMillis(),
                    TimeUnit.MILLISECONDS);
            logger.info("Retrying event topic={} correlationId={} retryCount={} delaySeconds={}",
                    topic, correlationId, retryCount + 1, delay.toSeconds());
            return;
        }

        Map<String, Object> headers = new HashMap<>();
        headers.put("x-original-topic", topic);
        headers.put("x-failure-reason", truncate(error.getMessage()));
        headers.put("x-error-type", error.getClass().getSimpleName());
        headers.put(RETRY_COUNT_HEADER, retryCount);
        headers.put("x-is-retryable", String.valueOf(retryable));
        synchronized (channel) {
            channel.basicPublish("", deadLetterQueue, persistent(correlationId, headers), delivery.getBody());
            channel.basicAck(deliveryTag, false);
        }
        logger.error("Event sent to DLQ topic={} correlationId={} dlq={} retryCount={} reason={}",
                topic, correlationId, deadLetterQueue, retryCount, retryable ? "max_retries" : "fatal_error");
    }

    private void republish(byte[] body, long deliveryTag, String correlationId, Map<String, Object> headers) {
        try {
            synchronized (channel) {
                channel.basicPublish("", queue, persistent(correlationId, headers), body);
                channel.basicAck(deliveryTag, false);
            }
        } catch (IOException e) {
            logger.error("Failed to re-publish event topic={} correlationId={}, requeueing", topic, correlationId, e);
            try {
                synchronized (channel) {
                    channel.basicNack(deliveryTag, false, true);
                }
            } catch (IOException nackError) {
                logger.error("Failed to nack event topic={} correlationId={}", topic, correlationId, nackError);
            }
        }
    }

    private void ack(long deliveryTag) throws IOException {
        synchronized (channel) {
            channel.basicAck(deliveryTag, false);
        }
    }

    private static JsonNode decode(byte[] body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new InvalidEventException("payload is not a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new InvalidEventException("payload is not valid JSON", e);
        }
    }

    static int retryCountOf(AMQP.BasicProperties properties) {
        if (properties == null || properties.getHeaders() == null) {
            return 0;
        }
        Object value = properties.getHeaders().get(RETRY_COUNT_HEADER);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    static AMQP.BasicProperties persistent(String correlationId, Map<String, Object> headers) {
        return new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .deliveryMode(2)
                .correlationId(correlationId)
                .headers(headers)
                .build();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
