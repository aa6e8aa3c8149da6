package com.productvideo.matching.shared.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productvideo.matching.shared.config.BrokerConfig;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DeliverCallback;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link EventBus} over a durable RabbitMQ TOPIC exchange. Each subscription gets
 * its own durable queue ({@code queue.<service>.<topic>}) and dead-letter queue.
 */
public class RabbitMQEventBus implements EventBus, AutoCloseable {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Logger logger = LogManager.getLogger(RabbitMQEventBus.class);

    private final Connection connection;
    private final Channel channel;
    private final String exchange;
    private final String serviceName;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService retryScheduler;

    public RabbitMQEventBus(BrokerConfig config, String serviceName) {
        Objects.requireNonNull(config, "config is null");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName is null");
        this.exchange = config.getExchange();
        this.retryPolicy = new RetryPolicy(config.getMaxRetries(), Duration.ofSeconds(config.getMaxBackoffSeconds()));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, serviceName + "-bus-retry");
            t.setDaemon(true);
            return t;
        });

        try {
            ConnectionFactory factory = new ConnectionFactory();
            factory.setHost(config.getHost());
            factory.setPort(config.getPort());
            factory.setUsername(config.getUsername());
            factory.setPassword(config.getPassword());
            factory.setVirtualHost(config.getVirtualHost());
            factory.setAutomaticRecoveryEnabled(true);
            this.connection = factory.newConnection(serviceName + "-eventbus");
            this.channel = connection.createChannel();

            channel.exchangeDeclare(this.exchange, BuiltinExchangeType.TOPIC, true);
            channel.basicQos(config.getPrefetch());
            logger.info("Connected to RabbitMQ {}", config);
        } catch (IOException | TimeoutException e) {
            retryScheduler.shutdownNow();
            throw new EventBusException("Failed to initialize RabbitMQEventBus", e);
        }
    }

    @Override
    public void publish(String topic, Object payload, String correlationId) {
        Objects.requireNonNull(topic, "topic is null");
        Objects.requireNonNull(payload, "payload is null");
        String resolvedCorrelationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        try {
            ObjectNode message = objectMapper.valueToTree(payload);
            ObjectNode metadata = message.putObject("_metadata");
            metadata.put("timestamp", Instant.now().toString());
            metadata.put("correlation_id", resolvedCorrelationId);
            metadata.put("topic", topic);
            byte[] body = objectMapper.writeValueAsBytes(message);

            synchronized (channel) {
                channel.basicPublish(exchange, topic, DeliveryHandler.persistent(resolvedCorrelationId, null), body);
            }
            logger.info("Published event topic={} correlationId={}", topic, resolvedCorrelationId);
        } catch (IOException e) {
            throw new EventBusException("Failed to publish event on " + topic, e);
        }
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        Objects.requireNonNull(topic, "topic is null");
        Objects.requireNonNull(handler, "handler is null");
        String queue = "queue." + serviceName + "." + topic;
        DeliveryHandler deliveryHandler =
                new DeliveryHandler(channel, queue, topic, handler, retryPolicy, retryScheduler);
        try {
            synchronized (channel) {
                channel.queueDeclare(queue, true, false, false, null);
                channel.queueBind(queue, exchange, topic);
                channel.queueDeclare(deliveryHandler.getDeadLetterQueue(), true, false, false, null);
            }
            DeliverCallback callback = (consumerTag, delivery) -> deliveryHandler.handle(delivery);
            channel.basicConsume(queue, false, callback, consumerTag -> {
                logger.warn("Consumer cancelled for queue {}", queue);
            });
            logger.info("Subscribed to topic={} queue={}", topic, queue);
        } catch (IOException e) {
            throw new EventBusException("Failed to subscribe to " + topic, e);
        }
    }

    @Override
    public void close() throws Exception {
        retryScheduler.shutdown();
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        if (connection != null && connection.isOpen()) {
            connection.close();
        }
    }
}
