package com.productvideo.matching.shared.config;

import java.util.Objects;

public class BrokerConfig {
    public static final String DEFAULT_EXCHANGE = "product_video_matching";

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String virtualHost;
    private final String exchange;
    private final int prefetch;
    private final int maxRetries;
    private final int maxBackoffSeconds;

    public BrokerConfig(
            String host,
            int port,
            String username,
            String password,
            String virtualHost,
            String exchange,
            int prefetch,
            int maxRetries,
            int maxBackoffSeconds
    ) {
        this.host = Objects.requireNonNull(host, "host");
        this.username = Objects.requireNonNull(username, "username");
        this.password = Objects.requireNonNull(password, "password");
        this.virtualHost = Objects.requireNonNull(virtualHost, "virtualHost");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        if (port <= 0) throw new IllegalArgumentException("port must be > 0");
        if (prefetch <= 0) throw new IllegalArgumentException("prefetch must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (maxBackoffSeconds <= 0) throw new IllegalArgumentException("maxBackoffSeconds must be > 0");
        this.port = port;
        this.prefetch = prefetch;
        this.maxRetries = maxRetries;
        this.maxBackoffSeconds = maxBackoffSeconds;
    }

    public static BrokerConfig fromEnv(EnvConfig env) {
        return new BrokerConfig(
                env.get("RABBITMQ_HOST", "localhost"),
                env.getInt("RABBITMQ_PORT", 5672),
                env.get("RABBITMQ_USER", "guest"),
                env.get("RABBITMQ_PASS", "guest"),
                env.get("RABBITMQ_VHOST", "/"),
                env.get("RABBITMQ_EXCHANGE", DEFAULT_EXCHANGE),
                env.getInt("RABBITMQ_PREFETCH", 1),
                env.getInt("BUS_MAX_RETRIES", 3),
                env.getInt("BUS_MAX_BACKOFF_SECONDS", 60)
        );
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public String getExchange() {
        return exchange;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxBackoffSeconds() {
        return maxBackoffSeconds;
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", username='" + username + '\'' +
                ", password='***'" +
                ", virtualHost='" + virtualHost + '\'' +
                ", exchange='" + exchange + '\'' +
                ", prefetch=" + prefetch +
                ", maxRetries=" + maxRetries +
                ", maxBackoffSeconds=" + maxBackoffSeconds +
                '}';
    }
}
