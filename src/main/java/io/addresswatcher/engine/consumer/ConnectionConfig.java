package io.addresswatcher.engine.consumer;

import java.time.Duration;

/**
 * Connection settings for a {@link ConnectionManager}.
 *
 * <p>Unset (null, zero or negative) retry and interval settings fall back to defaults. Broker and
 * topic are not validated here: an empty value surfaces as a connect failure.
 *
 * @param broker              bootstrap address, e.g. {@code localhost:9092}
 * @param topic               topic carrying the change events
 * @param partition           partition to read, must not be negative
 * @param maxRetries          connect attempts per {@link ConnectionManager#connectWithRetry()}
 * @param retryDelay          base backoff between connect attempts
 * @param healthCheckInterval period of the background liveness check
 */
public record ConnectionConfig(
        String broker,
        String topic,
        int partition,
        int maxRetries,
        Duration retryDelay,
        Duration healthCheckInterval) {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

    public ConnectionConfig {
        if (partition < 0) {
            throw new IllegalArgumentException("partition must not be negative: " + partition);
        }
        if (maxRetries <= 0) {
            maxRetries = DEFAULT_MAX_RETRIES;
        }
        if (retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()) {
            retryDelay = DEFAULT_RETRY_DELAY;
        }
        if (healthCheckInterval == null || healthCheckInterval.isZero() || healthCheckInterval.isNegative()) {
            healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
        }
    }

    /**
     * Creates a config for the given broker, topic and partition with default retry and health
     * check settings.
     */
    public static ConnectionConfig of(String broker, String topic, int partition) {
        return new ConnectionConfig(broker, topic, partition, 0, null, null);
    }

    /** Returns a copy with the given retry settings. */
    public ConnectionConfig withRetries(int maxRetries, Duration retryDelay) {
        return new ConnectionConfig(broker, topic, partition, maxRetries, retryDelay, healthCheckInterval);
    }

    /** Returns a copy with the given health check interval. */
    public ConnectionConfig withHealthCheckInterval(Duration interval) {
        return new ConnectionConfig(broker, topic, partition, maxRetries, retryDelay, interval);
    }
}
