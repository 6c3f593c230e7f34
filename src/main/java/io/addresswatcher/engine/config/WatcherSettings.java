package io.addresswatcher.engine.config;

import io.addresswatcher.engine.consumer.ConnectionConfig;
import java.time.Duration;
import java.util.Map;

/**
 * Settings for the watcher process, read from environment variables.
 *
 * <table border="1">
 *   <tr><th>Variable</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>{@code KAFKA_BROKER}</td><td>bootstrap address</td><td>none, reported at connect time</td></tr>
 *   <tr><td>{@code KAFKA_TOPIC}</td><td>change event topic</td><td>none, reported at connect time</td></tr>
 *   <tr><td>{@code KAFKA_PARTITION}</td><td>partition to read</td><td>0</td></tr>
 *   <tr><td>{@code KAFKA_RETRIES}</td><td>connect attempts</td><td>5</td></tr>
 *   <tr><td>{@code KAFKA_RETRY_DELAY}</td><td>base connect backoff, seconds</td><td>1</td></tr>
 *   <tr><td>{@code KAFKA_HEALTH_FREQ}</td><td>health check interval, seconds</td><td>30</td></tr>
 *   <tr><td>{@code KAFKA_READ_RETRY_DELAY}</td><td>stream restart delay, seconds</td><td>5</td></tr>
 * </table>
 *
 * @param connection     broker connection settings
 * @param readRetryDelay delay before restarting a failed stream, zero for the default
 */
public record WatcherSettings(ConnectionConfig connection, Duration readRetryDelay) {

    public static final String BROKER = "KAFKA_BROKER";
    public static final String TOPIC = "KAFKA_TOPIC";
    public static final String PARTITION = "KAFKA_PARTITION";
    public static final String RETRIES = "KAFKA_RETRIES";
    public static final String RETRY_DELAY = "KAFKA_RETRY_DELAY";
    public static final String HEALTH_FREQ = "KAFKA_HEALTH_FREQ";
    public static final String READ_RETRY_DELAY = "KAFKA_READ_RETRY_DELAY";

    /**
     * Reads settings from the given environment.
     *
     * @param env variable name to value, usually {@link System#getenv()}
     * @throws ConfigurationException if a numeric variable is not an integer or the partition is negative
     */
    public static WatcherSettings fromEnvironment(Map<String, String> env) {
        int partition = intValue(env, PARTITION);
        if (partition < 0) {
            throw new ConfigurationException(PARTITION + " must not be negative: " + partition, null);
        }
        ConnectionConfig connection = new ConnectionConfig(
                env.getOrDefault(BROKER, ""),
                env.getOrDefault(TOPIC, ""),
                partition,
                intValue(env, RETRIES),
                Duration.ofSeconds(intValue(env, RETRY_DELAY)),
                Duration.ofSeconds(intValue(env, HEALTH_FREQ)));
        return new WatcherSettings(connection, Duration.ofSeconds(intValue(env, READ_RETRY_DELAY)));
    }

    private static int intValue(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + raw + "'", e);
        }
    }
}
