package io.addresswatcher.engine.consumer;

/**
 * Long-running read of change events from the partition a manager is configured for.
 */
@FunctionalInterface
public interface EventReader {

    /**
     * Reads until cancelled.
     *
     * @throws java.util.concurrent.CancellationException once {@code cancellation} fires
     * @throws IllegalArgumentException if an argument is null
     */
    void read(Cancellation cancellation, ConnectionManager manager, EventHandler handler);
}
