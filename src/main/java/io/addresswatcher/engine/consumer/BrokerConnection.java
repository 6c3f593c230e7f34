package io.addresswatcher.engine.consumer;

import java.time.Duration;

/**
 * An open connection to the broker hosting the configured topic partition.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Performs a cheap metadata round-trip without side effects.
     *
     * @param timeout upper bound for the round-trip
     * @throws BrokerConnectionException if the broker does not answer in time or answers with an error
     */
    void probe(Duration timeout);

    /**
     * Releases the connection.
     *
     * @throws BrokerConnectionException if the underlying client fails to close cleanly
     */
    @Override
    void close();
}
