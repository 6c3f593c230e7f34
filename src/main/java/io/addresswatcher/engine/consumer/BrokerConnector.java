package io.addresswatcher.engine.consumer;

import java.time.Duration;

/**
 * Opens {@link BrokerConnection}s. A single call makes exactly one attempt; retrying is the
 * caller's business.
 */
@FunctionalInterface
public interface BrokerConnector {

    /**
     * @param config  target broker, topic and partition
     * @param timeout upper bound for the attempt
     * @return an open connection
     * @throws BrokerConnectionException if the connection cannot be established
     */
    BrokerConnection connect(ConnectionConfig config, Duration timeout);
}
