package io.addresswatcher.engine.consumer;

/**
 * Thrown by {@link ConnectionManager#healthCheck()} when the liveness probe fails.
 */
public class ConnectionNotAliveException extends BrokerConnectionException {

    public ConnectionNotAliveException() {
        super("connection is not alive");
    }
}
