package io.addresswatcher.engine.consumer;

/**
 * Failure to establish or use a broker connection.
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
