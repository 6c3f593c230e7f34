package io.addresswatcher.engine.consumer;

/**
 * Thrown by every {@link ConnectionManager} operation after {@link ConnectionManager#close()}.
 */
public class ManagerClosedException extends IllegalStateException {

    public ManagerClosedException() {
        super("connection manager is closed");
    }
}
