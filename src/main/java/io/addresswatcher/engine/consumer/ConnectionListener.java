package io.addresswatcher.engine.consumer;

/**
 * Observer of {@link ConnectionManager} connection events. All methods default to no-ops and are
 * called on the thread that made the attempt, which may be the background health check thread.
 */
public interface ConnectionListener {

    ConnectionListener NO_OP = new ConnectionListener() {};

    /** A new connection has replaced the previous one. */
    default void connected(ConnectionConfig config) {}

    /** The background health check found the connection dead and could not reconnect. */
    default void reconnectFailed(RuntimeException failure) {}
}
