package io.addresswatcher.engine.consumer;

/**
 * Every attempt of a {@link ConnectionManager#connectWithRetry()} call failed. The cause is the
 * failure of the last attempt.
 */
public class ConnectRetriesExhaustedException extends BrokerConnectionException {

    private final int attempts;

    public ConnectRetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("failed to connect after " + attempts + " attempts: "
                + (lastFailure != null ? lastFailure.getMessage() : "no attempt made"), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
