package io.addresswatcher.engine.consumer;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an {@link EventReader} running across abnormal exits by restarting it after a delay.
 *
 * <p>The restart delay is independent of the reader's own fetch retry delay: it guards the whole
 * subscription rather than a single fetch.
 */
public final class RetryingReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingReader.class);

    /** Restart delay used when none is given. */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

    private final EventReader delegate;

    public RetryingReader(EventReader delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Runs the reader until it is cancelled or returns normally.
     *
     * <p>Any other failure is logged and the reader restarted after {@code retryDelay}. Invalid
     * arguments and a closed manager are not retried.
     *
     * @param retryDelay pause before each restart; null or zero selects {@link #DEFAULT_RETRY_DELAY}
     * @throws CancellationException once {@code cancellation} fires
     * @throws IllegalArgumentException if an argument is null
     * @throws ManagerClosedException if the manager is closed
     */
    public void readWithRetry(
            Cancellation cancellation, ConnectionManager manager, EventHandler handler, Duration retryDelay) {
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation must not be null");
        }
        if (manager == null) {
            throw new IllegalArgumentException("connection manager must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("event handler must not be null");
        }
        Duration delay = retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()
                ? DEFAULT_RETRY_DELAY
                : retryDelay;

        while (true) {
            cancellation.throwIfCancelled();
            try {
                delegate.read(cancellation, manager, handler);
                return;
            } catch (CancellationException | IllegalArgumentException | ManagerClosedException e) {
                throw e;
            } catch (RuntimeException e) {
                cancellation.throwIfCancelled();
                LOGGER.warn("Read failed: {}, retrying in {}", e.getMessage(), delay, e);
                cancellation.sleep(delay);
            }
        }
    }
}
