package io.addresswatcher.engine.consumer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal shared between the owner of a stream and the thread reading it.
 *
 * <p>Cancelling is one-way and idempotent. Readers observe it at loop boundaries through
 * {@link #isCancelled()}, wake up early from {@link #sleep(Duration)}, and may register callbacks
 * that abort blocking calls in flight. Interrupting a thread that sleeps on this signal cancels it.
 */
public final class Cancellation {

    private static final Logger LOGGER = LoggerFactory.getLogger(Cancellation.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile String reason;

    /** Cancels with a generic reason. */
    public void cancel() {
        cancel("cancelled");
    }

    /**
     * Cancels and runs every registered callback on the calling thread. Only the first call has
     * any effect.
     */
    public void cancel(String reason) {
        List<Runnable> pending;
        synchronized (callbacks) {
            if (this.reason != null) {
                return;
            }
            this.reason = reason;
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        latch.countDown();
        pending.forEach(Cancellation::runCallback);
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * The error a cancelled operation reports, or null while not cancelled.
     */
    public CancellationException cause() {
        String current = reason;
        return current != null ? new CancellationException(current) : null;
    }

    /**
     * @throws CancellationException if cancelled
     */
    public void throwIfCancelled() {
        CancellationException cause = cause();
        if (cause != null) {
            throw cause;
        }
    }

    /**
     * Blocks for the given duration or until cancelled, whichever comes first.
     *
     * @return true if the full duration elapsed, false if cancelled
     */
    public boolean sleep(Duration duration) {
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
    }

    /**
     * Registers a callback to run once on cancellation. If already cancelled, the callback runs
     * immediately on the calling thread.
     *
     * @return a handle that deregisters the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (reason == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> { };
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Cancellation callback failed", e);
        }
    }

    /**
     * Deregistration handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
