package io.addresswatcher.engine.consumer;

import java.time.Duration;

/**
 * Blocks the calling thread between connect attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = new Sleeper() {
        @Override
        public void sleep(Duration duration) throws InterruptedException {
            Thread.sleep(duration.toMillis());
        }

        @Override
        public boolean sleep(Duration duration, Cancellation cancellation) {
            return cancellation.sleep(duration);
        }
    };

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps unless {@code cancellation} fires first. Interrupting the sleeping thread cancels it.
     *
     * @return true if the full duration elapsed without cancellation
     */
    default boolean sleep(Duration duration, Cancellation cancellation) {
        if (cancellation.isCancelled()) {
            return false;
        }
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            return false;
        }
        return !cancellation.isCancelled();
    }
}
