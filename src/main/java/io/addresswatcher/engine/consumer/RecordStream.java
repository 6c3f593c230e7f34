package io.addresswatcher.engine.consumer;

/**
 * Single-reader source of raw messages from one topic partition, in offset order.
 */
public interface RecordStream extends AutoCloseable {

    /**
     * Blocks until the next message is available.
     *
     * @return the next message
     * @throws RuntimeException if the fetch fails or is aborted by {@link #wakeup()}
     */
    StreamRecord fetch();

    /**
     * Aborts a blocking {@link #fetch()}, or the next one if none is in progress. Safe to call from
     * any thread.
     */
    void wakeup();

    @Override
    void close();
}
