package io.addresswatcher.engine.consumer;

import io.addresswatcher.engine.event.ChangeEvent;
import io.addresswatcher.engine.event.ChangeEventDecoder;
import io.addresswatcher.engine.event.EventDecodingException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads change events from the manager's topic partition and passes each one to a handler.
 *
 * <p>The loop runs until cancelled. Fetch failures are retried after {@link #FETCH_RETRY_DELAY};
 * records that fail to decode and events the handler rejects are logged and skipped. Records are
 * handled one at a time in offset order, so a single instance must not read the same manager from
 * more than one thread.
 *
 * <p>Example usage:
 * <pre>{@code
 * EventHandler handler = event -> {
 *     switch (event.operation()) {
 *         case CREATE, UPDATE -> notifier.userChanged(event.after());
 *         case DELETE -> notifier.userRemoved(event.before());
 *         default -> { }
 *     }
 * };
 * new StreamReader().read(cancellation, manager, handler);
 * }</pre>
 */
public final class StreamReader implements EventReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamReader.class);

    /** Consumer group the stream commits its offsets under. */
    public static final String GROUP_ID = "blockchain-address-watcher-group";

    /** Pause after a failed fetch before the next one. */
    public static final Duration FETCH_RETRY_DELAY = Duration.ofSeconds(1);

    private final RecordStreamFactory streamFactory;
    private final ChangeEventDecoder decoder = new ChangeEventDecoder();
    private final Duration fetchRetryDelay;

    public StreamReader() {
        this(KafkaRecordStream::open, FETCH_RETRY_DELAY);
    }

    public StreamReader(RecordStreamFactory streamFactory, Duration fetchRetryDelay) {
        this.streamFactory = Objects.requireNonNull(streamFactory, "streamFactory");
        this.fetchRetryDelay = Objects.requireNonNull(fetchRetryDelay, "fetchRetryDelay");
    }

    /**
     * Reads until {@code cancellation} fires.
     *
     * <p>Before subscribing, the manager's connection is checked and re-established if needed. Cancelling
     * stops a reconnect in progress.
     *
     * @throws java.util.concurrent.CancellationException once cancelled; this is the only normal exit
     * @throws IllegalArgumentException if an argument is null
     * @throws ManagerClosedException if the manager is closed
     * @throws BrokerConnectionException if the broker cannot be reached or the subscription cannot be opened
     */
    @Override
    public void read(Cancellation cancellation, ConnectionManager manager, EventHandler handler) {
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation must not be null");
        }
        if (manager == null) {
            throw new IllegalArgumentException("connection manager must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("event handler must not be null");
        }
        cancellation.throwIfCancelled();
        try {
            manager.getConnection(cancellation);
        } catch (RuntimeException e) {
            if (cancellation.isCancelled()) {
                throw cancellation.cause();
            }
            throw e;
        }
        cancellation.throwIfCancelled();

        ConnectionConfig config = manager.config();
        try (RecordStream stream = streamFactory.open(config, GROUP_ID);
                Cancellation.Registration ignored = cancellation.onCancel(stream::wakeup)) {
            LOGGER.info("Starting to read from topic: {}, partition: {}", config.topic(), config.partition());
            while (true) {
                if (cancellation.isCancelled()) {
                    LOGGER.info("Cancelled, stopping reader for topic: {}", config.topic());
                    throw cancellation.cause();
                }

                StreamRecord record;
                try {
                    record = stream.fetch();
                } catch (RuntimeException e) {
                    if (cancellation.isCancelled()) {
                        LOGGER.info("Cancelled during fetch, stopping reader for topic: {}", config.topic());
                        throw cancellation.cause();
                    }
                    LOGGER.warn("Error reading message: {}, retrying in {}", e.getMessage(), fetchRetryDelay, e);
                    cancellation.sleep(fetchRetryDelay);
                    continue;
                }

                process(record, handler, cancellation);
            }
        }
    }

    private void process(StreamRecord record, EventHandler handler, Cancellation cancellation) {
        LOGGER.debug("Received message at offset {} (partition {})", record.offset(), record.partition());
        if (record.isTombstone()) {
            LOGGER.debug("Skipping tombstone at offset {}", record.offset());
            return;
        }

        ChangeEvent event;
        try {
            event = decoder.decode(record.value());
        } catch (EventDecodingException e) {
            LOGGER.warn("Skipping undecodable message at offset {} (partition {}): {}",
                    record.offset(), record.partition(), e.getMessage());
            return;
        }

        try {
            handler.handle(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
        } catch (Exception e) {
            LOGGER.error("Event handler failed for operation '{}' at offset {} (partition {})",
                    event.operation().code(), record.offset(), record.partition(), e);
        }
    }
}
