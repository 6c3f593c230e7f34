package io.addresswatcher.engine;

import io.addresswatcher.engine.config.ConfigurationException;
import io.addresswatcher.engine.config.WatcherSettings;
import io.addresswatcher.engine.consumer.BrokerConnectionException;
import io.addresswatcher.engine.consumer.Cancellation;
import io.addresswatcher.engine.consumer.ConnectionManager;
import io.addresswatcher.engine.consumer.ManagerClosedException;
import io.addresswatcher.engine.consumer.RetryingReader;
import io.addresswatcher.engine.consumer.StreamReader;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the watcher engine: connects to Kafka and logs user changes until the JVM shuts
 * down.
 */
public final class App {

    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
        // Static utility class
    }

    public static void main(String[] args) {
        WatcherSettings settings;
        ConnectionManager manager;
        try {
            settings = WatcherSettings.fromEnvironment(System.getenv());
            manager = ConnectionManager.create(settings.connection());
        } catch (ConfigurationException | BrokerConnectionException e) {
            LOGGER.error("Error creating Kafka connection manager", e);
            System.exit(1);
            return;
        }

        Cancellation cancellation = new Cancellation();
        Thread reader = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(shutdownHook(cancellation, reader, manager));

        try (manager) {
            new RetryingReader(new StreamReader())
                    .readWithRetry(cancellation, manager, new LoggingEventHandler(), settings.readRetryDelay());
        } catch (CancellationException | ManagerClosedException e) {
            LOGGER.info("Watcher stopped: {}", e.getMessage());
        }
    }

    /**
     * Cancels the reader, waits up to {@link ConnectionManager#CONNECT_TIMEOUT} for it to stop, then
     * closes the manager whether or not the reader finished.
     */
    static Thread shutdownHook(Cancellation cancellation, Thread reader, ConnectionManager manager) {
        return new Thread(() -> {
            cancellation.cancel("shutdown");
            try {
                reader.join(ConnectionManager.CONNECT_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            try {
                manager.close();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to close connection manager", e);
            }
        }, "watcher-shutdown");
    }
}
