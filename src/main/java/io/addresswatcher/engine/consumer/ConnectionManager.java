package io.addresswatcher.engine.consumer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the connection to the broker hosting the watched topic partition.
 *
 * <p>The manager connects eagerly on construction, reconnects with exponential backoff whenever
 * the connection is found dead, and probes the connection periodically on a background thread.
 * Connection state is guarded by a read/write lock; network calls are made outside the lock, so a
 * foreground caller and the health check may both reconnect. The later connection wins and the
 * earlier one is closed.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (ConnectionManager manager = ConnectionManager.create(ConnectionConfig.of("localhost:9092", "users", 0))) {
 *     new RetryingReader(new StreamReader()).readWithRetry(cancellation, manager, handler, Duration.ZERO);
 * }
 * }</pre>
 */
public final class ConnectionManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    /** Upper bound for a single connect attempt. */
    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /** Upper bound for a single liveness probe. */
    public static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionConfig config;
    private final BrokerConnector connector;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ConnectionListener listener;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong retryCount = new AtomicLong();
    private final ScheduledExecutorService healthCheckExecutor;

    // guarded by lock
    private BrokerConnection connection;
    private boolean closed;
    private Instant lastConnect;

    private ConnectionManager(Builder builder) {
        this.config = builder.config;
        this.connector = builder.connector;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
        this.listener = builder.listener;
        this.healthCheckExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "connection-health-check");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Connects to Kafka with the given configuration and starts the background health check.
     *
     * @throws ConnectRetriesExhaustedException if the initial connect fails {@code maxRetries} times
     */
    public static ConnectionManager create(ConnectionConfig config) {
        return builder(config).build();
    }

    public static Builder builder(ConnectionConfig config) {
        return new Builder(config);
    }

    /** The normalized configuration this manager connects with. */
    public ConnectionConfig config() {
        return config;
    }

    /**
     * Makes exactly one connect attempt and, on success, makes the new connection current.
     *
     * @throws BrokerConnectionException if the attempt fails
     * @throws ManagerClosedException if the manager was closed while connecting
     */
    public void connect() {
        BrokerConnection fresh = connector.connect(config, CONNECT_TIMEOUT);
        BrokerConnection previous = null;
        boolean rejected;

        lock.writeLock().lock();
        try {
            rejected = closed;
            if (!rejected) {
                previous = connection;
                connection = fresh;
                lastConnect = clock.instant();
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (rejected) {
            closeConnection(fresh);
            throw new ManagerClosedException();
        }
        if (previous != null) {
            closeConnection(previous);
        }

        LOGGER.info("Connected to {}, topic: {}, partition: {}", config.broker(), config.topic(), config.partition());
        notifyListener(() -> listener.connected(config));
    }

    /**
     * Attempts {@link #connect()} up to {@code maxRetries} times, sleeping
     * {@code retryDelay * 2^attempt} between attempts.
     *
     * @throws ConnectRetriesExhaustedException if every attempt fails
     * @throws ManagerClosedException if the manager is closed before an attempt succeeds
     * @throws BrokerConnectionException if the thread is interrupted while backing off
     */
    public void connectWithRetry() {
        retry(null);
    }

    /**
     * Like {@link #connectWithRetry()}, but gives up as soon as {@code cancellation} fires, including
     * while backing off.
     *
     * @throws java.util.concurrent.CancellationException if cancelled before an attempt succeeds
     * @throws ConnectRetriesExhaustedException if every attempt fails
     * @throws ManagerClosedException if the manager is closed before an attempt succeeds
     */
    public void connectWithRetry(Cancellation cancellation) {
        retry(Objects.requireNonNull(cancellation, "cancellation"));
    }

    private void retry(Cancellation cancellation) {
        int maxRetries = config.maxRetries();
        RuntimeException lastFailure = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            if (isClosed()) {
                throw new ManagerClosedException();
            }
            throwIfCancelled(cancellation);
            try {
                connect();
                return;
            } catch (ManagerClosedException e) {
                throw e;
            } catch (RuntimeException e) {
                lastFailure = e;
                retryCount.incrementAndGet();
            }

            if (attempt + 1 < maxRetries) {
                Duration backoff = config.retryDelay().multipliedBy(1L << attempt);
                LOGGER.warn("Connection attempt {}/{} failed: {}, retrying in {}",
                        attempt + 1, maxRetries, lastFailure.getMessage(), backoff);
                backOff(backoff, cancellation);
            } else {
                LOGGER.warn("Connection attempt {}/{} failed: {}", attempt + 1, maxRetries, lastFailure.getMessage());
            }
        }

        throwIfCancelled(cancellation);
        throw new ConnectRetriesExhaustedException(maxRetries, lastFailure);
    }

    private void backOff(Duration backoff, Cancellation cancellation) {
        if (cancellation != null) {
            if (!sleeper.sleep(backoff, cancellation)) {
                cancellation.throwIfCancelled();
            }
            return;
        }
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("interrupted while waiting to reconnect", e);
        }
    }

    private static void throwIfCancelled(Cancellation cancellation) {
        if (cancellation != null) {
            cancellation.throwIfCancelled();
        }
    }

    /**
     * Returns the current connection if it passes a liveness probe, reconnecting otherwise.
     *
     * @throws ManagerClosedException if the manager is closed
     * @throws ConnectRetriesExhaustedException if reconnecting fails
     */
    public BrokerConnection getConnection() {
        return liveConnection(null);
    }

    /**
     * Like {@link #getConnection()}, but a reconnect in progress stops as soon as
     * {@code cancellation} fires.
     *
     * @throws java.util.concurrent.CancellationException if cancelled while reconnecting
     * @throws ManagerClosedException if the manager is closed
     * @throws ConnectRetriesExhaustedException if reconnecting fails
     */
    public BrokerConnection getConnection(Cancellation cancellation) {
        return liveConnection(Objects.requireNonNull(cancellation, "cancellation"));
    }

    private BrokerConnection liveConnection(Cancellation cancellation) {
        BrokerConnection current;
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ManagerClosedException();
            }
            current = connection;
        } finally {
            lock.readLock().unlock();
        }

        if (current != null) {
            if (probe(current)) {
                return current;
            }
            LOGGER.warn("Connection to {} appears dead, attempting reconnection", config.broker());
        }

        retry(cancellation);

        lock.readLock().lock();
        try {
            if (closed) {
                throw new ManagerClosedException();
            }
            return connection;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Probes the current connection. Returns false if the manager is closed, has no connection,
     * or the probe fails for any reason.
     */
    public boolean isAlive() {
        BrokerConnection current;
        lock.readLock().lock();
        try {
            if (closed || connection == null) {
                return false;
            }
            current = connection;
        } finally {
            lock.readLock().unlock();
        }
        return probe(current);
    }

    /**
     * On-demand health check, independent of the background loop.
     *
     * @throws ManagerClosedException if the manager is closed
     * @throws ConnectionNotAliveException if the liveness probe fails
     */
    public void healthCheck() {
        if (isClosed()) {
            throw new ManagerClosedException();
        }
        if (!isAlive()) {
            throw new ConnectionNotAliveException();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops the health check and closes the current connection. Calls after the first are no-ops.
     *
     * @throws BrokerConnectionException if closing the connection fails
     */
    @Override
    public void close() {
        BrokerConnection current;
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            current = connection;
            connection = null;
        } finally {
            lock.writeLock().unlock();
        }

        healthCheckExecutor.shutdownNow();
        if (current != null) {
            LOGGER.info("Closing connection to {}", config.broker());
            current.close();
        }
    }

    /**
     * Returns a snapshot of the connection state: broker, topic, partition, closed flag, retry
     * count, last connect time, connected flag and, once connected, uptime in seconds.
     */
    public Map<String, Object> stats() {
        lock.readLock().lock();
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("broker", config.broker());
            stats.put("topic", config.topic());
            stats.put("partition", config.partition());
            stats.put("closed", closed);
            stats.put("retryCount", retryCount.get());
            stats.put("lastConnect", lastConnect);
            stats.put("connected", connection != null);
            if (lastConnect != null) {
                stats.put("uptimeSeconds", Duration.between(lastConnect, clock.instant()).toMillis() / 1000.0);
            }
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void startHealthCheck() {
        long intervalMs = config.healthCheckInterval().toMillis();
        healthCheckExecutor.scheduleWithFixedDelay(this::runHealthCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void runHealthCheck() {
        if (isClosed() || isAlive()) {
            return;
        }
        LOGGER.warn("Health check failed, attempting reconnection to {}", config.broker());
        try {
            connectWithRetry();
        } catch (RuntimeException e) {
            if (isClosed()) {
                LOGGER.debug("Manager closed during reconnection");
                return;
            }
            LOGGER.error("Auto-reconnection to {} failed", config.broker(), e);
            notifyListener(() -> listener.reconnectFailed(e));
        }
    }

    private static void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Connection listener failed", e);
        }
    }

    private boolean probe(BrokerConnection candidate) {
        try {
            candidate.probe(PROBE_TIMEOUT);
            return true;
        } catch (RuntimeException e) {
            LOGGER.debug("Liveness probe failed: {}", e.getMessage());
            return false;
        }
    }

    private void closeConnection(BrokerConnection stale) {
        try {
            stale.close();
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to close replaced connection to {}", config.broker(), e);
        }
    }

    /**
     * Builder for managers with non-default collaborators.
     */
    public static final class Builder {

        private final ConnectionConfig config;
        private BrokerConnector connector = new KafkaBrokerConnector();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();
        private ConnectionListener listener = ConnectionListener.NO_OP;

        private Builder(ConnectionConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config must not be null");
            }
            this.config = config;
        }

        public Builder connector(BrokerConnector connector) {
            this.connector = Objects.requireNonNull(connector, "connector");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder listener(ConnectionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /**
         * Creates the manager, connects with retry and starts the health check.
         *
         * @throws ConnectRetriesExhaustedException if the initial connect fails
         */
        public ConnectionManager build() {
            ConnectionManager manager = new ConnectionManager(this);
            try {
                manager.connectWithRetry();
            } catch (RuntimeException e) {
                manager.healthCheckExecutor.shutdownNow();
                throw e;
            }
            manager.startHealthCheck();
            return manager;
        }
    }
}
