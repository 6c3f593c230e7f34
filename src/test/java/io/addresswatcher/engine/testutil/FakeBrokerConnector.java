package io.addresswatcher.engine.testutil;

import io.addresswatcher.engine.consumer.BrokerConnection;
import io.addresswatcher.engine.consumer.BrokerConnectionException;
import io.addresswatcher.engine.consumer.BrokerConnector;
import io.addresswatcher.engine.consumer.ConnectionConfig;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link BrokerConnector} that fails a configurable number of attempts before
 * succeeding, and records every connection it hands out.
 */
public final class FakeBrokerConnector implements BrokerConnector {

    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger failuresLeft;
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();

    private FakeBrokerConnector(int failures) {
        this.failuresLeft = new AtomicInteger(failures);
    }

    /** A connector whose first attempt succeeds. */
    public static FakeBrokerConnector healthy() {
        return new FakeBrokerConnector(0);
    }

    /** A connector that fails the first {@code failures} attempts. */
    public static FakeBrokerConnector failingFirst(int failures) {
        return new FakeBrokerConnector(failures);
    }

    /** A connector that never succeeds. */
    public static FakeBrokerConnector unreachable() {
        return new FakeBrokerConnector(Integer.MAX_VALUE);
    }

    @Override
    public BrokerConnection connect(ConnectionConfig config, Duration timeout) {
        int attempt = attempts.incrementAndGet();
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new BrokerConnectionException("connection refused (attempt " + attempt + ")");
        }
        FakeConnection connection = new FakeConnection();
        connections.add(connection);
        return connection;
    }

    /** Makes the next {@code failures} attempts fail. */
    public void failNext(int failures) {
        failuresLeft.set(failures);
    }

    public int attempts() {
        return attempts.get();
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public FakeConnection lastConnection() {
        return connections.get(connections.size() - 1);
    }

    /**
     * Connection whose liveness can be toggled and whose closes are counted.
     */
    public static final class FakeConnection implements BrokerConnection {

        private volatile boolean alive = true;
        private final AtomicInteger probes = new AtomicInteger();
        private final AtomicInteger closes = new AtomicInteger();

        @Override
        public void probe(Duration timeout) {
            probes.incrementAndGet();
            if (!alive) {
                throw new BrokerConnectionException("broker not responding");
            }
        }

        @Override
        public void close() {
            closes.incrementAndGet();
            alive = false;
        }

        public void kill() {
            alive = false;
        }

        public int probes() {
            return probes.get();
        }

        public int closes() {
            return closes.get();
        }
    }
}
