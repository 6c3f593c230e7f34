package io.addresswatcher.engine.consumer;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;

/**
 * {@link BrokerConnection} backed by a Kafka {@link Admin} client.
 */
final class KafkaBrokerConnection implements BrokerConnection {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Admin admin;

    KafkaBrokerConnection(Admin admin) {
        this.admin = admin;
    }

    @Override
    public void probe(Duration timeout) {
        DescribeClusterOptions options = new DescribeClusterOptions().timeoutMs((int) timeout.toMillis());
        Collection<Node> nodes = await(admin.describeCluster(options).nodes(), timeout, "describe cluster");
        if (nodes.isEmpty()) {
            throw new BrokerConnectionException("broker reported no live nodes");
        }
    }

    @Override
    public void close() {
        try {
            admin.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            throw new BrokerConnectionException("failed to close broker connection", e);
        }
    }

    /**
     * Waits for an admin future, translating every failure into a {@link BrokerConnectionException}.
     */
    static <T> T await(KafkaFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("interrupted during " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new BrokerConnectionException(operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new BrokerConnectionException(operation + " timed out after " + timeout.toMillis() + " ms", e);
        }
    }
}
