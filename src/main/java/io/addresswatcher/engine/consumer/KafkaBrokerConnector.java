package io.addresswatcher.engine.consumer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects to Kafka through an {@link Admin} client and checks that the configured partition
 * exists and currently has a leader.
 */
public final class KafkaBrokerConnector implements BrokerConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaBrokerConnector.class);

    static final String CLIENT_ID = "address-watcher-admin";

    @Override
    public BrokerConnection connect(ConnectionConfig config, Duration timeout) {
        if (config.broker() == null || config.broker().isBlank()) {
            throw new BrokerConnectionException("broker address must not be empty");
        }
        if (config.topic() == null || config.topic().isBlank()) {
            throw new BrokerConnectionException("topic must not be empty");
        }

        Admin admin = createAdmin(config, timeout);
        try {
            Map<String, TopicDescription> topics = KafkaBrokerConnection.await(
                    admin.describeTopics(List.of(config.topic())).allTopicNames(), timeout, "describe topic");
            TopicPartitionInfo partition = topics.get(config.topic()).partitions().stream()
                    .filter(info -> info.partition() == config.partition())
                    .findFirst()
                    .orElseThrow(() -> new BrokerConnectionException(
                            "partition " + config.partition() + " does not exist in topic " + config.topic()));
            if (partition.leader() == null || partition.leader().isEmpty()) {
                throw new BrokerConnectionException(
                        "partition " + config.partition() + " of topic " + config.topic() + " has no leader");
            }
            LOGGER.debug("Partition {}-{} led by broker {}", config.topic(), config.partition(), partition.leader().id());
            return new KafkaBrokerConnection(admin);
        } catch (RuntimeException e) {
            closeQuietly(admin);
            throw e;
        }
    }

    private static Admin createAdmin(ConnectionConfig config, Duration timeout) {
        int timeoutMs = (int) timeout.toMillis();
        Properties properties = new Properties();
        properties.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.broker());
        properties.put(AdminClientConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        properties.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        properties.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
        try {
            return Admin.create(properties);
        } catch (KafkaException e) {
            throw new BrokerConnectionException("failed to create Kafka client for " + config.broker(), e);
        }
    }

    private static void closeQuietly(Admin admin) {
        try {
            admin.close(Duration.ZERO);
        } catch (KafkaException e) {
            LOGGER.warn("Failed to release Kafka client after connect failure", e);
        }
    }
}
