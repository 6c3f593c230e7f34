package io.addresswatcher.engine.consumer;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecordStream} over a Kafka consumer assigned to a single topic partition.
 *
 * <p>Offsets are committed by the consumer's auto-commit. Records are buffered between polls and
 * handed out one at a time; on close the consumer is rewound to the first record not yet handed
 * out, so the final commit never skips unseen records.
 */
public final class KafkaRecordStream implements RecordStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaRecordStream.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    /** Minimum bytes the broker accumulates before answering a fetch. */
    public static final int MIN_FETCH_BYTES = 10_000;

    /** Maximum bytes returned by a single fetch. */
    public static final int MAX_FETCH_BYTES = 10_000_000;

    private final Consumer<byte[], byte[]> consumer;
    private final TopicPartition partition;
    private final Deque<ConsumerRecord<byte[], byte[]>> buffer = new ArrayDeque<>();

    KafkaRecordStream(Consumer<byte[], byte[]> consumer, TopicPartition partition) {
        this.consumer = consumer;
        this.partition = partition;
        consumer.assign(List.of(partition));
    }

    /**
     * Creates a consumer for the configured topic partition under the given group.
     */
    public static KafkaRecordStream open(ConnectionConfig config, String groupId) {
        Properties properties = new Properties();
        properties.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.broker());
        properties.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        properties.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        properties.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        properties.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, MIN_FETCH_BYTES);
        properties.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, MAX_FETCH_BYTES);

        KafkaConsumer<byte[], byte[]> consumer =
                new KafkaConsumer<>(properties, new ByteArrayDeserializer(), new ByteArrayDeserializer());
        return new KafkaRecordStream(consumer, new TopicPartition(config.topic(), config.partition()));
    }

    @Override
    public StreamRecord fetch() {
        while (buffer.isEmpty()) {
            consumer.poll(POLL_TIMEOUT).forEach(buffer::add);
        }
        ConsumerRecord<byte[], byte[]> record = buffer.poll();
        return new StreamRecord(record.value(), record.offset(), record.partition());
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        try {
            rewindToFirstUnprocessed();
            consumer.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            LOGGER.warn("Failed to close consumer for {} cleanly", partition, e);
        }
    }

    /**
     * Seeks back to the first buffered record and drops the buffer.
     */
    void rewindToFirstUnprocessed() {
        ConsumerRecord<byte[], byte[]> next = buffer.peek();
        if (next != null) {
            consumer.seek(partition, next.offset());
            buffer.clear();
        }
    }
}
