package io.addresswatcher.engine.consumer;

/**
 * Opens a {@link RecordStream} for the topic partition a manager is configured for.
 */
@FunctionalInterface
public interface RecordStreamFactory {

    RecordStream open(ConnectionConfig config, String groupId);
}
