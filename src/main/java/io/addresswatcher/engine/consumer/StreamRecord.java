package io.addresswatcher.engine.consumer;

/**
 * One raw message fetched from the broker.
 *
 * @param value     message value, null for tombstones
 * @param offset    offset within the partition
 * @param partition partition the message was read from
 */
public record StreamRecord(byte[] value, long offset, int partition) {

    /** True for tombstones, which carry no value. */
    public boolean isTombstone() {
        return value == null || value.length == 0;
    }
}
