package io.addresswatcher.engine.event;

import java.time.Instant;

/**
 * A decoded change to one row of the {@code users} table.
 *
 * <p>{@code before} is present only for updates and deletes; {@code after} only for creates,
 * updates and snapshot reads.
 *
 * @param operation the kind of change
 * @param before    row image before the change, or null
 * @param after     row image after the change, or null
 * @param source    connector metadata
 * @param timestamp when the connector processed the change
 */
public record ChangeEvent(
        Operation operation,
        UserRow before,
        UserRow after,
        SourceInfo source,
        Instant timestamp) {

    public boolean hasBefore() {
        return before != null;
    }

    public boolean hasAfter() {
        return after != null;
    }

    /**
     * Returns the most useful row for this operation: {@code before} for deletes,
     * {@code after} otherwise.
     */
    public UserRow effectiveRow() {
        return operation == Operation.DELETE ? before : after;
    }
}
