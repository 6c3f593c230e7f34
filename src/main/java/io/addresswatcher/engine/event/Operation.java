package io.addresswatcher.engine.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Change operation carried in the {@code op} field of a Debezium change event.
 *
 * <p>Each operation declares which row images a well-formed event must carry.
 */
public enum Operation {

    /** Row inserted. */
    CREATE("c", false, true),

    /** Row emitted by an initial or incremental snapshot. */
    READ("r", false, true),

    /** Row updated. */
    UPDATE("u", true, true),

    /** Row deleted. */
    DELETE("d", true, false);

    private final String code;
    private final boolean requiresBefore;
    private final boolean requiresAfter;

    Operation(String code, boolean requiresBefore, boolean requiresAfter) {
        this.code = code;
        this.requiresBefore = requiresBefore;
        this.requiresAfter = requiresAfter;
    }

    /** The single-letter wire code ({@code c}, {@code r}, {@code u} or {@code d}). */
    public String code() {
        return code;
    }

    public boolean requiresBefore() {
        return requiresBefore;
    }

    public boolean requiresAfter() {
        return requiresAfter;
    }

    /**
     * Looks up an operation by its wire code.
     *
     * @param code the {@code op} value, may be null
     * @return the matching operation, or empty for an unknown code
     */
    public static Optional<Operation> fromCode(String code) {
        return Arrays.stream(values())
                .filter(op -> op.code.equals(code))
                .findFirst();
    }
}
