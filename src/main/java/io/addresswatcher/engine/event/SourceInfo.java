package io.addresswatcher.engine.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Connector metadata from the {@code source} block of a change event.
 *
 * <p>{@code snapshot} is normalized to a boolean; see {@link SnapshotFlagDeserializer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceInfo(
        @JsonProperty("version") String version,
        @JsonProperty("connector") String connector,
        @JsonProperty("name") String name,
        @JsonProperty("ts_ms") long tsMs,
        @JsonProperty("ts_us") long tsUs,
        @JsonProperty("ts_ns") long tsNs,
        @JsonProperty("snapshot") @JsonDeserialize(using = SnapshotFlagDeserializer.class) boolean snapshot,
        @JsonProperty("db") String db,
        @JsonProperty("sequence") String sequence,
        @JsonProperty("schema") String schema,
        @JsonProperty("table") String table,
        @JsonProperty("txId") String txId,
        @JsonProperty("lsn") Long lsn) {

    /** Metadata used when an event carries no {@code source} block. */
    public static SourceInfo empty() {
        return new SourceInfo(null, null, null, 0L, 0L, 0L, false, null, null, null, null, null, null);
    }
}
