package io.addresswatcher.engine.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire shape of the {@code payload} object of a Debezium JSON message.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ChangePayload(
        @JsonProperty("before") UserRow before,
        @JsonProperty("after") UserRow after,
        @JsonProperty("source") SourceInfo source,
        @JsonProperty("op") String op,
        @JsonProperty("ts_ms") long tsMs,
        @JsonProperty("ts_us") long tsUs,
        @JsonProperty("ts_ns") long tsNs) {}
