package io.addresswatcher.engine.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.time.Instant;

/**
 * Turns raw Debezium JSON messages into {@link ChangeEvent}s.
 *
 * <p>Both message shapes produced by the Kafka Connect JSON converter are accepted: the
 * {@code {"schema": ..., "payload": ...}} envelope written with schemas enabled, and the bare
 * payload written with {@code schemas.enable=false}. The schema block is never inspected.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class ChangeEventDecoder {

    private static final ObjectMapper MAPPER = createMapper();

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Decodes one message value.
     *
     * @param data the raw message value
     * @return the decoded event
     * @throws EventDecodingException if the message cannot be parsed, has no operation, names an
     *     unknown operation, or lacks a row image its operation requires
     */
    public ChangeEvent decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new EventDecodingException("empty change event message");
        }

        ChangePayload payload = parse(data);

        String code = payload.op();
        if (code == null || code.isEmpty()) {
            throw new EventDecodingException("missing operation type in payload");
        }
        Operation operation = Operation.fromCode(code)
                .orElseThrow(() -> new EventDecodingException("unknown operation type: " + code));

        if (operation.requiresBefore() && payload.before() == null) {
            throw missingImage("before", operation);
        }
        if (operation.requiresAfter() && payload.after() == null) {
            throw missingImage("after", operation);
        }

        return new ChangeEvent(
                operation,
                operation.requiresBefore() ? payload.before() : null,
                operation.requiresAfter() ? payload.after() : null,
                payload.source() != null ? payload.source() : SourceInfo.empty(),
                Instant.ofEpochMilli(payload.tsMs()));
    }

    private static ChangePayload parse(byte[] data) {
        try {
            JsonNode root = MAPPER.readTree(data);
            if (root == null || !root.isObject()) {
                throw new EventDecodingException("failed to parse change event: expected a JSON object");
            }
            JsonNode payload = root.has("payload") ? root.get("payload") : root;
            if (!payload.isObject()) {
                throw new EventDecodingException("failed to parse change event: payload is not a JSON object");
            }
            return MAPPER.treeToValue(payload, ChangePayload.class);
        } catch (JsonProcessingException e) {
            throw new EventDecodingException("failed to parse change event: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EventDecodingException("failed to read change event", e);
        }
    }

    private static EventDecodingException missingImage(String image, Operation operation) {
        return new EventDecodingException(
                "missing '" + image + "' data for operation '" + operation.code() + "'");
    }
}
