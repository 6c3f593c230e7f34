package io.addresswatcher.engine.event;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;

/**
 * Reads {@code source.snapshot} as a boolean.
 *
 * <p>Connectors emit either a JSON boolean or a marker string ({@code "true"}, {@code "false"},
 * {@code "first"}, {@code "last"}, {@code "incremental"}, ...). Only {@code "false"} and the empty
 * string mean "not part of a snapshot".
 */
final class SnapshotFlagDeserializer extends JsonDeserializer<Boolean> {

    @Override
    public Boolean deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_TRUE || token == JsonToken.VALUE_FALSE) {
            return parser.getBooleanValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String marker = parser.getText().trim();
            return !(marker.isEmpty() || "false".equalsIgnoreCase(marker));
        }
        return (Boolean) context.handleUnexpectedToken(Boolean.class, parser);
    }

    @Override
    public Boolean getNullValue(DeserializationContext context) {
        return Boolean.FALSE;
    }
}
