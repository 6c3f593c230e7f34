package io.addresswatcher.engine.event;

/**
 * Thrown when a raw message cannot be turned into a {@link ChangeEvent}, either because it is not
 * a parseable change event or because it lacks a row image its operation requires.
 */
public class EventDecodingException extends RuntimeException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
