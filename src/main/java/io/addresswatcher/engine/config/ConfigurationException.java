package io.addresswatcher.engine.config;

/**
 * Thrown when the process environment holds an unusable setting.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
