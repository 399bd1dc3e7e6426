package org.example.annotations.exception;

/**
 * Thrown for unknown sort fields, sort directions, filter presets or annotation type tokens.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
