package org.example.annotations.exception;

import java.time.Instant;

/**
 * Error body returned by the HTTP layer.
 */
public record ApiError(String code, String message, String path, Instant timestamp) {

    public static final String VALIDATION_ERROR = "validation_error";
    public static final String CONFIGURATION_ERROR = "configuration_error";
}
