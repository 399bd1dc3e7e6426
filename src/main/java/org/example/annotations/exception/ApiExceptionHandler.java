package org.example.annotations.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(AnnotationValidationException.class)
    public ResponseEntity<ApiError> handleValidation(AnnotationValidationException ex, HttpServletRequest request) {
        log.debug("Rejected annotation input on {}: {}", request.getRequestURI(), ex.getMessage());
        return badRequest(ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(ExportOptionsException.class)
    public ResponseEntity<ApiError> handleExportOptions(ExportOptionsException ex, HttpServletRequest request) {
        log.debug("Rejected export options on {}: {}", request.getRequestURI(), ex.getMessage());
        return badRequest(ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        log.debug("Rejected configuration on {}: {}", request.getRequestURI(), ex.getMessage());
        return badRequest(ApiError.CONFIGURATION_ERROR, ex.getMessage(), request);
    }

    private ResponseEntity<ApiError> badRequest(String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(code, message, request.getRequestURI(), clock.instant()));
    }
}
