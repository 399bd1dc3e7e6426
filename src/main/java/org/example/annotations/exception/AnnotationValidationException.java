package org.example.annotations.exception;

/**
 * Thrown when an annotation would violate its range, text or palette rules.
 */
public class AnnotationValidationException extends RuntimeException {

    public AnnotationValidationException(String message) {
        super(message);
    }
}
