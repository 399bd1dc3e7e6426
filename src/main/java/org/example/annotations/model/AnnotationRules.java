package org.example.annotations.model;

import org.example.annotations.exception.AnnotationValidationException;

import java.time.Instant;

final class AnnotationRules {

    static final int MAX_NOTE_LENGTH = 5000;

    private AnnotationRules() {
    }

    static void requireIdentity(String id, String bookId) {
        if (id == null || id.isBlank()) {
            throw new AnnotationValidationException("Annotation id is required");
        }
        if (bookId == null || bookId.isBlank()) {
            throw new AnnotationValidationException("Book id is required");
        }
    }

    static void requireRange(int startOffset, int endOffset) {
        if (startOffset < 0) {
            throw new AnnotationValidationException("Start offset must be non-negative");
        }
        if (endOffset < 0) {
            throw new AnnotationValidationException("End offset must be non-negative");
        }
        if (endOffset < startOffset) {
            throw new AnnotationValidationException("End offset must not precede start offset");
        }
    }

    static void requireLikes(int likeCount) {
        if (likeCount < 0) {
            throw new AnnotationValidationException("Like count must be non-negative");
        }
    }

    static void requireTimestamps(Instant createdAt, Instant updatedAt) {
        if (createdAt == null || updatedAt == null) {
            throw new AnnotationValidationException("Timestamps are required");
        }
    }

    /**
     * Trims the note, mapping blank input to null.
     */
    static String optionalNote(String note) {
        if (note == null) {
            return null;
        }
        String trimmed = note.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > MAX_NOTE_LENGTH) {
            throw new AnnotationValidationException("Note must be at most " + MAX_NOTE_LENGTH + " characters");
        }
        return trimmed;
    }

    static String requiredNote(String note) {
        String normalized = optionalNote(note);
        if (normalized == null) {
            throw new AnnotationValidationException("Note text is required");
        }
        return normalized;
    }

    static String optionalText(String text) {
        return text == null || text.isEmpty() ? null : text;
    }
}
