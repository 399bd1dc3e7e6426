package org.example.annotations.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.example.annotations.exception.AnnotationValidationException;

import java.time.Instant;

public record Highlight(
        String id,
        String bookId,
        int startOffset,
        int endOffset,
        String selectedText,
        HighlightColor color,
        String note,
        @JsonProperty("isPublic") boolean isPublic,
        int likeCount,
        @JsonProperty("isLikedByCurrentUser") boolean likedByCurrentUser,
        Instant createdAt,
        Instant updatedAt
) implements Annotation {

    public Highlight {
        AnnotationRules.requireIdentity(id, bookId);
        AnnotationRules.requireRange(startOffset, endOffset);
        AnnotationRules.requireLikes(likeCount);
        AnnotationRules.requireTimestamps(createdAt, updatedAt);
        if (selectedText == null || selectedText.isBlank()) {
            throw new AnnotationValidationException("Highlight requires selected text");
        }
        if (color == null) {
            throw new AnnotationValidationException("Highlight requires a color");
        }
        note = AnnotationRules.optionalNote(note);
    }

    @Override
    @JsonProperty("type")
    public AnnotationType type() {
        return AnnotationType.HIGHLIGHT;
    }

    public Highlight withColor(HighlightColor color, Instant updatedAt) {
        return new Highlight(id, bookId, startOffset, endOffset, selectedText, color, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Highlight withNote(String note, Instant updatedAt) {
        return new Highlight(id, bookId, startOffset, endOffset, selectedText, color, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Highlight withVisibility(boolean isPublic, Instant updatedAt) {
        return new Highlight(id, bookId, startOffset, endOffset, selectedText, color, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Highlight withLikes(int likeCount, boolean likedByCurrentUser) {
        return new Highlight(id, bookId, startOffset, endOffset, selectedText, color, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }
}
