package org.example.annotations.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A free-standing note anchored to a range. {@code selectedText} is an optional context snippet.
 */
public record Note(
        String id,
        String bookId,
        int startOffset,
        int endOffset,
        String note,
        String selectedText,
        @JsonProperty("isPublic") boolean isPublic,
        int likeCount,
        @JsonProperty("isLikedByCurrentUser") boolean likedByCurrentUser,
        Instant createdAt,
        Instant updatedAt
) implements Annotation {

    public Note {
        AnnotationRules.requireIdentity(id, bookId);
        AnnotationRules.requireRange(startOffset, endOffset);
        AnnotationRules.requireLikes(likeCount);
        AnnotationRules.requireTimestamps(createdAt, updatedAt);
        note = AnnotationRules.requiredNote(note);
        selectedText = AnnotationRules.optionalText(selectedText);
    }

    @Override
    @JsonProperty("type")
    public AnnotationType type() {
        return AnnotationType.NOTE;
    }

    @Override
    public Note withNote(String note, Instant updatedAt) {
        return new Note(id, bookId, startOffset, endOffset, note, selectedText,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Note withVisibility(boolean isPublic, Instant updatedAt) {
        return new Note(id, bookId, startOffset, endOffset, note, selectedText,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Note withLikes(int likeCount, boolean likedByCurrentUser) {
        return new Note(id, bookId, startOffset, endOffset, note, selectedText,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }
}
