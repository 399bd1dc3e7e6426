package org.example.annotations.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.example.annotations.exception.AnnotationValidationException;

import java.time.Instant;

/**
 * A point annotation: {@code startOffset == endOffset}.
 */
public record Bookmark(
        String id,
        String bookId,
        int startOffset,
        int endOffset,
        String note,
        @JsonProperty("isPublic") boolean isPublic,
        int likeCount,
        @JsonProperty("isLikedByCurrentUser") boolean likedByCurrentUser,
        Instant createdAt,
        Instant updatedAt
) implements Annotation {

    public Bookmark {
        AnnotationRules.requireIdentity(id, bookId);
        AnnotationRules.requireRange(startOffset, endOffset);
        AnnotationRules.requireLikes(likeCount);
        AnnotationRules.requireTimestamps(createdAt, updatedAt);
        if (startOffset != endOffset) {
            throw new AnnotationValidationException("Bookmark start and end offsets must be equal");
        }
        note = AnnotationRules.optionalNote(note);
    }

    @Override
    @JsonProperty("type")
    public AnnotationType type() {
        return AnnotationType.BOOKMARK;
    }

    public int position() {
        return startOffset;
    }

    @Override
    public Bookmark withNote(String note, Instant updatedAt) {
        return new Bookmark(id, bookId, startOffset, endOffset, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Bookmark withVisibility(boolean isPublic, Instant updatedAt) {
        return new Bookmark(id, bookId, startOffset, endOffset, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }

    @Override
    public Bookmark withLikes(int likeCount, boolean likedByCurrentUser) {
        return new Bookmark(id, bookId, startOffset, endOffset, note,
                isPublic, likeCount, likedByCurrentUser, createdAt, updatedAt);
    }
}
