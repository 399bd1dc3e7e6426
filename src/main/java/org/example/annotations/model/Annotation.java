package org.example.annotations.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A mark placed on a book at canonical character offsets. The three variants are closed: use
 * {@link #type()} in an exhaustive switch for type-specific behavior.
 */
public sealed interface Annotation permits Highlight, Note, Bookmark {

    String id();

    String bookId();

    AnnotationType type();

    int startOffset();

    int endOffset();

    /** Optional for highlights and bookmarks, always present for notes. */
    String note();

    boolean isPublic();

    int likeCount();

    boolean likedByCurrentUser();

    Instant createdAt();

    Instant updatedAt();

    Annotation withNote(String note, Instant updatedAt);

    Annotation withVisibility(boolean isPublic, Instant updatedAt);

    Annotation withLikes(int likeCount, boolean likedByCurrentUser);

    @JsonIgnore
    default boolean isHighlight() {
        return type() == AnnotationType.HIGHLIGHT;
    }

    @JsonIgnore
    default boolean isNote() {
        return type() == AnnotationType.NOTE;
    }

    @JsonIgnore
    default boolean isBookmark() {
        return type() == AnnotationType.BOOKMARK;
    }

    @JsonIgnore
    default boolean hasNote() {
        return note() != null && !note().isBlank();
    }

    /**
     * The quoted book text when the variant carries one: always for highlights, optionally for notes.
     */
    @JsonIgnore
    default String selectedTextOrNull() {
        return switch (type()) {
            case HIGHLIGHT -> ((Highlight) this).selectedText();
            case NOTE -> ((Note) this).selectedText();
            case BOOKMARK -> null;
        };
    }
}
