package org.example.annotations.model;

import org.example.annotations.exception.AnnotationValidationException;

import java.time.Instant;

/**
 * Input for creating an annotation before it has an id or timestamps.
 */
public record AnnotationDraft(
        String bookId,
        AnnotationType type,
        int startOffset,
        int endOffset,
        String selectedText,
        String note,
        HighlightColor color,
        boolean isPublic
) {

    public static AnnotationDraft highlight(String bookId, TextSelection selection, HighlightColor color, String note) {
        requireValid(selection);
        return new AnnotationDraft(
                bookId,
                AnnotationType.HIGHLIGHT,
                selection.startOffset(),
                selection.endOffset(),
                selection.text(),
                note,
                color == null ? HighlightColor.DEFAULT : color,
                false
        );
    }

    public static AnnotationDraft note(String bookId, TextSelection selection, String note) {
        requireValid(selection);
        return new AnnotationDraft(
                bookId,
                AnnotationType.NOTE,
                selection.startOffset(),
                selection.endOffset(),
                selection.text(),
                note,
                null,
                false
        );
    }

    public static AnnotationDraft bookmark(String bookId, int offset, String note) {
        return new AnnotationDraft(bookId, AnnotationType.BOOKMARK, offset, offset, null, note, null, false);
    }

    public AnnotationDraft withPublic(boolean isPublic) {
        return new AnnotationDraft(bookId, type, startOffset, endOffset, selectedText, note, color, isPublic);
    }

    public Annotation toAnnotation(String id, Instant now) {
        if (type == null) {
            throw new AnnotationValidationException("Annotation type is required");
        }
        return switch (type) {
            case HIGHLIGHT -> new Highlight(id, bookId, startOffset, endOffset, selectedText,
                    color == null ? HighlightColor.DEFAULT : color, note, isPublic, 0, false, now, now);
            case NOTE -> new Note(id, bookId, startOffset, endOffset, note, selectedText,
                    isPublic, 0, false, now, now);
            case BOOKMARK -> new Bookmark(id, bookId, startOffset, endOffset, note,
                    isPublic, 0, false, now, now);
        };
    }

    private static void requireValid(TextSelection selection) {
        TextSelection.SelectionCheck check = TextSelection.validate(selection);
        if (!check.valid()) {
            throw new AnnotationValidationException(check.error());
        }
    }
}
