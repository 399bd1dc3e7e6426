package org.example.annotations.service.export;

import org.example.annotations.model.AnnotationType;

import java.util.ArrayList;
import java.util.List;

/**
 * The three ordered export buckets. Only non-empty buckets become sections.
 */
public record ExportGroups(List<ExportItem> highlights, List<ExportItem> notes, List<ExportItem> bookmarks) {

    public ExportGroups {
        highlights = List.copyOf(highlights);
        notes = List.copyOf(notes);
        bookmarks = List.copyOf(bookmarks);
    }

    public List<ExportSection> sections() {
        List<ExportSection> sections = new ArrayList<>();
        if (!highlights.isEmpty()) {
            sections.add(new ExportSection(AnnotationType.HIGHLIGHT, highlights));
        }
        if (!notes.isEmpty()) {
            sections.add(new ExportSection(AnnotationType.NOTE, notes));
        }
        if (!bookmarks.isEmpty()) {
            sections.add(new ExportSection(AnnotationType.BOOKMARK, bookmarks));
        }
        return sections;
    }

    public boolean isEmpty() {
        return highlights.isEmpty() && notes.isEmpty() && bookmarks.isEmpty();
    }
}
