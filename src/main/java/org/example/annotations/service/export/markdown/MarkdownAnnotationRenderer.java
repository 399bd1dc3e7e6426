package org.example.annotations.service.export.markdown;

import org.example.annotations.config.AnnotationProperties;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.Bookmark;
import org.example.annotations.model.Highlight;
import org.example.annotations.model.Note;
import org.example.annotations.service.export.ExportItem;
import org.example.annotations.service.export.ExportOptions;
import org.example.annotations.service.export.ExportSection;
import org.example.annotations.service.export.ExportStats;
import org.example.annotations.service.export.PreparedExport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a prepared export as a single Markdown document: {@code #} title, {@code ##} sections, {@code ###} items.
 */
@Component
public class MarkdownAnnotationRenderer {

    private static final String RULE = "---";

    private final String appName;

    public MarkdownAnnotationRenderer(AnnotationProperties properties) {
        this.appName = properties.getExport().getAppName();
    }

    public String render(PreparedExport prepared) {
        ExportOptions options = prepared.options();
        List<String> lines = new ArrayList<>();

        header(lines, options);
        if (options.statsEnabled()) {
            stats(lines, prepared.stats(), prepared.generatedOn());
        }

        List<ExportSection> sections = prepared.groups().sections();
        if (options.tocEnabled() && !sections.isEmpty()) {
            tableOfContents(lines, sections);
        }

        for (int i = 0; i < sections.size(); i++) {
            ExportSection section = sections.get(i);
            lines.add("## " + section.title());
            lines.add("");
            for (ExportItem item : section.items()) {
                item(lines, item);
            }
            if (i < sections.size() - 1) {
                lines.add(RULE);
                lines.add("");
            }
        }

        lines.add(RULE);
        lines.add("*Exported from " + appName + " on " + prepared.generatedOn() + "*");
        return String.join("\n", lines) + "\n";
    }

    private void header(List<String> lines, ExportOptions options) {
        lines.add("# " + MarkdownEscaper.escape(options.bookTitle().trim()));
        if (options.hasAuthor()) {
            lines.add("**Author:** " + MarkdownEscaper.escape(options.bookAuthor().trim()));
        }
        lines.add("");
        lines.add(RULE);
        lines.add("");
    }

    private void stats(List<String> lines, ExportStats stats, String exportedOn) {
        lines.add("## Summary");
        lines.add("");
        lines.add("- **Total Annotations:** " + stats.totalAnnotations());
        lines.add("- **Highlights:** " + stats.highlights());
        lines.add("- **Notes:** " + stats.notes());
        lines.add("- **Bookmarks:** " + stats.bookmarks());
        lines.add("- **Exported:** " + exportedOn);
        lines.add("");
        lines.add(RULE);
        lines.add("");
    }

    private void tableOfContents(List<String> lines, List<ExportSection> sections) {
        lines.add("## Table of Contents");
        lines.add("");
        for (ExportSection section : sections) {
            lines.add("- [" + section.title() + "](#" + section.anchor() + ") (" + section.items().size() + ")");
        }
        lines.add("");
        lines.add(RULE);
        lines.add("");
    }

    private void item(List<String> lines, ExportItem item) {
        Annotation annotation = item.annotation();
        lines.add("### " + item.index() + ". " + item.typeLabel());
        lines.add("");
        switch (annotation.type()) {
            case HIGHLIGHT -> highlight(lines, (Highlight) annotation, item.date());
            case NOTE -> note(lines, (Note) annotation, item.date());
            case BOOKMARK -> bookmark(lines, (Bookmark) annotation, item.date());
        }
        lines.add("");
    }

    private void highlight(List<String> lines, Highlight highlight, String date) {
        lines.add(blockquote(MarkdownEscaper.escape(highlight.selectedText())));
        lines.add("");
        lines.add("**Color:** " + highlight.color().displayName() + " | **Date:** " + date);
        appendNote(lines, highlight.note());
    }

    private void note(List<String> lines, Note note, String date) {
        lines.add(MarkdownEscaper.escape(note.note()));
        if (note.selectedText() != null) {
            lines.add("");
            lines.add(blockquote("*" + MarkdownEscaper.escape(note.selectedText()) + "*"));
        }
        lines.add("");
        lines.add("**Date:** " + date);
    }

    private void bookmark(List<String> lines, Bookmark bookmark, String date) {
        lines.add("**Position:** " + bookmark.position() + " | **Date:** " + date);
        appendNote(lines, bookmark.note());
    }

    private void appendNote(List<String> lines, String note) {
        if (note != null && !note.isBlank()) {
            lines.add("");
            lines.add("**Note:** " + MarkdownEscaper.escape(note));
        }
    }

    private String blockquote(String text) {
        return "> " + text.replace("\r\n", "\n").replace("\n", "\n> ");
    }
}
