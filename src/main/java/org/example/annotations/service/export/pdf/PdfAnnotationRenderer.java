package org.example.annotations.service.export.pdf;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Lays a prepared export out on A4 pages. Layout is computed against a {@link PageCanvas}, so the same pass drives
 * both the PDFBox output and recording canvases in tests.
 */
@Component
public class PdfAnnotationRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfAnnotationRenderer.class);

    private static final float TEXT_GRAY = 0.2f;
    private static final float MUTED_GRAY = 0.5f;
    private static final double CONTENT_INDENT = 5;
    private static final double NOTE_INDENT = 10;
    private static final double SWATCH_SIZE = 3;
    private static final double SWATCH_GAP = 2;

    private final String appName;
    private final PageGeometry geometry;

    @Autowired
    public PdfAnnotationRenderer(AnnotationProperties properties) {
        this(properties, PageGeometry.A4);
    }

    PdfAnnotationRenderer(AnnotationProperties properties, PageGeometry geometry) {
        this.appName = properties.getExport().getAppName();
        this.geometry = geometry;
    }

    public byte[] render(PreparedExport prepared) {
        ExportOptions options = prepared.options();
        try (PdfBoxPageCanvas canvas = new PdfBoxPageCanvas(geometry)) {
            PageLayoutWriter writer = layout(prepared, canvas);
            byte[] bytes = canvas.toByteArray(options.bookTitle().trim(),
                    options.hasAuthor() ? options.bookAuthor().trim() : null, appName);
            log.debug("Laid out {} annotations on {} pages", prepared.annotations().size(), writer.pageCount());
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close PDF document", e);
        }
    }

    /**
     * Runs the full layout pass against {@code canvas} and returns the writer in its final position.
     */
    public PageLayoutWriter layout(PreparedExport prepared, PageCanvas canvas) {
        PageLayoutWriter writer = new PageLayoutWriter(geometry, canvas);
        ExportOptions options = prepared.options();

        header(writer, options);
        if (options.statsEnabled()) {
            stats(writer, prepared.stats());
        }
        for (ExportSection section : prepared.groups().sections()) {
            section(writer, section);
        }
        footer(writer, prepared.generatedOn());
        return writer;
    }

    private void header(PageLayoutWriter writer, ExportOptions options) {
        double lineHeight = geometry.lineHeight();
        TextStyle title = new TextStyle(TextStyle.Weight.BOLD, geometry.titleFontSize(), 0f);
        writer.paragraph(options.bookTitle().trim(), geometry.charsPerLine(geometry.titleFontSize()), title, 0,
                lineHeight + 2);
        if (options.hasAuthor()) {
            writer.line("Author: " + options.bookAuthor().trim(),
                    new TextStyle(TextStyle.Weight.ITALIC, geometry.bodyFontSize(), TEXT_GRAY), 0);
        }
        writer.advance(3);
        writer.rule();
        writer.advance(lineHeight);
    }

    private void stats(PageLayoutWriter writer, ExportStats stats) {
        double lineHeight = geometry.lineHeight();
        TextStyle body = body();
        writer.checkPageBreak(lineHeight * 6);
        writer.line("Summary", heading(), 0, lineHeight + 2);
        writer.line("Total annotations: " + stats.totalAnnotations(), body, CONTENT_INDENT, lineHeight - 1);
        writer.line("Highlights: " + stats.highlights(), body, CONTENT_INDENT, lineHeight - 1);
        writer.line("Notes: " + stats.notes(), body, CONTENT_INDENT, lineHeight - 1);
        writer.line("Bookmarks: " + stats.bookmarks(), body, CONTENT_INDENT, lineHeight + 3);
        writer.rule();
        writer.advance(lineHeight);
    }

    private void section(PageLayoutWriter writer, ExportSection section) {
        double lineHeight = geometry.lineHeight();
        writer.checkPageBreak(lineHeight * 3);
        writer.line(section.title(), heading(), 0, lineHeight + 2);
        for (ExportItem item : section.items()) {
            item(writer, item);
        }
        writer.rule();
        writer.advance(lineHeight);
    }

    private void item(PageLayoutWriter writer, ExportItem item) {
        double lineHeight = geometry.lineHeight();
        int bodyChars = geometry.charsPerLine(geometry.bodyFontSize());
        Annotation annotation = item.annotation();

        writer.checkPageBreak(lineHeight * 5);
        double headerIndent = 0;
        if (annotation instanceof Highlight highlight) {
            writer.swatch(geometry.marginLeft(), SWATCH_SIZE, highlight.color().hex());
            headerIndent = SWATCH_SIZE + SWATCH_GAP;
        }
        writer.line(item.index() + ". " + item.typeLabel(),
                new TextStyle(TextStyle.Weight.BOLD, geometry.bodyFontSize(), 0f), headerIndent);

        String content = content(annotation);
        writer.paragraph(content, bodyChars, body(), CONTENT_INDENT, lineHeight - 1);

        if (annotation instanceof Note note) {
            labelledBlock(writer, "Context:", note.selectedText(), bodyChars);
        } else if (annotation.hasNote() && !annotation.note().equals(content)) {
            labelledBlock(writer, "Note:", annotation.note(), bodyChars);
        }

        writer.line(meta(item), new TextStyle(TextStyle.Weight.REGULAR, geometry.smallFontSize(), MUTED_GRAY),
                CONTENT_INDENT, lineHeight + 3);
    }

    private void labelledBlock(PageLayoutWriter writer, String label, String text, int bodyChars) {
        if (text == null || text.isBlank()) {
            return;
        }
        double lineHeight = geometry.lineHeight();
        writer.line(label, new TextStyle(TextStyle.Weight.ITALIC, geometry.bodyFontSize(), MUTED_GRAY),
                CONTENT_INDENT, lineHeight - 1);
        writer.paragraph(text, Math.max(1, bodyChars - 5),
                new TextStyle(TextStyle.Weight.ITALIC, geometry.bodyFontSize(), TEXT_GRAY), NOTE_INDENT,
                lineHeight - 1);
    }

    private String content(Annotation annotation) {
        return switch (annotation.type()) {
            case HIGHLIGHT -> ((Highlight) annotation).selectedText();
            case NOTE -> ((Note) annotation).note();
            case BOOKMARK -> {
                Bookmark bookmark = (Bookmark) annotation;
                yield bookmark.hasNote() ? bookmark.note() : "Position: " + bookmark.position();
            }
        };
    }

    private String meta(ExportItem item) {
        StringBuilder meta = new StringBuilder("Date: ").append(item.date());
        if (item.annotation() instanceof Highlight highlight) {
            meta.append(" | Color: ").append(highlight.color().displayName());
        } else if (item.annotation() instanceof Bookmark bookmark) {
            meta.append(" | Position: ").append(bookmark.position());
        }
        return meta.toString();
    }

    private void footer(PageLayoutWriter writer, String generatedOn) {
        writer.checkPageBreak(geometry.lineHeight() * 2);
        writer.line("Exported from " + appName + " on " + generatedOn,
                new TextStyle(TextStyle.Weight.REGULAR, geometry.smallFontSize(), MUTED_GRAY), 0);
    }

    private TextStyle heading() {
        return new TextStyle(TextStyle.Weight.BOLD, geometry.headingFontSize(), 0f);
    }

    private TextStyle body() {
        return new TextStyle(TextStyle.Weight.REGULAR, geometry.bodyFontSize(), TEXT_GRAY);
    }
}
