package org.example.annotations.service.export;

import org.example.annotations.config.AnnotationProperties;
import org.example.annotations.exception.ExportOptionsException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.Highlight;
import org.example.annotations.service.export.markdown.MarkdownAnnotationRenderer;
import org.example.annotations.service.export.pdf.PdfAnnotationRenderer;
import org.example.annotations.service.query.AnnotationQueryService;
import org.example.annotations.service.query.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates options, selects and orders annotations, and hands the grouped result to the requested serializer.
 */
@Service
public class AnnotationExportService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExportService.class);

    private final AnnotationQueryService queryService;
    private final MarkdownAnnotationRenderer markdownRenderer;
    private final PdfAnnotationRenderer pdfRenderer;
    private final ExportDateFormatter dateFormatter;
    private final ZoneId zone;
    private final Clock clock;

    public AnnotationExportService(
            AnnotationQueryService queryService,
            MarkdownAnnotationRenderer markdownRenderer,
            PdfAnnotationRenderer pdfRenderer,
            AnnotationProperties properties,
            Clock clock) {
        this.queryService = queryService;
        this.markdownRenderer = markdownRenderer;
        this.pdfRenderer = pdfRenderer;
        this.zone = ZoneId.of(properties.getExport().getZone());
        this.dateFormatter = new ExportDateFormatter(
                Locale.forLanguageTag(properties.getExport().getLocale()), zone);
        this.clock = clock;
    }

    public ExportResult export(List<? extends Annotation> annotations, ExportOptions options) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        String filename = ExportFilenames.filename(
                options == null ? null : options.bookTitle(),
                options == null ? null : options.format(),
                today);
        try {
            validate(options);
        } catch (ExportOptionsException e) {
            log.warn("Rejected export options ({}): {}", e.getCode(), e.getMessage());
            return ExportResult.failure(e.getCode(), e.getMessage(), filename);
        }

        PreparedExport prepared = prepare(annotations, options);
        ExportResult result = switch (options.format()) {
            case MARKDOWN -> ExportResult.markdown(markdownRenderer.render(prepared), filename);
            case PDF -> ExportResult.pdf(pdfRenderer.render(prepared), filename);
        };
        log.info("Exported {} annotations as {} to {} ({} bytes)",
                prepared.stats().totalAnnotations(), options.format().value(), filename, result.bytes().length);
        return result;
    }

    public void validate(ExportOptions options) {
        if (options == null || options.bookTitle() == null || options.bookTitle().trim().isEmpty()) {
            throw new ExportOptionsException(ExportOptionsException.INVALID_TITLE, "Book title is required");
        }
        if (options.format() == null) {
            throw new ExportOptionsException(ExportOptionsException.INVALID_FORMAT, "Invalid export format");
        }
    }

    /**
     * Filter, document-order sort, statistics and per-type grouping. Options must already be valid.
     */
    public PreparedExport prepare(List<? extends Annotation> annotations, ExportOptions options) {
        List<Annotation> snapshot = annotations == null ? List.of() : List.copyOf(annotations);
        List<Annotation> filtered = filterForExport(snapshot, options.filters());
        List<Annotation> sorted = queryService.sort(filtered, SortSpec.byPosition());
        Instant now = clock.instant();
        ExportStats stats = calculateStats(sorted, now);
        ExportGroups groups = group(sorted, options.dateStyle());
        return new PreparedExport(options, sorted, stats, groups,
                dateFormatter.format(now, ExportDateStyle.LONG));
    }

    public List<Annotation> filterForExport(List<? extends Annotation> annotations, ExportFilters filters) {
        if (annotations == null || annotations.isEmpty()) {
            return List.of();
        }
        if (filters == null) {
            return List.copyOf(annotations);
        }
        return annotations.stream()
                .filter(annotation -> filters.types().isEmpty() || filters.types().contains(annotation.type()))
                .filter(annotation -> !filters.publicOnlyEnabled() || annotation.isPublic())
                .filter(annotation -> filters.colors().isEmpty()
                        || (annotation instanceof Highlight highlight && filters.colors().contains(highlight.color())))
                .map(Annotation.class::cast)
                .toList();
    }

    public ExportStats calculateStats(List<? extends Annotation> annotations) {
        return calculateStats(annotations, clock.instant());
    }

    private ExportStats calculateStats(List<? extends Annotation> annotations, Instant exportDate) {
        int highlights = 0;
        int notes = 0;
        int bookmarks = 0;
        int withNotes = 0;
        int publicAnnotations = 0;
        for (Annotation annotation : annotations) {
            switch (annotation.type()) {
                case HIGHLIGHT -> highlights++;
                case NOTE -> notes++;
                case BOOKMARK -> bookmarks++;
            }
            if (annotation.hasNote()) {
                withNotes++;
            }
            if (annotation.isPublic()) {
                publicAnnotations++;
            }
        }
        return new ExportStats(annotations.size(), highlights, notes, bookmarks, withNotes, publicAnnotations,
                exportDate);
    }

    private ExportGroups group(List<Annotation> sorted, ExportDateStyle dateStyle) {
        List<ExportItem> highlights = new ArrayList<>();
        List<ExportItem> notes = new ArrayList<>();
        List<ExportItem> bookmarks = new ArrayList<>();
        for (Annotation annotation : sorted) {
            String date = dateFormatter.format(annotation.createdAt(), dateStyle);
            switch (annotation.type()) {
                case HIGHLIGHT -> highlights.add(new ExportItem(highlights.size() + 1, annotation, date));
                case NOTE -> notes.add(new ExportItem(notes.size() + 1, annotation, date));
                case BOOKMARK -> bookmarks.add(new ExportItem(bookmarks.size() + 1, annotation, date));
            }
        }
        return new ExportGroups(highlights, notes, bookmarks);
    }
}
