package org.example.annotations.controller;

import org.example.annotations.exception.AnnotationValidationException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationDraft;
import org.example.annotations.model.AnnotationType;
import org.example.annotations.model.HighlightColor;
import org.example.annotations.model.TextSelection;
import org.example.annotations.service.AnnotationService;
import org.example.annotations.service.AnnotationUpdate;
import org.example.annotations.service.query.AnnotationQueryService;
import org.example.annotations.service.query.FilterCriteria;
import org.example.annotations.service.query.MergedRange;
import org.example.annotations.service.query.SortSpec;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/books/{bookId}/annotations")
public class AnnotationController {

    private final AnnotationService annotationService;
    private final AnnotationQueryService queryService;

    public AnnotationController(AnnotationService annotationService, AnnotationQueryService queryService) {
        this.annotationService = annotationService;
        this.queryService = queryService;
    }

    @GetMapping
    public List<Annotation> listAnnotations(
            @PathVariable String bookId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Boolean hasNote,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "startOffset") String sortField,
            @RequestParam(defaultValue = "asc") String sortDirection) {
        FilterCriteria criteria = new FilterCriteria(
                type == null || type.isBlank() ? null : AnnotationType.fromValue(type),
                hasNote,
                search);
        List<Annotation> filtered = queryService.filter(annotationService.list(bookId), criteria);
        return queryService.sort(filtered, SortSpec.of(sortField, sortDirection));
    }

    @PostMapping
    public ResponseEntity<Annotation> createAnnotation(
            @PathVariable String bookId,
            @RequestBody CreateAnnotationRequest request) {
        if (request == null || request.type() == null) {
            return ResponseEntity.badRequest().build();
        }
        AnnotationDraft draft = toDraft(bookId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(annotationService.create(draft));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Annotation> updateAnnotation(
            @PathVariable String bookId,
            @PathVariable String id,
            @RequestBody UpdateAnnotationRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().build();
        }
        HighlightColor color = request.color() == null ? null : HighlightColor.fromValue(request.color());
        return annotationService.update(bookId, id, new AnnotationUpdate(request.note(), color, request.isPublic()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/like")
    public ResponseEntity<Annotation> likeAnnotation(@PathVariable String bookId, @PathVariable String id) {
        return annotationService.like(bookId, id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}/like")
    public ResponseEntity<Annotation> unlikeAnnotation(@PathVariable String bookId, @PathVariable String id) {
        return annotationService.unlike(bookId, id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAnnotation(@PathVariable String bookId, @PathVariable String id) {
        if (annotationService.delete(bookId, id)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/at")
    public ResponseEntity<Annotation> annotationAt(@PathVariable String bookId, @RequestParam int offset) {
        return queryService.pointLookup(annotationService.list(bookId), offset)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/range")
    public ResponseEntity<List<Annotation>> annotationsInRange(
            @PathVariable String bookId,
            @RequestParam int start,
            @RequestParam int end) {
        if (end < start) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(queryService.rangeOverlap(annotationService.list(bookId), start, end));
    }

    @GetMapping("/merged-highlights")
    public List<MergedRange> mergedHighlights(@PathVariable String bookId) {
        return queryService.mergeOverlappingRanges(annotationService.list(bookId));
    }

    private AnnotationDraft toDraft(String bookId, CreateAnnotationRequest request) {
        AnnotationType type = AnnotationType.fromValue(request.type());
        int start = request.startOffset() == null ? 0 : request.startOffset();
        int end = request.endOffset() == null ? start : request.endOffset();
        AnnotationDraft draft = switch (type) {
            case HIGHLIGHT -> AnnotationDraft.highlight(
                    bookId,
                    new TextSelection(request.selectedText(), start, end),
                    request.color() == null ? null : HighlightColor.fromValue(request.color()),
                    request.note());
            case NOTE -> request.selectedText() == null
                    ? noteWithoutContext(bookId, start, end, request.note())
                    : AnnotationDraft.note(bookId, new TextSelection(request.selectedText(), start, end),
                            request.note());
            case BOOKMARK -> {
                if (request.endOffset() != null && end != start) {
                    throw new AnnotationValidationException("Bookmark start and end offsets must be equal");
                }
                yield AnnotationDraft.bookmark(bookId, start, request.note());
            }
        };
        return draft.withPublic(Boolean.TRUE.equals(request.isPublic()));
    }

    private AnnotationDraft noteWithoutContext(String bookId, int start, int end, String note) {
        return new AnnotationDraft(bookId, AnnotationType.NOTE, start, end, null, note, null, false);
    }

    public record CreateAnnotationRequest(
            String type,
            Integer startOffset,
            Integer endOffset,
            String selectedText,
            String note,
            String color,
            Boolean isPublic
    ) {}

    public record UpdateAnnotationRequest(
            String note,
            String color,
            Boolean isPublic
    ) {}
}
