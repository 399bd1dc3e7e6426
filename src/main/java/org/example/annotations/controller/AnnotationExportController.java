package org.example.annotations.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.annotations.exception.ApiError;
import org.example.annotations.service.AnnotationService;
import org.example.annotations.service.export.AnnotationExportService;
import org.example.annotations.service.export.ExportFormat;
import org.example.annotations.service.export.ExportOptions;
import org.example.annotations.service.export.ExportResult;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/books/{bookId}/annotations/export")
public class AnnotationExportController {

    private final AnnotationService annotationService;
    private final AnnotationExportService exportService;
    private final Clock clock;

    public AnnotationExportController(
            AnnotationService annotationService,
            AnnotationExportService exportService,
            Clock clock) {
        this.annotationService = annotationService;
        this.exportService = exportService;
        this.clock = clock;
    }

    /**
     * Responds with the rendered document as an attachment, or a 400 {@link ApiError} carrying the options error code.
     */
    @PostMapping
    public ResponseEntity<?> exportAnnotations(
            @PathVariable String bookId,
            @RequestBody ExportOptions options,
            HttpServletRequest request) {
        ExportResult result = exportService.export(annotationService.list(bookId), options);
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ApiError(result.errorCode(), result.error(), request.getRequestURI(), clock.instant()));
        }
        String contentType = ExportFormat.MARKDOWN.mediaType().equals(result.mediaType())
                ? result.mediaType() + ";charset=UTF-8"
                : result.mediaType();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(result.filename())
                        .build()
                        .toString())
                .body(result.bytes());
    }
}
