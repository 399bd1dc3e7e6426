package org.example.annotations.service.export;

import java.nio.charset.StandardCharsets;

/**
 * Outcome of an export. Markdown results carry both {@code content} and its UTF-8 {@code bytes}; PDF results carry
 * only bytes. Failed results carry an error code and no document.
 */
public record ExportResult(
        boolean success,
        String content,
        byte[] bytes,
        String filename,
        String mediaType,
        String errorCode,
        String error
) {

    public static ExportResult markdown(String content, String filename) {
        return new ExportResult(true, content, content.getBytes(StandardCharsets.UTF_8), filename,
                ExportFormat.MARKDOWN.mediaType(), null, null);
    }

    public static ExportResult pdf(byte[] bytes, String filename) {
        return new ExportResult(true, null, bytes, filename, ExportFormat.PDF.mediaType(), null, null);
    }

    public static ExportResult failure(String errorCode, String error, String filename) {
        return new ExportResult(false, null, null, filename, null, errorCode, error);
    }
}
