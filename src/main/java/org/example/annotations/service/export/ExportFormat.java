package org.example.annotations.service.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportFormat {
    MARKDOWN("markdown", "md", "text/markdown"),
    PDF("pdf", "pdf", "application/pdf");

    private final String value;
    private final String extension;
    private final String mediaType;

    ExportFormat(String value, String extension, String mediaType) {
        this.value = value;
        this.extension = extension;
        this.mediaType = mediaType;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * Unknown tokens bind to null so option validation can report them as {@code invalid_format}.
     */
    @JsonCreator
    public static ExportFormat fromValue(String value) {
        for (ExportFormat format : values()) {
            if (format.value.equals(value)) {
                return format;
            }
        }
        return null;
    }
}
