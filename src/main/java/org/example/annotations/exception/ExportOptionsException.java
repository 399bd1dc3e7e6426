package org.example.annotations.exception;

/**
 * Raised before any rendering work when export options are unusable.
 */
public class ExportOptionsException extends RuntimeException {

    public static final String INVALID_TITLE = "invalid_title";
    public static final String INVALID_FORMAT = "invalid_format";

    private final String code;

    public ExportOptionsException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
