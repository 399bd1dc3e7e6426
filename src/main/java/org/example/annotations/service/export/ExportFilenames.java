package org.example.annotations.service.export;

import java.time.LocalDate;
import java.util.Locale;

public final class ExportFilenames {

    private static final int MAX_SLUG_LENGTH = 50;
    private static final String FALLBACK_SLUG = "book";

    private ExportFilenames() {
    }

    /**
     * {@code slug(title)-annotations-YYYY-MM-DD.ext}
     */
    public static String filename(String bookTitle, ExportFormat format, LocalDate date) {
        ExportFormat effective = format == null ? ExportFormat.MARKDOWN : format;
        return slug(bookTitle) + "-annotations-" + date + "." + effective.extension();
    }

    public static String slug(String bookTitle) {
        if (bookTitle == null) {
            return FALLBACK_SLUG;
        }
        String slug = bookTitle.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }
}
