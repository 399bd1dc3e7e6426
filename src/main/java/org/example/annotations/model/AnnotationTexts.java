package org.example.annotations.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Display helpers shared by the notes panel and list views.
 */
public final class AnnotationTexts {

    public static final int DEFAULT_EXCERPT_LENGTH = 100;

    private static final DateTimeFormatter NUMERIC_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    private AnnotationTexts() {
    }

    public static String excerpt(String text) {
        return excerpt(text, DEFAULT_EXCERPT_LENGTH);
    }

    public static String excerpt(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    /**
     * "Today", "Yesterday", "N days ago" within a week, otherwise a numeric date.
     */
    public static String relativeDate(Instant createdAt, Instant now, ZoneId zone) {
        LocalDate created = createdAt.atZone(zone).toLocalDate();
        LocalDate today = now.atZone(zone).toLocalDate();
        long days = Duration.between(created.atStartOfDay(), today.atStartOfDay()).toDays();
        if (days <= 0) {
            return "Today";
        }
        if (days == 1) {
            return "Yesterday";
        }
        if (days < 7) {
            return days + " days ago";
        }
        return created.format(NUMERIC_DATE);
    }
}
