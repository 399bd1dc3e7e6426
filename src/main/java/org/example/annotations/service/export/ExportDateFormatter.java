package org.example.annotations.service.export;

import java.time.Instant;
import java.time.ZoneId;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.FormatStyle;
import java.util.Locale;

/**
 * Renders annotation timestamps in one of the three export date styles.
 */
public class ExportDateFormatter {

    private final ZoneId zone;
    private final DateTimeFormatter shortFormatter;
    private final DateTimeFormatter longFormatter;

    public ExportDateFormatter(Locale locale, ZoneId zone) {
        this.zone = zone;
        this.shortFormatter = DateTimeFormatter.ofPattern(twoDigitMonthAndDay(fourDigitYear(
                DateTimeFormatterBuilder.getLocalizedDateTimePattern(
                        FormatStyle.SHORT, null, IsoChronology.INSTANCE, locale))), locale);
        this.longFormatter = DateTimeFormatter.ofLocalizedDate(FormatStyle.LONG).withLocale(locale);
    }

    public String format(Instant instant, ExportDateStyle style) {
        ExportDateStyle effective = style == null ? ExportDateStyle.LONG : style;
        return switch (effective) {
            case SHORT -> shortFormatter.format(instant.atZone(zone));
            case LONG -> longFormatter.format(instant.atZone(zone));
            case ISO -> DateTimeFormatter.ISO_LOCAL_DATE.format(instant.atZone(zone));
        };
    }

    private static String fourDigitYear(String pattern) {
        if (pattern.contains("yyyy") || !pattern.contains("yy")) {
            return pattern;
        }
        return pattern.replace("yy", "yyyy");
    }

    /**
     * Widens single-letter month and day fields so short dates always read like {@code 01/03/2024}.
     */
    private static String twoDigitMonthAndDay(String pattern) {
        return pattern.replaceAll("(?<!M)M(?!M)", "MM")
                .replaceAll("(?<!d)d(?!d)", "dd");
    }
}
