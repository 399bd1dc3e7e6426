package org.example.annotations.service.export;

public record ExportOptions(
        ExportFormat format,
        String bookTitle,
        String bookAuthor,
        ExportFilters filters,
        Boolean includeToc,
        Boolean includeStats,
        ExportDateStyle dateFormat
) {

    public static ExportOptions of(ExportFormat format, String bookTitle) {
        return new ExportOptions(format, bookTitle, null, null, null, null, null);
    }

    public ExportOptions withFilters(ExportFilters filters) {
        return new ExportOptions(format, bookTitle, bookAuthor, filters, includeToc, includeStats, dateFormat);
    }

    public ExportOptions withAuthor(String bookAuthor) {
        return new ExportOptions(format, bookTitle, bookAuthor, filters, includeToc, includeStats, dateFormat);
    }

    public ExportOptions withSections(boolean includeToc, boolean includeStats) {
        return new ExportOptions(format, bookTitle, bookAuthor, filters, includeToc, includeStats, dateFormat);
    }

    public ExportOptions withDateFormat(ExportDateStyle dateFormat) {
        return new ExportOptions(format, bookTitle, bookAuthor, filters, includeToc, includeStats, dateFormat);
    }

    public boolean tocEnabled() {
        return !Boolean.FALSE.equals(includeToc);
    }

    public boolean statsEnabled() {
        return !Boolean.FALSE.equals(includeStats);
    }

    public ExportDateStyle dateStyle() {
        return dateFormat == null ? ExportDateStyle.LONG : dateFormat;
    }

    public boolean hasAuthor() {
        return bookAuthor != null && !bookAuthor.isBlank();
    }
}
