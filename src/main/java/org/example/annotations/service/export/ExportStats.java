package org.example.annotations.service.export;

import java.time.Instant;

public record ExportStats(
        int totalAnnotations,
        int highlights,
        int notes,
        int bookmarks,
        int withNotes,
        int publicAnnotations,
        Instant exportDate
) {
}
