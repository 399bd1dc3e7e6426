package org.example.annotations.service.export;

import org.example.annotations.model.AnnotationType;

import java.util.List;
import java.util.Locale;

public record ExportSection(AnnotationType type, List<ExportItem> items) {

    public ExportSection {
        items = List.copyOf(items);
    }

    public String title() {
        return type.pluralLabel();
    }

    public String anchor() {
        return type.pluralLabel().toLowerCase(Locale.ROOT);
    }
}
