package org.example.annotations.service.export;

import org.example.annotations.model.AnnotationType;
import org.example.annotations.model.HighlightColor;

import java.util.List;

/**
 * Export-time selection. A non-empty color list implicitly restricts the export to highlights.
 */
public record ExportFilters(List<AnnotationType> types, Boolean publicOnly, List<HighlightColor> colors) {

    public ExportFilters {
        types = types == null ? List.of() : List.copyOf(types);
        colors = colors == null ? List.of() : List.copyOf(colors);
    }

    public static ExportFilters none() {
        return new ExportFilters(List.of(), false, List.of());
    }

    public static ExportFilters ofTypes(AnnotationType... types) {
        return new ExportFilters(List.of(types), false, List.of());
    }

    public boolean publicOnlyEnabled() {
        return Boolean.TRUE.equals(publicOnly);
    }
}
