package org.example.annotations.service.export;

import org.example.annotations.model.Annotation;

import java.util.List;

/**
 * Output of the common export stage, shared by both serializers.
 *
 * @param annotations filtered annotations in document order
 * @param generatedOn the export instant rendered as a long date, used by stats and footers
 */
public record PreparedExport(
        ExportOptions options,
        List<Annotation> annotations,
        ExportStats stats,
        ExportGroups groups,
        String generatedOn
) {

    public PreparedExport {
        annotations = List.copyOf(annotations);
    }
}
