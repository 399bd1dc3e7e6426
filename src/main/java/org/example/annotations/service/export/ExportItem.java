package org.example.annotations.service.export;

import org.example.annotations.model.Annotation;

/**
 * An annotation placed in its export bucket with a 1-based index and its rendered date.
 */
public record ExportItem(int index, Annotation annotation, String date) {

    public String typeLabel() {
        return annotation.type().label();
    }
}
