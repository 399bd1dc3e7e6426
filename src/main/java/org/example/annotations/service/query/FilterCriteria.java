package org.example.annotations.service.query;

import org.example.annotations.model.AnnotationType;

/**
 * Structured predicate set. Null fields impose no constraint; present fields are ANDed.
 */
public record FilterCriteria(AnnotationType type, Boolean hasNote, String search) {

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null);
    }

    public static FilterCriteria ofType(AnnotationType type) {
        return new FilterCriteria(type, null, null);
    }

    public static FilterCriteria withNote() {
        return new FilterCriteria(null, true, null);
    }

    public FilterCriteria withSearch(String search) {
        return new FilterCriteria(type, hasNote, search);
    }

    public boolean isEmpty() {
        return type == null && hasNote == null && (search == null || search.isBlank());
    }
}
