package org.example.annotations.service;

import org.example.annotations.model.HighlightColor;

/**
 * Fields to change on a stored annotation. A null field is left as it is.
 */
public record AnnotationUpdate(String note, HighlightColor color, Boolean isPublic) {
}
