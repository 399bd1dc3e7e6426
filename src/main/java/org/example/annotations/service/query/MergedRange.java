package org.example.annotations.service.query;

import java.util.List;

/**
 * One paint region covering {@code [startOffset, endOffset]}, referencing every highlight that contributed to it.
 */
public record MergedRange(int startOffset, int endOffset, List<String> annotationIds) {

    public MergedRange {
        annotationIds = List.copyOf(annotationIds);
    }
}
