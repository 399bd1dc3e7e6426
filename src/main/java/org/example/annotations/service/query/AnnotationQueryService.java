package org.example.annotations.service.query;

import org.example.annotations.exception.ConfigurationException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over an annotation set. Every method returns a new collection and leaves its input untouched.
 */
@Service
public class AnnotationQueryService {

    private static final Comparator<Annotation> BY_START_THEN_END = Comparator
            .comparingInt(Annotation::startOffset)
            .thenComparingInt(Annotation::endOffset);

    public List<Annotation> filter(List<? extends Annotation> annotations, FilterCriteria criteria) {
        if (annotations == null || annotations.isEmpty()) {
            return List.of();
        }
        if (criteria == null) {
            return List.copyOf(annotations);
        }
        String needle = normalizeSearch(criteria.search());
        return annotations.stream()
                .filter(annotation -> criteria.type() == null || annotation.type() == criteria.type())
                .filter(annotation -> criteria.hasNote() == null || annotation.hasNote() == criteria.hasNote())
                .filter(annotation -> needle == null || matchesSearch(annotation, needle))
                .map(Annotation.class::cast)
                .toList();
    }

    /**
     * Stable sort: annotations with equal keys keep their relative input order.
     */
    public List<Annotation> sort(List<? extends Annotation> annotations, SortSpec sortSpec) {
        if (sortSpec == null) {
            throw new ConfigurationException("Sort order is required");
        }
        if (annotations == null || annotations.isEmpty()) {
            return List.of();
        }
        Comparator<Annotation> comparator = comparatorFor(sortSpec.field());
        if (sortSpec.direction() == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        List<Annotation> sorted = new ArrayList<>(annotations);
        sorted.sort(comparator);
        return sorted;
    }

    /**
     * Annotations whose {@code [start, end)} intersects the query range. A bookmark only matches a point query at its
     * own offset; use {@link #pointLookup} for inclusive hit testing.
     */
    public List<Annotation> rangeOverlap(List<? extends Annotation> annotations, int startOffset, int endOffset) {
        if (annotations == null || annotations.isEmpty()) {
            return List.of();
        }
        boolean pointQuery = startOffset == endOffset;
        return annotations.stream()
                .filter(annotation -> overlaps(annotation, startOffset, endOffset)
                        || (pointQuery && annotation.isBookmark() && annotation.startOffset() == startOffset))
                .map(Annotation.class::cast)
                .toList();
    }

    /**
     * First annotation in input order with {@code start <= offset <= end}.
     */
    public Optional<Annotation> pointLookup(List<? extends Annotation> annotations, int offset) {
        if (annotations == null) {
            return Optional.empty();
        }
        for (Annotation annotation : annotations) {
            if (offset >= annotation.startOffset() && offset <= annotation.endOffset()) {
                return Optional.of(annotation);
            }
        }
        return Optional.empty();
    }

    /**
     * Coalesces overlapping or touching highlight ranges. Non-highlights in the input are ignored.
     */
    public List<MergedRange> mergeOverlappingRanges(List<? extends Annotation> annotations) {
        if (annotations == null || annotations.isEmpty()) {
            return List.of();
        }
        List<Annotation> highlights = annotations.stream()
                .filter(Annotation::isHighlight)
                .sorted(BY_START_THEN_END)
                .map(Annotation.class::cast)
                .toList();
        if (highlights.isEmpty()) {
            return List.of();
        }

        List<MergedRange> merged = new ArrayList<>();
        Annotation first = highlights.get(0);
        int currentStart = first.startOffset();
        int currentEnd = first.endOffset();
        List<String> currentIds = new ArrayList<>();
        currentIds.add(first.id());

        for (Annotation next : highlights.subList(1, highlights.size())) {
            if (next.startOffset() <= currentEnd) {
                currentEnd = Math.max(currentEnd, next.endOffset());
                currentIds.add(next.id());
            } else {
                merged.add(new MergedRange(currentStart, currentEnd, currentIds));
                currentStart = next.startOffset();
                currentEnd = next.endOffset();
                currentIds = new ArrayList<>();
                currentIds.add(next.id());
            }
        }
        merged.add(new MergedRange(currentStart, currentEnd, currentIds));
        return merged;
    }

    /**
     * Buckets by type, preserving input order in each bucket. All three types are always present.
     */
    public Map<AnnotationType, List<Annotation>> groupByType(List<? extends Annotation> annotations) {
        Map<AnnotationType, List<Annotation>> groups = new EnumMap<>(AnnotationType.class);
        for (AnnotationType type : AnnotationType.values()) {
            groups.put(type, new ArrayList<>());
        }
        if (annotations != null) {
            for (Annotation annotation : annotations) {
                groups.get(annotation.type()).add(annotation);
            }
        }
        groups.replaceAll((type, list) -> List.copyOf(list));
        return groups;
    }

    public Map<AnnotationType, Integer> countByType(List<? extends Annotation> annotations) {
        Map<AnnotationType, Integer> counts = new EnumMap<>(AnnotationType.class);
        for (AnnotationType type : AnnotationType.values()) {
            counts.put(type, 0);
        }
        if (annotations != null) {
            for (Annotation annotation : annotations) {
                counts.merge(annotation.type(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private Comparator<Annotation> comparatorFor(SortField field) {
        return switch (field) {
            case CREATED_AT -> Comparator.comparing(Annotation::createdAt);
            case UPDATED_AT -> Comparator.comparing(Annotation::updatedAt);
            case START_OFFSET -> Comparator.comparingInt(Annotation::startOffset);
            case TYPE -> Comparator.comparing(annotation -> annotation.type().name());
        };
    }

    private boolean overlaps(Annotation annotation, int startOffset, int endOffset) {
        return annotation.startOffset() < endOffset && annotation.endOffset() > startOffset;
    }

    private boolean matchesSearch(Annotation annotation, String needle) {
        if (annotation.note() != null && annotation.note().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return annotation.isHighlight()
                && annotation.selectedTextOrNull() != null
                && annotation.selectedTextOrNull().toLowerCase(Locale.ROOT).contains(needle);
    }

    private String normalizeSearch(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        return search.trim().toLowerCase(Locale.ROOT);
    }
}
