package org.example.annotations.service.query;

import org.example.annotations.exception.ConfigurationException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationType;
import org.example.annotations.model.Bookmark;
import org.example.annotations.model.Highlight;
import org.example.annotations.model.HighlightColor;
import org.example.annotations.model.Note;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.example.annotations.model.AnnotationFixtures.BOOK_ID;
import static org.example.annotations.model.AnnotationFixtures.bookmark;
import static org.example.annotations.model.AnnotationFixtures.day;
import static org.example.annotations.model.AnnotationFixtures.highlight;
import static org.example.annotations.model.AnnotationFixtures.note;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotationQueryServiceTest {

    private final AnnotationQueryService queryService = new AnnotationQueryService();

    @Test
    void filter_byType_keepsOnlyMatchingType() {
        List<Annotation> annotations = List.of(
                note("n1", 0, 0, "First", null),
                highlight("h1", 150, 200, HighlightColor.BLUE, "Important"));

        List<Annotation> result = queryService.filter(annotations, FilterCriteria.ofType(AnnotationType.HIGHLIGHT));

        assertEquals(1, result.size());
        assertEquals("h1", result.get(0).id());
        assertEquals(HighlightColor.BLUE, ((Highlight) result.get(0)).color());
    }

    @Test
    void filter_hasNoteFalse_selectsBlankOrMissingNotes() {
        List<Annotation> annotations = List.of(
                highlight("h1", 0, 5, HighlightColor.YELLOW, "kept"),
                highlight("h2", 5, 9),
                bookmark("b1", 12, null));

        List<Annotation> result = queryService.filter(annotations, new FilterCriteria(null, false, null));

        assertEquals(List.of("h2", "b1"), ids(result));
    }

    @Test
    void filter_search_matchesNoteAndHighlightTextIgnoringCase() {
        Highlight byText = new Highlight("h1", BOOK_ID, 0, 10, "It was the best of times", HighlightColor.GREEN,
                null, false, 0, false, day(1), day(1));
        Note byNote = note("n1", 20, 30, "Times are changing", null);
        Note contextOnly = note("n2", 40, 50, "unrelated", "the worst of times");

        List<Annotation> result = queryService.filter(List.of(byText, byNote, contextOnly),
                FilterCriteria.none().withSearch("TIMES"));

        assertEquals(List.of("h1", "n1"), ids(result));
    }

    @Test
    void filter_isIdempotentAndLeavesInputUntouched() {
        List<Annotation> annotations = new ArrayList<>(List.of(
                highlight("h1", 0, 5, HighlightColor.YELLOW, "note"),
                note("n1", 3, 8, "thought", null),
                bookmark("b1", 9, null)));
        FilterCriteria criteria = FilterCriteria.withNote();

        List<Annotation> once = queryService.filter(annotations, criteria);
        List<Annotation> twice = queryService.filter(once, criteria);

        assertEquals(once, twice);
        assertEquals(3, annotations.size());
    }

    @Test
    void filter_emptyCriteria_returnsEverything() {
        List<Annotation> annotations = List.of(highlight("h1", 0, 5), bookmark("b1", 3, null));

        assertEquals(annotations, queryService.filter(annotations, FilterCriteria.none()));
        assertTrue(queryService.filter(null, FilterCriteria.none()).isEmpty());
    }

    @Test
    void sort_isStableForEqualKeys() {
        List<Annotation> annotations = List.of(
                highlight("h1", 10, 20),
                bookmark("b1", 10, null),
                note("n1", 5, 8, "first", null),
                highlight("h2", 10, 12));

        List<Annotation> sorted = queryService.sort(annotations, SortSpec.byPosition());

        assertEquals(List.of("n1", "h1", "b1", "h2"), ids(sorted));
    }

    @Test
    void sort_byCreatedAtDescending_putsNewestFirst() {
        List<Annotation> annotations = List.of(
                created(highlight("h1", 0, 5), 3),
                created(highlight("h2", 5, 9), 1),
                created(bookmark("b1", 12, null), 5));

        List<Annotation> sorted = queryService.sort(annotations, SortSpec.of("createdAt", "desc"));

        assertEquals(List.of("b1", "h1", "h2"), ids(sorted));
    }

    @Test
    void sort_byType_usesTypeName() {
        List<Annotation> annotations = List.of(
                note("n1", 0, 1, "x", null),
                highlight("h1", 0, 5),
                bookmark("b1", 3, null));

        List<Annotation> sorted = queryService.sort(annotations, new SortSpec(SortField.TYPE, SortDirection.ASC));

        assertEquals(List.of("b1", "h1", "n1"), ids(sorted));
    }

    @Test
    void sortSpec_unknownTokens_areRejected() {
        assertThrows(ConfigurationException.class, () -> SortSpec.of("title", "asc"));
        assertThrows(ConfigurationException.class, () -> SortSpec.of("createdAt", "up"));
        assertThrows(ConfigurationException.class, () -> queryService.sort(List.of(), null));
    }

    @Test
    void rangeOverlap_usesHalfOpenIntervals() {
        List<Annotation> annotations = List.of(
                highlight("h1", 0, 10),
                highlight("h2", 10, 20),
                note("n1", 5, 15, "middle", null));

        assertEquals(List.of("h1", "n1"), ids(queryService.rangeOverlap(annotations, 0, 10)));
        assertEquals(List.of("h2", "n1"), ids(queryService.rangeOverlap(annotations, 10, 12)));
    }

    @Test
    void rangeOverlap_bookmarkMatchesOnlyPointQueryAtItsOffset() {
        List<Annotation> annotations = List.of(bookmark("b1", 10, null));

        assertTrue(queryService.rangeOverlap(annotations, 5, 15).isEmpty());
        assertEquals(List.of("b1"), ids(queryService.rangeOverlap(annotations, 10, 10)));
    }

    @Test
    void pointLookup_isInclusiveAndReturnsFirstInInputOrder() {
        List<Annotation> annotations = List.of(
                highlight("h1", 0, 10),
                highlight("h2", 10, 20),
                bookmark("b1", 25, null));

        assertEquals(Optional.of("h1"), queryService.pointLookup(annotations, 10).map(Annotation::id));
        assertEquals(Optional.of("h2"), queryService.pointLookup(annotations, 20).map(Annotation::id));
        assertEquals(Optional.of("b1"), queryService.pointLookup(annotations, 25).map(Annotation::id));
        assertEquals(Optional.empty(), queryService.pointLookup(annotations, 22));
    }

    @Test
    void mergeOverlappingRanges_coalescesOverlappingAndTouchingHighlights() {
        List<Annotation> annotations = List.of(
                highlight("h3", 30, 40),
                highlight("h1", 0, 10),
                note("n1", 5, 35, "ignored", null),
                highlight("h2", 10, 15),
                highlight("h4", 35, 50));

        List<MergedRange> merged = queryService.mergeOverlappingRanges(annotations);

        assertEquals(2, merged.size());
        assertEquals(new MergedRange(0, 15, List.of("h1", "h2")), merged.get(0));
        assertEquals(new MergedRange(30, 50, List.of("h3", "h4")), merged.get(1));
    }

    @Test
    void mergeOverlappingRanges_rangesAreDisjointAndCoverEveryHighlight() {
        List<Annotation> annotations = List.of(
                highlight("h1", 0, 4), highlight("h2", 2, 6), highlight("h3", 8, 9), highlight("h4", 20, 30));

        List<MergedRange> merged = queryService.mergeOverlappingRanges(annotations);

        for (int i = 1; i < merged.size(); i++) {
            assertTrue(merged.get(i - 1).endOffset() < merged.get(i).startOffset());
        }
        assertEquals(4, merged.stream().mapToInt(range -> range.annotationIds().size()).sum());
    }

    @Test
    void countByType_alwaysHasAllTypes() {
        Map<AnnotationType, Integer> counts = queryService.countByType(List.of(highlight("h1", 0, 4)));

        assertEquals(1, counts.get(AnnotationType.HIGHLIGHT));
        assertEquals(0, counts.get(AnnotationType.NOTE));
        assertEquals(0, counts.get(AnnotationType.BOOKMARK));
    }

    @Test
    void groupByType_preservesInputOrderPerBucket() {
        Map<AnnotationType, List<Annotation>> groups = queryService.groupByType(List.of(
                highlight("h2", 10, 14), bookmark("b1", 2, null), highlight("h1", 0, 4)));

        assertEquals(List.of("h2", "h1"), ids(groups.get(AnnotationType.HIGHLIGHT)));
        assertEquals(List.of("b1"), ids(groups.get(AnnotationType.BOOKMARK)));
        assertTrue(groups.get(AnnotationType.NOTE).isEmpty());
    }

    private static Annotation created(Highlight highlight, int dayOfMonth) {
        return new Highlight(highlight.id(), highlight.bookId(), highlight.startOffset(), highlight.endOffset(),
                highlight.selectedText(), highlight.color(), highlight.note(), false, 0, false,
                day(dayOfMonth), day(dayOfMonth));
    }

    private static Annotation created(Bookmark bookmark, int dayOfMonth) {
        return new Bookmark(bookmark.id(), bookmark.bookId(), bookmark.startOffset(), bookmark.endOffset(),
                bookmark.note(), false, 0, false, day(dayOfMonth), day(dayOfMonth));
    }

    private static List<String> ids(List<? extends Annotation> annotations) {
        return annotations.stream().map(Annotation::id).toList();
    }
}
