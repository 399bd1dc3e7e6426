package org.example.annotations.service.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.annotations.config.AnnotationProperties;
import org.example.annotations.exception.ConfigurationException;
import org.example.annotations.exception.SettingsStorageException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationType;
import org.example.annotations.model.Bookmark;
import org.example.annotations.model.Highlight;
import org.example.annotations.model.HighlightColor;
import org.example.annotations.model.Note;
import org.example.annotations.service.query.AnnotationQueryService;
import org.example.annotations.service.query.FilterCriteria;
import org.example.annotations.service.query.SortDirection;
import org.example.annotations.service.query.SortField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.example.annotations.model.AnnotationFixtures.BOOK_ID;
import static org.example.annotations.model.AnnotationFixtures.bookmark;
import static org.example.annotations.model.AnnotationFixtures.day;
import static org.example.annotations.model.AnnotationFixtures.note;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotesPanelSettingsServiceTest {

    private static final String KEY = "notes-panel-settings";

    @Mock
    private SettingsStore store;

    private NotesPanelSettingsService service;

    private final List<Annotation> annotations = List.of(
            highlight("h1", "Note on highlight", 3),
            highlight("h2", null, 1),
            withCreated(note("n1", 0, 10, "First note", null), 2),
            withCreated(note("n2", 0, 10, "Second note", "Context text"), 4),
            withCreated(bookmark("b1", 0, null), 5));

    @BeforeEach
    void setUp() {
        service = new NotesPanelSettingsService(store, new AnnotationQueryService(), new ObjectMapper(),
                new AnnotationProperties());
    }

    @Test
    void defaults_matchPanelConstraints() {
        NotesPanelSettings defaults = NotesPanelSettings.defaults();

        assertEquals(PanelPosition.RIGHT, defaults.position());
        assertEquals(360, defaults.width());
        assertEquals(300, defaults.height());
        assertEquals(FilterPreset.ALL, defaults.filterPreset());
        assertEquals(SortField.CREATED_AT, defaults.sortField());
        assertEquals(SortDirection.DESC, defaults.sortDirection());
    }

    @Test
    void clamp_boundsValue() {
        assertEquals(100, NotesPanelSettingsService.clamp(50, 100, 500));
        assertEquals(500, NotesPanelSettingsService.clamp(600, 100, 500));
        assertEquals(300, NotesPanelSettingsService.clamp(300, 100, 500));
        assertEquals(280, NotesPanelSettingsService.clampWidth(100));
        assertEquals(600, NotesPanelSettingsService.clampWidth(1000));
        assertEquals(200, NotesPanelSettingsService.clampHeight(50));
        assertEquals(150, NotesPanelSettingsService.clampHeight(50,
                new PanelConstraints(280, 600, 150, 400, 360, 300)));
    }

    @Test
    void presetToFilters_mapsEachPreset() {
        assertTrue(service.presetToFilters("all").isEmpty());
        assertEquals(FilterCriteria.ofType(AnnotationType.NOTE), service.presetToFilters("notes-only"));
        assertEquals(FilterCriteria.withNote(), service.presetToFilters("with-notes"));
        assertTrue(service.presetToFilters(FilterPreset.RECENT).isEmpty());
        assertThrows(ConfigurationException.class, () -> service.presetToFilters("favorites"));
    }

    @Test
    void validate_fillsDefaultsAndClamps() {
        NotesPanelSettings result = service.validate(new NotesPanelSettingsInput(null, 1000, 50, null, null, null));

        assertEquals(600, result.width());
        assertEquals(200, result.height());
        assertEquals(PanelPosition.RIGHT, result.position());
        assertEquals(NotesPanelSettings.defaults(), service.validate(NotesPanelSettingsInput.empty()));
    }

    @Test
    void validate_keepsValidSettingsAndDropsUnknownTokens() {
        NotesPanelSettings valid = new NotesPanelSettings(PanelPosition.BOTTOM, 400, 350, FilterPreset.NOTES_ONLY,
                SortField.UPDATED_AT, SortDirection.ASC);

        assertEquals(valid, service.validate(NotesPanelSettingsInput.of(valid)));
        assertEquals(NotesPanelSettings.defaults(),
                service.validate(new NotesPanelSettingsInput("left", null, null, "starred", "title", "sideways")));
    }

    @Test
    void saveThenLoad_roundTripsThroughStore() {
        NotesPanelSettings settings = new NotesPanelSettings(PanelPosition.BOTTOM, 400, 350,
                FilterPreset.WITH_NOTES, SortField.START_OFFSET, SortDirection.ASC);

        assertTrue(service.save(settings));
        verify(store).write(eq(KEY), anyString());

        when(store.read(KEY)).thenReturn(Optional.of(
                "{\"position\":\"bottom\",\"width\":400,\"height\":350,\"filterPreset\":\"with-notes\","
                        + "\"sortField\":\"startOffset\",\"sortDirection\":\"asc\"}"));
        assertEquals(settings, service.load());
    }

    @Test
    void load_emptyStore_returnsDefaults() {
        when(store.read(KEY)).thenReturn(Optional.empty());

        assertEquals(NotesPanelSettings.defaults(), service.load());
    }

    @Test
    void load_malformedJson_returnsDefaults() {
        when(store.read(KEY)).thenReturn(Optional.of("invalid json"));

        assertEquals(NotesPanelSettings.defaults(), service.load());
    }

    @Test
    void load_validatesStoredValues() {
        when(store.read(KEY)).thenReturn(Optional.of("{\"width\":1000}"));

        assertEquals(600, service.load().width());
    }

    @Test
    void load_storageFailure_returnsDefaults() {
        when(store.read(KEY)).thenThrow(new SettingsStorageException("disk gone", new IOException("disk gone")));

        assertEquals(NotesPanelSettings.defaults(), service.load());
    }

    @Test
    void save_storageFailure_reportsFalse() {
        doThrow(new SettingsStorageException("read-only", new IOException("read-only")))
                .when(store).write(eq(KEY), anyString());

        assertFalse(service.save(NotesPanelSettings.defaults()));
    }

    @Test
    void applyView_filtersByPresetAndSearchThenSorts() {
        NotesPanelSettings defaults = NotesPanelSettings.defaults();

        assertEquals(List.of("b1", "n2", "h1", "n1", "h2"), ids(service.applyView(annotations, defaults, null)));
        assertEquals(List.of("n1"), ids(service.applyView(annotations, defaults, "First")));

        NotesPanelSettings notesOnly = new NotesPanelSettings(PanelPosition.RIGHT, 360, 300,
                FilterPreset.NOTES_ONLY, SortField.CREATED_AT, SortDirection.ASC);
        assertEquals(List.of("n1", "n2"), ids(service.applyView(annotations, notesOnly, null)));
    }

    @Test
    void countByPreset_countsMatches() {
        assertEquals(5, service.countByPreset(annotations, FilterPreset.ALL));
        assertEquals(2, service.countByPreset(annotations, FilterPreset.NOTES_ONLY));
        assertEquals(3, service.countByPreset(annotations, FilterPreset.WITH_NOTES));
        assertEquals(5, service.countByPreset(annotations, FilterPreset.RECENT));
    }

    @Test
    void editTextAndContext_dependOnVariant() {
        Highlight highlight = highlight("h3", null, 1);
        Bookmark bookmark = bookmark("b2", 4, null);

        assertEquals("My note", service.editText(highlight("h4", "My note", 1)));
        assertEquals("Highlighted h3", service.editText(highlight));
        assertEquals("", service.editText(bookmark));
        assertEquals(Optional.of("Highlighted h3"), service.context(highlight));
        assertEquals(Optional.of("Context text"), service.context(annotations.get(3)));
        assertEquals(Optional.empty(), service.context(note("n9", 0, 1, "no context", null)));
        assertEquals(Optional.empty(), service.context(bookmark));
    }

    @Test
    void listExcerpt_truncatesLongText() {
        Note longNote = note("n9", 0, 1, "A".repeat(100), null);

        String excerpt = service.listExcerpt(longNote, 50);

        assertEquals(50, excerpt.length());
        assertTrue(excerpt.endsWith("..."));
        assertEquals("Short", service.listExcerpt(note("n8", 0, 1, "Short", null), 50));
        assertEquals(80, service.listExcerpt(longNote).length());
    }

    @Test
    void calculatePanelLayout_splitsViewport() {
        assertEquals(new PanelLayout(360, 800, 840, 800),
                service.calculatePanelLayout(PanelPosition.RIGHT, 360, 300, 1200, 800));
        assertEquals(new PanelLayout(1200, 300, 1200, 500),
                service.calculatePanelLayout(PanelPosition.BOTTOM, 360, 300, 1200, 800));
        assertEquals(600, service.calculatePanelLayout(PanelPosition.RIGHT, 1000, 300, 1200, 800).panelWidth());
        assertEquals(500, service.calculatePanelLayout(PanelPosition.BOTTOM, 360, 1000, 1200, 800).panelHeight());
    }

    @Test
    void labelKeys_areStable() {
        assertEquals("reader.notes.filters.notesOnly", FilterPreset.NOTES_ONLY.labelKey());
        assertEquals("reader.notes.filters.withNotes", FilterPreset.WITH_NOTES.labelKey());
        assertEquals("reader.notes.sort.position", NotesPanelSettingsService.sortFieldLabelKey(SortField.START_OFFSET));
        assertEquals("reader.notes.sort.created", NotesPanelSettingsService.sortFieldLabelKey(SortField.CREATED_AT));
    }

    private static Highlight highlight(String id, String note, int createdDay) {
        return new Highlight(id, BOOK_ID, 0, 10, "Highlighted " + id, HighlightColor.YELLOW, note,
                false, 0, false, day(createdDay), day(createdDay));
    }

    private static Annotation withCreated(Note note, int createdDay) {
        return new Note(note.id(), note.bookId(), note.startOffset(), note.endOffset(), note.note(),
                note.selectedText(), false, 0, false, day(createdDay), day(createdDay));
    }

    private static Annotation withCreated(Bookmark bookmark, int createdDay) {
        return new Bookmark(bookmark.id(), bookmark.bookId(), bookmark.startOffset(), bookmark.endOffset(),
                bookmark.note(), false, 0, false, day(createdDay), day(createdDay));
    }

    private static List<String> ids(List<Annotation> annotations) {
        return annotations.stream().map(Annotation::id).toList();
    }
}
