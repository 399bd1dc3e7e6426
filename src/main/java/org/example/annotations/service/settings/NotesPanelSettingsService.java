package org.example.annotations.service.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.annotations.config.AnnotationProperties;
import org.example.annotations.exception.SettingsStorageException;
import org.example.annotations.model.Annotation;
import org.example.annotations.model.AnnotationTexts;
import org.example.annotations.model.Highlight;
import org.example.annotations.model.Note;
import org.example.annotations.service.query.AnnotationQueryService;
import org.example.annotations.service.query.FilterCriteria;
import org.example.annotations.service.query.SortDirection;
import org.example.annotations.service.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * View state for the notes panel: clamping, preset filters, and load/save against a {@link SettingsStore}.
 * Storage failures never escape this class; loads fall back to defaults and saves report {@code false}.
 */
@Service
public class NotesPanelSettingsService {

    private static final Logger log = LoggerFactory.getLogger(NotesPanelSettingsService.class);

    public static final int DEFAULT_LIST_EXCERPT_LENGTH = 80;

    private final SettingsStore store;
    private final AnnotationQueryService queryService;
    private final ObjectMapper objectMapper;
    private final String storageKey;

    public NotesPanelSettingsService(
            SettingsStore store,
            AnnotationQueryService queryService,
            ObjectMapper objectMapper,
            AnnotationProperties properties) {
        this.store = store;
        this.queryService = queryService;
        this.objectMapper = objectMapper;
        this.storageKey = properties.getSettings().getKey();
    }

    public static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    public static int clampWidth(int width) {
        return clampWidth(width, PanelConstraints.DEFAULT);
    }

    public static int clampWidth(int width, PanelConstraints constraints) {
        return clamp(width, constraints.minWidth(), constraints.maxWidth());
    }

    public static int clampHeight(int height) {
        return clampHeight(height, PanelConstraints.DEFAULT);
    }

    public static int clampHeight(int height, PanelConstraints constraints) {
        return clamp(height, constraints.minHeight(), constraints.maxHeight());
    }

    public FilterCriteria presetToFilters(FilterPreset preset) {
        return preset.toCriteria();
    }

    public FilterCriteria presetToFilters(String preset) {
        return FilterPreset.fromValue(preset).toCriteria();
    }

    /**
     * Fills missing fields from the defaults and clamps sizes. Unknown tokens are treated as missing.
     */
    public NotesPanelSettings validate(NotesPanelSettingsInput input) {
        NotesPanelSettings defaults = NotesPanelSettings.defaults();
        if (input == null) {
            return defaults;
        }
        return new NotesPanelSettings(
                PanelPosition.find(input.position()).orElse(defaults.position()),
                clampWidth(input.width() == null ? defaults.width() : input.width()),
                clampHeight(input.height() == null ? defaults.height() : input.height()),
                FilterPreset.find(input.filterPreset()).orElse(defaults.filterPreset()),
                SortField.find(input.sortField()).orElse(defaults.sortField()),
                SortDirection.find(input.sortDirection()).orElse(defaults.sortDirection()));
    }

    public NotesPanelSettings load() {
        Optional<String> stored;
        try {
            stored = store.read(storageKey);
        } catch (SettingsStorageException e) {
            log.warn("Could not read notes panel settings, using defaults: {}", e.getMessage());
            return NotesPanelSettings.defaults();
        }
        if (stored.isEmpty() || stored.get().isBlank()) {
            log.debug("No stored notes panel settings under {}", storageKey);
            return NotesPanelSettings.defaults();
        }
        try {
            return validate(objectMapper.readValue(stored.get(), NotesPanelSettingsInput.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed notes panel settings under {}: {}", storageKey, e.getOriginalMessage());
            return NotesPanelSettings.defaults();
        }
    }

    /**
     * @return false if the store rejected the write
     */
    public boolean save(NotesPanelSettings settings) {
        try {
            store.write(storageKey, objectMapper.writeValueAsString(settings));
            return true;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notes panel settings", e);
        } catch (SettingsStorageException e) {
            log.warn("Could not save notes panel settings: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Applies the preset filter and optional search, then the settings' sort order.
     */
    public List<Annotation> applyView(List<? extends Annotation> annotations, NotesPanelSettings settings,
                                      String search) {
        FilterCriteria criteria = settings.filterPreset().toCriteria().withSearch(search);
        List<Annotation> filtered = queryService.filter(annotations, criteria);
        return queryService.sort(filtered, settings.sortSpec());
    }

    public int countByPreset(List<? extends Annotation> annotations, FilterPreset preset) {
        return queryService.filter(annotations, preset.toCriteria()).size();
    }

    public String editText(Annotation annotation) {
        if (annotation.note() != null && !annotation.note().isEmpty()) {
            return annotation.note();
        }
        if (annotation instanceof Highlight highlight) {
            return highlight.selectedText();
        }
        return "";
    }

    /**
     * Source passage shown above the editor: the highlighted text, or a note's attached selection.
     */
    public Optional<String> context(Annotation annotation) {
        if (annotation instanceof Highlight highlight) {
            return Optional.of(highlight.selectedText());
        }
        if (annotation instanceof Note note) {
            return Optional.ofNullable(note.selectedText());
        }
        return Optional.empty();
    }

    public String listExcerpt(Annotation annotation) {
        return listExcerpt(annotation, DEFAULT_LIST_EXCERPT_LENGTH);
    }

    public String listExcerpt(Annotation annotation, int maxLength) {
        return AnnotationTexts.excerpt(editText(annotation), maxLength);
    }

    public PanelLayout calculatePanelLayout(PanelPosition position, int width, int height,
                                            int viewportWidth, int viewportHeight) {
        return switch (position) {
            case RIGHT -> {
                int panelWidth = clampWidth(width);
                yield new PanelLayout(panelWidth, viewportHeight, viewportWidth - panelWidth, viewportHeight);
            }
            case BOTTOM -> {
                int panelHeight = clampHeight(height);
                yield new PanelLayout(viewportWidth, panelHeight, viewportWidth, viewportHeight - panelHeight);
            }
        };
    }

    public static String sortFieldLabelKey(SortField field) {
        return switch (field) {
            case CREATED_AT -> "reader.notes.sort.created";
            case UPDATED_AT -> "reader.notes.sort.updated";
            case START_OFFSET -> "reader.notes.sort.position";
            case TYPE -> "reader.notes.sort.type";
        };
    }
}
