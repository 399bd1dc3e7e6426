package org.example.annotations.service.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.example.annotations.exception.ConfigurationException;
import org.example.annotations.model.AnnotationType;
import org.example.annotations.service.query.FilterCriteria;

import java.util.Optional;

/**
 * Fixed filter shortcuts offered by the notes panel.
 */
public enum FilterPreset {
    ALL("all", "reader.notes.filters.all"),
    NOTES_ONLY("notes-only", "reader.notes.filters.notesOnly"),
    WITH_NOTES("with-notes", "reader.notes.filters.withNotes"),
    // Ordering alone expresses "recent"; no extra predicate.
    RECENT("recent", "reader.notes.filters.recent");

    private final String value;
    private final String labelKey;

    FilterPreset(String value, String labelKey) {
        this.value = value;
        this.labelKey = labelKey;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String labelKey() {
        return labelKey;
    }

    public FilterCriteria toCriteria() {
        return switch (this) {
            case ALL, RECENT -> FilterCriteria.none();
            case NOTES_ONLY -> FilterCriteria.ofType(AnnotationType.NOTE);
            case WITH_NOTES -> FilterCriteria.withNote();
        };
    }

    @JsonCreator
    public static FilterPreset fromValue(String value) {
        return find(value).orElseThrow(() -> new ConfigurationException("Unsupported filter preset: " + value));
    }

    public static Optional<FilterPreset> find(String value) {
        for (FilterPreset preset : values()) {
            if (preset.value.equals(value)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
