package org.example.annotations.model;

import org.example.annotations.exception.ConfigurationException;

public enum AnnotationType {
    HIGHLIGHT("Highlight", "Highlights", "highlight"),
    NOTE("Note", "Notes", "note"),
    BOOKMARK("Bookmark", "Bookmarks", "bookmark");

    private final String label;
    private final String pluralLabel;
    private final String icon;

    AnnotationType(String label, String pluralLabel, String icon) {
        this.label = label;
        this.pluralLabel = pluralLabel;
        this.icon = icon;
    }

    public String label() {
        return label;
    }

    public String pluralLabel() {
        return pluralLabel;
    }

    public String icon() {
        return icon;
    }

    /**
     * Resolves the wire token ({@code HIGHLIGHT}, {@code NOTE}, {@code BOOKMARK}). Matching is case-sensitive.
     */
    public static AnnotationType fromValue(String value) {
        if (value != null) {
            for (AnnotationType type : values()) {
                if (type.name().equals(value)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown annotation type: " + value);
    }
}
