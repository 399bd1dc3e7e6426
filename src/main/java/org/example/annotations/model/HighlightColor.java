package org.example.annotations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import org.example.annotations.exception.AnnotationValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed highlight palette. No other colors are accepted.
 */
public enum HighlightColor {
    YELLOW("yellow", "#fff176"),
    GREEN("green", "#a5d6a7"),
    BLUE("blue", "#90caf9"),
    PINK("pink", "#f48fb1"),
    PURPLE("purple", "#ce93d8"),
    ORANGE("orange", "#ffcc80");

    public static final HighlightColor DEFAULT = YELLOW;

    private final String value;
    private final String hex;

    HighlightColor(String value, String hex) {
        this.value = value;
        this.hex = hex;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String hex() {
        return hex;
    }

    public String displayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    @JsonCreator
    public static HighlightColor fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (HighlightColor color : values()) {
                if (color.value.equals(normalized)) {
                    return color;
                }
            }
        }
        throw new AnnotationValidationException("Unknown highlight color: " + value);
    }

    public static Optional<HighlightColor> fromHex(String hex) {
        if (hex == null || !hex.matches("^#[0-9A-Fa-f]{6}$")) {
            return Optional.empty();
        }
        String normalized = hex.toLowerCase(Locale.ROOT);
        for (HighlightColor color : values()) {
            if (color.hex.equals(normalized)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }
}
