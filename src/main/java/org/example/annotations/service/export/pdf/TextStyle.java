package org.example.annotations.service.export.pdf;

/**
 * @param gray fill level from 0 (black) to 1 (white)
 */
public record TextStyle(Weight weight, float fontSize, float gray) {

    public enum Weight {
        REGULAR,
        BOLD,
        ITALIC
    }
}
