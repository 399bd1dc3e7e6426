package org.example.annotations.service.settings;

/**
 * Size bounds for the notes panel, in CSS pixels.
 */
public record PanelConstraints(
        int minWidth,
        int maxWidth,
        int minHeight,
        int maxHeight,
        int defaultWidth,
        int defaultHeight
) {

    public static final PanelConstraints DEFAULT = new PanelConstraints(280, 600, 200, 500, 360, 300);
}
