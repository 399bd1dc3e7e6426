package org.example.annotations.service.export.pdf;

/**
 * Page size, margins and type scale in millimetres. {@code y} grows downward from the top edge.
 */
public record PageGeometry(
        double width,
        double height,
        double marginTop,
        double marginBottom,
        double marginLeft,
        double marginRight,
        double lineHeight,
        float titleFontSize,
        float headingFontSize,
        float bodyFontSize,
        float smallFontSize
) {

    public static final PageGeometry A4 = new PageGeometry(210, 297, 20, 20, 20, 20, 7, 18, 14, 11, 9);

    private static final double CHAR_WIDTH_FACTOR = 0.5;

    public double contentWidth() {
        return width - marginLeft - marginRight;
    }

    /**
     * Lowest {@code y} that content may reach.
     */
    public double bottomLimit() {
        return height - marginBottom;
    }

    /**
     * Fixed-pitch estimate; no kerning or justification.
     */
    public int charsPerLine(float fontSize) {
        return (int) Math.floor(contentWidth() / (fontSize * CHAR_WIDTH_FACTOR));
    }
}
