package org.example.annotations.service.export.pdf;

/**
 * Drawing surface addressed in page millimetres, {@code y} measured from the top edge.
 */
public interface PageCanvas {

    void newPage();

    /**
     * Draws one line of text with its baseline at {@code y}.
     */
    void text(String text, double x, double y, TextStyle style);

    void rule(double fromX, double toX, double y);

    /**
     * Fills a square whose bottom edge sits at {@code y}.
     */
    void swatch(double x, double y, double size, String hexColor);
}
