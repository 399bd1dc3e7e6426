package org.example.annotations.service.export.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running cursor for one layout pass. Owns the vertical position and page index; every draw checks the remaining
 * space first, so nothing is placed below {@link PageGeometry#bottomLimit()}.
 */
public class PageLayoutWriter {

    private static final Logger log = LoggerFactory.getLogger(PageLayoutWriter.class);

    private final PageGeometry geometry;
    private final PageCanvas canvas;
    private double y;
    private int pageIndex;

    public PageLayoutWriter(PageGeometry geometry, PageCanvas canvas) {
        this.geometry = geometry;
        this.canvas = canvas;
        canvas.newPage();
        this.pageIndex = 0;
        this.y = geometry.marginTop();
    }

    /**
     * Starts a new page when a block of {@code neededHeight} would cross the bottom margin. A block taller than a
     * whole page is placed on the current page if that page is still empty.
     *
     * @return true if a page break happened
     */
    public boolean checkPageBreak(double neededHeight) {
        if (y + neededHeight <= geometry.bottomLimit() || y <= geometry.marginTop()) {
            return false;
        }
        canvas.newPage();
        pageIndex++;
        y = geometry.marginTop();
        log.debug("Page break before block of {}mm, now on page {}", neededHeight, pageIndex + 1);
        return true;
    }

    /**
     * Draws a single line at the cursor and advances by {@code advance}. The line reserves a full line height.
     */
    public double line(String text, TextStyle style, double indent, double advance) {
        checkPageBreak(geometry.lineHeight());
        canvas.text(text, geometry.marginLeft() + indent, y, style);
        y += advance;
        return y;
    }

    public double line(String text, TextStyle style, double indent) {
        return line(text, style, indent, geometry.lineHeight());
    }

    /**
     * Wraps {@code text} to {@code maxChars} and draws each line, checking for a page break line by line.
     */
    public double paragraph(String text, int maxChars, TextStyle style, double indent, double advance) {
        for (String wrapped : TextWrapper.wrap(text, maxChars)) {
            line(wrapped, style, indent, advance);
        }
        return y;
    }

    public double rule() {
        checkPageBreak(geometry.lineHeight());
        canvas.rule(geometry.marginLeft(), geometry.width() - geometry.marginRight(), y);
        return y;
    }

    /**
     * Fills a color square on the current baseline without moving the cursor.
     */
    public void swatch(double x, double size, String hexColor) {
        checkPageBreak(geometry.lineHeight());
        canvas.swatch(x, y, size, hexColor);
    }

    public double advance(double delta) {
        y += delta;
        return y;
    }

    public double y() {
        return y;
    }

    public int pageIndex() {
        return pageIndex;
    }

    public int pageCount() {
        return pageIndex + 1;
    }
}
