package org.example.annotations.service.export.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * {@link PageCanvas} backed by a PDFBox document using the standard Helvetica family.
 */
public class PdfBoxPageCanvas implements PageCanvas, Closeable {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageCanvas.class);

    private static final float POINTS_PER_MM = 72f / 25.4f;
    private static final float RULE_GRAY = 200f / 255f;
    private static final char REPLACEMENT = '?';

    private final PageGeometry geometry;
    private final PDDocument document;
    private final Map<TextStyle.Weight, PDFont> fonts = new EnumMap<>(TextStyle.Weight.class);
    private PDPageContentStream contentStream;

    public PdfBoxPageCanvas(PageGeometry geometry) {
        this.geometry = geometry;
        this.document = new PDDocument();
        fonts.put(TextStyle.Weight.REGULAR, new PDType1Font(Standard14Fonts.FontName.HELVETICA));
        fonts.put(TextStyle.Weight.BOLD, new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD));
        fonts.put(TextStyle.Weight.ITALIC, new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE));
    }

    @Override
    public void newPage() {
        try {
            closeContentStream();
            PDPage page = new PDPage(new PDRectangle(toPoints(geometry.width()), toPoints(geometry.height())));
            document.addPage(page);
            contentStream = new PDPageContentStream(document, page);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start PDF page", e);
        }
    }

    @Override
    public void text(String text, double x, double y, TextStyle style) {
        PDFont font = fonts.get(style.weight());
        String printable = toPrintable(text, font);
        if (printable.isEmpty()) {
            return;
        }
        try {
            contentStream.setNonStrokingColor(style.gray());
            contentStream.beginText();
            contentStream.setFont(font, style.fontSize());
            contentStream.newLineAtOffset(toPoints(x), toPdfY(y));
            contentStream.showText(printable);
            contentStream.endText();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw PDF text", e);
        }
    }

    @Override
    public void rule(double fromX, double toX, double y) {
        try {
            contentStream.setStrokingColor(RULE_GRAY);
            contentStream.setLineWidth(0.5f);
            contentStream.moveTo(toPoints(fromX), toPdfY(y));
            contentStream.lineTo(toPoints(toX), toPdfY(y));
            contentStream.stroke();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw PDF rule", e);
        }
    }

    @Override
    public void swatch(double x, double y, double size, String hexColor) {
        try {
            contentStream.setNonStrokingColor(Color.decode(hexColor));
            contentStream.addRect(toPoints(x), toPdfY(y), toPoints(size), toPoints(size));
            contentStream.fill();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to draw PDF swatch", e);
        } catch (NumberFormatException e) {
            log.warn("Skipping swatch with unparseable color {}", hexColor);
        }
    }

    public byte[] toByteArray(String title, String author, String creator) {
        try {
            closeContentStream();
            PDDocumentInformation info = document.getDocumentInformation();
            info.setTitle(title);
            if (author != null && !author.isBlank()) {
                info.setAuthor(author);
            }
            info.setCreator(creator);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write PDF document", e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            closeContentStream();
        } finally {
            document.close();
        }
    }

    private void closeContentStream() throws IOException {
        if (contentStream != null) {
            contentStream.close();
            contentStream = null;
        }
    }

    /**
     * Replaces control characters with spaces and characters the font cannot encode with '?'.
     */
    String toPrintable(String text, PDFont font) {
        if (text == null) {
            return "";
        }
        StringBuilder printable = new StringBuilder(text.length());
        int unsupported = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (Character.isISOControl(codePoint)) {
                printable.append(' ');
                continue;
            }
            String glyph = new String(Character.toChars(codePoint));
            if (canEncode(font, glyph)) {
                printable.append(glyph);
            } else {
                printable.append(REPLACEMENT);
                unsupported++;
            }
        }
        if (unsupported > 0) {
            log.warn("Replaced {} characters not supported by {}", unsupported, font.getName());
        }
        return printable.toString();
    }

    private boolean canEncode(PDFont font, String glyph) {
        try {
            font.encode(glyph);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private float toPoints(double millimetres) {
        return (float) millimetres * POINTS_PER_MM;
    }

    private float toPdfY(double y) {
        return toPoints(geometry.height() - y);
    }
}
