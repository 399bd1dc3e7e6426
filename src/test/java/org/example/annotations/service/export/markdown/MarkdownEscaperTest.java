package org.example.annotations.service.export.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MarkdownEscaperTest {

    @Test
    void escape_prefixesEveryControlCharacter() {
        assertEquals("\\*bold\\* \\_it\\_ \\[link\\]\\(url\\) \\#1\\!",
                MarkdownEscaper.escape("*bold* _it_ [link](url) #1!"));
    }

    @Test
    void escape_handlesBackslashAndBackticks() {
        assertEquals("a\\\\b \\`code\\`", MarkdownEscaper.escape("a\\b `code`"));
    }

    @Test
    void escape_plainTextIsUnchanged() {
        assertEquals("Call me Ishmael", MarkdownEscaper.escape("Call me Ishmael"));
    }

    @Test
    void escape_nullBecomesEmpty() {
        assertEquals("", MarkdownEscaper.escape(null));
    }
}
