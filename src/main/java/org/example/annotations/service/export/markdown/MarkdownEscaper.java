package org.example.annotations.service.export.markdown;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MarkdownEscaper {

    private static final Pattern SPECIAL_CHARACTERS = Pattern.compile("([\\\\`*_{}\\[\\]()#+\\-.!])");

    private MarkdownEscaper() {
    }

    /**
     * Backslash-prefixes every Markdown control character. Single pass: already escaped text is escaped again.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return SPECIAL_CHARACTERS.matcher(text).replaceAll(Matcher.quoteReplacement("\\") + "$1");
    }
}
