package org.example.annotations.service.export.pdf;

import java.util.ArrayList;
import java.util.List;

public final class TextWrapper {

    private TextWrapper() {
    }

    /**
     * Greedy word wrap. Words are never split: a word longer than {@code maxChars} sits alone on its own line.
     * Blank input yields no lines.
     */
    public static List<String> wrap(String text, int maxChars) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return lines;
        }
        StringBuilder current = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (current.length() == 0) {
                current.append(word);
            } else if (current.length() + 1 + word.length() <= maxChars) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
