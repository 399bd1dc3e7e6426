package org.example.annotations.model;

/**
 * A reader selection already translated into canonical offsets.
 */
public record TextSelection(String text, int startOffset, int endOffset) {

    public static SelectionCheck validate(TextSelection selection) {
        if (selection == null) {
            return SelectionCheck.invalid("No text selected");
        }
        if (selection.text() == null || selection.text().trim().isEmpty()) {
            return SelectionCheck.invalid("Selection is empty");
        }
        if (selection.startOffset() < 0) {
            return SelectionCheck.invalid("Invalid start offset");
        }
        if (selection.endOffset() <= selection.startOffset()) {
            return SelectionCheck.invalid("Invalid selection range");
        }
        return SelectionCheck.ok();
    }

    public record SelectionCheck(boolean valid, String error) {

        static SelectionCheck ok() {
            return new SelectionCheck(true, null);
        }

        static SelectionCheck invalid(String error) {
            return new SelectionCheck(false, error);
        }
    }
}
