package com.demo.churn.service.explain;

import java.util.List;

/**
 * Reason outcome for one row: either the rendered phrases, or a fallback text
 * when explaining the row failed.
 */
public record RowExplanation(List<String> phrases, String fallback, boolean degraded) {

    public static final String SEPARATOR = "; ";

    public RowExplanation {
        phrases = List.copyOf(phrases);
    }

    public static RowExplanation explained(List<String> phrases, String fallback) {
        return new RowExplanation(phrases, fallback, false);
    }

    public static RowExplanation degraded(String fallback) {
        return new RowExplanation(List.of(), fallback, true);
    }

    public static RowExplanation none() {
        return new RowExplanation(List.of(), "", false);
    }

    public String text() {
        return phrases.isEmpty() ? fallback : String.join(SEPARATOR, phrases);
    }
}
