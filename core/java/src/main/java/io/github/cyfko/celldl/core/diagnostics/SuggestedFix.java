package io.github.cyfko.celldl.core.diagnostics;

import java.util.Objects;

/**
 * Text edit proposed to repair a diagnostic: replace the source range
 * {@code [startOffset, endOffset)} with {@code replacement}. An empty range is an insertion.
 *
 * @param description human wording of the edit, e.g. "Add missing '}'"
 * @param replacement text to put in place of the range
 * @param startOffset 0-based start offset, inclusive
 * @param endOffset   0-based end offset, exclusive
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SuggestedFix(String description, String replacement, int startOffset, int endOffset) {

    public SuggestedFix {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(replacement, "replacement");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                    String.format("Invalid fix range [%d, %d)", startOffset, endOffset));
        }
    }

    /** Insertion of {@code text} at {@code offset}. */
    public static SuggestedFix insert(String description, String text, int offset) {
        return new SuggestedFix(description, text, offset, offset);
    }

    public boolean isInsertion() {
        return startOffset == endOffset;
    }

    /**
     * Applies the edit to {@code source}.
     *
     * @throws IllegalArgumentException when the range lies outside the source
     */
    public String applyTo(String source) {
        if (endOffset > source.length()) {
            throw new IllegalArgumentException(
                    String.format("Fix range [%d, %d) exceeds source length %d", startOffset, endOffset, source.length()));
        }
        return source.substring(0, startOffset) + replacement + source.substring(endOffset);
    }
}
