package io.github.cyfko.celldl.core.recovery;

import io.github.cyfko.celldl.core.diagnostics.SuggestedFix;

import java.util.Objects;

/**
 * Outcome of a matching {@link ErrorPattern}.
 *
 * @param patternName name of the pattern that produced it
 * @param hint        advice for the author
 * @param fix         machine-applicable edit, {@code null} when the pattern can only advise
 */
public record RecoverySuggestion(String patternName, String hint, SuggestedFix fix) {

    public RecoverySuggestion {
        Objects.requireNonNull(patternName, "patternName");
        Objects.requireNonNull(hint, "hint");
    }

    public boolean hasFix() {
        return fix != null;
    }
}
