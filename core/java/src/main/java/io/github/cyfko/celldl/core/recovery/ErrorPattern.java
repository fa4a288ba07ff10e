package io.github.cyfko.celldl.core.recovery;

/**
 * Detector for one recurring authoring mistake.
 * <p>
 * {@link #suggest(PatternContext)} is only called after {@link #matches(PatternContext)}
 * returned {@code true} for the same context.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ErrorPatterns
 */
public interface ErrorPattern {

    /** Stable name, used in logs and reported in {@link RecoverySuggestion#patternName()}. */
    String name();

    boolean matches(PatternContext context);

    RecoverySuggestion suggest(PatternContext context);
}
