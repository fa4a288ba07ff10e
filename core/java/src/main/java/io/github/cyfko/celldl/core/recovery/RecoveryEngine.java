package io.github.cyfko.celldl.core.recovery;

import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.parsing.SyntaxError;
import io.github.cyfko.celldl.core.utils.EditDistance;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs an ordered list of {@link ErrorPattern}s against a syntax error and returns the
 * suggestion of the first one that matches.
 * <p>
 * The engine holds no mutable state and may be shared between threads as long as its
 * patterns are stateless, which the {@linkplain ErrorPatterns#defaults() defaults} are.
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * RecoveryEngine engine = new RecoveryEngine();
 * for (SyntaxError error : tree.errors()) {
 *     EnhancedParseError diagnostic = DiagnosticMessages.fromSyntaxError(error, tree.tokens());
 *     collector.add(engine.enhance(diagnostic, error, tree.tokens()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecoveryEngine {

    private static final Logger log = Logger.getLogger(RecoveryEngine.class.getName());

    private final List<ErrorPattern> patterns;

    /** Engine running the built-in detectors. */
    public RecoveryEngine() {
        this(ErrorPatterns.defaults());
    }

    public RecoveryEngine(List<ErrorPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        this.patterns = List.copyOf(patterns);
    }

    public List<ErrorPattern> patterns() {
        return patterns;
    }

    /**
     * Suggestion of the first matching pattern.
     */
    public Optional<RecoverySuggestion> suggest(PatternContext context) {
        for (ErrorPattern pattern : patterns) {
            if (pattern.matches(context)) {
                RecoverySuggestion suggestion = pattern.suggest(context);
                log.fine(() -> String.format("Pattern '%s' matched at token %d", pattern.name(), context.position()));
                return Optional.ofNullable(suggestion);
            }
        }
        return Optional.empty();
    }

    public Optional<RecoverySuggestion> suggest(List<Token> tokens, SyntaxError error) {
        return suggest(PatternContext.of(tokens, error));
    }

    /**
     * Replaces the default hint of {@code diagnostic} with the matching pattern's hint and
     * attaches its fix. The diagnostic is returned unchanged when no pattern matches.
     */
    public EnhancedParseError enhance(EnhancedParseError diagnostic, SyntaxError error, List<Token> tokens) {
        Optional<RecoverySuggestion> suggestion = suggest(tokens, error);
        if (suggestion.isEmpty()) {
            return diagnostic;
        }
        EnhancedParseError enhanced = diagnostic.withRecoveryHint(suggestion.get().hint());
        if (suggestion.get().hasFix()) {
            enhanced = enhanced.withSuggestedFix(suggestion.get().fix());
        }
        return enhanced;
    }

    /**
     * Closest vocabulary word to {@code input} within {@code maxDistance} edits.
     *
     * @return the match, or {@code null}
     * @see EditDistance#findClosestMatch(String, List, int)
     */
    public static String findClosestMatch(String input, List<String> candidates, int maxDistance) {
        return EditDistance.findClosestMatch(input, candidates, maxDistance);
    }

    public static String findClosestMatch(String input, List<String> candidates) {
        return EditDistance.findClosestMatch(input, candidates);
    }
}
