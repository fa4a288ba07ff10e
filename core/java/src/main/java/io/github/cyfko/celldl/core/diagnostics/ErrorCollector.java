package io.github.cyfko.celldl.core.diagnostics;

import io.github.cyfko.celldl.core.lexer.LexError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Accumulates diagnostics for one parse.
 * <p>
 * Diagnostics are keyed by {@code line:column:code}; a second diagnostic for the same key only
 * replaces the first one when it carries more help: a suggested fix beats no fix, then a hint
 * beats no hint, then a longer expected-token list wins. Every view is sorted by severity
 * (errors first), then line, then column.
 * </p>
 * <p>
 * A collector is not thread-safe and is meant to be used for a single source text.
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * ErrorCollector collector = new ErrorCollector();
 * collector.addLexErrors(lexResult.errors());
 * collector.add(error);
 * System.out.println(collector.format());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ErrorCollector {

    private static final Comparator<EnhancedParseError> ORDER = Comparator
            .comparing((EnhancedParseError e) -> e.severity().ordinal())
            .thenComparingInt(EnhancedParseError::line)
            .thenComparingInt(EnhancedParseError::column);

    private final Map<String, EnhancedParseError> errors = new LinkedHashMap<>();
    private final Deque<String> ruleStack = new ArrayDeque<>();

    // ------------------------------------------------------------------
    // rule context
    // ------------------------------------------------------------------

    public void enterRule(String ruleName) {
        ruleStack.push(ruleName);
    }

    public void exitRule() {
        ruleStack.poll();
    }

    /**
     * @return innermost rule entered, or {@code null} outside any rule
     */
    public String currentRule() {
        return ruleStack.peek();
    }

    // ------------------------------------------------------------------
    // addition
    // ------------------------------------------------------------------

    /**
     * Adds a diagnostic. One lacking a rule name is attributed to the {@linkplain #currentRule() current rule}.
     */
    public void add(EnhancedParseError error) {
        if (error.ruleName() == null && currentRule() != null) {
            error = error.withRuleName(currentRule());
        }
        String key = error.line() + ":" + error.column() + ":" + error.code().code();
        EnhancedParseError existing = errors.get(key);
        if (existing == null || isRicher(error, existing)) {
            errors.put(key, error);
        }
    }

    public void addAll(List<EnhancedParseError> diagnostics) {
        diagnostics.forEach(this::add);
    }

    public void addLexErrors(List<LexError> lexErrors) {
        for (LexError lexError : lexErrors) {
            add(DiagnosticMessages.fromLexError(lexError));
        }
    }

    private static boolean isRicher(EnhancedParseError candidate, EnhancedParseError existing) {
        boolean candidateFix = candidate.suggestedFix() != null;
        if (candidateFix != (existing.suggestedFix() != null)) {
            return candidateFix;
        }
        boolean candidateHint = candidate.recoveryHint() != null;
        if (candidateHint != (existing.recoveryHint() != null)) {
            return candidateHint;
        }
        return existing.expectedTokens().size() < candidate.expectedTokens().size();
    }

    public void clear() {
        errors.clear();
        ruleStack.clear();
    }

    // ------------------------------------------------------------------
    // views
    // ------------------------------------------------------------------

    /** All diagnostics, deduplicated and sorted. */
    public List<EnhancedParseError> getErrors() {
        List<EnhancedParseError> sorted = new ArrayList<>(errors.values());
        sorted.sort(ORDER);
        return sorted;
    }

    /** Diagnostics of severity {@link ErrorSeverity#ERROR} only. */
    public List<EnhancedParseError> getErrorsOnly() {
        return getErrors().stream()
                .filter(EnhancedParseError::isError)
                .collect(Collectors.toList());
    }

    public Map<Integer, List<EnhancedParseError>> getErrorsByLine() {
        Map<Integer, List<EnhancedParseError>> byLine = new TreeMap<>();
        for (EnhancedParseError error : getErrors()) {
            byLine.computeIfAbsent(error.line(), k -> new ArrayList<>()).add(error);
        }
        return byLine;
    }

    public Map<ErrorCategory, List<EnhancedParseError>> getErrorsByCategory() {
        Map<ErrorCategory, List<EnhancedParseError>> byCategory = new EnumMap<>(ErrorCategory.class);
        for (EnhancedParseError error : getErrors()) {
            byCategory.computeIfAbsent(error.category(), k -> new ArrayList<>()).add(error);
        }
        return byCategory;
    }

    /** Diagnostics starting on a line of {@code [startLine, endLine]}. */
    public List<EnhancedParseError> getErrorsInRange(int startLine, int endLine) {
        return getErrors().stream()
                .filter(e -> e.line() >= startLine && e.line() <= endLine)
                .collect(Collectors.toList());
    }

    /** Most important diagnostic, if any. */
    public Optional<EnhancedParseError> getFirstError() {
        List<EnhancedParseError> sorted = getErrors();
        return sorted.isEmpty() ? Optional.empty() : Optional.of(sorted.get(0));
    }

    public int getErrorCount() {
        return errors.size();
    }

    /** Whether any diagnostic, of any severity, was collected. */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Whether a diagnostic of severity {@link ErrorSeverity#ERROR} was collected. */
    public boolean hasFatalErrors() {
        return errors.values().stream().anyMatch(EnhancedParseError::isError);
    }

    // ------------------------------------------------------------------
    // projections
    // ------------------------------------------------------------------

    public List<EditorMarker> toEditorMarkers() {
        List<EditorMarker> markers = new ArrayList<>();
        for (EnhancedParseError error : getErrors()) {
            markers.add(new EditorMarker(
                    error.line(), error.column(), error.endLine(), error.endColumn(),
                    messageWithHint(error), error.severity().markerSeverity(),
                    String.valueOf(error.code().code())));
        }
        return markers;
    }

    public List<LspDiagnostic> toLspDiagnostics() {
        List<LspDiagnostic> diagnostics = new ArrayList<>();
        for (EnhancedParseError error : getErrors()) {
            LspDiagnostic.Range range = new LspDiagnostic.Range(
                    new LspDiagnostic.Position(error.line() - 1, error.column() - 1),
                    new LspDiagnostic.Position(error.endLine() - 1, error.endColumn() - 1));
            diagnostics.add(new LspDiagnostic(range, messageWithHint(error),
                    error.severity().lspSeverity(), error.code().code(), LspDiagnostic.SOURCE));
        }
        return diagnostics;
    }

    /**
     * Human report, one line per diagnostic and an indented hint line when there is one.
     *
     * @return the report, empty when nothing was collected
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (EnhancedParseError error : getErrors()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(error.severity().prefix())
                    .append(" [").append(error.line()).append(':').append(error.column()).append("] ")
                    .append(error.message());
            if (error.recoveryHint() != null) {
                sb.append("\n       Hint: ").append(error.recoveryHint());
            }
        }
        return sb.toString();
    }

    private static String messageWithHint(EnhancedParseError error) {
        return error.recoveryHint() == null
                ? error.message()
                : error.message() + "\n\nHint: " + error.recoveryHint();
    }
}
