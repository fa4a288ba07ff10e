package io.github.cyfko.celldl.core.diagnostics;

/**
 * Diagnostic shaped for an in-browser code editor: 1-based positions, marker severity
 * 8 (error), 4 (warning) or 2 (info), and a textual code.
 */
public record EditorMarker(
        int startLineNumber,
        int startColumn,
        int endLineNumber,
        int endColumn,
        String message,
        int severity,
        String code
) {
}
