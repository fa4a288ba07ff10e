package io.github.cyfko.celldl.core.diagnostics;

/**
 * Diagnostic shaped for the language server protocol: 0-based positions, severity
 * 1 (error), 2 (warning) or 3 (information), numeric code and a fixed source name.
 *
 * @param range    affected range
 * @param message  message, followed by the recovery hint when there is one
 * @param severity LSP severity
 * @param code     numeric error code
 * @param source   always {@value #SOURCE}
 */
public record LspDiagnostic(Range range, String message, int severity, int code, String source) {

    public static final String SOURCE = "CellDL";

    public record Range(Position start, Position end) {
    }

    public record Position(int line, int character) {
    }
}
