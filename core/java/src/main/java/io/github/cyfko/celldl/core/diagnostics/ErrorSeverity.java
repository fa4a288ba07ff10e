package io.github.cyfko.celldl.core.diagnostics;

/**
 * Severity of a diagnostic. Declaration order is the sort order used by {@link ErrorCollector}.
 */
public enum ErrorSeverity {
    ERROR(1, 8, "ERROR"),
    WARNING(2, 4, "WARN "),
    INFO(3, 2, "INFO ");

    private final int lspSeverity;
    private final int markerSeverity;
    private final String prefix;

    ErrorSeverity(int lspSeverity, int markerSeverity, String prefix) {
        this.lspSeverity = lspSeverity;
        this.markerSeverity = markerSeverity;
        this.prefix = prefix;
    }

    /** Language-server severity: 1 error, 2 warning, 3 information. */
    public int lspSeverity() {
        return lspSeverity;
    }

    /** Editor marker severity: 8 error, 4 warning, 2 info. */
    public int markerSeverity() {
        return markerSeverity;
    }

    String prefix() {
        return prefix;
    }
}
