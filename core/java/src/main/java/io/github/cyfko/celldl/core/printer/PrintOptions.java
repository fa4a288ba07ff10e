package io.github.cyfko.celldl.core.printer;

import java.util.Objects;

/**
 * Formatting knobs for {@link AstPrinter}.
 * <p>
 * Defaults: two-space indentation, {@code \n} line endings and a blank line between
 * top-level statements.
 * </p>
 */
public final class PrintOptions {

    private static final PrintOptions DEFAULTS = builder().build();

    private final String indent;
    private final String lineEnding;
    private final boolean blankLinesBetweenStatements;

    private PrintOptions(Builder builder) {
        this.indent = builder.indent;
        this.lineEnding = builder.lineEnding;
        this.blankLinesBetweenStatements = builder.blankLinesBetweenStatements;
    }

    public static PrintOptions defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public String getIndent() { return indent; }
    public String getLineEnding() { return lineEnding; }
    public boolean isBlankLinesBetweenStatements() { return blankLinesBetweenStatements; }

    /**
     * Builder for {@link PrintOptions}.
     */
    public static final class Builder {
        private String indent = "  ";
        private String lineEnding = "\n";
        private boolean blankLinesBetweenStatements = true;

        public Builder indent(String indent) {
            this.indent = Objects.requireNonNull(indent, "indent");
            return this;
        }

        public Builder lineEnding(String lineEnding) {
            Objects.requireNonNull(lineEnding, "lineEnding");
            if (lineEnding.isEmpty()) {
                throw new IllegalArgumentException("lineEnding must not be empty");
            }
            this.lineEnding = lineEnding;
            return this;
        }

        public Builder blankLinesBetweenStatements(boolean blankLines) {
            this.blankLinesBetweenStatements = blankLines;
            return this;
        }

        public PrintOptions build() { return new PrintOptions(this); }
    }
}
