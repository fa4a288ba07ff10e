package io.github.cyfko.celldl.core.ast;

import java.util.Objects;

/**
 * Edge between two components of the same cell.
 *
 * @param label edge label, may be {@code null}
 */
public record InternalConnection(String source, String target, String label) {

    public InternalConnection {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
