package io.github.cyfko.celldl.core.ast;

import io.github.cyfko.celldl.core.diagnostics.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Placeholder for a fragment the tolerant builder could not turn into a real node.
 * <p>
 * It stands where the statement or component would have been, so the rest of the program
 * keeps its shape. {@code partialData} holds whatever could still be read from the fragment,
 * typically its {@code id}.
 * </p>
 *
 * @param code         diagnostic code describing the failure
 * @param message      human message
 * @param ruleName     grammar rule of the fragment
 * @param location     where the fragment starts
 * @param recoveryHint advice, may be {@code null}
 * @param partialData  recovered fields
 */
public record ErrorNode(
        ErrorCode code,
        String message,
        String ruleName,
        SourceLocation location,
        String recoveryHint,
        Map<String, Object> partialData
) implements Statement, CellComponent {

    public ErrorNode {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(location, "location");
        partialData = partialData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(partialData));
    }

    @Override
    public <R> R accept(Statement.Visitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public <R> R accept(CellComponent.Visitor<R> visitor) {
        return visitor.visitError(this);
    }
}
