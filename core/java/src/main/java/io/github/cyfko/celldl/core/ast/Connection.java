package io.github.cyfko.celldl.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed edge between two endpoints. A chain {@code A -> B -> C} is stored as two edges.
 *
 * @param direction  direction relative to the cell boundary, may be {@code null}
 * @param source     source endpoint
 * @param target     target endpoint
 * @param attributes edge attributes, a flow label included under {@code label}
 */
public record Connection(
        ConnectionDirection direction,
        ConnectionEndpoint source,
        ConnectionEndpoint target,
        Map<String, AttributeValue> attributes
) {

    public Connection {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Label attribute as text, or {@code null}. */
    public String label() {
        AttributeValue value = attributes.get("label");
        return value instanceof AttributeValue.StringValue s ? s.value() : null;
    }
}
