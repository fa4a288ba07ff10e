package io.github.cyfko.celldl.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Component deployed in a cell.
 *
 * @param id            component name
 * @param componentType canonical type, aliases already resolved
 * @param attributes    attributes in source order, {@code sidecar} excluded
 * @param sidecars      sidecar names taken from the {@code sidecar} attribute
 * @param env           environment variables
 */
public record ComponentDefinition(
        String id,
        ComponentType componentType,
        Map<String, AttributeValue> attributes,
        List<String> sidecars,
        Map<String, String> env
) implements CellComponent {

    public ComponentDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(componentType, "componentType");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        sidecars = sidecars == null ? List.of() : List.copyOf(sidecars);
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    }

    public ComponentDefinition(String id, ComponentType componentType, Map<String, AttributeValue> attributes) {
        this(id, componentType, attributes, List.of(), Map.of());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComponent(this);
    }
}
