package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Application composed of cells.
 *
 * @param id      name
 * @param label   display label, may be {@code null}
 * @param version version, may be {@code null}
 * @param cells   names of the member cells
 * @param gateway application gateway, may be {@code null}
 */
public record ApplicationDefinition(
        String id,
        String label,
        String version,
        List<String> cells,
        GatewayDefinition gateway
) implements Statement {

    public ApplicationDefinition {
        Objects.requireNonNull(id, "id");
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitApplication(this);
    }
}
