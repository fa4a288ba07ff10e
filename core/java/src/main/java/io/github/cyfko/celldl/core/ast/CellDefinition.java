package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A cell: a bounded unit with its gateways, components and internal wiring.
 *
 * @param id          cell name
 * @param label       display label, may be {@code null}
 * @param cellType    cell type, {@link CellType#LOGIC} when not written
 * @param gateways    gateways in source order
 * @param components  components, clusters and placeholders in source order
 * @param connections connections between components of this cell
 */
public record CellDefinition(
        String id,
        String label,
        CellType cellType,
        List<GatewayDefinition> gateways,
        List<CellComponent> components,
        List<InternalConnection> connections
) implements Statement {

    public CellDefinition {
        Objects.requireNonNull(id, "id");
        cellType = cellType == null ? CellType.LOGIC : cellType;
        gateways = gateways == null ? List.of() : List.copyOf(gateways);
        components = components == null ? List.of() : List.copyOf(components);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /** First gateway, or {@code null} when the cell has none. */
    public GatewayDefinition gateway() {
        return gateways.isEmpty() ? null : gateways.get(0);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCell(this);
    }
}
