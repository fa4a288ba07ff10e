package io.github.cyfko.celldl.core.ast;

import java.util.List;

/**
 * {@code connections { ... }} block, or a {@code flow} block once desugared.
 *
 * @param name        flow name, {@code null} for a plain connections block
 * @param connections edges in source order
 */
public record ConnectionsBlock(String name, List<Connection> connections) implements Statement {

    public ConnectionsBlock {
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    public boolean isFlow() {
        return name != null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConnections(this);
    }
}
