package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Group of replicated components.
 *
 * @param id          cluster name
 * @param clusterType type of the replicated components, may be {@code null}
 * @param replicas    replica count, may be {@code null}
 * @param components  member components
 */
public record ClusterDefinition(
        String id,
        ComponentType clusterType,
        Integer replicas,
        List<ComponentDefinition> components
) implements CellComponent {

    public ClusterDefinition {
        Objects.requireNonNull(id, "id");
        components = components == null ? List.of() : List.copyOf(components);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCluster(this);
    }
}
