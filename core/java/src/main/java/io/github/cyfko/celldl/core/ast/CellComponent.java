package io.github.cyfko.celldl.core.ast;

/**
 * Element of a cell's component list.
 */
public sealed interface CellComponent permits ComponentDefinition, ClusterDefinition, ErrorNode {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitComponent(ComponentDefinition component);

        R visitCluster(ClusterDefinition cluster);

        R visitError(ErrorNode error);
    }
}
