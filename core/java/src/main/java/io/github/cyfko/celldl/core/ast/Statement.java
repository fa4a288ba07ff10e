package io.github.cyfko.celldl.core.ast;

/**
 * Top-level element of a {@link Program}.
 * <p>
 * The hierarchy is closed; {@link Visitor} gives exhaustive dispatch over it, so adding a
 * statement kind breaks every visitor at compile time rather than at run time.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Statement
        permits CellDefinition, ExternalDefinition, UserDefinition, ApplicationDefinition, ConnectionsBlock, ErrorNode {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitCell(CellDefinition cell);

        R visitExternal(ExternalDefinition external);

        R visitUser(UserDefinition user);

        R visitApplication(ApplicationDefinition application);

        R visitConnections(ConnectionsBlock connections);

        R visitError(ErrorNode error);
    }
}
