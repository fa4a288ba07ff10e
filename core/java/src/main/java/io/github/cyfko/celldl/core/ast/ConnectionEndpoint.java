package io.github.cyfko.celldl.core.ast;

import java.util.Objects;

/**
 * End of a connection: an entity, optionally narrowed to one of its components
 * ({@code Orders.api}).
 *
 * @param entity    cell, external system or user name
 * @param component component name, may be {@code null}
 */
public record ConnectionEndpoint(String entity, String component) {

    public ConnectionEndpoint {
        Objects.requireNonNull(entity, "entity");
    }

    public static ConnectionEndpoint of(String entity) {
        return new ConnectionEndpoint(entity, null);
    }

    @Override
    public String toString() {
        return component == null ? entity : entity + "." + component;
    }
}
