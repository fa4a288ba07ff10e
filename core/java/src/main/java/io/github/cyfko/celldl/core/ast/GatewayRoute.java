package io.github.cyfko.celldl.core.ast;

import java.util.Objects;

/**
 * Routing rule of a gateway: requests matching {@code path} go to {@code target}.
 */
public record GatewayRoute(String path, ConnectionEndpoint target) {

    public GatewayRoute {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(target, "target");
    }
}
