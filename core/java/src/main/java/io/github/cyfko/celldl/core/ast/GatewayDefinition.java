package io.github.cyfko.celldl.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cell gateway.
 *
 * @param id         gateway name, {@value #DEFAULT_ID} when not written
 * @param position   side of the cell, may be {@code null}
 * @param direction  traffic direction, may be {@code null}
 * @param label      display label, may be {@code null}
 * @param exposes    exposed endpoint types, {@code [api]} when not written
 * @param policies   policy names
 * @param auth       authentication, may be {@code null}
 * @param attributes other properties (protocol, port, context, ...)
 * @param routes     routing rules
 */
public record GatewayDefinition(
        String id,
        GatewayPosition position,
        GatewayDirection direction,
        String label,
        List<EndpointType> exposes,
        List<String> policies,
        AuthConfig auth,
        Map<String, AttributeValue> attributes,
        List<GatewayRoute> routes
) {

    public static final String DEFAULT_ID = "gateway";

    public GatewayDefinition {
        id = id == null ? DEFAULT_ID : id;
        exposes = exposes == null || exposes.isEmpty() ? List.of(EndpointType.API) : List.copyOf(exposes);
        policies = policies == null ? List.of() : List.copyOf(policies);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        routes = routes == null ? List.of() : List.copyOf(routes);
    }
}
