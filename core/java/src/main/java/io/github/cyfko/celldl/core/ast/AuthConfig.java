package io.github.cyfko.celldl.core.ast;

import java.util.Objects;

/**
 * Gateway authentication.
 *
 * @param authType  authentication style
 * @param reference identity provider of a federated gateway, may be {@code null}
 */
public record AuthConfig(AuthType authType, String reference) {

    public AuthConfig {
        Objects.requireNonNull(authType, "authType");
    }
}
