package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * System outside the architecture.
 *
 * @param id           name
 * @param label        display label, may be {@code null}
 * @param externalType kind, {@link ExternalType#SAAS} when not written
 * @param provides     endpoint types it offers
 */
public record ExternalDefinition(String id, String label, ExternalType externalType, List<EndpointType> provides)
        implements Statement {

    public ExternalDefinition {
        Objects.requireNonNull(id, "id");
        externalType = externalType == null ? ExternalType.SAAS : externalType;
        provides = provides == null ? List.of() : List.copyOf(provides);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExternal(this);
    }
}
