package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Actor of the system.
 *
 * @param userType kind, {@link UserType#EXTERNAL} when not written
 * @param channels channels the actor uses (web, mobile, ...)
 */
public record UserDefinition(String id, String label, UserType userType, List<String> channels) implements Statement {

    public UserDefinition {
        Objects.requireNonNull(id, "id");
        userType = userType == null ? UserType.EXTERNAL : userType;
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUser(this);
    }
}
