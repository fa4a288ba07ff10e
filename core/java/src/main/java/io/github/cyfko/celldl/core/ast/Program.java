package io.github.cyfko.celldl.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the AST.
 * <p>
 * {@code name}, {@code version}, {@code description} and {@code properties} are only filled
 * for the {@code workspace} dialect ({@code name} also for {@code diagram}); a bare list of
 * statements leaves them {@code null} and empty.
 * </p>
 *
 * @param name        workspace or diagram name, may be {@code null}
 * @param version     workspace version, may be {@code null}
 * @param description workspace description, may be {@code null}
 * @param properties  workspace properties in source order
 * @param statements  statements in source order
 */
public record Program(
        String name,
        String version,
        String description,
        Map<String, AttributeValue> properties,
        List<Statement> statements
) {

    public Program {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static Program of(List<Statement> statements) {
        return new Program(null, null, null, Map.of(), statements);
    }

    public static Program empty() {
        return of(List.of());
    }
}
