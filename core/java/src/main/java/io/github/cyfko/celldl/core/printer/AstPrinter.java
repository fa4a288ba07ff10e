package io.github.cyfko.celldl.core.printer;

import io.github.cyfko.celldl.core.ast.ApplicationDefinition;
import io.github.cyfko.celldl.core.ast.AttributeValue;
import io.github.cyfko.celldl.core.ast.AuthConfig;
import io.github.cyfko.celldl.core.ast.AuthType;
import io.github.cyfko.celldl.core.ast.CellComponent;
import io.github.cyfko.celldl.core.ast.CellDefinition;
import io.github.cyfko.celldl.core.ast.ClusterDefinition;
import io.github.cyfko.celldl.core.ast.ComponentDefinition;
import io.github.cyfko.celldl.core.ast.Connection;
import io.github.cyfko.celldl.core.ast.ConnectionEndpoint;
import io.github.cyfko.celldl.core.ast.ConnectionsBlock;
import io.github.cyfko.celldl.core.ast.EndpointType;
import io.github.cyfko.celldl.core.ast.ErrorNode;
import io.github.cyfko.celldl.core.ast.ExternalDefinition;
import io.github.cyfko.celldl.core.ast.GatewayDefinition;
import io.github.cyfko.celldl.core.ast.GatewayRoute;
import io.github.cyfko.celldl.core.ast.InternalConnection;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.ast.Statement;
import io.github.cyfko.celldl.core.ast.UserDefinition;
import io.github.cyfko.celldl.core.lexer.Keywords;
import io.github.cyfko.celldl.core.utils.StringEscapes;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns an AST back into CellDL source.
 * <p>
 * The output is canonical rather than faithful to the original layout: cell components are
 * grouped in a {@code components} block, every property is written with a colon and every
 * string value is quoted. Parsing the output yields a structurally equal AST.
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * Program program = CellDl.parseOrThrow(source);
 * String formatted = AstPrinter.stringify(program, PrintOptions.builder().indent("    ").build());
 * }</pre>
 *
 * <p>
 * Error placeholders have no source form; they are written as line comments so that the
 * output of a tolerant parse can still be shown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstPrinter {

    private static final Pattern BARE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_-]*");

    private AstPrinter() {}

    public static String stringify(Program program) {
        return stringify(program, PrintOptions.defaults());
    }

    public static String stringify(Program program, PrintOptions options) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(options, "options");
        Writer writer = new Writer(options);
        writer.program(program);
        return writer.result();
    }

    /**
     * Source form of a name: bare when it lexes as a plain identifier, quoted otherwise.
     */
    public static String name(String name) {
        if (BARE_NAME.matcher(name).matches() && !Keywords.isReserved(name)) {
            return name;
        }
        return StringEscapes.quote(name);
    }

    /**
     * Source form of an attribute value.
     */
    public static String value(AttributeValue value) {
        if (value instanceof AttributeValue.StringValue s) {
            return StringEscapes.quote(s.value());
        }
        if (value instanceof AttributeValue.NumberValue n) {
            if (n.isInteger()) {
                return n.value().toString();
            }
            // a whole float keeps its point so it reads back as a float
            String plain = BigDecimal.valueOf(n.value().doubleValue()).toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        if (value instanceof AttributeValue.BooleanValue b) {
            return String.valueOf(b.value());
        }
        AttributeValue.ListValue list = (AttributeValue.ListValue) value;
        return list.values().stream()
                .map(StringEscapes::quote)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static final class Writer implements Statement.Visitor<Void>, CellComponent.Visitor<Void> {

        private final PrintOptions options;
        private final List<String> lines = new ArrayList<>();
        private int depth;

        Writer(PrintOptions options) {
            this.options = options;
        }

        String result() {
            return String.join(options.getLineEnding(), lines).trim() + options.getLineEnding();
        }

        void program(Program program) {
            boolean wrapped = program.name() != null;
            if (wrapped) {
                line("workspace " + name(program.name()) + " {");
                depth++;
                if (program.version() != null) {
                    line("version: " + StringEscapes.quote(program.version()));
                }
                if (program.description() != null) {
                    line("description: " + StringEscapes.quote(program.description()));
                }
                program.properties().forEach((key, value) -> line("property " + key + ": " + value(value)));
                if (program.version() != null || program.description() != null || !program.properties().isEmpty()) {
                    separate();
                }
            }
            for (Statement statement : program.statements()) {
                statement.accept(this);
                separate();
            }
            if (wrapped) {
                if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
                    lines.remove(lines.size() - 1);
                }
                depth--;
                line("}");
            }
        }

        // statements

        @Override
        public Void visitCell(CellDefinition cell) {
            line("cell " + name(cell.id()) + " {");
            depth++;
            if (cell.label() != null) {
                line("label: " + StringEscapes.quote(cell.label()));
            }
            line("type: " + cell.cellType().keyword());
            for (GatewayDefinition gateway : cell.gateways()) {
                blank();
                gateway(gateway);
            }
            if (!cell.components().isEmpty()) {
                blank();
                block("components", () -> cell.components().forEach(c -> c.accept(this)));
            }
            if (!cell.connections().isEmpty()) {
                blank();
                block("connections", () -> cell.connections().forEach(this::internalConnection));
            }
            depth--;
            line("}");
            return null;
        }

        @Override
        public Void visitExternal(ExternalDefinition external) {
            line("external " + name(external.id()) + " {");
            depth++;
            if (external.label() != null) {
                line("label: " + StringEscapes.quote(external.label()));
            }
            line("type: " + external.externalType().keyword());
            if (!external.provides().isEmpty()) {
                line("provides: " + endpointTypes(external.provides()));
            }
            depth--;
            line("}");
            return null;
        }

        @Override
        public Void visitUser(UserDefinition user) {
            line("user " + name(user.id()) + " {");
            depth++;
            if (user.label() != null) {
                line("label: " + StringEscapes.quote(user.label()));
            }
            line("type: " + user.userType().keyword());
            if (!user.channels().isEmpty()) {
                line("channels: " + names(user.channels()));
            }
            depth--;
            line("}");
            return null;
        }

        @Override
        public Void visitApplication(ApplicationDefinition application) {
            line("application " + name(application.id()) + " {");
            depth++;
            if (application.label() != null) {
                line("label: " + StringEscapes.quote(application.label()));
            }
            if (application.version() != null) {
                line("version: " + StringEscapes.quote(application.version()));
            }
            if (!application.cells().isEmpty()) {
                line("cells: " + names(application.cells()));
            }
            if (application.gateway() != null) {
                blank();
                gateway(application.gateway());
            }
            depth--;
            line("}");
            return null;
        }

        @Override
        public Void visitConnections(ConnectionsBlock connections) {
            String header = connections.isFlow() ? "flow " + name(connections.name()) : "connections";
            block(header, () -> connections.connections().forEach(this::connection));
            return null;
        }

        @Override
        public Void visitError(ErrorNode error) {
            line("// " + error.code().codeName() + ": " + error.message().replace('\n', ' ').replace('\r', ' '));
            return null;
        }

        // cell content

        @Override
        public Void visitComponent(ComponentDefinition component) {
            Map<String, AttributeValue> attributes = new LinkedHashMap<>(component.attributes());
            if (!component.sidecars().isEmpty()) {
                attributes.put("sidecar", new AttributeValue.ListValue(component.sidecars()));
            }
            String head = component.componentType().keyword() + " " + name(component.id());
            if (component.env().isEmpty()) {
                line(head + attributeList(attributes));
                return null;
            }
            block(head, () -> {
                attributes.forEach((key, value) -> line(key + ": " + value(value)));
                block("env", () -> component.env().forEach(
                        (key, value) -> line(name(key) + " = " + StringEscapes.quote(value))));
            });
            return null;
        }

        @Override
        public Void visitCluster(ClusterDefinition cluster) {
            block("cluster " + name(cluster.id()), () -> {
                if (cluster.clusterType() != null) {
                    line("type: " + cluster.clusterType().keyword());
                }
                if (cluster.replicas() != null) {
                    line("replicas: " + cluster.replicas());
                }
                cluster.components().forEach(this::visitComponent);
            });
            return null;
        }

        private void gateway(GatewayDefinition gateway) {
            StringBuilder head = new StringBuilder("gateway");
            if (!GatewayDefinition.DEFAULT_ID.equals(gateway.id())) {
                head.append(' ').append(name(gateway.id()));
            }
            if (gateway.direction() != null) {
                head.append(' ').append(gateway.direction().keyword());
            }
            block(head.toString(), () -> {
                if (gateway.label() != null) {
                    line("label: " + StringEscapes.quote(gateway.label()));
                }
                if (gateway.position() != null) {
                    line("position: " + gateway.position().keyword());
                }
                if (!gateway.exposes().equals(List.of(EndpointType.API))) {
                    line("exposes: " + endpointTypes(gateway.exposes()));
                }
                if (!gateway.policies().isEmpty()) {
                    line("policies: " + names(gateway.policies()));
                }
                if (gateway.auth() != null) {
                    line("auth: " + auth(gateway.auth()));
                }
                gateway.attributes().forEach((key, value) -> line(key + ": " + value(value)));
                for (GatewayRoute route : gateway.routes()) {
                    line("route " + StringEscapes.quote(route.path()) + " -> " + endpoint(route.target()));
                }
            });
        }

        private void internalConnection(InternalConnection connection) {
            String text = name(connection.source()) + " -> " + name(connection.target());
            if (connection.label() != null) {
                text += " : " + StringEscapes.quote(connection.label());
            }
            line(text);
        }

        private void connection(Connection connection) {
            StringBuilder text = new StringBuilder();
            if (connection.direction() != null) {
                text.append(connection.direction().keyword()).append(' ');
            }
            text.append(endpoint(connection.source())).append(" -> ").append(endpoint(connection.target()));
            Map<String, AttributeValue> attributes = new LinkedHashMap<>(connection.attributes());
            if (attributes.get("label") instanceof AttributeValue.StringValue label) {
                attributes.remove("label");
                text.append(" : ").append(StringEscapes.quote(label.value()));
            }
            text.append(attributeList(attributes));
            line(text.toString());
        }

        // fragments

        private static String auth(AuthConfig auth) {
            if (auth.authType() == AuthType.LOCAL_STS || auth.reference() == null) {
                return auth.authType().keyword();
            }
            String reference = auth.reference();
            int dot = reference.indexOf('.');
            String target = dot < 0
                    ? name(reference)
                    : name(reference.substring(0, dot)) + "." + name(reference.substring(dot + 1));
            return auth.authType().keyword() + "(" + target + ")";
        }

        private static String endpoint(ConnectionEndpoint endpoint) {
            return endpoint.component() == null
                    ? name(endpoint.entity())
                    : name(endpoint.entity()) + "." + name(endpoint.component());
        }

        private static String attributeList(Map<String, AttributeValue> attributes) {
            if (attributes.isEmpty()) {
                return "";
            }
            return attributes.entrySet().stream()
                    .map(e -> e.getKey() + ": " + value(e.getValue()))
                    .collect(Collectors.joining(", ", " [", "]"));
        }

        private static String endpointTypes(List<EndpointType> types) {
            return types.stream().map(EndpointType::keyword).collect(Collectors.joining(", ", "[", "]"));
        }

        private static String names(List<String> names) {
            return names.stream().map(AstPrinter::name).collect(Collectors.joining(", ", "[", "]"));
        }

        // layout

        private void block(String header, Runnable body) {
            line(header + " {");
            depth++;
            body.run();
            depth--;
            line("}");
        }

        private void line(String text) {
            lines.add(options.getIndent().repeat(depth) + text);
        }

        private void blank() {
            lines.add("");
        }

        private void separate() {
            if (options.isBlankLinesBetweenStatements()) {
                blank();
            }
        }
    }
}
