package io.github.cyfko.celldl.core.visitor;

import io.github.cyfko.celldl.core.ast.ApplicationDefinition;
import io.github.cyfko.celldl.core.ast.AttributeValue;
import io.github.cyfko.celldl.core.ast.AuthConfig;
import io.github.cyfko.celldl.core.ast.AuthType;
import io.github.cyfko.celldl.core.ast.CellComponent;
import io.github.cyfko.celldl.core.ast.CellDefinition;
import io.github.cyfko.celldl.core.ast.CellType;
import io.github.cyfko.celldl.core.ast.ClusterDefinition;
import io.github.cyfko.celldl.core.ast.ComponentDefinition;
import io.github.cyfko.celldl.core.ast.ComponentType;
import io.github.cyfko.celldl.core.ast.Connection;
import io.github.cyfko.celldl.core.ast.ConnectionDirection;
import io.github.cyfko.celldl.core.ast.ConnectionEndpoint;
import io.github.cyfko.celldl.core.ast.ConnectionsBlock;
import io.github.cyfko.celldl.core.ast.EndpointType;
import io.github.cyfko.celldl.core.ast.ExternalDefinition;
import io.github.cyfko.celldl.core.ast.ExternalType;
import io.github.cyfko.celldl.core.ast.GatewayDefinition;
import io.github.cyfko.celldl.core.ast.GatewayDirection;
import io.github.cyfko.celldl.core.ast.GatewayPosition;
import io.github.cyfko.celldl.core.ast.GatewayRoute;
import io.github.cyfko.celldl.core.ast.InternalConnection;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.ast.Statement;
import io.github.cyfko.celldl.core.ast.UserDefinition;
import io.github.cyfko.celldl.core.ast.UserType;
import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.exception.AstConstructionException;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.CstNode;
import io.github.cyfko.celldl.core.parsing.GrammarRule;
import io.github.cyfko.celldl.core.utils.StringEscapes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Template for turning a concrete syntax tree into the AST.
 * <p>
 * The walk itself is shared; subclasses decide what happens when a fragment cannot be built by
 * implementing the boundary hooks. A boundary wraps the construction of one program, statement
 * or cell component, and {@link #report(AstConstructionException)} receives problems that do not
 * invalidate the enclosing fragment.
 * </p>
 *
 * <h2>Construction rules</h2>
 * <ul>
 *   <li>Names written as string literals are unquoted and unescaped</li>
 *   <li>Component type aliases ({@code ms}, {@code fn}, {@code db}) resolve to their canonical type</li>
 *   <li>Missing cell types default to {@code logic}, component types to {@code microservice}</li>
 *   <li>A chain {@code A -> B -> C} yields one edge per arrow; its label goes on the last edge</li>
 *   <li>A {@code sidecar} attribute is moved out of the attribute map into the sidecar list</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link StrictAstBuilder}: the first problem escapes as an {@link AstConstructionException}</li>
 *   <li>{@link TolerantAstBuilder}: problems become {@link io.github.cyfko.celldl.core.ast.ErrorNode}s
 *       and diagnostics, the result is always a program</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AstBuilder {

    private static final String SIDECAR = "sidecar";
    private static final String LABEL = "label";

    /**
     * Builds the AST rooted at a {@code program} node.
     *
     * @param root CST root produced by {@link io.github.cyfko.celldl.core.parsing.GrammarParser}
     * @return the program
     */
    public final Program build(CstNode root) {
        Objects.requireNonNull(root, "root");
        if (root.rule() != GrammarRule.PROGRAM) {
            throw new IllegalArgumentException("Expected a program node, got " + root.rule().ruleName());
        }
        reset();
        return programBoundary(root, () -> program(root));
    }

    /** Called before each build. */
    protected void reset() {
    }

    protected abstract Program programBoundary(CstNode node, Supplier<Program> body);

    protected abstract Statement statementBoundary(CstNode node, Supplier<Statement> body);

    protected abstract CellComponent componentBoundary(CstNode node, Supplier<CellComponent> body);

    /**
     * Receives a problem that only affects a detail of the fragment being built.
     */
    protected abstract void report(AstConstructionException problem);

    /**
     * Whether parts missing from a recovered node (a property without value, a connection
     * without target) are silently dropped instead of failing.
     */
    protected abstract boolean tolerateIncomplete();

    // ------------------------------------------------------------------
    // program
    // ------------------------------------------------------------------

    private Program program(CstNode root) {
        String name = null;
        String version = null;
        String description = null;
        Map<String, AttributeValue> properties = new LinkedHashMap<>();
        List<Statement> statements = new ArrayList<>();

        CstNode workspace = root.node("workspace");
        CstNode diagram = root.node("diagram");
        if (workspace != null) {
            name = optionalName(workspace.token("name"));
            version = lastValue(workspace.nodes("version"));
            description = lastValue(workspace.nodes("description"));
            for (CstNode property : workspace.nodes("property")) {
                CstNode inner = property.node("property");
                if (inner != null) {
                    property(inner, properties);
                }
            }
            statements(workspace, statements);
        } else if (diagram != null) {
            name = optionalName(diagram.token("name"));
            statements(diagram, statements);
        }
        statements(root, statements);
        return new Program(name, version, description, properties, statements);
    }

    private void statements(CstNode parent, List<Statement> statements) {
        for (CstNode node : parent.nodes("statement")) {
            statements.add(statementBoundary(node, () -> statement(node)));
        }
    }

    private Statement statement(CstNode node) {
        return switch (node.rule()) {
            case CELL_DEFINITION -> cell(node);
            case EXTERNAL_DEFINITION -> external(node);
            case USER_DEFINITION -> user(node);
            case APPLICATION_DEFINITION -> application(node);
            case CONNECTIONS_BLOCK, FLOW_BLOCK -> connections(node);
            default -> throw new AstConstructionException(ErrorCode.UNEXPECTED_TOKEN,
                    "Unexpected statement " + node.rule().ruleName(), node.firstToken());
        };
    }

    // ------------------------------------------------------------------
    // cells
    // ------------------------------------------------------------------

    private CellDefinition cell(CstNode node) {
        String id = requireName(node, ErrorCode.INCOMPLETE_CELL_DEFINITION, "Cell");
        String label = lastValue(node.nodes("label"));

        CellType cellType = null;
        for (CstNode type : node.nodes("type")) {
            Token value = type.token("value");
            if (value != null) {
                cellType = CellType.fromKeyword(word(value));
            }
        }

        List<GatewayDefinition> gateways = new ArrayList<>();
        for (CstNode gateway : node.nodes("gateway")) {
            gateways.add(gateway(gateway));
        }

        List<CstNode> componentNodes = new ArrayList<>(node.nodes("component"));
        for (CstNode block : node.nodes("components")) {
            componentNodes.addAll(block.nodes("component"));
        }
        componentNodes.sort(Comparator.comparingInt(AstBuilder::startOffset));
        List<CellComponent> components = new ArrayList<>();
        for (CstNode component : componentNodes) {
            components.add(componentBoundary(component, () -> cellComponent(component)));
        }

        List<InternalConnection> connections = new ArrayList<>();
        for (CstNode block : node.nodes("connections")) {
            for (CstNode connection : block.nodes("connection")) {
                internalConnections(connection, connections);
            }
        }
        return new CellDefinition(id, label, cellType, gateways, components, connections);
    }

    private void internalConnections(CstNode node, List<InternalConnection> out) {
        List<String> names = new ArrayList<>();
        for (CstNode endpoint : node.nodes("endpoint")) {
            if (endpoint.has("dot")) {
                report(new AstConstructionException(ErrorCode.UNEXPECTED_TOKEN,
                        "Connections inside a cell link its components by name; dotted references are not allowed",
                        endpoint.token("dot")));
                return;
            }
            Token entity = endpoint.token("entity");
            if (entity == null) {
                incomplete(node);
                return;
            }
            names.add(text(entity));
        }
        if (names.size() < 2) {
            incomplete(node);
            return;
        }
        String label = optionalText(node.token(LABEL));
        for (int i = 0; i + 1 < names.size(); i++) {
            boolean last = i + 2 == names.size();
            out.add(new InternalConnection(names.get(i), names.get(i + 1), last ? label : null));
        }
    }

    // ------------------------------------------------------------------
    // gateways
    // ------------------------------------------------------------------

    private GatewayDefinition gateway(CstNode node) {
        String id = optionalName(node.token("name"));
        Token directionToken = node.token("direction");
        GatewayDirection direction = directionToken == null ? null : GatewayDirection.fromKeyword(word(directionToken));
        String label = lastValue(node.nodes("label"));

        List<EndpointType> exposes = new ArrayList<>();
        for (CstNode list : node.nodes("exposes")) {
            for (Token element : list.tokens("element")) {
                EndpointType type = EndpointType.fromKeyword(word(element));
                if (type != null) {
                    exposes.add(type);
                }
            }
        }

        List<String> policies = new ArrayList<>();
        for (CstNode list : node.nodes("policies")) {
            for (Token element : list.tokens("element")) {
                policies.add(text(element));
            }
        }

        AuthConfig auth = null;
        for (CstNode authNode : node.nodes("auth")) {
            AuthConfig candidate = auth(authNode);
            if (candidate != null) {
                auth = candidate;
            }
        }

        GatewayPosition position = null;
        for (CstNode positionNode : node.nodes("position")) {
            Token value = positionNode.token("value");
            if (value != null) {
                position = GatewayPosition.fromKeyword(value.image().toLowerCase(Locale.ROOT));
            }
        }

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (CstNode property : node.nodes("property")) {
            property(property, attributes);
        }

        List<GatewayRoute> routes = new ArrayList<>();
        for (CstNode route : node.nodes("route")) {
            Token path = route.token("path");
            ConnectionEndpoint target = endpoint(route.node("target"));
            if (path == null || target == null) {
                incomplete(route);
                continue;
            }
            routes.add(new GatewayRoute(text(path), target));
        }
        return new GatewayDefinition(id, position, direction, label, exposes, policies, auth, attributes, routes);
    }

    private AuthConfig auth(CstNode node) {
        Token value = node.token("value");
        if (value == null) {
            incomplete(node);
            return null;
        }
        AuthType type = AuthType.fromKeyword(word(value));
        if (type == null) {
            incomplete(node);
            return null;
        }
        ConnectionEndpoint reference = endpoint(node.node("reference"));
        return new AuthConfig(type, reference == null ? null : reference.toString());
    }

    // ------------------------------------------------------------------
    // components and clusters
    // ------------------------------------------------------------------

    private CellComponent cellComponent(CstNode node) {
        if (node.rule() == GrammarRule.CLUSTER_DEFINITION) {
            return cluster(node);
        }
        return component(node);
    }

    private ComponentDefinition component(CstNode node) {
        String id = requireName(node, ErrorCode.INCOMPLETE_COMPONENT_DEFINITION, "Component");
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        Map<String, String> env = new LinkedHashMap<>();
        ComponentType bodyType = null;

        CstNode attributeList = node.node("attributes");
        if (attributeList != null) {
            for (CstNode attribute : attributeList.nodes("attribute")) {
                property(attribute, attributes);
            }
        }
        CstNode body = node.node("body");
        if (body != null) {
            for (CstNode type : body.nodes("type")) {
                Token value = type.token("value");
                if (value != null) {
                    bodyType = ComponentType.fromKeyword(word(value));
                }
            }
            for (CstNode property : body.nodes("property")) {
                property(property, attributes);
            }
            for (CstNode block : body.nodes("env")) {
                for (CstNode entry : block.nodes("entry")) {
                    envEntry(entry, env);
                }
            }
        }

        Token keyword = node.token("type");
        ComponentType declared = keyword == null || keyword.is(TokenKind.COMPONENT)
                ? null
                : ComponentType.fromKeyword(word(keyword));
        if (declared == null && attributes.get("type") instanceof AttributeValue.StringValue typeName) {
            ComponentType fromAttribute = ComponentType.fromKeyword(typeName.value());
            if (fromAttribute != null) {
                declared = fromAttribute;
                attributes.remove("type");
            }
        }
        ComponentType componentType = bodyType != null ? bodyType
                : declared != null ? declared
                : ComponentType.MICROSERVICE;

        List<String> sidecars = new ArrayList<>();
        AttributeValue sidecar = attributes.remove(SIDECAR);
        if (sidecar instanceof AttributeValue.ListValue list) {
            sidecars.addAll(list.values());
        } else if (sidecar != null) {
            sidecars.add(String.valueOf(sidecar.raw()));
        }
        return new ComponentDefinition(id, componentType, attributes, sidecars, env);
    }

    private void envEntry(CstNode entry, Map<String, String> env) {
        Token key = entry.token("key");
        AttributeValue value = value(entry.node("value"));
        if (key == null || value == null) {
            incomplete(entry);
            return;
        }
        env.put(key.is(TokenKind.STRING) ? text(key) : key.image(), String.valueOf(value.raw()));
    }

    private ClusterDefinition cluster(CstNode node) {
        String id = requireName(node, ErrorCode.INCOMPLETE_COMPONENT_DEFINITION, "Cluster");
        ComponentType clusterType = null;
        for (CstNode type : node.nodes("type")) {
            Token value = type.token("value");
            if (value != null) {
                clusterType = ComponentType.fromKeyword(word(value));
            }
        }
        Integer replicas = null;
        for (CstNode property : node.nodes("replicas")) {
            CstNode valueNode = property.node("value");
            if (value(valueNode) instanceof AttributeValue.NumberValue number) {
                replicas = replicaCount(number, valueNode.firstToken());
            } else {
                incomplete(property);
            }
        }
        List<ComponentDefinition> members = new ArrayList<>();
        for (CstNode member : node.nodes("component")) {
            members.add(component(member));
        }
        return new ClusterDefinition(id, clusterType, replicas, members);
    }

    private Integer replicaCount(AttributeValue.NumberValue number, Token token) {
        long count = number.value().longValue();
        if (number.isInteger() && count >= 0 && count <= Integer.MAX_VALUE) {
            return (int) count;
        }
        report(new AstConstructionException(ErrorCode.INVALID_ATTRIBUTE_VALUE,
                String.format("Replica count must be a whole number between 0 and %d, but found %s",
                        Integer.MAX_VALUE, number.value()), token));
        return null;
    }

    // ------------------------------------------------------------------
    // connections
    // ------------------------------------------------------------------

    private ConnectionsBlock connections(CstNode node) {
        String name = node.rule() == GrammarRule.FLOW_BLOCK ? optionalName(node.token("name")) : null;
        List<Connection> connections = new ArrayList<>();
        for (CstNode connection : node.nodes("connection")) {
            connection(connection, connections);
        }
        return new ConnectionsBlock(name, connections);
    }

    private void connection(CstNode node, List<Connection> out) {
        List<ConnectionEndpoint> endpoints = new ArrayList<>();
        for (CstNode endpointNode : node.nodes("endpoint")) {
            ConnectionEndpoint endpoint = endpoint(endpointNode);
            if (endpoint == null) {
                incomplete(node);
                return;
            }
            endpoints.add(endpoint);
        }
        if (endpoints.size() < 2) {
            incomplete(node);
            return;
        }

        ConnectionDirection direction = direction(node.token("direction"));
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        CstNode attributeList = node.node("attributes");
        if (attributeList != null) {
            if (direction == null) {
                direction = direction(attributeList.token("direction"));
            }
            for (CstNode attribute : attributeList.nodes("attribute")) {
                property(attribute, attributes);
            }
        }
        String label = optionalText(node.token(LABEL));
        for (int i = 0; i + 1 < endpoints.size(); i++) {
            Map<String, AttributeValue> edgeAttributes = attributes;
            if (label != null && i + 2 == endpoints.size()) {
                edgeAttributes = new LinkedHashMap<>(attributes);
                edgeAttributes.put(LABEL, new AttributeValue.StringValue(label));
            }
            out.add(new Connection(direction, endpoints.get(i), endpoints.get(i + 1), edgeAttributes));
        }
    }

    private static ConnectionDirection direction(Token token) {
        return token == null ? null : ConnectionDirection.fromKeyword(word(token));
    }

    private static ConnectionEndpoint endpoint(CstNode reference) {
        if (reference == null) {
            return null;
        }
        Token entity = reference.token("entity");
        if (entity == null) {
            return null;
        }
        if (reference.has("dot")) {
            Token component = reference.token("component");
            if (component == null) {
                return null;
            }
            return new ConnectionEndpoint(text(entity), text(component));
        }
        return ConnectionEndpoint.of(text(entity));
    }

    // ------------------------------------------------------------------
    // externals, users, applications
    // ------------------------------------------------------------------

    private ExternalDefinition external(CstNode node) {
        String id = requireName(node, ErrorCode.MISSING_IDENTIFIER, "External");
        ExternalType type = null;
        for (CstNode typeNode : node.nodes("type")) {
            Token value = typeNode.token("value");
            if (value != null) {
                type = ExternalType.fromKeyword(word(value));
            }
        }
        List<EndpointType> provides = new ArrayList<>();
        for (CstNode list : node.nodes("provides")) {
            for (Token element : list.tokens("element")) {
                EndpointType endpointType = EndpointType.fromKeyword(word(element));
                if (endpointType != null) {
                    provides.add(endpointType);
                }
            }
        }
        return new ExternalDefinition(id, lastValue(node.nodes("label")), type, provides);
    }

    private UserDefinition user(CstNode node) {
        String id = requireName(node, ErrorCode.MISSING_IDENTIFIER, "User");
        UserType type = null;
        for (CstNode typeNode : node.nodes("type")) {
            Token value = typeNode.token("value");
            if (value != null) {
                type = UserType.fromKeyword(word(value));
            }
        }
        List<String> channels = new ArrayList<>();
        for (CstNode list : node.nodes("channels")) {
            for (Token element : list.tokens("element")) {
                channels.add(element.is(TokenKind.IDENTIFIER) || element.is(TokenKind.STRING)
                        ? text(element)
                        : word(element));
            }
        }
        return new UserDefinition(id, lastValue(node.nodes("label")), type, channels);
    }

    private ApplicationDefinition application(CstNode node) {
        String id = requireName(node, ErrorCode.MISSING_IDENTIFIER, "Application");
        List<String> cells = new ArrayList<>();
        for (CstNode list : node.nodes("cells")) {
            for (Token element : list.tokens("element")) {
                cells.add(text(element));
            }
        }
        CstNode gatewayNode = node.node("gateway");
        GatewayDefinition gateway = gatewayNode == null ? null : gateway(gatewayNode);
        return new ApplicationDefinition(id, lastValue(node.nodes("label")), lastValue(node.nodes("version")),
                cells, gateway);
    }

    // ------------------------------------------------------------------
    // properties and values
    // ------------------------------------------------------------------

    /**
     * Adds a {@code key: value} node to {@code target}; a later key overwrites an earlier one.
     */
    private void property(CstNode node, Map<String, AttributeValue> target) {
        Token key = node.token("key");
        AttributeValue value = value(node.node("value"));
        if (key == null || value == null) {
            incomplete(node);
            return;
        }
        target.put(key.is(TokenKind.IDENTIFIER) ? key.image() : key.kind().literal(), value);
    }

    /**
     * Value of a {@code propertyValue} or {@code protocolValue} node.
     *
     * @return the value, or {@code null} when the node holds none
     */
    private static AttributeValue value(CstNode node) {
        if (node == null) {
            return null;
        }
        CstNode array = node.node("array");
        if (array != null) {
            List<String> elements = new ArrayList<>();
            for (Token element : array.tokens("element")) {
                elements.add(scalarText(element));
            }
            return new AttributeValue.ListValue(elements);
        }
        Token token = node.token("value");
        if (token == null) {
            return null;
        }
        return switch (token.kind()) {
            case STRING -> new AttributeValue.StringValue(text(token));
            case NUMBER -> new AttributeValue.NumberValue(number(token.image()));
            case TRUE -> new AttributeValue.BooleanValue(true);
            case FALSE -> new AttributeValue.BooleanValue(false);
            default -> new AttributeValue.StringValue(word(token));
        };
    }

    private static Number number(String image) {
        if (image.indexOf('.') < 0) {
            try {
                return Long.parseLong(image);
            } catch (NumberFormatException e) {
                // beyond the long range, kept as a double
            }
        }
        return Double.parseDouble(image);
    }

    private static String scalarText(Token token) {
        return switch (token.kind()) {
            case STRING -> text(token);
            case NUMBER, TRUE, FALSE, IDENTIFIER -> token.image();
            default -> word(token);
        };
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private void incomplete(CstNode node) {
        if (!tolerateIncomplete()) {
            throw new AstConstructionException(incompleteCode(node.rule()),
                    String.format("Incomplete %s", node.rule().description()), node.firstToken());
        }
    }

    private static ErrorCode incompleteCode(GrammarRule rule) {
        return switch (rule) {
            case CONNECTION, FLOW_STATEMENT -> ErrorCode.INCOMPLETE_FLOW_STATEMENT;
            case AUTH_PROPERTY, ROUTE_DEFINITION -> ErrorCode.INCOMPLETE_GATEWAY_DEFINITION;
            case CLUSTER_DEFINITION, COMPONENT_DEFINITION -> ErrorCode.INCOMPLETE_COMPONENT_DEFINITION;
            default -> ErrorCode.INVALID_ATTRIBUTE_VALUE;
        };
    }

    private static String requireName(CstNode node, ErrorCode code, String what) {
        Token name = node.token("name");
        if (name == null) {
            throw new AstConstructionException(code,
                    String.format("%s definition is missing a name", what), node.firstToken());
        }
        return text(name);
    }

    private static String optionalName(Token token) {
        return token == null ? null : text(token);
    }

    private static String optionalText(Token token) {
        return token == null ? null : text(token);
    }

    /** Text of the {@code value} token of the last property node, or {@code null}. */
    private static String lastValue(List<CstNode> properties) {
        String result = null;
        for (CstNode property : properties) {
            Token value = property.token("value");
            if (value != null) {
                result = text(value);
            }
        }
        return result;
    }

    /** Names and string literals: string literals are unquoted. */
    private static String text(Token token) {
        return token.is(TokenKind.STRING) ? StringEscapes.unquote(token.image()) : token.image();
    }

    /** Vocabulary words in their canonical spelling, identifiers as written. */
    private static String word(Token token) {
        String literal = token.kind().literal();
        return literal != null ? literal : text(token);
    }

    private static int startOffset(CstNode node) {
        Token first = node.firstToken();
        return first == null ? Integer.MAX_VALUE : first.offset();
    }
}
