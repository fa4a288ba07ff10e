package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

import static io.github.cyfko.celldl.core.lexer.TokenKind.*;

/**
 * Recursive-descent parser turning a CellDL token stream into a concrete syntax tree.
 * <p>
 * Each grammar rule is a method; the rule being applied is pushed on a rule stack so that every
 * recorded {@link SyntaxError} names its enclosing rule. Three top-level dialects coexist and are
 * tried in order: a {@code workspace} wrapper, a legacy {@code diagram} wrapper, and a bare
 * sequence of statements.
 * </p>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * program         := workspace | diagram | statement*
 * workspace       := 'workspace' name '{' (version | description | 'property' property | statement)* '}'
 * diagram         := 'diagram' name '{' statement* '}'
 * statement       := cell | external | user | application | connections | flow
 * cell            := 'cell' name (label | cellType)* '{' (label | cellType | gateway | components
 *                    | cluster | component | connections | flow)* '}'
 * gateway         := 'gateway' name? ('ingress' | 'egress')? '{' (label | exposes | policies | auth
 *                    | position | route | property)* '}'
 * components      := 'components' '{' (cluster | component)* '}'
 * component       := (componentType | 'component') name (attributeList | componentBody)?
 * cluster         := 'cluster' name '{' (componentTypeProp | 'replicas' ':'? NUMBER | component)* '}'
 * connections     := 'connections' '{' connection* '}'
 * flow            := 'flow' name? '{' connection+ '}'
 * connection      := direction? reference ('-&gt;' reference)+ (':' STRING)? ('[' attribute, ... ']')?
 * external        := 'external' name externalType? ('{' (label | externalType | provides)* '}')?
 * user            := 'user' name userType? ('{' (label | userType | channels)* '}')?
 * application     := 'application' name '{' (label | version | cells | gateway)* '}'
 * property        := key ':'? value
 * attributeList   := '[' (key ':' value (',' key ':' value)*)? ']'
 * reference       := name ('.' name)?
 * name            := IDENTIFIER | STRING
 * </pre>
 *
 * <h2>Recovery</h2>
 * <p>
 * With recovery enabled the parser never gives up:
 * </p>
 * <ul>
 *   <li><strong>Token deletion</strong>: an unexpected token followed by the expected one is skipped</li>
 *   <li><strong>Token insertion</strong>: a missing separator or a missing token whose follower is
 *       present is assumed and parsing goes on</li>
 *   <li><strong>Resynchronisation</strong>: otherwise the enclosing repetition skips balanced
 *       blocks until a token that can start an item, its closing brace, a statement keyword or
 *       the end of input</li>
 *   <li><strong>Unclosed blocks</strong>: reported once per block, innermost first, anchored on the
 *       opening brace</li>
 * </ul>
 * <p>
 * With recovery disabled parsing stops at the first error and the partial tree is returned.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GrammarParser {

    private static final Logger log = Logger.getLogger(GrammarParser.class.getName());

    private static final Set<TokenKind> STATEMENT_KEYWORDS =
            Collections.unmodifiableSet(EnumSet.of(CELL, EXTERNAL, USER, APPLICATION, CONNECTIONS, FLOW));
    private static final Set<TokenKind> NAME = Collections.unmodifiableSet(EnumSet.of(IDENTIFIER, STRING));
    private static final Set<TokenKind> COLON_OPTIONAL_KEYS = Collections.unmodifiableSet(EnumSet.of(
            LABEL, TYPE, PORT, REPLICAS, PROTOCOL, CONTEXT, TARGET, POLICY, ENGINE, STORAGE, VERSION));
    private static final Set<TokenKind> NUMERIC_KEYS = Collections.unmodifiableSet(EnumSet.of(PORT, REPLICAS));
    private static final Set<TokenKind> INSERTABLE =
            Collections.unmodifiableSet(EnumSet.of(COLON, ARROW, COMMA, RBRACKET, RPAREN, EQUALS));
    private static final Set<TokenKind> DIRECTIONS =
            Collections.unmodifiableSet(EnumSet.of(NORTHBOUND, SOUTHBOUND, EASTBOUND, WESTBOUND));
    private static final Set<TokenKind> ENDPOINT_TYPES = Collections.unmodifiableSet(EnumSet.of(API, EVENTS, STREAM));
    private static final Set<TokenKind> PROTOCOLS =
            Collections.unmodifiableSet(EnumSet.of(HTTPS, HTTP, GRPC, MTLS, KAFKA, TCP));
    private static final Set<TokenKind> AUTH_TYPES = Collections.unmodifiableSet(EnumSet.of(LOCAL_STS, FEDERATED));
    private static final Set<TokenKind> REFERENCE_FOLLOW = Collections.unmodifiableSet(
            EnumSet.of(ARROW, COLON, DOT, LBRACKET, RBRACKET, RBRACE, RPAREN, COMMA));
    private static final Set<TokenKind> VALUE_CLOSERS =
            Collections.unmodifiableSet(EnumSet.of(COMMA, RBRACKET, RBRACE, EOF));
    private static final Set<String> POSITIONS = Set.of("north", "south", "east", "west");

    private static final Set<TokenKind> CELL_COMPONENT_STARTERS;
    private static final Set<TokenKind> COMPONENT_STARTERS;
    private static final Set<TokenKind> CELL_BODY_EXPECTED;
    private static final Set<TokenKind> VALUE_EXPECTED;

    static {
        EnumSet<TokenKind> components = EnumSet.copyOf(TokenKind.componentTypes());
        components.add(COMPONENT);
        COMPONENT_STARTERS = Collections.unmodifiableSet(EnumSet.copyOf(components));
        components.remove(GATEWAY);
        CELL_COMPONENT_STARTERS = Collections.unmodifiableSet(components);

        EnumSet<TokenKind> cellBody = EnumSet.of(LABEL, TYPE, GATEWAY, COMPONENTS, CLUSTER, CONNECTIONS, FLOW);
        cellBody.add(COMPONENT);
        CELL_BODY_EXPECTED = Collections.unmodifiableSet(cellBody);

        VALUE_EXPECTED = Collections.unmodifiableSet(EnumSet.of(STRING, NUMBER, TRUE, FALSE, IDENTIFIER, LBRACKET));
    }

    private static final ResyncSignal RESYNC = new ResyncSignal();

    private final List<Token> tokens;
    private final Token eof;
    private final boolean recoveryEnabled;
    private final List<SyntaxError> errors = new ArrayList<>();
    private final Deque<GrammarRule> ruleStack = new ArrayDeque<>();
    private int pos;
    private boolean innermostUnclosedReported;

    private GrammarParser(List<Token> tokens, boolean recoveryEnabled) {
        this.tokens = List.copyOf(tokens);
        this.recoveryEnabled = recoveryEnabled;
        this.eof = endOfInput(this.tokens);
    }

    /**
     * Parses a token stream with recovery enabled.
     *
     * @param tokens tokens produced by the lexer
     * @return the CST and the syntax errors met
     */
    public static ParseTree parse(List<Token> tokens) {
        return parse(tokens, true);
    }

    /**
     * Parses a token stream.
     *
     * @param tokens          tokens produced by the lexer
     * @param recoveryEnabled whether to recover from errors or stop at the first one
     * @return the CST (partial when recovery is disabled and an error occurred) and the syntax errors met
     */
    public static ParseTree parse(List<Token> tokens, boolean recoveryEnabled) {
        GrammarParser parser = new GrammarParser(tokens, recoveryEnabled);
        CstNode root = parser.program();
        log.fine(() -> String.format("Parsed %d tokens, %d syntax error(s), recovery %s",
                parser.tokens.size(), parser.errors.size(), recoveryEnabled ? "on" : "off"));
        return new ParseTree(root, parser.errors, parser.tokens);
    }

    /**
     * End-of-input marker placed right after the last token.
     */
    static Token endOfInput(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return new Token(EOF, "", 1, 1, 0, 0);
        }
        Token last = tokens.get(tokens.size() - 1);
        return new Token(EOF, "", last.line(), last.endColumn(), last.endOffset(), 0);
    }

    // ------------------------------------------------------------------
    // top level
    // ------------------------------------------------------------------

    private CstNode program() {
        CstNode root = new CstNode(GrammarRule.PROGRAM);
        ruleStack.push(GrammarRule.PROGRAM);
        try {
            boolean wrapped = false;
            if (check(WORKSPACE)) {
                wrapper(root, "workspace", GrammarRule.WORKSPACE_DEFINITION, this::workspaceDefinition);
                wrapped = true;
            } else if (check(DIAGRAM)) {
                wrapper(root, "diagram", GrammarRule.DIAGRAM_DEFINITION, this::diagramDefinition);
                wrapped = true;
            }
            if (wrapped && !check(EOF)) {
                record(SyntaxError.Kind.NOT_ALL_INPUT_PARSED, EnumSet.of(EOF), GrammarRule.PROGRAM, null);
            }
            statements(root);
        } catch (ParseAbort abort) {
            log.fine(() -> String.format("Parsing stopped at token %d, recovery disabled", pos));
        } finally {
            ruleStack.pop();
            if (!errors.isEmpty()) {
                root.markRecovered();
            }
        }
        return root;
    }

    private void wrapper(CstNode root, String label, GrammarRule rule, Consumer<CstNode> body) {
        int start = pos;
        try {
            within(root, label, rule, body);
        } catch (ResyncSignal signal) {
            resync(start, this::startsStatement, false);
        }
    }

    private void statements(CstNode node) {
        while (!check(EOF)) {
            int start = pos;
            if (startsStatement(la())) {
                try {
                    statement(node);
                } catch (ResyncSignal signal) {
                    resync(start, this::startsStatement, false);
                }
            } else {
                noViable(GrammarRule.STATEMENT, STATEMENT_KEYWORDS);
                resync(start, this::startsStatement, false);
            }
        }
    }

    private boolean startsStatement(Token token) {
        return STATEMENT_KEYWORDS.contains(token.kind());
    }

    private void statement(CstNode parent) {
        switch (la().kind()) {
            case CELL -> within(parent, "statement", GrammarRule.CELL_DEFINITION, this::cellDefinition);
            case EXTERNAL -> within(parent, "statement", GrammarRule.EXTERNAL_DEFINITION, this::externalDefinition);
            case USER -> within(parent, "statement", GrammarRule.USER_DEFINITION, this::userDefinition);
            case APPLICATION ->
                    within(parent, "statement", GrammarRule.APPLICATION_DEFINITION, this::applicationDefinition);
            case CONNECTIONS -> within(parent, "statement", GrammarRule.CONNECTIONS_BLOCK, this::connectionsBlock);
            case FLOW -> within(parent, "statement", GrammarRule.FLOW_BLOCK, this::flowBlock);
            default -> throw new IllegalStateException("Not a statement start: " + la());
        }
    }

    private void workspaceDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(LBRACE));
        Token open = open(node, EnumSet.of(VERSION, DESCRIPTION, PROPERTY, RBRACE));
        items(node, GrammarRule.WORKSPACE_DEFINITION,
                t -> t.is(VERSION) || t.is(DESCRIPTION) || t.is(PROPERTY) || startsStatement(t),
                EnumSet.of(VERSION, DESCRIPTION, PROPERTY, CELL, EXTERNAL, USER, APPLICATION, CONNECTIONS, FLOW),
                n -> {
                    switch (la().kind()) {
                        case VERSION -> within(n, "version", GrammarRule.VERSION_PROPERTY, this::versionProperty);
                        case DESCRIPTION ->
                                within(n, "description", GrammarRule.DESCRIPTION_PROPERTY, this::descriptionProperty);
                        case PROPERTY -> within(n, "property", GrammarRule.WORKSPACE_PROPERTY, this::workspaceProperty);
                        default -> statement(n);
                    }
                });
        close(node, open);
    }

    private void diagramDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(LBRACE));
        Token open = open(node, STATEMENT_KEYWORDS);
        items(node, GrammarRule.DIAGRAM_DEFINITION, this::startsStatement, STATEMENT_KEYWORDS, this::statement);
        close(node, open);
    }

    private void workspaceProperty(CstNode node) {
        take(node, "keyword");
        if (!la().kind().isPropertyKey()) {
            mismatch(EnumSet.of(IDENTIFIER));
            throw RESYNC;
        }
        within(node, "property", GrammarRule.PROPERTY, this::blockProperty);
    }

    // ------------------------------------------------------------------
    // cells
    // ------------------------------------------------------------------

    private void cellDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(LBRACE, TYPE, LABEL));
        while (check(LABEL) || check(TYPE)) {
            if (check(LABEL)) {
                within(node, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
            } else {
                within(node, "type", GrammarRule.CELL_TYPE_PROPERTY, this::cellTypeProperty);
            }
        }
        Token open = open(node, CELL_BODY_EXPECTED);
        items(node, GrammarRule.CELL_BODY, this::startsCellBody, CELL_BODY_EXPECTED, this::cellBodyItem);
        close(node, open);
    }

    private boolean startsCellBody(Token token) {
        return CELL_BODY_EXPECTED.contains(token.kind()) || CELL_COMPONENT_STARTERS.contains(token.kind());
    }

    private void cellBodyItem(CstNode node) {
        switch (la().kind()) {
            case LABEL -> within(node, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
            case TYPE -> within(node, "type", GrammarRule.CELL_TYPE_PROPERTY, this::cellTypeProperty);
            case GATEWAY -> within(node, "gateway", GrammarRule.GATEWAY_BLOCK, this::gatewayBlock);
            case COMPONENTS -> within(node, "components", GrammarRule.COMPONENTS_BLOCK, this::componentsBlock);
            case CLUSTER -> within(node, "component", GrammarRule.CLUSTER_DEFINITION, this::clusterDefinition);
            case CONNECTIONS -> within(node, "connections", GrammarRule.CONNECTIONS_BLOCK, this::connectionsBlock);
            case FLOW -> within(node, "connections", GrammarRule.FLOW_BLOCK, this::flowBlock);
            default -> within(node, "component", GrammarRule.COMPONENT_DEFINITION, this::componentDefinition);
        }
    }

    private void cellTypeProperty(CstNode node) {
        take(node, "keyword");
        colon(node, TYPE);
        typeValue(node, TokenKind.cellTypes(), GrammarRule.CELL_TYPE);
    }

    private void labelProperty(CstNode node) {
        take(node, "keyword");
        colon(node, LABEL);
        literal(node, "value", EnumSet.of(STRING));
    }

    private void versionProperty(CstNode node) {
        take(node, "keyword");
        colon(node, VERSION);
        literal(node, "value", EnumSet.of(STRING, NUMBER));
    }

    private void descriptionProperty(CstNode node) {
        take(node, "keyword");
        colon(node, DESCRIPTION);
        literal(node, "value", EnumSet.of(STRING));
    }

    // ------------------------------------------------------------------
    // gateways
    // ------------------------------------------------------------------

    private void gatewayBlock(CstNode node) {
        take(node, "keyword");
        if (isName(la())) {
            take(node, "name");
        }
        if (check(INGRESS) || check(EGRESS)) {
            take(node, "direction");
        }
        Token open = open(node, EnumSet.of(LABEL, EXPOSES, POLICIES, AUTH, ROUTE));
        items(node, GrammarRule.GATEWAY_BLOCK, this::startsGatewayBody,
                EnumSet.of(LABEL, EXPOSES, POLICIES, AUTH, ROUTE, IDENTIFIER), this::gatewayBodyItem);
        close(node, open);
    }

    private boolean startsGatewayBody(Token token) {
        TokenKind kind = token.kind();
        return kind == EXPOSES || kind == POLICIES || kind == AUTH || kind == ROUTE || kind.isPropertyKey();
    }

    private void gatewayBodyItem(CstNode node) {
        switch (la().kind()) {
            case LABEL -> within(node, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
            case EXPOSES -> within(node, "exposes", GrammarRule.EXPOSES_PROPERTY, n -> {
                take(n, "keyword");
                colon(n, EXPOSES);
                elementList(n, t -> ENDPOINT_TYPES.contains(t.kind()), ENDPOINT_TYPES, true);
            });
            case POLICIES -> within(node, "policies", GrammarRule.POLICIES_PROPERTY, n -> {
                take(n, "keyword");
                colon(n, POLICIES);
                elementList(n, this::isName, NAME, true);
            });
            case AUTH -> within(node, "auth", GrammarRule.AUTH_PROPERTY, this::authProperty);
            case ROUTE -> within(node, "route", GrammarRule.ROUTE_DEFINITION, this::routeDefinition);
            default -> {
                if (la().is(IDENTIFIER) && la().image().equalsIgnoreCase("position") && la(2).is(COLON)) {
                    within(node, "position", GrammarRule.GATEWAY_POSITION, this::gatewayPosition);
                } else {
                    within(node, "property", GrammarRule.PROPERTY, this::blockProperty);
                }
            }
        }
    }

    private void gatewayPosition(CstNode node) {
        take(node, "keyword");
        take(node, "colon");
        Token value = la();
        if (value.is(IDENTIFIER) && POSITIONS.contains(value.image().toLowerCase(Locale.ROOT))) {
            take(node, "value");
            return;
        }
        noViable(GrammarRule.GATEWAY_POSITION, EnumSet.of(IDENTIFIER));
        if (isValueLike(value)) {
            pos++;
        }
    }

    private void authProperty(CstNode node) {
        take(node, "keyword");
        colon(node, AUTH);
        if (check(LOCAL_STS)) {
            take(node, "value");
        } else if (check(FEDERATED)) {
            take(node, "value");
            if (check(LPAREN)) {
                take(node, "lparen");
                reference(node, "reference");
                consume(node, "rparen", RPAREN);
            }
        } else {
            noViable(GrammarRule.AUTH_PROPERTY, AUTH_TYPES);
            if (isValueLike(la())) {
                pos++;
            }
        }
    }

    private void routeDefinition(CstNode node) {
        take(node, "keyword");
        literal(node, "path", EnumSet.of(STRING));
        consume(node, "arrow", ARROW);
        reference(node, "target");
    }

    // ------------------------------------------------------------------
    // components and clusters
    // ------------------------------------------------------------------

    private void componentsBlock(CstNode node) {
        take(node, "keyword");
        Token open = open(node, COMPONENT_STARTERS);
        items(node, GrammarRule.COMPONENTS_BLOCK,
                t -> t.is(CLUSTER) || COMPONENT_STARTERS.contains(t.kind()),
                COMPONENT_STARTERS,
                n -> {
                    if (check(CLUSTER)) {
                        within(n, "component", GrammarRule.CLUSTER_DEFINITION, this::clusterDefinition);
                    } else {
                        within(n, "component", GrammarRule.COMPONENT_DEFINITION, this::componentDefinition);
                    }
                });
        close(node, open);
    }

    private void componentDefinition(CstNode node) {
        take(node, "type");
        name(node, "name", EnumSet.of(LBRACKET, LBRACE));
        if (check(LBRACKET)) {
            within(node, "attributes", GrammarRule.ATTRIBUTE_LIST, this::attributeList);
        } else if (check(LBRACE)) {
            within(node, "body", GrammarRule.COMPONENT_BODY, this::componentBody);
        }
    }

    private void componentBody(CstNode node) {
        Token open = take(node, "lbrace");
        items(node, GrammarRule.COMPONENT_BODY,
                t -> t.is(ENV) || t.kind().isPropertyKey(),
                EnumSet.of(TYPE, ENV, IDENTIFIER),
                n -> {
                    if (check(TYPE)) {
                        within(n, "type", GrammarRule.COMPONENT_TYPE_PROPERTY, this::componentTypeProperty);
                    } else if (check(ENV)) {
                        within(n, "env", GrammarRule.ENV_BLOCK, this::envBlock);
                    } else {
                        within(n, "property", GrammarRule.PROPERTY, this::blockProperty);
                    }
                });
        close(node, open);
    }

    private void componentTypeProperty(CstNode node) {
        take(node, "keyword");
        colon(node, TYPE);
        typeValue(node, TokenKind.componentTypes(), GrammarRule.COMPONENT_TYPE);
    }

    private void envBlock(CstNode node) {
        take(node, "keyword");
        Token open = open(node, EnumSet.of(IDENTIFIER, STRING));
        items(node, GrammarRule.ENV_BLOCK,
                t -> t.is(STRING) || t.kind().isPropertyKey(),
                EnumSet.of(IDENTIFIER, STRING),
                n -> within(n, "entry", GrammarRule.ENV_ENTRY, entry -> {
                    take(entry, "key");
                    consume(entry, "equals", EQUALS);
                    within(entry, "value", GrammarRule.PROPERTY_VALUE, this::propertyValue);
                }));
        close(node, open);
    }

    private void clusterDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(LBRACE));
        Token open = open(node, COMPONENT_STARTERS);
        items(node, GrammarRule.CLUSTER_DEFINITION,
                t -> t.is(TYPE) || t.is(REPLICAS) || COMPONENT_STARTERS.contains(t.kind()),
                COMPONENT_STARTERS,
                n -> {
                    if (check(TYPE)) {
                        within(n, "type", GrammarRule.COMPONENT_TYPE_PROPERTY, this::componentTypeProperty);
                    } else if (check(REPLICAS)) {
                        within(n, "replicas", GrammarRule.PROPERTY, this::blockProperty);
                    } else {
                        within(n, "component", GrammarRule.COMPONENT_DEFINITION, this::componentDefinition);
                    }
                });
        close(node, open);
    }

    // ------------------------------------------------------------------
    // connections and flows
    // ------------------------------------------------------------------

    private void connectionsBlock(CstNode node) {
        take(node, "keyword");
        Token open = open(node, EnumSet.of(IDENTIFIER, STRING));
        items(node, GrammarRule.CONNECTIONS_BLOCK, this::startsConnection, connectionExpected(),
                n -> within(n, "connection", GrammarRule.CONNECTION, this::connection));
        close(node, open);
    }

    private void flowBlock(CstNode node) {
        take(node, "keyword");
        if (isName(la())) {
            take(node, "name");
        }
        Token open = open(node, EnumSet.of(IDENTIFIER, STRING));
        if (check(RBRACE)) {
            record(SyntaxError.Kind.EARLY_EXIT, connectionExpected(), GrammarRule.FLOW_BLOCK, null);
        }
        items(node, GrammarRule.FLOW_BLOCK, this::startsConnection, connectionExpected(),
                n -> within(n, "connection", GrammarRule.FLOW_STATEMENT, this::connection));
        close(node, open);
    }

    private boolean startsConnection(Token token) {
        return isName(token) || DIRECTIONS.contains(token.kind());
    }

    private static Set<TokenKind> connectionExpected() {
        EnumSet<TokenKind> expected = EnumSet.of(IDENTIFIER, STRING);
        expected.addAll(DIRECTIONS);
        return expected;
    }

    private void connection(CstNode node) {
        if (DIRECTIONS.contains(la().kind())) {
            take(node, "direction");
        }
        reference(node, "endpoint");
        do {
            consume(node, "arrow", ARROW);
            reference(node, "endpoint");
        } while (check(ARROW));
        if (check(COLON)) {
            take(node, "colon");
            literal(node, "label", EnumSet.of(STRING));
        }
        if (check(LBRACKET)) {
            within(node, "attributes", GrammarRule.CONNECTION_ATTRIBUTES, this::connectionAttributes);
        }
    }

    private void connectionAttributes(CstNode node) {
        take(node, "lbracket");
        if (!check(RBRACKET)) {
            Predicate<Token> starts = t -> DIRECTIONS.contains(t.kind()) || t.kind().isPropertyKey();
            while (true) {
                if (DIRECTIONS.contains(la().kind())) {
                    take(node, "direction");
                } else if (la().kind().isPropertyKey()) {
                    within(node, "attribute", GrammarRule.ATTRIBUTE, this::attribute);
                } else {
                    EnumSet<TokenKind> expected = EnumSet.copyOf(DIRECTIONS);
                    expected.add(IDENTIFIER);
                    noViable(GrammarRule.CONNECTION_ATTRIBUTES, expected);
                    if (!check(COMMA)) {
                        if (VALUE_CLOSERS.contains(la().kind())) {
                            break;
                        }
                        pos++;
                    }
                }
                if (!separator(node, starts)) {
                    break;
                }
            }
        }
        consume(node, "rbracket", RBRACKET);
    }

    private void reference(CstNode parent, String label) {
        within(parent, label, GrammarRule.REFERENCE, node -> {
            name(node, "entity", REFERENCE_FOLLOW);
            if (check(DOT)) {
                take(node, "dot");
                name(node, "component", REFERENCE_FOLLOW);
            }
        });
    }

    // ------------------------------------------------------------------
    // externals, users, applications
    // ------------------------------------------------------------------

    private void externalDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(TYPE, LBRACE));
        if (check(TYPE)) {
            within(node, "type", GrammarRule.EXTERNAL_TYPE_PROPERTY, this::externalTypeProperty);
        }
        if (check(LBRACE)) {
            Token open = take(node, "lbrace");
            items(node, GrammarRule.EXTERNAL_DEFINITION,
                    t -> t.is(LABEL) || t.is(TYPE) || t.is(PROVIDES),
                    EnumSet.of(LABEL, TYPE, PROVIDES),
                    n -> {
                        switch (la().kind()) {
                            case LABEL -> within(n, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
                            case TYPE ->
                                    within(n, "type", GrammarRule.EXTERNAL_TYPE_PROPERTY, this::externalTypeProperty);
                            default -> within(n, "provides", GrammarRule.PROVIDES_PROPERTY, p -> {
                                take(p, "keyword");
                                colon(p, PROVIDES);
                                elementList(p, t -> ENDPOINT_TYPES.contains(t.kind()), ENDPOINT_TYPES, true);
                            });
                        }
                    });
            close(node, open);
        }
    }

    private void externalTypeProperty(CstNode node) {
        take(node, "keyword");
        colon(node, TYPE);
        typeValue(node, TokenKind.externalTypes(), GrammarRule.EXTERNAL_TYPE);
    }

    private void userDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(TYPE, LBRACE));
        if (check(TYPE)) {
            within(node, "type", GrammarRule.USER_TYPE_PROPERTY, this::userTypeProperty);
        }
        if (check(LBRACE)) {
            Token open = take(node, "lbrace");
            items(node, GrammarRule.USER_DEFINITION,
                    t -> t.is(LABEL) || t.is(TYPE) || t.is(CHANNELS),
                    EnumSet.of(LABEL, TYPE, CHANNELS),
                    n -> {
                        switch (la().kind()) {
                            case LABEL -> within(n, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
                            case TYPE -> within(n, "type", GrammarRule.USER_TYPE_PROPERTY, this::userTypeProperty);
                            default -> within(n, "channels", GrammarRule.CHANNELS_PROPERTY, p -> {
                                take(p, "keyword");
                                colon(p, CHANNELS);
                                elementList(p, this::isValueLike, EnumSet.of(STRING, IDENTIFIER), true);
                            });
                        }
                    });
            close(node, open);
        }
    }

    private void userTypeProperty(CstNode node) {
        take(node, "keyword");
        colon(node, TYPE);
        typeValue(node, TokenKind.userTypes(), GrammarRule.USER_TYPE);
    }

    private void applicationDefinition(CstNode node) {
        take(node, "keyword");
        name(node, "name", EnumSet.of(LBRACE));
        Token open = open(node, EnumSet.of(LABEL, VERSION, CELLS, GATEWAY));
        items(node, GrammarRule.APPLICATION_DEFINITION,
                t -> t.is(LABEL) || t.is(VERSION) || t.is(CELLS) || t.is(GATEWAY),
                EnumSet.of(LABEL, VERSION, CELLS, GATEWAY),
                n -> {
                    switch (la().kind()) {
                        case LABEL -> within(n, "label", GrammarRule.LABEL_PROPERTY, this::labelProperty);
                        case VERSION -> within(n, "version", GrammarRule.VERSION_PROPERTY, this::versionProperty);
                        case CELLS -> within(n, "cells", GrammarRule.CELLS_PROPERTY, p -> {
                            take(p, "keyword");
                            colon(p, CELLS);
                            elementList(p, this::isName, NAME, true);
                        });
                        default -> within(n, "gateway", GrammarRule.GATEWAY_BLOCK, this::gatewayBlock);
                    }
                });
        close(node, open);
    }

    // ------------------------------------------------------------------
    // properties and values
    // ------------------------------------------------------------------

    private void blockProperty(CstNode node) {
        Token key = take(node, "key");
        colon(node, key.kind());
        propertyValueFor(node, key);
    }

    private void attribute(CstNode node) {
        Token key = take(node, "key");
        consume(node, "colon", COLON);
        propertyValueFor(node, key);
    }

    private void propertyValueFor(CstNode node, Token key) {
        if (NUMERIC_KEYS.contains(key.kind())) {
            within(node, "value", GrammarRule.PROPERTY_VALUE, n -> literal(n, "value", EnumSet.of(NUMBER)));
        } else if (key.is(PROTOCOL)) {
            within(node, "value", GrammarRule.PROTOCOL_VALUE, this::protocolValue);
        } else {
            within(node, "value", GrammarRule.PROPERTY_VALUE, this::propertyValue);
        }
    }

    private void protocolValue(CstNode node) {
        if (PROTOCOLS.contains(la().kind()) || check(STRING)) {
            take(node, "value");
            return;
        }
        noViable(GrammarRule.PROTOCOL_VALUE, PROTOCOLS);
        if (isValueLike(la())) {
            pos++;
        }
    }

    private void propertyValue(CstNode node) {
        Token value = la();
        if (value.is(LBRACKET)) {
            within(node, "array", GrammarRule.ARRAY_LITERAL, n -> elementList(n, this::isValueLike, VALUE_EXPECTED, false));
            return;
        }
        if (isValueLike(value)) {
            take(node, "value");
            return;
        }
        noViable(GrammarRule.PROPERTY_VALUE, VALUE_EXPECTED);
        if (!VALUE_CLOSERS.contains(value.kind())) {
            throw RESYNC;
        }
    }

    private void attributeList(CstNode node) {
        take(node, "lbracket");
        if (!check(RBRACKET)) {
            Predicate<Token> starts = t -> t.kind().isPropertyKey();
            while (true) {
                if (starts.test(la())) {
                    within(node, "attribute", GrammarRule.ATTRIBUTE, this::attribute);
                } else {
                    noViable(GrammarRule.ATTRIBUTE_LIST, EnumSet.of(IDENTIFIER));
                    if (!check(COMMA)) {
                        if (VALUE_CLOSERS.contains(la().kind())) {
                            break;
                        }
                        pos++;
                    }
                }
                if (!separator(node, starts)) {
                    break;
                }
            }
        }
        consume(node, "rbracket", RBRACKET);
    }

    /**
     * Bracketed, comma-separated list of single tokens stored under {@code "element"}.
     */
    private void elementList(CstNode node, Predicate<Token> accepts, Set<TokenKind> expected, boolean atLeastOne) {
        consume(node, "lbracket", LBRACKET, expected);
        if (check(RBRACKET)) {
            if (atLeastOne) {
                record(SyntaxError.Kind.EARLY_EXIT, expected, currentRule(), null);
            }
            take(node, "rbracket");
            return;
        }
        while (true) {
            if (accepts.test(la())) {
                take(node, "element");
            } else {
                noViable(currentRule(), expected);
                if (!check(COMMA)) {
                    if (VALUE_CLOSERS.contains(la().kind()) || startsStatement(la())) {
                        break;
                    }
                    pos++;
                }
            }
            if (!separator(node, accepts)) {
                break;
            }
        }
        consume(node, "rbracket", RBRACKET);
    }

    /**
     * Consumes a list separator. A missing comma between two items is reported and assumed.
     *
     * @return whether another item follows
     */
    private boolean separator(CstNode node, Predicate<Token> startsItem) {
        if (check(COMMA)) {
            take(node, "comma");
            return true;
        }
        if (startsItem.test(la())) {
            mismatch(EnumSet.of(COMMA));
            return true;
        }
        return false;
    }

    private void typeValue(CstNode node, Set<TokenKind> allowed, GrammarRule valueRule) {
        if (allowed.contains(la().kind())) {
            take(node, "value");
            return;
        }
        noViable(valueRule, allowed);
        if (isValueLike(la())) {
            pos++;
        }
    }

    private void colon(CstNode node, TokenKind key) {
        if (check(COLON)) {
            take(node, "colon");
        } else if (!COLON_OPTIONAL_KEYS.contains(key)) {
            consume(node, "colon", COLON);
        }
    }

    // ------------------------------------------------------------------
    // token plumbing
    // ------------------------------------------------------------------

    private CstNode within(CstNode parent, String label, GrammarRule rule, Consumer<CstNode> body) {
        CstNode node = new CstNode(rule);
        parent.add(label, node);
        ruleStack.push(rule);
        int before = errors.size();
        try {
            body.accept(node);
        } finally {
            ruleStack.pop();
            if (errors.size() > before) {
                node.markRecovered();
            }
        }
        return node;
    }

    /**
     * Repeats {@code item} until the enclosing block ends, resynchronising after each failure.
     */
    private void items(CstNode node, GrammarRule bodyRule, Predicate<Token> starts,
                       Set<TokenKind> expected, Consumer<CstNode> item) {
        while (!atBlockEnd(starts)) {
            int start = pos;
            if (starts.test(la())) {
                try {
                    item.accept(node);
                } catch (ResyncSignal signal) {
                    resync(start, starts, true);
                }
                if (pos == start) {
                    skip();
                }
            } else {
                noViable(bodyRule, expected);
                resync(start, starts, true);
            }
        }
    }

    private boolean atBlockEnd(Predicate<Token> starts) {
        Token token = la();
        return token.is(RBRACE) || token.is(EOF) || (startsStatement(token) && !starts.test(token));
    }

    private void resync(int start, Predicate<Token> starts, boolean stopAtClose) {
        if (pos == start) {
            skip();
        }
        while (!check(EOF)) {
            Token token = la();
            if ((stopAtClose && token.is(RBRACE)) || starts.test(token) || startsStatement(token)) {
                return;
            }
            skip();
        }
    }

    /**
     * Skips one token, or a whole balanced {@code { ... }} group.
     */
    private void skip() {
        if (check(LBRACE)) {
            int depth = 0;
            do {
                if (check(LBRACE)) {
                    depth++;
                } else if (check(RBRACE)) {
                    depth--;
                }
                pos++;
            } while (depth > 0 && !check(EOF));
        } else if (!check(EOF)) {
            pos++;
        }
    }

    private Token open(CstNode node, Set<TokenKind> follow) {
        EnumSet<TokenKind> accepted = EnumSet.of(RBRACE);
        accepted.addAll(follow);
        return consume(node, "lbrace", LBRACE, accepted);
    }

    private void close(CstNode node, Token open) {
        if (check(RBRACE)) {
            take(node, "rbrace");
            return;
        }
        int stray = 0;
        if (open != null && check(EOF) && !innermostUnclosedReported) {
            innermostUnclosedReported = true;
            stray = strayBracesAfter(open);
        }
        record(SyntaxError.Kind.MISMATCHED_TOKEN, EnumSet.of(RBRACE), currentRule(), open, stray);
    }

    /**
     * Braces opened after {@code open} and never closed. Blocks are unwound innermost first, so
     * for the first unclosed block only skipped groups can leave any.
     */
    private int strayBracesAfter(Token open) {
        int depth = 0;
        for (Token token : tokens) {
            if (token.offset() <= open.offset()) {
                continue;
            }
            if (token.is(LBRACE)) {
                depth++;
            } else if (token.is(RBRACE) && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    private Token name(CstNode node, String label, Set<TokenKind> follow) {
        Token current = la();
        if (isName(current)) {
            return take(node, label);
        }
        if (current.kind().isKeyword() && follow.contains(la(2).kind())) {
            mismatch(NAME);
            return take(node, label);
        }
        return consumeOneOf(node, label, NAME, follow);
    }

    /**
     * Takes a literal token of one of {@code kinds}; a wrong value token is reported and skipped.
     * Never unwinds.
     */
    private Token literal(CstNode node, String label, Set<TokenKind> kinds) {
        Token current = la();
        if (kinds.contains(current.kind())) {
            return take(node, label);
        }
        mismatch(kinds);
        if (isValueLike(current)) {
            pos++;
        }
        return null;
    }

    private Token consume(CstNode node, String label, TokenKind kind) {
        return consumeOneOf(node, label, EnumSet.of(kind), Set.of());
    }

    private Token consume(CstNode node, String label, TokenKind kind, Set<TokenKind> follow) {
        return consumeOneOf(node, label, EnumSet.of(kind), follow);
    }

    private Token consumeOneOf(CstNode node, String label, Set<TokenKind> kinds, Set<TokenKind> follow) {
        Token current = la();
        if (kinds.contains(current.kind())) {
            return take(node, label);
        }
        mismatch(kinds);
        if (!current.is(RBRACE) && !current.is(EOF) && kinds.contains(la(2).kind())) {
            pos++;
            return take(node, label);
        }
        if (INSERTABLE.containsAll(kinds) || follow.contains(current.kind())) {
            return null;
        }
        throw RESYNC;
    }

    private Token take(CstNode node, String label) {
        Token token = la();
        node.add(label, token);
        pos++;
        return token;
    }

    private void mismatch(Set<TokenKind> expected) {
        record(SyntaxError.Kind.MISMATCHED_TOKEN, expected, currentRule(), null);
    }

    private void noViable(GrammarRule rule, Set<TokenKind> expected) {
        record(SyntaxError.Kind.NO_VIABLE_ALTERNATIVE, expected, rule, null);
    }

    private void record(SyntaxError.Kind kind, Set<TokenKind> expected, GrammarRule rule, Token opening) {
        record(kind, expected, rule, opening, 0);
    }

    private void record(SyntaxError.Kind kind, Set<TokenKind> expected, GrammarRule rule, Token opening,
                        int strayBraces) {
        int index = Math.min(pos, tokens.size());
        if (opening == null && !errors.isEmpty()) {
            SyntaxError last = errors.get(errors.size() - 1);
            if (last.tokenIndex() == index && !last.isUnclosedBlock()) {
                return;
            }
        }
        errors.add(new SyntaxError(kind, la(), index, new ArrayList<>(expected), rule, opening, strayBraces));
        if (!recoveryEnabled) {
            throw new ParseAbort();
        }
    }

    private GrammarRule currentRule() {
        GrammarRule rule = ruleStack.peek();
        return rule == null ? GrammarRule.PROGRAM : rule;
    }

    private Token la() {
        return la(1);
    }

    private Token la(int k) {
        int index = pos + k - 1;
        return index < tokens.size() ? tokens.get(index) : eof;
    }

    private boolean check(TokenKind kind) {
        return la().kind() == kind;
    }

    private boolean isName(Token token) {
        return NAME.contains(token.kind());
    }

    private boolean isValueLike(Token token) {
        TokenKind kind = token.kind();
        return kind == STRING || kind == NUMBER || kind == TRUE || kind == FALSE
                || TokenKind.valueWords().contains(kind);
    }

    /** Unwinds to the nearest repetition, which resynchronises. */
    private static final class ResyncSignal extends RuntimeException {
        ResyncSignal() {
            super(null, null, false, false);
        }
    }

    /** Stops the whole parse when recovery is disabled. */
    private static final class ParseAbort extends RuntimeException {
        ParseAbort() {
            super(null, null, false, false);
        }
    }
}
