package io.github.cyfko.celldl.core.lexer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of token kinds produced by the {@link Lexer}.
 * <p>
 * Keyword kinds carry their literal spelling and whether they match case-sensitively.
 * The type vocabularies (cell types, component types and their aliases, endpoint types)
 * are case-sensitive; every other keyword matches regardless of case.
 * </p>
 *
 * <h2>Groups</h2>
 * <ul>
 *   <li><strong>Structure</strong>: block and statement keywords ({@code cell}, {@code gateway}, ...)</li>
 *   <li><strong>Property keys</strong>: keys that may be written without a colon ({@code label}, {@code port}, ...)</li>
 *   <li><strong>Vocabularies</strong>: closed value sets (cell types, component types, protocols, ...)</li>
 *   <li><strong>Literals and punctuation</strong>: identifiers, strings, numbers, delimiters</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {

    // structure
    WORKSPACE("workspace", false, Group.STRUCTURE),
    DIAGRAM("diagram", false, Group.STRUCTURE),
    CELL("cell", false, Group.STRUCTURE),
    CELLS("cells", false, Group.STRUCTURE),
    EXTERNAL("external", false, Group.STRUCTURE),
    USER("user", false, Group.STRUCTURE),
    APPLICATION("application", false, Group.STRUCTURE),
    CONNECTIONS("connections", false, Group.STRUCTURE),
    FLOW("flow", false, Group.STRUCTURE),
    GATEWAY("gateway", false, Group.STRUCTURE),
    COMPONENTS("components", false, Group.STRUCTURE),
    COMPONENT("component", false, Group.STRUCTURE),
    CLUSTER("cluster", false, Group.STRUCTURE),
    EXPOSES("exposes", false, Group.STRUCTURE),
    POLICIES("policies", false, Group.STRUCTURE),
    AUTH("auth", false, Group.STRUCTURE),
    FEDERATED("federated", false, Group.STRUCTURE),
    LOCAL_STS("local-sts", false, Group.STRUCTURE),
    ROUTE("route", false, Group.STRUCTURE),
    ENV("env", false, Group.STRUCTURE),
    PROVIDES("provides", false, Group.STRUCTURE),
    CHANNELS("channels", false, Group.STRUCTURE),
    PROPERTY("property", false, Group.STRUCTURE),
    INGRESS("ingress", false, Group.STRUCTURE),
    EGRESS("egress", false, Group.STRUCTURE),

    // property keys
    LABEL("label", false, Group.PROPERTY_KEY),
    TYPE("type", false, Group.PROPERTY_KEY),
    DESCRIPTION("description", false, Group.PROPERTY_KEY),
    VERSION("version", false, Group.PROPERTY_KEY),
    PORT("port", false, Group.PROPERTY_KEY),
    REPLICAS("replicas", false, Group.PROPERTY_KEY),
    PROTOCOL("protocol", false, Group.PROPERTY_KEY),
    CONTEXT("context", false, Group.PROPERTY_KEY),
    TARGET("target", false, Group.PROPERTY_KEY),
    POLICY("policy", false, Group.PROPERTY_KEY),
    ENGINE("engine", false, Group.PROPERTY_KEY),
    STORAGE("storage", false, Group.PROPERTY_KEY),
    SOURCE("source", false, Group.PROPERTY_KEY),

    // cell types
    LOGIC("logic", true, Group.CELL_TYPE),
    INTEGRATION("integration", true, Group.CELL_TYPE),
    DATA("data", true, Group.CELL_TYPE),
    SECURITY("security", true, Group.CELL_TYPE),
    CHANNEL("channel", true, Group.CELL_TYPE),
    LEGACY("legacy", true, Group.CELL_TYPE),

    // component types and aliases
    MICROSERVICE("microservice", true, Group.COMPONENT_TYPE),
    MS("ms", true, Group.COMPONENT_TYPE),
    FUNCTION("function", true, Group.COMPONENT_TYPE),
    FN("fn", true, Group.COMPONENT_TYPE),
    DATABASE("database", true, Group.COMPONENT_TYPE),
    DB("db", true, Group.COMPONENT_TYPE),
    BROKER("broker", true, Group.COMPONENT_TYPE),
    CACHE("cache", true, Group.COMPONENT_TYPE),
    IDP("idp", true, Group.COMPONENT_TYPE),
    STS("sts", true, Group.COMPONENT_TYPE),
    USERSTORE("userstore", true, Group.COMPONENT_TYPE),
    ESB("esb", true, Group.COMPONENT_TYPE),
    ADAPTER("adapter", true, Group.COMPONENT_TYPE),
    TRANSFORMER("transformer", true, Group.COMPONENT_TYPE),
    WEBAPP("webapp", true, Group.COMPONENT_TYPE),
    MOBILE("mobile", true, Group.COMPONENT_TYPE),
    IOT("iot", true, Group.COMPONENT_TYPE),

    // endpoint types
    API("api", true, Group.ENDPOINT_TYPE),
    EVENTS("events", true, Group.ENDPOINT_TYPE),
    STREAM("stream", true, Group.ENDPOINT_TYPE),

    // protocols
    HTTPS("https", false, Group.PROTOCOL),
    HTTP("http", false, Group.PROTOCOL),
    GRPC("grpc", false, Group.PROTOCOL),
    MTLS("mtls", false, Group.PROTOCOL),
    KAFKA("kafka", false, Group.PROTOCOL),
    TCP("tcp", false, Group.PROTOCOL),

    // connection directions
    NORTHBOUND("northbound", false, Group.DIRECTION),
    SOUTHBOUND("southbound", false, Group.DIRECTION),
    EASTBOUND("eastbound", false, Group.DIRECTION),
    WESTBOUND("westbound", false, Group.DIRECTION),

    // external and user types
    SAAS("saas", false, Group.EXTERNAL_TYPE),
    PARTNER("partner", false, Group.EXTERNAL_TYPE),
    ENTERPRISE("enterprise", false, Group.EXTERNAL_TYPE),
    INTERNAL("internal", false, Group.USER_TYPE),
    SYSTEM("system", false, Group.USER_TYPE),

    TRUE("true", false, Group.BOOLEAN),
    FALSE("false", false, Group.BOOLEAN),

    IDENTIFIER(null, false, Group.LITERAL, "identifier"),
    STRING(null, false, Group.LITERAL, "string"),
    NUMBER(null, false, Group.LITERAL, "number"),

    ARROW("->", false, Group.PUNCTUATION),
    EQUALS("=", false, Group.PUNCTUATION),
    DOT(".", false, Group.PUNCTUATION),
    LBRACE("{", false, Group.PUNCTUATION),
    RBRACE("}", false, Group.PUNCTUATION),
    LBRACKET("[", false, Group.PUNCTUATION),
    RBRACKET("]", false, Group.PUNCTUATION),
    LPAREN("(", false, Group.PUNCTUATION),
    RPAREN(")", false, Group.PUNCTUATION),
    COLON(":", false, Group.PUNCTUATION),
    COMMA(",", false, Group.PUNCTUATION),

    EOF(null, false, Group.EOF, "end of input");

    /**
     * Coarse classification of token kinds.
     */
    public enum Group {
        STRUCTURE, PROPERTY_KEY, CELL_TYPE, COMPONENT_TYPE, ENDPOINT_TYPE, PROTOCOL,
        DIRECTION, EXTERNAL_TYPE, USER_TYPE, BOOLEAN, LITERAL, PUNCTUATION, EOF
    }

    private final String literal;
    private final boolean caseSensitive;
    private final Group group;
    private final String displayName;

    TokenKind(String literal, boolean caseSensitive, Group group) {
        this(literal, caseSensitive, group, null);
    }

    TokenKind(String literal, boolean caseSensitive, Group group, String displayName) {
        this.literal = literal;
        this.caseSensitive = caseSensitive;
        this.group = group;
        this.displayName = displayName;
    }

    /** Fixed spelling of this kind, or {@code null} for literals and EOF. */
    public String literal() {
        return literal;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public Group group() {
        return group;
    }

    /**
     * Name used in diagnostics: the quoted spelling for keywords and punctuation,
     * a descriptive noun for literals.
     */
    public String displayName() {
        if (displayName != null) {
            return displayName;
        }
        return "'" + literal + "'";
    }

    public boolean isKeyword() {
        return literal != null && group != Group.PUNCTUATION;
    }

    public boolean isPunctuation() {
        return group == Group.PUNCTUATION;
    }

    private static final Set<TokenKind> CELL_TYPES = Collections.unmodifiableSet(
            EnumSet.of(LOGIC, INTEGRATION, DATA, SECURITY, CHANNEL, LEGACY));

    private static final Set<TokenKind> COMPONENT_TYPES = Collections.unmodifiableSet(EnumSet.of(
            MICROSERVICE, MS, FUNCTION, FN, DATABASE, DB, BROKER, CACHE, GATEWAY, IDP, STS, USERSTORE,
            ESB, ADAPTER, TRANSFORMER, WEBAPP, MOBILE, IOT, LEGACY));

    private static final Set<TokenKind> EXTERNAL_TYPES = Collections.unmodifiableSet(
            EnumSet.of(SAAS, PARTNER, ENTERPRISE));

    private static final Set<TokenKind> USER_TYPES = Collections.unmodifiableSet(
            EnumSet.of(EXTERNAL, INTERNAL, SYSTEM));

    private static final Set<TokenKind> VALUE_WORDS;

    static {
        EnumSet<TokenKind> words = EnumSet.noneOf(TokenKind.class);
        words.add(IDENTIFIER);
        words.addAll(CELL_TYPES);
        words.addAll(COMPONENT_TYPES);
        words.addAll(EXTERNAL_TYPES);
        words.addAll(USER_TYPES);
        for (TokenKind kind : values()) {
            if (kind.group == Group.ENDPOINT_TYPE || kind.group == Group.PROTOCOL || kind.group == Group.DIRECTION) {
                words.add(kind);
            }
        }
        words.add(INGRESS);
        words.add(EGRESS);
        words.add(LOCAL_STS);
        VALUE_WORDS = Collections.unmodifiableSet(words);
    }

    public static Set<TokenKind> cellTypes() {
        return CELL_TYPES;
    }

    /** Component type keywords, aliases and the shared {@code gateway}/{@code legacy} keywords included. */
    public static Set<TokenKind> componentTypes() {
        return COMPONENT_TYPES;
    }

    public static Set<TokenKind> externalTypes() {
        return EXTERNAL_TYPES;
    }

    public static Set<TokenKind> userTypes() {
        return USER_TYPES;
    }

    /**
     * Kinds accepted as a bare property value or array element: identifiers plus the
     * vocabulary keywords that keep their keyword meaning everywhere else.
     */
    public static Set<TokenKind> valueWords() {
        return VALUE_WORDS;
    }

    /**
     * Kinds accepted as a property key: identifiers plus every keyword of the property-key group.
     */
    public boolean isPropertyKey() {
        return this == IDENTIFIER || group == Group.PROPERTY_KEY;
    }
}
