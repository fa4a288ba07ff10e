package io.github.cyfko.celldl.core.ast;

import java.util.Map;

/**
 * Kind of component deployed inside a cell.
 * <p>
 * The short forms {@code ms}, {@code fn} and {@code db} are accepted by
 * {@link #fromKeyword(String)} and resolve to {@link #MICROSERVICE}, {@link #FUNCTION} and
 * {@link #DATABASE}; the AST only ever holds the canonical constant.
 * </p>
 */
public enum ComponentType implements DslKeyword {
    MICROSERVICE("microservice", "Microservice"),
    FUNCTION("function", "Function"),
    DATABASE("database", "Database"),
    BROKER("broker", "Broker"),
    CACHE("cache", "Cache"),
    GATEWAY("gateway", "Gateway"),
    IDP("idp", "Identity Provider"),
    STS("sts", "Security Token Service"),
    USERSTORE("userstore", "User Store"),
    ESB("esb", "ESB"),
    ADAPTER("adapter", "Adapter"),
    TRANSFORMER("transformer", "Transformer"),
    WEBAPP("webapp", "Web App"),
    MOBILE("mobile", "Mobile App"),
    IOT("iot", "IoT Gateway"),
    LEGACY("legacy", "Legacy System");

    private static final Map<String, ComponentType> ALIASES = Map.of(
            "ms", MICROSERVICE,
            "fn", FUNCTION,
            "db", DATABASE);

    private final String keyword;
    private final String displayLabel;

    ComponentType(String keyword, String displayLabel) {
        this.keyword = keyword;
        this.displayLabel = displayLabel;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    public String displayLabel() {
        return displayLabel;
    }

    /**
     * Resolves a component type word, aliases included.
     *
     * @return the canonical constant, or {@code null} when the word is unknown
     */
    public static ComponentType fromKeyword(String keyword) {
        ComponentType alias = keyword == null ? null : ALIASES.get(keyword);
        return alias != null ? alias : DslKeyword.lookup(ComponentType.class, keyword);
    }
}
