package io.github.cyfko.celldl.core.parsing;

/**
 * Grammar rules of the CellDL parser. The rule name is carried as data by every CST node and
 * every syntax error so that diagnostics can be phrased per rule.
 */
public enum GrammarRule {
    PROGRAM("program", "program"),
    WORKSPACE_DEFINITION("workspaceDefinition", "workspace definition"),
    DIAGRAM_DEFINITION("diagramDefinition", "diagram definition"),
    STATEMENT("statement", "statement"),
    CELL_DEFINITION("cellDefinition", "cell definition"),
    CELL_BODY("cellBody", "cell body"),
    CELL_TYPE_PROPERTY("cellTypeProperty", "cell type property"),
    CELL_TYPE("cellType", "cell type"),
    LABEL_PROPERTY("labelProperty", "label property"),
    VERSION_PROPERTY("versionProperty", "version property"),
    DESCRIPTION_PROPERTY("descriptionProperty", "description property"),
    WORKSPACE_PROPERTY("workspaceProperty", "workspace property"),
    GATEWAY_BLOCK("gatewayBlock", "gateway definition"),
    GATEWAY_POSITION("gatewayPosition", "gateway position"),
    EXPOSES_PROPERTY("exposesProperty", "exposes list"),
    POLICIES_PROPERTY("policiesProperty", "policies list"),
    AUTH_PROPERTY("authProperty", "auth property"),
    ROUTE_DEFINITION("routeDefinition", "route definition"),
    COMPONENTS_BLOCK("componentsBlock", "components block"),
    COMPONENT_DEFINITION("componentDefinition", "component definition"),
    COMPONENT_TYPE_PROPERTY("componentTypeProperty", "component type property"),
    COMPONENT_TYPE("componentType", "component type"),
    COMPONENT_BODY("componentBody", "component body"),
    ENV_BLOCK("envBlock", "env block"),
    ENV_ENTRY("envEntry", "env entry"),
    CLUSTER_DEFINITION("clusterDefinition", "cluster definition"),
    CONNECTIONS_BLOCK("connectionsBlock", "connections block"),
    FLOW_BLOCK("flowBlock", "flow block"),
    CONNECTION("connection", "connection"),
    FLOW_STATEMENT("flowStatement", "flow statement"),
    CONNECTION_ATTRIBUTES("connectionAttributes", "connection attributes"),
    REFERENCE("reference", "reference"),
    EXTERNAL_DEFINITION("externalDefinition", "external definition"),
    EXTERNAL_TYPE_PROPERTY("externalTypeProperty", "external type property"),
    EXTERNAL_TYPE("externalType", "external type"),
    PROVIDES_PROPERTY("providesProperty", "provides list"),
    USER_DEFINITION("userDefinition", "user definition"),
    USER_TYPE_PROPERTY("userTypeProperty", "user type property"),
    USER_TYPE("userType", "user type"),
    CHANNELS_PROPERTY("channelsProperty", "channels list"),
    APPLICATION_DEFINITION("applicationDefinition", "application definition"),
    CELLS_PROPERTY("cellsProperty", "cells list"),
    PROPERTY("property", "property"),
    PROTOCOL_VALUE("protocolValue", "protocol"),
    ATTRIBUTE_LIST("attributeList", "attribute list"),
    ATTRIBUTE("attribute", "attribute"),
    PROPERTY_VALUE("propertyValue", "property value"),
    ARRAY_LITERAL("arrayLiteral", "array");

    private final String ruleName;
    private final String description;

    GrammarRule(String ruleName, String description) {
        this.ruleName = ruleName;
        this.description = description;
    }

    /** camelCase rule name as reported in diagnostics. */
    public String ruleName() {
        return ruleName;
    }

    /** Human wording, e.g. "cell definition". */
    public String description() {
        return description;
    }

    /**
     * Looks up a rule by its camelCase name.
     *
     * @return the rule, or {@code null} when unknown
     */
    public static GrammarRule byName(String ruleName) {
        for (GrammarRule rule : values()) {
            if (rule.ruleName.equals(ruleName)) {
                return rule;
            }
        }
        return null;
    }
}
