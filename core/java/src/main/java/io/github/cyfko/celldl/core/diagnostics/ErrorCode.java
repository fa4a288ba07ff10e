package io.github.cyfko.celldl.core.diagnostics;

/**
 * Closed catalogue of diagnostic codes.
 * <p>
 * The integer space is partitioned by range and every code has a fixed category and default
 * severity. Nothing outside this table decides how serious a diagnostic is.
 * </p>
 *
 * <table border="1">
 * <caption>Code ranges</caption>
 * <tr><th>Range</th><th>Category</th></tr>
 * <tr><td>1xxx</td><td>{@link ErrorCategory#LEXICAL}</td></tr>
 * <tr><td>2xxx</td><td>{@link ErrorCategory#STRUCTURAL}</td></tr>
 * <tr><td>3xxx, 4xxx, 9999</td><td>{@link ErrorCategory#SYNTACTIC}</td></tr>
 * <tr><td>5xxx</td><td>{@link ErrorCategory#SEMANTIC} (reserved)</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ErrorCode {

    UNEXPECTED_CHARACTER(1001, "UnexpectedCharacter", ErrorCategory.LEXICAL, ErrorSeverity.ERROR),
    UNTERMINATED_STRING(1002, "UnterminatedString", ErrorCategory.LEXICAL, ErrorSeverity.ERROR),
    INVALID_NUMBER(1003, "InvalidNumber", ErrorCategory.LEXICAL, ErrorSeverity.ERROR),
    INVALID_ESCAPE_SEQUENCE(1004, "InvalidEscapeSequence", ErrorCategory.LEXICAL, ErrorSeverity.ERROR),

    MISSING_OPENING_BRACE(2001, "MissingOpeningBrace", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    MISSING_CLOSING_BRACE(2002, "MissingClosingBrace", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    MISSING_OPENING_BRACKET(2003, "MissingOpeningBracket", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    MISSING_CLOSING_BRACKET(2004, "MissingClosingBracket", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    MISSING_OPENING_PAREN(2005, "MissingOpeningParen", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    MISSING_CLOSING_PAREN(2006, "MissingClosingParen", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    UNBALANCED_DELIMITERS(2007, "UnbalancedDelimiters", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),
    UNTERMINATED_BLOCK(2008, "UnterminatedBlock", ErrorCategory.STRUCTURAL, ErrorSeverity.ERROR),

    MISSING_IDENTIFIER(3001, "MissingIdentifier", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_STRING_LITERAL(3002, "MissingStringLiteral", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_NUMBER_LITERAL(3003, "MissingNumberLiteral", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_COLON(3004, "MissingColon", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_ARROW(3005, "MissingArrow", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_EQUALS(3006, "MissingEquals", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    MISSING_COMMA(3007, "MissingComma", ErrorCategory.SYNTACTIC, ErrorSeverity.WARNING),
    MISSING_KEYWORD(3008, "MissingKeyword", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),

    UNEXPECTED_TOKEN(4001, "UnexpectedToken", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_CELL_TYPE(4002, "InvalidCellType", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_COMPONENT_TYPE(4003, "InvalidComponentType", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_GATEWAY_DIRECTION(4004, "InvalidGatewayDirection", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_EXTERNAL_TYPE(4005, "InvalidExternalType", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_USER_TYPE(4006, "InvalidUserType", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INVALID_PROTOCOL(4007, "InvalidProtocol", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INCOMPLETE_CELL_DEFINITION(4008, "IncompleteCellDefinition", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INCOMPLETE_GATEWAY_DEFINITION(4009, "IncompleteGatewayDefinition", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INCOMPLETE_COMPONENT_DEFINITION(4010, "IncompleteComponentDefinition", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    INCOMPLETE_FLOW_STATEMENT(4011, "IncompleteFlowStatement", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    NO_VIABLE_ALTERNATIVE(4012, "NoViableAlternative", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    EARLY_EXIT(4013, "EarlyExit", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),
    REDUNDANT_INPUT(4014, "RedundantInput", ErrorCategory.SYNTACTIC, ErrorSeverity.WARNING),
    INVALID_ATTRIBUTE_VALUE(4015, "InvalidAttributeValue", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR),

    UNDEFINED_REFERENCE(5001, "UndefinedReference", ErrorCategory.SEMANTIC, ErrorSeverity.ERROR),
    DUPLICATE_IDENTIFIER(5002, "DuplicateIdentifier", ErrorCategory.SEMANTIC, ErrorSeverity.WARNING),
    TYPE_MISMATCH(5003, "TypeMismatch", ErrorCategory.SEMANTIC, ErrorSeverity.ERROR),

    UNKNOWN_ERROR(9999, "UnknownError", ErrorCategory.SYNTACTIC, ErrorSeverity.ERROR);

    private final int code;
    private final String codeName;
    private final ErrorCategory category;
    private final ErrorSeverity severity;

    ErrorCode(int code, String codeName, ErrorCategory category, ErrorSeverity severity) {
        this.code = code;
        this.codeName = codeName;
        this.category = category;
        this.severity = severity;
    }

    public int code() {
        return code;
    }

    /** PascalCase name, e.g. {@code MissingClosingBrace}. */
    public String codeName() {
        return codeName;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    /**
     * Looks up a code by its integer value.
     *
     * @param code numeric code
     * @return the matching constant, {@link #UNKNOWN_ERROR} when the value is not catalogued
     */
    public static ErrorCode fromCode(int code) {
        for (ErrorCode candidate : values()) {
            if (candidate.code == code) {
                return candidate;
            }
        }
        return UNKNOWN_ERROR;
    }
}
