package io.github.cyfko.celldl.core;

import io.github.cyfko.celldl.core.api.CellDlParser;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.exception.CellDlSyntaxException;
import io.github.cyfko.celldl.core.impl.DefaultCellDlParser;
import io.github.cyfko.celldl.core.lexer.LexResult;
import io.github.cyfko.celldl.core.model.ParseError;
import io.github.cyfko.celldl.core.model.ParseResult;
import io.github.cyfko.celldl.core.model.RecoveryParseResult;
import io.github.cyfko.celldl.core.printer.PrintOptions;

import java.util.List;

/**
 * Static entry point to the CellDL front end, backed by a {@link DefaultCellDlParser} with the
 * default policy.
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * String source = """
 *     cell Orders type: logic {
 *       gateway ingress { exposes: [api] }
 *       microservice OrderApi [port: 8080]
 *       database Store [engine: "postgres"]
 *       connections { OrderApi -> Store }
 *     }
 *     """;
 *
 * Program program = CellDl.parseOrThrow(source);
 * String formatted = CellDl.stringify(program);
 *
 * RecoveryParseResult partial = CellDl.parseWithRecovery("cell Orders {");
 * partial.errors().get(0).suggestedFix();   // inserts "}"
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link CellDlSyntaxException} - strict parse of invalid source</li>
 *   <li>{@link IllegalArgumentException} - {@code null} source</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CellDl {

    private static final CellDlParser PARSER = new DefaultCellDlParser();

    private CellDl() {}

    public static ParseResult parse(String source) {
        return PARSER.parse(source);
    }

    public static Program parseOrThrow(String source) throws CellDlSyntaxException {
        return PARSER.parseOrThrow(source);
    }

    public static List<ParseError> validate(String source) {
        return PARSER.validate(source);
    }

    public static RecoveryParseResult parseWithRecovery(String source) {
        return PARSER.parseWithRecovery(source);
    }

    public static String stringify(Program program) {
        return PARSER.stringify(program);
    }

    public static String stringify(Program program, PrintOptions options) {
        return PARSER.stringify(program, options);
    }

    public static LexResult tokenize(String source) {
        return PARSER.tokenize(source);
    }
}
