package io.github.cyfko.celldl.core.api;

import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.exception.CellDlSyntaxException;
import io.github.cyfko.celldl.core.lexer.LexResult;
import io.github.cyfko.celldl.core.model.ParseError;
import io.github.cyfko.celldl.core.model.ParseResult;
import io.github.cyfko.celldl.core.model.RecoveryParseResult;
import io.github.cyfko.celldl.core.printer.PrintOptions;

import java.util.List;

/**
 * Entry points of the CellDL front end.
 * <p>
 * Two families of operations coexist:
 * </p>
 * <ul>
 *   <li><strong>Strict</strong> ({@link #parse(String)}, {@link #parseOrThrow(String)},
 *       {@link #validate(String)}): any diagnostic makes the parse fail and no AST is produced</li>
 *   <li><strong>Tolerant</strong> ({@link #parseWithRecovery(String)}): the parse never fails, the AST
 *       is always returned, fragments that could not be built are replaced by error nodes and
 *       each diagnostic carries a hint and, where one is known, a suggested fix</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * CellDlParser parser = new DefaultCellDlParser();
 *
 * // Build time: fail loudly
 * Program program = parser.parseOrThrow("cell Orders type: logic { microservice OrderApi }");
 *
 * // Editor: always render something
 * RecoveryParseResult result = parser.parseWithRecovery("cell Orders {");
 * result.errors().forEach(e -> System.out.println(e.message() + " " + e.recoveryHint()));
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Calls are independent: no state is shared between two calls</li>
 *   <li>Identical input gives identical output</li>
 *   <li>The tolerant operation never throws for a non-null source</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface CellDlParser {

    /**
     * Strict parse.
     *
     * @param source CellDL source text
     * @return the AST when there is no error, the errors otherwise
     * @throws IllegalArgumentException if {@code source} is {@code null}
     */
    ParseResult parse(String source);

    /**
     * Strict parse that fails loudly.
     * <p><strong>Failure message:</strong></p>
     * <pre>{@code
     * Parse errors:
     *   Line 1:6: Expected a name (identifier or string) in cell definition, but found '{'
     * }</pre>
     *
     * @param source CellDL source text
     * @return the AST
     * @throws CellDlSyntaxException if the source has any error
     */
    Program parseOrThrow(String source) throws CellDlSyntaxException;

    /**
     * Errors of a strict parse, empty when the source is valid.
     */
    List<ParseError> validate(String source);

    /**
     * Tolerant parse.
     *
     * @param source CellDL source text
     * @return the AST, never {@code null}, with every diagnostic
     */
    RecoveryParseResult parseWithRecovery(String source);

    /**
     * Canonical source text of {@code program}.
     */
    String stringify(Program program, PrintOptions options);

    default String stringify(Program program) {
        return stringify(program, PrintOptions.defaults());
    }

    /**
     * Token stream of {@code source}, for syntax highlighting.
     */
    LexResult tokenize(String source);
}
