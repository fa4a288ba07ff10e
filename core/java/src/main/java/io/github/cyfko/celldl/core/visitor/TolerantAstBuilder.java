package io.github.cyfko.celldl.core.visitor;

import io.github.cyfko.celldl.core.ast.CellComponent;
import io.github.cyfko.celldl.core.ast.ErrorNode;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.ast.SourceLocation;
import io.github.cyfko.celldl.core.ast.Statement;
import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;
import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.diagnostics.ErrorCollector;
import io.github.cyfko.celldl.core.exception.AstConstructionException;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.CstNode;
import io.github.cyfko.celldl.core.utils.StringEscapes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builder that never fails.
 * <p>
 * A statement or component that cannot be built is replaced by an {@link ErrorNode} at the same
 * place, and every problem is also recorded as a diagnostic available through {@link #errors()}.
 * Parts missing from recovered nodes are dropped. Whatever the input tree, {@link #build(CstNode)}
 * returns a program.
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * TolerantAstBuilder builder = new TolerantAstBuilder();
 * Program program = builder.build(tree.root());
 * int placeholders = ErrorNodes.countErrorNodes(program);
 * builder.errors().forEach(System.out::println);
 * }</pre>
 *
 * <p>An instance is not thread-safe; diagnostics are cleared at the start of each build.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TolerantAstBuilder extends AstBuilder {

    private static final Logger log = Logger.getLogger(TolerantAstBuilder.class.getName());

    private final ErrorCollector collector = new ErrorCollector();

    @Override
    protected void reset() {
        collector.clear();
    }

    /** Diagnostics recorded by the last build. */
    public List<EnhancedParseError> errors() {
        return collector.getErrors();
    }

    @Override
    protected Program programBoundary(CstNode node, Supplier<Program> body) {
        collector.enterRule(node.rule().ruleName());
        try {
            return body.get();
        } catch (RuntimeException e) {
            return Program.of(List.of(record(node, e)));
        } finally {
            collector.exitRule();
        }
    }

    @Override
    protected Statement statementBoundary(CstNode node, Supplier<Statement> body) {
        collector.enterRule(node.rule().ruleName());
        try {
            return body.get();
        } catch (RuntimeException e) {
            return record(node, e);
        } finally {
            collector.exitRule();
        }
    }

    @Override
    protected CellComponent componentBoundary(CstNode node, Supplier<CellComponent> body) {
        collector.enterRule(node.rule().ruleName());
        try {
            return body.get();
        } catch (RuntimeException e) {
            return record(node, e);
        } finally {
            collector.exitRule();
        }
    }

    @Override
    protected void report(AstConstructionException problem) {
        collector.add(diagnostic(problem.getCode(), problem.getMessage(), location(problem.getToken(), null), null));
    }

    @Override
    protected boolean tolerateIncomplete() {
        return true;
    }

    private ErrorNode record(CstNode node, RuntimeException failure) {
        ErrorCode code;
        String message;
        Token token = null;
        if (failure instanceof AstConstructionException problem) {
            code = problem.getCode();
            message = problem.getMessage();
            token = problem.getToken();
        } else {
            code = ErrorCode.UNKNOWN_ERROR;
            message = String.format("Could not build %s: %s", node.rule().description(), failure.getMessage());
        }
        SourceLocation location = location(token, node);
        String hint = String.format("Check the %s starting at line %d", node.rule().description(), location.line());

        Map<String, Object> partialData = new LinkedHashMap<>();
        Token name = node.token("name");
        if (name != null) {
            partialData.put("id", name.is(TokenKind.STRING)
                    ? StringEscapes.unquote(name.image())
                    : name.image());
        }

        collector.add(diagnostic(code, message, location, hint));
        log.fine(() -> String.format("Replaced %s at %d:%d with an error node: %s",
                node.rule().ruleName(), location.line(), location.column(), message));
        return new ErrorNode(code, message, node.rule().ruleName(), location, hint, partialData);
    }

    private static SourceLocation location(Token token, CstNode fallback) {
        Token anchor = token != null ? token : fallback == null ? null : fallback.firstToken();
        if (anchor == null) {
            return SourceLocation.START;
        }
        return new SourceLocation(anchor.line(), anchor.column(), anchor.offset(), Math.max(1, anchor.length()));
    }

    private static EnhancedParseError diagnostic(ErrorCode code, String message, SourceLocation location, String hint) {
        return EnhancedParseError.builder(code, message)
                .location(location.line(), location.column(), location.offset(), location.length())
                .recoveryHint(hint)
                .build();
    }
}
