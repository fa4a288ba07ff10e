package io.github.cyfko.celldl.core.impl;

import io.github.cyfko.celldl.core.api.CellDlParser;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.config.ParserPolicy;
import io.github.cyfko.celldl.core.diagnostics.DiagnosticMessages;
import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;
import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.diagnostics.ErrorCollector;
import io.github.cyfko.celldl.core.exception.AstConstructionException;
import io.github.cyfko.celldl.core.exception.CellDlSyntaxException;
import io.github.cyfko.celldl.core.lexer.LexResult;
import io.github.cyfko.celldl.core.lexer.Lexer;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.model.ParseError;
import io.github.cyfko.celldl.core.model.ParseResult;
import io.github.cyfko.celldl.core.model.RecoveryParseResult;
import io.github.cyfko.celldl.core.parsing.GrammarParser;
import io.github.cyfko.celldl.core.parsing.ParseTree;
import io.github.cyfko.celldl.core.parsing.SyntaxError;
import io.github.cyfko.celldl.core.printer.AstPrinter;
import io.github.cyfko.celldl.core.printer.PrintOptions;
import io.github.cyfko.celldl.core.recovery.RecoveryEngine;
import io.github.cyfko.celldl.core.visitor.ErrorNodes;
import io.github.cyfko.celldl.core.visitor.StrictAstBuilder;
import io.github.cyfko.celldl.core.visitor.TolerantAstBuilder;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Default {@link CellDlParser}: lexer, recursive-descent parser, AST builder and recovery engine
 * wired together.
 * <p>
 * Every call creates its own collector and builder, so one instance may be shared freely
 * between threads.
 * </p>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Lex</strong>: {@link Lexer#tokenize(String)}, lexical errors are recorded, never fatal</li>
 *   <li><strong>Parse</strong>: {@link GrammarParser#parse(List, boolean)} builds the CST</li>
 *   <li><strong>Enhance</strong> (tolerant only): each syntax error is described by
 *       {@link DiagnosticMessages} and given a hint and fix by the {@link RecoveryEngine}</li>
 *   <li><strong>Build</strong>: {@link StrictAstBuilder} or {@link TolerantAstBuilder}</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * CellDlParser parser = new DefaultCellDlParser();
 *
 * // Strict configuration (untrusted input, first error only)
 * CellDlParser strictParser = new DefaultCellDlParser(ParserPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DefaultCellDlParser implements CellDlParser {

    private static final Logger log = Logger.getLogger(DefaultCellDlParser.class.getName());

    private final ParserPolicy parserPolicy;
    private final RecoveryEngine recoveryEngine;

    /**
     * Default constructor using {@link ParserPolicy#defaults()} and the built-in error patterns.
     */
    public DefaultCellDlParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param parserPolicy limits and switches to apply
     * @throws IllegalArgumentException if the policy is null
     */
    public DefaultCellDlParser(ParserPolicy parserPolicy) {
        this(parserPolicy, new RecoveryEngine());
    }

    /**
     * @param parserPolicy   limits and switches to apply
     * @param recoveryEngine engine providing hints and fixes on the tolerant path
     * @throws IllegalArgumentException if any argument is null
     */
    public DefaultCellDlParser(ParserPolicy parserPolicy, RecoveryEngine recoveryEngine) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (recoveryEngine == null) {
            throw new IllegalArgumentException("Recovery engine is required");
        }
        this.parserPolicy = parserPolicy;
        this.recoveryEngine = recoveryEngine;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    // ------------------------------------------------------------------
    // strict
    // ------------------------------------------------------------------

    @Override
    public ParseResult parse(String source) {
        requireSource(source);
        if (source.length() > parserPolicy.maxSourceLength()) {
            String message = tooLong(source);
            log.fine(() -> message);
            return ParseResult.failure(List.of(new ParseError(message, 1, 1, 0, 1)));
        }

        LexResult lexResult = Lexer.tokenize(source);
        ParseTree tree = GrammarParser.parse(lexResult.tokens(), parserPolicy.recoveryEnabled());

        ErrorCollector collector = new ErrorCollector();
        collector.addLexErrors(lexResult.errors());
        for (SyntaxError error : tree.errors()) {
            collector.add(DiagnosticMessages.fromSyntaxError(error, tree.tokens()));
        }
        if (collector.hasErrors()) {
            List<ParseError> errors = toParseErrors(collector.getErrors());
            log.fine(() -> String.format("Strict parse failed with %d error(s) [policy=%s]",
                    errors.size(), parserPolicy.policyName()));
            return ParseResult.failure(errors);
        }

        try {
            Program program = new StrictAstBuilder().build(tree.root());
            log.fine(() -> String.format("Strict parse succeeded: %d statement(s)", program.statements().size()));
            return ParseResult.success(program);
        } catch (AstConstructionException e) {
            Token token = e.getToken();
            ParseError error = token == null
                    ? new ParseError(e.getMessage(), 1, 1, 0, 1)
                    : new ParseError(e.getMessage(), token.line(), token.column(), token.offset(),
                            Math.max(1, token.length()));
            log.fine(() -> String.format("AST construction failed: %s", e.getMessage()));
            return ParseResult.failure(List.of(error));
        }
    }

    @Override
    public Program parseOrThrow(String source) throws CellDlSyntaxException {
        ParseResult result = parse(source);
        if (!result.success()) {
            throw new CellDlSyntaxException(result.errors());
        }
        return result.ast();
    }

    @Override
    public List<ParseError> validate(String source) {
        return parse(source).errors();
    }

    // ------------------------------------------------------------------
    // tolerant
    // ------------------------------------------------------------------

    @Override
    public RecoveryParseResult parseWithRecovery(String source) {
        requireSource(source);
        if (source.length() > parserPolicy.maxSourceLength()) {
            return failure(tooLong(source));
        }
        try {
            LexResult lexResult = Lexer.tokenize(source);
            ParseTree tree = GrammarParser.parse(lexResult.tokens(), true);

            ErrorCollector collector = new ErrorCollector();
            collector.addLexErrors(lexResult.errors());
            for (SyntaxError error : tree.errors()) {
                EnhancedParseError diagnostic = DiagnosticMessages.fromSyntaxError(error, tree.tokens());
                collector.add(recoveryEngine.enhance(diagnostic, error, tree.tokens()));
            }

            TolerantAstBuilder builder = new TolerantAstBuilder();
            Program program = builder.build(tree.root());
            collector.addAll(builder.errors());

            int errorNodeCount = ErrorNodes.countErrorNodes(program);
            log.fine(() -> String.format("Tolerant parse: %d statement(s), %d diagnostic(s), %d error node(s)",
                    program.statements().size(), collector.getErrorCount(), errorNodeCount));
            return RecoveryParseResult.of(program, collector.getErrors(), errorNodeCount);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Tolerant parse failed unexpectedly", e);
            return failure("Unexpected parser failure: " + e.getMessage());
        }
    }

    private static RecoveryParseResult failure(String message) {
        EnhancedParseError error = EnhancedParseError.builder(ErrorCode.UNKNOWN_ERROR, message)
                .location(1, 1, 0, 1)
                .build();
        return RecoveryParseResult.of(Program.empty(), List.of(error), 0);
    }

    // ------------------------------------------------------------------
    // other operations
    // ------------------------------------------------------------------

    @Override
    public String stringify(Program program, PrintOptions options) {
        return AstPrinter.stringify(program, options);
    }

    @Override
    public LexResult tokenize(String source) {
        requireSource(source);
        return Lexer.tokenize(source);
    }

    private static void requireSource(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Source text cannot be null");
        }
    }

    private String tooLong(String source) {
        return String.format("Source length %d exceeds the maximum of %d characters allowed by %s",
                source.length(), parserPolicy.maxSourceLength(), parserPolicy.policyName());
    }

    private static List<ParseError> toParseErrors(List<EnhancedParseError> errors) {
        return errors.stream().map(ParseError::from).collect(Collectors.toList());
    }
}
