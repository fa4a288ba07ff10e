package io.github.cyfko.celldl.core.visitor;

import io.github.cyfko.celldl.core.ast.CellComponent;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.ast.Statement;
import io.github.cyfko.celldl.core.exception.AstConstructionException;
import io.github.cyfko.celldl.core.parsing.CstNode;

import java.util.function.Supplier;

/**
 * Builder for trees that parsed without errors: the first construction problem escapes as an
 * {@link AstConstructionException}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StrictAstBuilder extends AstBuilder {

    @Override
    protected Program programBoundary(CstNode node, Supplier<Program> body) {
        return body.get();
    }

    @Override
    protected Statement statementBoundary(CstNode node, Supplier<Statement> body) {
        return body.get();
    }

    @Override
    protected CellComponent componentBoundary(CstNode node, Supplier<CellComponent> body) {
        return body.get();
    }

    @Override
    protected void report(AstConstructionException problem) {
        throw problem;
    }

    @Override
    protected boolean tolerateIncomplete() {
        return false;
    }
}
