package io.github.cyfko.celldl.core.visitor;

import io.github.cyfko.celldl.core.ast.CellComponent;
import io.github.cyfko.celldl.core.ast.CellDefinition;
import io.github.cyfko.celldl.core.ast.ErrorNode;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Queries over the {@link ErrorNode} placeholders of a program, cell components included.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ErrorNodes {

    private ErrorNodes() {}

    public static int countErrorNodes(Program program) {
        return extractErrorNodes(program).size();
    }

    /** Placeholders in source order. */
    public static List<ErrorNode> extractErrorNodes(Program program) {
        List<ErrorNode> found = new ArrayList<>();
        for (Statement statement : program.statements()) {
            if (statement instanceof ErrorNode error) {
                found.add(error);
            } else if (statement instanceof CellDefinition cell) {
                for (CellComponent component : cell.components()) {
                    if (component instanceof ErrorNode error) {
                        found.add(error);
                    }
                }
            }
        }
        return found;
    }
}
