package io.github.cyfko.celldl.core.visitor;

import io.github.cyfko.celldl.core.ast.CellDefinition;
import io.github.cyfko.celldl.core.ast.ClusterDefinition;
import io.github.cyfko.celldl.core.ast.ConnectionsBlock;
import io.github.cyfko.celldl.core.ast.ErrorNode;
import io.github.cyfko.celldl.core.ast.InternalConnection;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;
import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.lexer.Lexer;
import io.github.cyfko.celldl.core.parsing.GrammarParser;
import io.github.cyfko.celldl.core.parsing.ParseTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TolerantAstBuilder")
class TolerantAstBuilderTest {

    private TolerantAstBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TolerantAstBuilder();
    }

    private Program build(String source) {
        ParseTree tree = GrammarParser.parse(Lexer.tokenize(source).tokens());
        return builder.build(tree.root());
    }

    // ==================== Error nodes ====================

    @Nested
    @DisplayName("Error nodes")
    class ErrorNodeTests {

        @Test
        @DisplayName("A cell without a name becomes an error node in place")
        void unnamedCell() {
            // When
            Program program = build("cell {}\ncell B {}");

            // Then
            assertEquals(2, program.statements().size());
            ErrorNode error = assertInstanceOf(ErrorNode.class, program.statements().get(0));
            assertEquals(ErrorCode.INCOMPLETE_CELL_DEFINITION, error.code());
            assertEquals("cellDefinition", error.ruleName());
            assertEquals(1, error.location().line());
            assertEquals(1, error.location().column());
            assertEquals("Check the cell definition starting at line 1", error.recoveryHint());
            assertTrue(error.partialData().isEmpty());

            CellDefinition cell = assertInstanceOf(CellDefinition.class, program.statements().get(1));
            assertEquals("B", cell.id());
        }

        @Test
        @DisplayName("A broken component leaves the rest of its cell intact")
        void unnamedComponent() {
            // When
            Program program = build("cell A { ms [port: 1] db Store }");

            // Then
            CellDefinition cell = assertInstanceOf(CellDefinition.class, program.statements().get(0));
            assertEquals(2, cell.components().size());
            ErrorNode error = assertInstanceOf(ErrorNode.class, cell.components().get(0));
            assertEquals(ErrorCode.INCOMPLETE_COMPONENT_DEFINITION, error.code());
            assertEquals("componentDefinition", error.ruleName());
            assertEquals(10, error.location().column());
        }

        @Test
        @DisplayName("A cluster with a broken member keeps its name as partial data")
        void clusterPartialData() {
            // When
            Program program = build("cell A { cluster Workers { fn [port: 1] } }");

            // Then
            CellDefinition cell = (CellDefinition) program.statements().get(0);
            ErrorNode error = assertInstanceOf(ErrorNode.class, cell.components().get(0));
            assertEquals("clusterDefinition", error.ruleName());
            assertEquals(Map.of("id", "Workers"), error.partialData());
        }

        @Test
        @DisplayName("Error nodes are found in statements and cell components")
        void extractErrorNodes() {
            // Given
            Program program = build("cell {}\ncell A { ms [port: 1] }");

            // When
            List<ErrorNode> errors = ErrorNodes.extractErrorNodes(program);

            // Then
            assertEquals(2, ErrorNodes.countErrorNodes(program));
            assertEquals("cellDefinition", errors.get(0).ruleName());
            assertEquals("componentDefinition", errors.get(1).ruleName());
        }
    }

    // ==================== Diagnostics ====================

    @Nested
    @DisplayName("Diagnostics")
    class DiagnosticTests {

        @Test
        @DisplayName("Each error node is also a diagnostic")
        void errorNodesAreReported() {
            // When
            build("cell {}\ncell A { ms [port: 1] }");

            // Then
            List<EnhancedParseError> errors = builder.errors();
            assertEquals(2, errors.size());
            assertEquals(ErrorCode.INCOMPLETE_CELL_DEFINITION, errors.get(0).code());
            assertEquals("cellDefinition", errors.get(0).ruleName());
            assertEquals(ErrorCode.INCOMPLETE_COMPONENT_DEFINITION, errors.get(1).code());
            assertEquals(2, errors.get(1).line());
        }

        @Test
        @DisplayName("A dotted reference inside a cell is reported and its connection skipped")
        void dottedInternalReference() {
            // Given
            String source = "cell A { ms Svc ms Other connections { Svc -> Other.Api Svc -> Other } }";

            // When
            Program program = build(source);

            // Then
            CellDefinition cell = (CellDefinition) program.statements().get(0);
            assertEquals(List.of(new InternalConnection("Svc", "Other", null)), cell.connections());
            assertEquals(1, builder.errors().size());
            EnhancedParseError error = builder.errors().get(0);
            assertEquals(ErrorCode.UNEXPECTED_TOKEN, error.code());
            assertEquals(source.indexOf('.') + 1, error.column());
        }

        @Test
        @DisplayName("A fractional replica count is reported and left unset")
        void fractionalReplicas() {
            // When
            Program program = build("cell A { cluster Workers { replicas: 2.7 fn Job } }");

            // Then
            CellDefinition cell = (CellDefinition) program.statements().get(0);
            ClusterDefinition cluster = assertInstanceOf(ClusterDefinition.class, cell.components().get(0));
            assertNull(cluster.replicas());
            assertEquals(1, cluster.components().size());
            assertEquals(1, builder.errors().size());
            EnhancedParseError error = builder.errors().get(0);
            assertEquals(ErrorCode.INVALID_ATTRIBUTE_VALUE, error.code());
            assertEquals(38, error.column());
        }

        @Test
        @DisplayName("Incomplete connections are dropped silently")
        void incompleteConnectionDropped() {
            // When
            Program program = build("flow F { A -> B\n A -> }");

            // Then
            ConnectionsBlock flow = assertInstanceOf(ConnectionsBlock.class, program.statements().get(0));
            assertEquals(1, flow.connections().size());
            assertTrue(builder.errors().isEmpty());
        }

        @Test
        @DisplayName("Diagnostics are cleared between builds")
        void diagnosticsResetPerBuild() {
            // Given
            build("cell {}");
            assertEquals(1, builder.errors().size());

            // When
            build("cell A {}");

            // Then
            assertTrue(builder.errors().isEmpty());
        }
    }
}
