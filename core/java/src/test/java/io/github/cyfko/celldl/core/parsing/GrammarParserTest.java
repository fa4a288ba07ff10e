package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Lexer;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrammarParser")
class GrammarParserTest {

    private static ParseTree parse(String source) {
        return GrammarParser.parse(Lexer.tokenize(source).tokens());
    }

    // ==================== Dialects ====================

    @Nested
    @DisplayName("Dialects")
    class DialectTests {

        @Test
        @DisplayName("Bare statements hang under the program")
        void bareStatements() {
            // Given
            String source = "cell Orders type:logic { microservice OrderApi [port: 8080] }\n"
                    + "external Stripe type: saas";

            // When
            ParseTree tree = parse(source);

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
            List<CstNode> statements = tree.root().nodes("statement");
            assertEquals(2, statements.size());
            assertEquals(GrammarRule.CELL_DEFINITION, statements.get(0).rule());
            assertEquals(GrammarRule.EXTERNAL_DEFINITION, statements.get(1).rule());
            assertEquals("Orders", statements.get(0).token("name").image());
        }

        @Test
        @DisplayName("A workspace wrapper holds metadata and statements")
        void workspaceWrapper() {
            // Given
            String source = "workspace \"Shop\" {\n"
                    + "  version: \"1.0\"\n"
                    + "  description: \"Online shop\"\n"
                    + "  property owner: \"team-a\"\n"
                    + "  cell A { }\n"
                    + "}";

            // When
            ParseTree tree = parse(source);

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
            CstNode workspace = tree.root().node("workspace");
            assertNotNull(workspace);
            assertEquals(GrammarRule.WORKSPACE_DEFINITION, workspace.rule());
            assertEquals(1, workspace.nodes("version").size());
            assertEquals(1, workspace.nodes("description").size());
            assertEquals(1, workspace.nodes("property").size());
            assertEquals(1, workspace.nodes("statement").size());
            assertTrue(tree.root().nodes("statement").isEmpty());
        }

        @Test
        @DisplayName("A diagram wrapper holds statements only")
        void diagramWrapper() {
            // When
            ParseTree tree = parse("diagram Shop { cell A {} external Stripe {} }");

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
            CstNode diagram = tree.root().node("diagram");
            assertNotNull(diagram);
            assertEquals(2, diagram.nodes("statement").size());
        }

        @Test
        @DisplayName("Content after the wrapper is flagged but still parsed")
        void contentAfterWrapper() {
            // When
            ParseTree tree = parse("workspace W { cell A {} }\ncell B {}");

            // Then
            assertEquals(1, tree.errors().size());
            assertEquals(SyntaxError.Kind.NOT_ALL_INPUT_PARSED, tree.errors().get(0).kind());
            assertEquals(1, tree.root().node("workspace").nodes("statement").size());
            assertEquals(1, tree.root().nodes("statement").size());
            assertTrue(tree.root().recovered());
        }
    }

    // ==================== Properties ====================

    @Nested
    @DisplayName("Properties")
    class PropertyTests {

        @Test
        @DisplayName("Colons may be omitted after label, type and port")
        void optionalColons() {
            // When
            ParseTree tree = parse("cell A type logic { label \"Accounts\" microservice Svc { port 8080 } }");

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
        }

        @Test
        @DisplayName("A colon is required inside an attribute list")
        void colonRequiredInAttributeList() {
            // When
            ParseTree tree = parse("cell A { microservice Svc [port 8080] }");

            // Then
            assertEquals(1, tree.errors().size());
            SyntaxError error = tree.errors().get(0);
            assertEquals(SyntaxError.Kind.MISMATCHED_TOKEN, error.kind());
            assertEquals(List.of(TokenKind.COLON), error.expected());
            assertEquals("8080", error.token().image());
        }

        @Test
        @DisplayName("A missing comma between attributes is assumed")
        void missingCommaIsAssumed() {
            // When
            ParseTree tree = parse("cell A { microservice Svc [port: 1 protocol: https] }");

            // Then
            assertEquals(1, tree.errors().size());
            assertEquals(List.of(TokenKind.COMMA), tree.errors().get(0).expected());
            CstNode component = tree.root().node("statement").node("component");
            assertEquals(2, component.node("attributes").nodes("attribute").size());
        }
    }

    // ==================== Connections ====================

    @Nested
    @DisplayName("Connections")
    class ConnectionTests {

        @Test
        @DisplayName("A chain is kept as one connection with every endpoint")
        void chainIsOneConnection() {
            // When
            ParseTree tree = parse("flow Checkout { Web -> Api -> Store : \"order\" }");

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
            CstNode flow = tree.root().node("statement");
            assertEquals(GrammarRule.FLOW_BLOCK, flow.rule());
            CstNode connection = flow.node("connection");
            assertEquals(GrammarRule.FLOW_STATEMENT, connection.rule());
            assertEquals(3, connection.nodes("endpoint").size());
            assertEquals("\"order\"", connection.token("label").image());
        }

        @Test
        @DisplayName("An empty flow is an early exit")
        void emptyFlow() {
            // When
            ParseTree tree = parse("flow F { }");

            // Then
            assertEquals(1, tree.errors().size());
            assertEquals(SyntaxError.Kind.EARLY_EXIT, tree.errors().get(0).kind());
        }

        @Test
        @DisplayName("Dotted references keep both parts")
        void dottedReference() {
            // When
            ParseTree tree = parse("connections { Orders.OrderApi -> Payments.PayApi }");

            // Then
            assertFalse(tree.hasErrors(), () -> "Unexpected errors: " + tree.errors());
            CstNode connection = tree.root().node("statement").node("connection");
            CstNode target = connection.nodes("endpoint").get(1);
            assertTrue(target.has("dot"));
            assertEquals("Payments", target.token("entity").image());
            assertEquals("PayApi", target.token("component").image());
        }
    }

    // ==================== Recovery ====================

    @Nested
    @DisplayName("Recovery")
    class RecoveryTests {

        @Test
        @DisplayName("A cell without a name is reported and parsing continues")
        void cellWithoutName() {
            // When
            ParseTree tree = parse("cell {}\ncell B {}");

            // Then
            assertEquals(1, tree.errors().size());
            SyntaxError error = tree.errors().get(0);
            assertEquals(SyntaxError.Kind.MISMATCHED_TOKEN, error.kind());
            assertTrue(error.expected().containsAll(List.of(TokenKind.IDENTIFIER, TokenKind.STRING)));
            assertEquals(2, tree.root().nodes("statement").size());
            assertNull(tree.root().nodes("statement").get(0).token("name"));
        }

        @Test
        @DisplayName("Each unclosed block is reported with its opening brace")
        void nestedUnclosedBlocks() {
            // Given
            String source = "cell A {\n  components {\n    microservice Svc\n";

            // When
            ParseTree tree = parse(source);

            // Then
            assertEquals(2, tree.errors().size());
            assertTrue(tree.errors().stream().allMatch(SyntaxError::isUnclosedBlock));
            assertEquals(2, tree.errors().get(0).openingToken().line());
            assertEquals(1, tree.errors().get(1).openingToken().line());
        }

        @Test
        @DisplayName("Stray tokens between statements are skipped")
        void strayTokens() {
            // When
            ParseTree tree = parse("cell A {} 42 ] cell B {}");

            // Then
            assertEquals(1, tree.errors().size());
            assertEquals(SyntaxError.Kind.NO_VIABLE_ALTERNATIVE, tree.errors().get(0).kind());
            assertEquals(2, tree.root().nodes("statement").size());
        }

        @Test
        @DisplayName("With recovery disabled parsing stops at the first error")
        void recoveryDisabled() {
            // When
            ParseTree tree = GrammarParser.parse(Lexer.tokenize("cell {}\ncell {}").tokens(), false);

            // Then
            assertEquals(1, tree.errors().size());
        }

        @Test
        @DisplayName("Empty input parses to an empty program")
        void emptyInput() {
            // When
            ParseTree tree = parse("");

            // Then
            assertFalse(tree.hasErrors());
            assertTrue(tree.root().nodes("statement").isEmpty());
            assertEquals(GrammarRule.PROGRAM, tree.root().rule());
        }
    }
}
