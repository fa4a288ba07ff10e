package io.github.cyfko.celldl.core.printer;

import io.github.cyfko.celldl.core.CellDl;
import io.github.cyfko.celldl.core.ast.AttributeValue;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.model.RecoveryParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AstPrinter")
class AstPrinterTest {

    private static final String SHOP = "workspace \"Shop\" {\n"
            + "  version: \"1.0\"\n"
            + "  property owner: \"team-a\"\n"
            + "  cell Orders type: logic {\n"
            + "    label: \"Orders\"\n"
            + "    gateway Edge ingress {\n"
            + "      position: north\n"
            + "      exposes: [api, events]\n"
            + "      policies: [rateLimit]\n"
            + "      auth: federated(Idp.Keycloak)\n"
            + "      route \"/orders\" -> OrderApi\n"
            + "    }\n"
            + "    ms OrderApi [port: 8080, protocol: https, sidecar: [\"envoy\"]]\n"
            + "    db Store { engine: \"postgres\" env { POOL = 10 } }\n"
            + "    cluster Workers { type: function replicas: 2 fn Job }\n"
            + "    connections { OrderApi -> Store : \"writes\" }\n"
            + "  }\n"
            + "  external Stripe type: saas { provides: [api] }\n"
            + "  user Shopper { channels: [web, mobile] }\n"
            + "  application Shop { cells: [Orders] gateway { exposes: [api] } }\n"
            + "  flow Checkout { Shopper -> Orders.OrderApi -> Stripe : \"pays\" [protocol: https, timeout: 30] }\n"
            + "}\n";

    // ==================== Round trip ====================

    @Nested
    @DisplayName("Round trip")
    class RoundTripTests {

        @Test
        @DisplayName("Printed source parses back to an equal AST")
        void printedSourceParsesBack() {
            // Given
            Program program = CellDl.parseOrThrow(SHOP);

            // When
            String printed = AstPrinter.stringify(program);

            // Then
            assertEquals(program, CellDl.parseOrThrow(printed));
        }

        @ParameterizedTest
        @ValueSource(strings = {"10000000000.0", "12345678.0", "2.5"})
        @DisplayName("Floats keep their kind through a round trip")
        void floatsStayFloats(String ratio) {
            // Given
            Program program = CellDl.parseOrThrow("cell A { ms Svc [ratio: " + ratio + "] }");

            // When
            Program reparsed = CellDl.parseOrThrow(AstPrinter.stringify(program));

            // Then
            assertEquals(program, reparsed);
        }

        @Test
        @DisplayName("Printing is stable once canonical")
        void printingIsStable() {
            // Given
            String once = AstPrinter.stringify(CellDl.parseOrThrow(SHOP));

            // When
            String twice = AstPrinter.stringify(CellDl.parseOrThrow(once));

            // Then
            assertEquals(once, twice);
        }

        @Test
        @DisplayName("Cell components are grouped and defaults written out")
        void canonicalCellLayout() {
            // When
            String printed = AstPrinter.stringify(CellDl.parseOrThrow("cell A { ms Svc [port: 80] }"));

            // Then
            assertEquals("cell A {\n"
                    + "  type: logic\n"
                    + "\n"
                    + "  components {\n"
                    + "    microservice Svc [port: 80]\n"
                    + "  }\n"
                    + "}\n", printed);
        }

        @Test
        @DisplayName("An empty program prints to source with no statements")
        void emptyProgram() {
            // When
            String printed = AstPrinter.stringify(Program.empty());

            // Then
            assertTrue(printed.isBlank());
            assertTrue(CellDl.parseOrThrow(printed).statements().isEmpty());
        }

        @Test
        @DisplayName("Error nodes are written as comments")
        void errorNodesAsComments() {
            // Given
            RecoveryParseResult result = CellDl.parseWithRecovery("cell {}\ncell B {}");

            // When
            String printed = AstPrinter.stringify(result.ast());

            // Then
            assertTrue(printed.startsWith("// IncompleteCellDefinition: "), printed);
            assertEquals(1, CellDl.parseOrThrow(printed).statements().size());
        }
    }

    // ==================== Names and values ====================

    @Nested
    @DisplayName("Names and values")
    class FragmentTests {

        @ParameterizedTest
        @ValueSource(strings = {"Orders", "api-gw", "order_service", "Api"})
        @DisplayName("Plain identifiers stay bare")
        void bareNames(String name) {
            assertEquals(name, AstPrinter.name(name));
        }

        @ParameterizedTest
        @CsvSource({
                "Order Service, \"Order Service\"",
                "cell, \"cell\"",
                "api, \"api\"",
                "9lives, \"9lives\"",
                "Cell, \"Cell\""
        })
        @DisplayName("Names that would not lex as identifiers are quoted")
        void quotedNames(String name, String expected) {
            assertEquals(expected, AstPrinter.name(name));
        }

        @Test
        @DisplayName("Values print in their source form")
        void values() {
            assertEquals("\"say \\\"hi\\\"\"", AstPrinter.value(AttributeValue.of("say \"hi\"")));
            assertEquals("42", AstPrinter.value(AttributeValue.of(42L)));
            assertEquals("2.5", AstPrinter.value(new AttributeValue.NumberValue(2.5)));
            assertEquals("10000000000.0", AstPrinter.value(new AttributeValue.NumberValue(1e10)));
            assertEquals("true", AstPrinter.value(AttributeValue.of(true)));
            assertEquals("[\"a\", \"b\"]", AstPrinter.value(AttributeValue.of(List.of("a", "b"))));
        }
    }

    // ==================== Options ====================

    @Nested
    @DisplayName("Print options")
    class OptionTests {

        @Test
        @DisplayName("Indent and line ending are configurable")
        void indentAndLineEnding() {
            // Given
            PrintOptions options = PrintOptions.builder().indent("    ").lineEnding("\r\n").build();

            // When
            String printed = AstPrinter.stringify(CellDl.parseOrThrow("cell A {}"), options);

            // Then
            assertEquals("cell A {\r\n    type: logic\r\n}\r\n", printed);
        }

        @Test
        @DisplayName("Blank lines between statements can be turned off")
        void blankLines() {
            // Given
            Program program = CellDl.parseOrThrow("cell A {}\ncell B {}");
            PrintOptions compact = PrintOptions.builder().blankLinesBetweenStatements(false).build();

            // When / Then
            assertEquals("cell A {\n  type: logic\n}\n\ncell B {\n  type: logic\n}\n", AstPrinter.stringify(program));
            assertEquals("cell A {\n  type: logic\n}\ncell B {\n  type: logic\n}\n", AstPrinter.stringify(program, compact));
        }

        @Test
        @DisplayName("Invalid options are rejected")
        void invalidOptions() {
            assertThrows(IllegalArgumentException.class, () -> PrintOptions.builder().lineEnding(""));
            assertThrows(NullPointerException.class, () -> PrintOptions.builder().indent(null));
            assertThrows(NullPointerException.class, () -> AstPrinter.stringify(Program.empty(), null));
        }

        @Test
        @DisplayName("Defaults use two spaces, LF and blank lines")
        void defaults() {
            PrintOptions defaults = PrintOptions.defaults();
            assertEquals("  ", defaults.getIndent());
            assertEquals("\n", defaults.getLineEnding());
            assertTrue(defaults.isBlankLinesBetweenStatements());
        }
    }
}
