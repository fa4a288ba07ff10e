package io.github.cyfko.celldl.core;

import io.github.cyfko.celldl.core.ast.ComponentDefinition;
import io.github.cyfko.celldl.core.ast.ComponentType;
import io.github.cyfko.celldl.core.ast.CellDefinition;
import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.diagnostics.SuggestedFix;
import io.github.cyfko.celldl.core.exception.CellDlSyntaxException;
import io.github.cyfko.celldl.core.model.RecoveryParseResult;
import io.github.cyfko.celldl.core.printer.PrintOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CellDl")
class CellDlTest {

    private static final String ORDERS = "cell Orders type: logic {\n"
            + "  gateway ingress { exposes: [api] }\n"
            + "  microservice OrderApi [port: 8080]\n"
            + "  database Store [engine: \"postgres\"]\n"
            + "  connections { OrderApi -> Store }\n"
            + "}\n";

    @Test
    @DisplayName("Parses, prints and parses again")
    void parsePrintParse() {
        // When
        Program program = CellDl.parseOrThrow(ORDERS);
        String printed = CellDl.stringify(program, PrintOptions.builder().indent("\t").build());

        // Then
        CellDefinition cell = (CellDefinition) program.statements().get(0);
        assertEquals(ComponentType.DATABASE, ((ComponentDefinition) cell.components().get(1)).componentType());
        assertEquals(1, cell.connections().size());
        assertEquals(program, CellDl.parseOrThrow(printed));
        assertEquals(CellDl.stringify(program), CellDl.stringify(CellDl.parseOrThrow(printed)));
    }

    @Test
    @DisplayName("Applying the suggested fix makes the source valid")
    void applyingFixRepairsSource() {
        // Given
        String source = "cell Orders {";
        RecoveryParseResult partial = CellDl.parseWithRecovery(source);
        SuggestedFix fix = partial.errors().get(0).suggestedFix();

        // When
        String repaired = fix.applyTo(source);

        // Then
        assertEquals("cell Orders {}", repaired);
        assertTrue(CellDl.validate(repaired).isEmpty());
        assertTrue(CellDl.parse(repaired).success());
    }

    @Test
    @DisplayName("Strict parsing of invalid source throws")
    void strictThrows() {
        assertThrows(CellDlSyntaxException.class, () -> CellDl.parseOrThrow("cell Orders {"));
        assertEquals(4, CellDl.tokenize("cell Orders { }").tokens().size());
    }
}
