package org.pragmatica.metascript.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.metascript.parser.Parser;
import org.pragmatica.metascript.tree.SourceLocation;
import org.pragmatica.metascript.tree.SourceSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxErrorTest {

    @Test
    void unexpectedInput_messageNamesTokenLocationAndExpectation() {
        var span = SourceSpan.of(SourceLocation.at(2, 5, 10), SourceLocation.at(2, 6, 11));

        var error = SyntaxError.unexpectedInput(span, "'='", "variable name");

        assertEquals("Unexpected '=' at 2:5, expected variable name", error.getMessage());
        assertEquals(SourceLocation.at(2, 5, 10), error.location());
    }

    @Test
    void format_underlinesOffendingToken() {
        var source = "say 1\nlet = 5";
        var error = assertThrows(SyntaxError.class, () -> Parser.parse(source));

        var formatted = error.format(source, "prog.ms");

        assertTrue(formatted.startsWith("error: unexpected input\n"), formatted);
        assertTrue(formatted.contains("  --> prog.ms:2:5\n"), formatted);
        assertTrue(formatted.contains("2 | let = 5\n"), formatted);
        assertTrue(formatted.contains("  |     ^ found '='\n"), formatted);
        assertTrue(formatted.contains("= help: expected variable name"), formatted);
    }

    @Test
    void formatSimple_usesDefaultInputName() {
        var diagnostic = Diagnostic.error("bad thing", SourceSpan.at(SourceLocation.at(3, 7, 20)));

        assertEquals("input:3:7: error: bad thing", diagnostic.formatSimple(null));
    }

    @Test
    void withNote_keepsEarlierNotes() {
        var diagnostic = Diagnostic.error("bad", SourceSpan.at(SourceLocation.START))
                                   .withNote("first")
                                   .withHelp("second");

        assertEquals(List.of("first", "help: second"), diagnostic.notes());
    }

    @Test
    void depthError_abbreviatesLongChains() {
        var chain = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j");

        var error = new MacroExpansionDepthError(9, chain);

        assertEquals("Macro expansion exceeded depth 9: a -> b -> c -> d -> ... -> h -> i -> j", error.getMessage());
        assertEquals(chain, error.chain());
    }
}
