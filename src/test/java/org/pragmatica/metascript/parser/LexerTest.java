package org.pragmatica.metascript.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<String> kinds(List<Token> tokens) {
        return tokens.stream()
                     .map(token -> token.getClass().getSimpleName())
                     .toList();
    }

    @Test
    void tokenize_simpleStatement_producesIdentifierLiteralAndNewline() {
        var tokens = Lexer.tokenize("say \"Hi\"", Layout.BLOCK);

        assertEquals(List.of("Identifier", "StringLiteral", "Newline", "Eof"), kinds(tokens));
        assertEquals("say", ((Token.Identifier) tokens.get(0)).name());
        assertEquals("Hi", ((Token.StringLiteral) tokens.get(1)).value());
    }

    @Test
    void tokenize_indentedBlock_producesIndentAndDedent() {
        var tokens = Lexer.tokenize("""
            if x:
                say 1
            say 2
            """, Layout.BLOCK);

        assertEquals(List.of("Identifier", "Identifier", "Symbol", "Newline",
                             "Indent", "Identifier", "IntLiteral", "Newline",
                             "Dedent", "Identifier", "IntLiteral", "Newline",
                             "Eof"),
                     kinds(tokens));
    }

    @Test
    void tokenize_unclosedBlockAtEnd_closesWithDedents() {
        var tokens = Lexer.tokenize("def f():\n    if x:\n        say 1", Layout.BLOCK);

        var kinds = kinds(tokens);
        assertEquals(List.of("Newline", "Dedent", "Dedent", "Eof"), kinds.subList(kinds.size() - 4, kinds.size()));
    }

    @Test
    void tokenize_inconsistentDedent_producesError() {
        var tokens = Lexer.tokenize("if x:\n    say 1\n  say 2\n", Layout.BLOCK);

        assertTrue(tokens.stream().anyMatch(token -> token instanceof Token.Error));
    }

    @Test
    void tokenize_lineLayout_joinsHeaderWithIndentedLines() {
        var tokens = Lexer.tokenize("""
            def f():
                return 1
            say 2
            """, Layout.LINE);

        var kinds = kinds(tokens);
        assertFalse(kinds.contains("Indent"));
        assertFalse(kinds.contains("Dedent"));
        assertEquals(2, kinds.stream().filter("Newline"::equals).count());
        assertInstanceOf(Token.Newline.class, tokens.get(7));
    }

    @Test
    void tokenize_lineLayout_joinsElseLine() {
        var tokens = Lexer.tokenize("if x: say 1\nelse: say 2\n", Layout.LINE);

        assertEquals(1, kinds(tokens).stream().filter("Newline"::equals).count());
    }

    @Test
    void tokenize_lineLayout_unindentedLineStartsNewLogicalLine() {
        var tokens = Lexer.tokenize("say 1\n    say 2\n", Layout.LINE);

        assertEquals(2, kinds(tokens).stream().filter("Newline"::equals).count());
    }

    @Test
    void tokenize_agentPayload_isCapturedRaw() {
        var tokens = Lexer.tokenize("agent frontend [\"type\": \"x\", \"items\": [1, \"]\"]]", Layout.BLOCK);

        assertEquals(List.of("Identifier", "Identifier", "Payload", "Newline", "Eof"), kinds(tokens));
        assertEquals("\"type\": \"x\", \"items\": [1, \"]\"]", ((Token.Payload) tokens.get(2)).text());
    }

    @Test
    void tokenize_agentAsVariable_isNotPayload() {
        var tokens = Lexer.tokenize("say agent [1]", Layout.BLOCK);

        assertFalse(kinds(tokens).contains("Payload"));
    }

    @Test
    void tokenize_unterminatedPayload_producesError() {
        var tokens = Lexer.tokenize("agent backend [\"action\": \"x\"", Layout.BLOCK);

        assertTrue(tokens.stream().anyMatch(token -> token instanceof Token.Error));
    }

    @Test
    void tokenize_unterminatedString_producesError() {
        var tokens = Lexer.tokenize("say \"oops\nsay 1", Layout.BLOCK);

        var error = tokens.stream()
                          .filter(token -> token instanceof Token.Error)
                          .map(Token.Error.class::cast)
                          .findFirst()
                          .orElseThrow();
        assertEquals("Unterminated string literal", error.message());
        assertEquals(1, error.span().start().line());
        assertEquals(5, error.span().start().column());
    }

    @Test
    void tokenize_escapeSequences_areDecoded() {
        var tokens = Lexer.tokenize("say \"a\\\"b\\n\\t\\\\\\q\"", Layout.BLOCK);

        assertEquals("a\"b\n\t\\\\q", ((Token.StringLiteral) tokens.get(1)).value());
    }

    @Test
    void tokenize_singleQuotedString_isAccepted() {
        var tokens = Lexer.tokenize("say 'it\\'s'", Layout.BLOCK);

        assertEquals("it's", ((Token.StringLiteral) tokens.get(1)).value());
    }

    @Test
    void tokenize_commentsAndBlankLines_areSkipped() {
        var tokens = Lexer.tokenize("# heading\n\nsay 1  # trailing\n\n   \n", Layout.BLOCK);

        assertEquals(List.of("Identifier", "IntLiteral", "Newline", "Eof"), kinds(tokens));
    }

    @Test
    void tokenize_lineBreakInsideBrackets_isIgnored() {
        var tokens = Lexer.tokenize("say [1,\n     2]\n", Layout.BLOCK);

        var kinds = kinds(tokens);
        assertEquals(1, kinds.stream().filter("Newline"::equals).count());
        assertFalse(kinds.contains("Indent"));
    }

    @Test
    void tokenize_twoCharacterSymbols_areRecognized() {
        var tokens = Lexer.tokenize("1..3 == <= >= != < >", Layout.BLOCK);

        var symbols = tokens.stream()
                            .filter(token -> token instanceof Token.Symbol)
                            .map(token -> ((Token.Symbol) token).text())
                            .toList();
        assertEquals(List.of("..", "==", "<=", ">=", "!=", "<", ">"), symbols);
    }

    @Test
    void tokenize_unknownCharacter_producesError() {
        var tokens = Lexer.tokenize("say $", Layout.BLOCK);

        assertInstanceOf(Token.Error.class, tokens.get(1));
    }

    @Test
    void tokenize_crlfLineEndings_trackLines() {
        var tokens = Lexer.tokenize("say 1\r\nsay 2\r\n", Layout.BLOCK);

        var second = tokens.get(3);
        assertInstanceOf(Token.Identifier.class, second);
        assertEquals(2, second.span().start().line());
        assertEquals(1, second.span().start().column());
    }
}
