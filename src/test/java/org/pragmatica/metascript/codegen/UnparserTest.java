package org.pragmatica.metascript.codegen;

import org.junit.jupiter.api.Test;
import org.pragmatica.metascript.macro.MacroExpander;
import org.pragmatica.metascript.parser.Layout;
import org.pragmatica.metascript.parser.Parser;
import org.pragmatica.metascript.parser.ParserConfig;
import org.pragmatica.metascript.tree.Expression.BinaryOp;
import org.pragmatica.metascript.tree.Expression.IntLiteral;
import org.pragmatica.metascript.tree.Expression.Name;
import org.pragmatica.metascript.tree.Expression.StringLiteral;
import org.pragmatica.metascript.tree.Program;
import org.pragmatica.metascript.tree.Statement.Say;

import static org.assertj.core.api.Assertions.assertThat;

class UnparserTest {

    private static final String PROGRAM = """
        # everything the parser accepts
        macro twice(x):
            say x
            say x
        @twice("Hi")
        let total = 0
        count = 3
        for i in range(0, 10, 2):
            total = total + i * 2
        for n in 1..3: print n
        for item in items:
            pass
        if not total == 0: say "nonzero" else: say 'zero'
        while count > 0:
            count = count - 1
        def add(a, b):
            return a + b
        async def fetch(url):
            return await get(url, [1, "two"])
        do:
            log(-count)
        match pair:
            case [a, _]: say a
            case -1: pass
            case "s\\tq\\"": say "quoted"
            case other:
                say other
        agent backend ["action": "validate", "path": "C:\\temp"]
        """;

    @Test
    void unparse_say_quotesWithDoubleQuotes() {
        assertThat(Unparser.unparse(Program.of(new Say(new StringLiteral("s")))))
            .isEqualTo("say \"s\"\n");
    }

    @Test
    void unparse_blocks_useFourSpaceIndentAndPass() {
        var text = Unparser.unparse(Parser.parse("""
            def f(a):
                if a: pass else: say a
            """));

        assertThat(text).isEqualTo("""
            def f(a):
                if a:
                    pass
                else:
                    say a
            """);
    }

    @Test
    void unparse_binaryOperations_areFullyParenthesized() {
        var expression = new BinaryOp("*", new BinaryOp("+", new Name("a"), new IntLiteral(1)), new IntLiteral(2));

        assertThat(Unparser.unparse(expression)).isEqualTo("((a + 1) * 2)");
    }

    @Test
    void unparse_match_nestsCases() {
        var text = Unparser.unparse(Parser.parse("match v: case [x, 1]: say x case _: pass"));

        assertThat(text).isEqualTo("""
            match v:
                case [x, 1]:
                    say x
                case _:
                    pass
            """);
    }

    @Test
    void unparse_thenParse_reproducesTree() {
        var tree = Parser.parse(PROGRAM);

        assertThat(Parser.parse(Unparser.unparse(tree))).isEqualTo(tree);
    }

    @Test
    void unparse_thenParseInLineLayout_reproducesSingleStatementBodies() {
        var tree = Parser.parse("""
            for i in range(3): say i
            match v: case 1: say "one" case _: pass
            """);

        assertThat(Parser.parse(Unparser.unparse(tree), new ParserConfig(Layout.LINE))).isEqualTo(tree);
    }

    @Test
    void unparse_expandedTree_roundTrips() {
        var expanded = MacroExpander.expand(Parser.parse(PROGRAM));

        var text = Unparser.unparse(expanded);

        assertThat(text).doesNotContain("macro ").doesNotContain("@twice");
        assertThat(Parser.parse(text)).isEqualTo(expanded);
    }
}
