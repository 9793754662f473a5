package org.pragmatica.metascript.codegen;

import org.junit.jupiter.api.Test;
import org.pragmatica.metascript.error.UnsupportedConstructError;
import org.pragmatica.metascript.macro.ExpanderConfig;
import org.pragmatica.metascript.parser.Parser;
import org.pragmatica.metascript.tree.Program;
import org.pragmatica.metascript.tree.Statement.AgentCall;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonGeneratorTest {

    private static final String HEADER = "# Generated by MetaScript (python target)\n";

    private static final GeneratorConfig PLACEHOLDERS = GeneratorConfig.DEFAULT.withUnsupported(UnsupportedPolicy.PLACEHOLDER);

    private static String python(String source) {
        return PythonGenerator.create().generate(Parser.parse(source));
    }

    @Test
    void generate_say_becomesPrint() {
        assertThat(python("say \"Hi\"")).isEqualTo(HEADER + "print('Hi')\n");
    }

    @Test
    void generate_macroCall_isExpandedInline() {
        var output = python("""
            macro twice(x):
                say x
                say x
            @twice("Hi")
            """);

        assertThat(output).isEqualTo(HEADER + "print('Hi')\nprint('Hi')\n")
                          .doesNotContain("twice");
    }

    @Test
    void generate_forOverRange_isNativeLoop() {
        assertThat(python("for i in range(3): say i")).isEqualTo(HEADER + """
            for i in range(3):
                print(i)
            """);
    }

    @Test
    void generate_inclusiveRange_addsOneToEnd() {
        assertThat(python("for i in 1..3: say i")).contains("for i in range(1, (3 + 1)):");
    }

    @Test
    void generate_forOverIterable_keepsExpression() {
        assertThat(python("for x in items: print x")).contains("for x in items:\n    print(x)\n");
    }

    @Test
    void generate_ifElse_usesNativeBranches() {
        assertThat(python("if x > 0: say \"pos\" else: say \"neg\"")).isEqualTo(HEADER + """
            if (x > 0):
                print('pos')
            else:
                print('neg')
            """);
    }

    @Test
    void generate_asyncFunction_keepsAwait() {
        assertThat(python("async def fetch(): return await get()")).isEqualTo(HEADER + """
            async def fetch():
                return await get()
            """);
    }

    @Test
    void generate_emptyBodies_becomePass() {
        var output = python("""
            def f():
                pass
            while busy:
                do:
                    pass
            """);

        assertThat(output).isEqualTo(HEADER + """
            def f():
                pass
            while busy:
                pass
            """);
    }

    @Test
    void generate_match_becomesIfElifChain() {
        var output = python("""
            match arr:
                case [a, 0]: say a
                case "x": say "ex"
                case _: say "other"
            """);

        assertThat(output).isEqualTo(HEADER + """
            __ms_match_val = arr
            if isinstance(__ms_match_val, list) and len(__ms_match_val) == 2 and __ms_match_val[1] == 0:
                a = __ms_match_val[0]
                print(a)
            elif __ms_match_val == 'x':
                print('ex')
            elif True:
                print('other')
            """);
    }

    @Test
    void generate_secondMatch_usesNumberedTemporary() {
        var output = python("""
            match a: case 1: say 1
            match b: case n: say n
            """);

        assertThat(output).contains("__ms_match_val = a\n")
                          .contains("__ms_match_val_2 = b\n")
                          .contains("    n = __ms_match_val_2\n");
    }

    @Test
    void generate_agentCall_rendersPayloadAsPythonLiteral() {
        var output = python("agent backend [\"action\": \"validate\", \"retries\": 2, \"dry\": true, \"tags\": null]");

        assertThat(output).isEqualTo(HEADER + "agent_call('backend', {'action': 'validate', 'retries': 2, 'dry': True, 'tags': None})\n");
    }

    @Test
    void generate_agentEntryPoint_isConfigurable() {
        var generator = PythonGenerator.create(new GeneratorConfig(UnsupportedPolicy.FAIL, "dispatch", "dispatch"),
                                               ExpanderConfig.DEFAULT);

        assertThat(generator.generate(Parser.parse("agent ui []"))).contains("dispatch('ui', {})");
    }

    @Test
    void generate_stringWithSingleQuote_switchesQuotes() {
        assertThat(python("say \"it's\"")).contains("print(\"it's\")");
        assertThat(python("say \"a\\nb\"")).contains("print('a\\nb')");
    }

    @Test
    void generate_notAndNegation_areParenthesized() {
        assertThat(python("if not x == -1: pass")).contains("if (not (x == -1)):\n    pass\n");
    }

    @Test
    void generate_macroLocal_appearsUnderFreshName() {
        var output = python("""
            macro keep(v):
                let tmp = v
                say tmp
            let tmp = 0
            @keep(tmp)
            """);

        assertThat(output).contains("__ms_macro_tmp_1 = tmp\nprint(__ms_macro_tmp_1)\n");
    }

    @Test
    void generate_nestedListPattern_failsByDefault() {
        assertThatThrownBy(() -> python("match v: case [[a], b]: say a"))
            .isInstanceOf(UnsupportedConstructError.class)
            .hasMessage("Unsupported construct for python target: nested list pattern");
    }

    @Test
    void generate_nestedListPattern_placeholderPolicyKeepsGoing() {
        var generator = PythonGenerator.create(PLACEHOLDERS, ExpanderConfig.DEFAULT);

        var output = generator.generate(Parser.parse("match v: case [[a], b]: say b"));

        assertThat(output).contains("# unsupported: nested list pattern\n")
                          .contains("    b = __ms_match_val[1]\n");
    }

    @Test
    void generate_undecodablePayload_followsPolicy() {
        var program = Program.of(new AgentCall("ops", "not json"));

        assertThatThrownBy(() -> PythonGenerator.create().generate(program))
            .isInstanceOf(UnsupportedConstructError.class);
        assertThat(PythonGenerator.create(PLACEHOLDERS, ExpanderConfig.DEFAULT).generate(program))
            .isEqualTo(HEADER + "# unsupported: undecodable payload for agent 'ops'\n");
    }
}
