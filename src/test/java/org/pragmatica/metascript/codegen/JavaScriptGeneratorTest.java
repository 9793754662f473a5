package org.pragmatica.metascript.codegen;

import org.junit.jupiter.api.Test;
import org.pragmatica.metascript.error.UnsupportedConstructError;
import org.pragmatica.metascript.macro.ExpanderConfig;
import org.pragmatica.metascript.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaScriptGeneratorTest {

    private static final String HEADER = "// Generated by MetaScript (javascript target)\n";

    private static String javaScript(String source) {
        return JavaScriptGenerator.create().generate(Parser.parse(source));
    }

    @Test
    void generate_say_becomesConsoleLog() {
        assertThat(javaScript("say \"Hi\"")).isEqualTo(HEADER + "console.log(\"Hi\");\n");
    }

    @Test
    void generate_forOverRange_isCountingLoop() {
        assertThat(javaScript("for i in range(3): say i")).isEqualTo(HEADER + """
            for (let i=0; i<3; i++) {
              console.log(i);
            }
            """);
    }

    @Test
    void generate_rangeWithStep_usesCompoundUpdate() {
        assertThat(javaScript("for i in range(0, 10, 2): say \"S\""))
            .contains("for (let i=0; i<10; i += 2) {")
            .contains("console.log(\"S\");");
    }

    @Test
    void generate_inclusiveRange_startsAtLowerBound() {
        assertThat(javaScript("for i in 1..3: say i")).contains("for (let i=1; i<(3 + 1); i++) {");
    }

    @Test
    void generate_forOverIterable_usesForOf() {
        assertThat(javaScript("for x in items: print x")).contains("for (let x of items) {\n  console.log(x);\n}\n");
    }

    @Test
    void generate_forOfBodyReassigningVariable_keepsLoopBinding() {
        assertThat(javaScript("for i in xs: i = i + 1")).isEqualTo(HEADER + """
            for (let i of xs) {
              i = (i + 1);
            }
            """);
    }

    @Test
    void generate_caseBindingReassignedInBody_isNotHoisted() {
        var output = javaScript("match v: case [n]: n = n + 1");

        assertThat(output).doesNotContain("let n;")
                          .contains("  let n = __ms_match_val[0];\n  n = (n + 1);\n");
    }

    @Test
    void generate_functionInsideBlock_isHoistedAndRebound() {
        var output = javaScript("""
            if c:
                def f():
                    return 1
            f = 3
            """);

        assertThat(output).isEqualTo(HEADER + """
            let f;
            if (c) {
              f = function f() {
                return 1;
              };
            }
            f = 3;
            """);
    }

    @Test
    void generate_functionAfterAssignment_doesNotRedeclare() {
        assertThat(javaScript("let g = 1\ndef g(): return 2"))
            .isEqualTo(HEADER + "let g = 1;\ng = function g() {\n  return 2;\n};\n");
    }

    @Test
    void generate_assignments_declareOnFirstBinding() {
        var output = javaScript("""
            let x = 1
            x = x + 1
            def f(a):
                x = a
                a = 2
                return x
            """);

        assertThat(output).isEqualTo(HEADER + """
            let x = 1;
            x = (x + 1);
            function f(a) {
              let x = a;
              a = 2;
              return x;
            }
            """);
    }

    @Test
    void generate_assignmentInsideBlock_isDeclaredAtFunctionTop() {
        var output = javaScript("""
            if ready:
                total = 1
            else:
                total = 2
            say total
            """);

        assertThat(output).isEqualTo(HEADER + """
            let total;
            if (ready) {
              total = 1;
            } else {
              total = 2;
            }
            console.log(total);
            """);
    }

    @Test
    void generate_loopVariable_isNotRedeclaredInBody() {
        var output = javaScript("""
            for i in range(3):
                i = i + 1
            """);

        assertThat(output).contains("for (let i=0; i<3; i++) {\n  i = (i + 1);\n}\n")
                          .doesNotContain("let i;")
                          .doesNotContain("let i = ");
    }

    @Test
    void generate_equality_isStrict() {
        assertThat(javaScript("if a == b: say 1 else: say 2")).isEqualTo(HEADER + """
            if ((a === b)) {
              console.log(1);
            } else {
              console.log(2);
            }
            """);
        assertThat(javaScript("say a != b")).contains("(a !== b)");
    }

    @Test
    void generate_notAndDoubleNegation_areSafe() {
        assertThat(javaScript("if not x: say -y")).contains("if (!x) {\n  console.log(-y);\n}");
        assertThat(javaScript("let z = - -1")).contains("let z = -(-1);");
    }

    @Test
    void generate_asyncFunction_keepsAwait() {
        assertThat(javaScript("async def fetch(): return await get()")).isEqualTo(HEADER + """
            async function fetch() {
              return await get();
            }
            """);
    }

    @Test
    void generate_doBlock_becomesBraces() {
        assertThat(javaScript("do:\n    say 1\n")).isEqualTo(HEADER + "{\n  console.log(1);\n}\n");
    }

    @Test
    void generate_match_becomesElseIfChain() {
        var output = javaScript("""
            match arr:
                case [a, b]: say a
                case 1: say "one"
                case _: say "other"
            """);

        assertThat(output).isEqualTo(HEADER + """
            const __ms_match_val = arr;
            if (Array.isArray(__ms_match_val) && __ms_match_val.length === 2) {
              let a = __ms_match_val[0];
              let b = __ms_match_val[1];
              console.log(a);
            } else if (__ms_match_val === 1) {
              console.log("one");
            } else if (true) {
              console.log("other");
            }
            """);
    }

    @Test
    void generate_agentCall_rendersPayloadAsJson() {
        assertThat(javaScript("agent backend [\"action\": \"validate\"]"))
            .isEqualTo(HEADER + "agentCall(\"backend\", {\"action\":\"validate\"});\n");
    }

    @Test
    void generate_agentCallWithQuotedJson_decodesInnerDocument() {
        assertThat(javaScript("agent frontend [{\"type\": \"intent-draft\", \"ids\": [1, 2]}]"))
            .contains("agentCall(\"frontend\", {\"type\":\"intent-draft\",\"ids\":[1,2]});");
    }

    @Test
    void generate_macroLoop_isRenamedHygienically() {
        var output = javaScript("""
            macro mk(n):
                for j in range(n):
                    say j
            @mk(2)
            """);

        assertThat(output).contains("for (let __ms_macro_j_1=0; __ms_macro_j_1<2; __ms_macro_j_1++) {")
                          .doesNotContain("mk");
    }

    @Test
    void generate_stringEscapes_useJavaScriptForms() {
        assertThat(javaScript("say \"say \\\"hi\\\"\\n\"")).contains("console.log(\"say \\\"hi\\\"\\n\");");
    }

    @Test
    void generate_nestedListPattern_followsPolicy() {
        var source = Parser.parse("match v: case [[a]]: say 1");

        assertThatThrownBy(() -> JavaScriptGenerator.create().generate(source))
            .isInstanceOf(UnsupportedConstructError.class)
            .hasMessageContaining("javascript target");

        var lenient = JavaScriptGenerator.create(GeneratorConfig.DEFAULT.withUnsupported(UnsupportedPolicy.PLACEHOLDER),
                                                 ExpanderConfig.DEFAULT);
        assertThat(lenient.generate(source)).contains("/* unsupported: nested list pattern */");
    }
}
