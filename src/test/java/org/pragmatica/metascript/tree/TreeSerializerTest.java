package org.pragmatica.metascript.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.metascript.tree.Expression.BinaryOp;
import org.pragmatica.metascript.tree.Expression.IntLiteral;
import org.pragmatica.metascript.tree.Expression.Name;
import org.pragmatica.metascript.tree.Expression.StringLiteral;
import org.pragmatica.metascript.tree.Pattern.Wildcard;
import org.pragmatica.metascript.tree.Statement.If;
import org.pragmatica.metascript.tree.Statement.Match;
import org.pragmatica.metascript.tree.Statement.Say;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TreeSerializerTest {

    @Test
    void toStructure_say_isKeyedByNodeKind() {
        var structure = TreeSerializer.toStructure(Program.of(new Say(new StringLiteral("Hi"))));

        assertThat(structure).isEqualTo(Map.of("Program", List.of(Map.of("Say", Map.of("String", "Hi")))));
    }

    @Test
    void toStructure_fieldsKeepDeclarationOrder() {
        var structure = TreeSerializer.toStructure(new BinaryOp("+", new Name("a"), new IntLiteral(1)));

        @SuppressWarnings("unchecked")
        var fields = (Map<String, Object>) ((Map<String, Object>) structure).get("BinaryOp");
        assertThat(fields.keySet()).containsExactly("op", "left", "right");
    }

    @Test
    void toJson_matchAndIf_renderPatternsAndMissingElse() {
        var program = Program.of(
            new Match(new Name("v"), List.of(new MatchCase(new Wildcard(), List.of()))),
            new If(new Name("c"), List.of(), Optional.empty()));

        var json = TreeSerializer.toJson(program);

        assertThat(json).contains("\"Pattern\" : \"_\"")
                        .contains("\"orelse\" : null")
                        .contains("\"subject\" : {");
    }
}
