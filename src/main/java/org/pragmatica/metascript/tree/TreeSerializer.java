package org.pragmatica.metascript.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.pragmatica.metascript.tree.Expression.Await;
import org.pragmatica.metascript.tree.Expression.BinaryOp;
import org.pragmatica.metascript.tree.Expression.FunctionCall;
import org.pragmatica.metascript.tree.Expression.IntLiteral;
import org.pragmatica.metascript.tree.Expression.ListLiteral;
import org.pragmatica.metascript.tree.Expression.Name;
import org.pragmatica.metascript.tree.Expression.StringLiteral;
import org.pragmatica.metascript.tree.Expression.UnaryOp;
import org.pragmatica.metascript.tree.Pattern.ListPattern;
import org.pragmatica.metascript.tree.Pattern.LiteralPattern;
import org.pragmatica.metascript.tree.Pattern.NamePattern;
import org.pragmatica.metascript.tree.Pattern.Wildcard;
import org.pragmatica.metascript.tree.Statement.AgentCall;
import org.pragmatica.metascript.tree.Statement.Assign;
import org.pragmatica.metascript.tree.Statement.DoBlock;
import org.pragmatica.metascript.tree.Statement.ExpressionStatement;
import org.pragmatica.metascript.tree.Statement.ForLoop;
import org.pragmatica.metascript.tree.Statement.FunctionDef;
import org.pragmatica.metascript.tree.Statement.If;
import org.pragmatica.metascript.tree.Statement.MacroCall;
import org.pragmatica.metascript.tree.Statement.MacroDef;
import org.pragmatica.metascript.tree.Statement.Match;
import org.pragmatica.metascript.tree.Statement.Print;
import org.pragmatica.metascript.tree.Statement.Return;
import org.pragmatica.metascript.tree.Statement.Say;
import org.pragmatica.metascript.tree.Statement.While;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical structural form of a tree: nested ordered maps and lists keyed by node kind.
 *
 * <p>Example: {@code say "Hi"} becomes {@code {"Program": [{"Say": {"String": "Hi"}}]}}.
 * The form is stable across runs and is used by tests and debug logging.
 */
public final class TreeSerializer implements Statement.Visitor<Object>, Expression.Visitor<Object>, Pattern.Visitor<Object> {

    private static final TreeSerializer INSTANCE = new TreeSerializer();
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TreeSerializer() {}

    public static Object toStructure(Node node) {
        if (node instanceof Program program) {
            return single("Program", INSTANCE.statements(program.statements()));
        }
        if (node instanceof Statement statement) {
            return statement.accept(INSTANCE);
        }
        if (node instanceof Expression expression) {
            return expression.accept(INSTANCE);
        }
        if (node instanceof Pattern pattern) {
            return pattern.accept(INSTANCE);
        }
        var matchCase = (MatchCase) node;
        return single("MatchCase", INSTANCE.matchCase(matchCase));
    }

    public static String toJson(Node node) {
        try {
            return MAPPER.writeValueAsString(toStructure(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<Object> statements(List<Statement> statements) {
        return statements.stream()
                         .map(s -> s.accept(this))
                         .toList();
    }

    private List<Object> expressions(List<Expression> expressions) {
        return expressions.stream()
                          .map(e -> e.accept(this))
                          .toList();
    }

    private Map<String, Object> matchCase(MatchCase matchCase) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("pattern", matchCase.pattern().accept(this));
        fields.put("body", statements(matchCase.body()));
        return fields;
    }

    private static Map<String, Object> single(String key, Object value) {
        var map = new LinkedHashMap<String, Object>();
        map.put(key, value);
        return map;
    }

    private static Map<String, Object> fields(Object... keysAndValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    @Override
    public Object visitSay(Say say) {
        return single("Say", say.text().accept(this));
    }

    @Override
    public Object visitPrint(Print print) {
        return single("Print", print.text().accept(this));
    }

    @Override
    public Object visitAssign(Assign assign) {
        return single("Assign", fields("name", assign.name(), "value", assign.value().accept(this)));
    }

    @Override
    public Object visitIf(If ifStatement) {
        return single("If", fields("cond", ifStatement.condition().accept(this),
                                   "body", statements(ifStatement.body()),
                                   "orelse", ifStatement.elseBody().map(this::statements).orElse(null)));
    }

    @Override
    public Object visitWhile(While whileLoop) {
        return single("While", fields("cond", whileLoop.condition().accept(this),
                                      "body", statements(whileLoop.body())));
    }

    @Override
    public Object visitForLoop(ForLoop forLoop) {
        return single("ForLoop", fields("var", forLoop.variable(),
                                        "end", forLoop.end().accept(this),
                                        "body", statements(forLoop.body())));
    }

    @Override
    public Object visitFunctionDef(FunctionDef function) {
        return single("FunctionDef", fields("name", function.name(),
                                            "params", function.parameters(),
                                            "is_async", function.async(),
                                            "body", statements(function.body())));
    }

    @Override
    public Object visitReturn(Return returnStatement) {
        return single("Return", returnStatement.value().accept(this));
    }

    @Override
    public Object visitDoBlock(DoBlock block) {
        return single("DoBlock", statements(block.body()));
    }

    @Override
    public Object visitAgentCall(AgentCall agentCall) {
        return single("AgentCall", fields("agent", agentCall.agent(), "payload", agentCall.payload()));
    }

    @Override
    public Object visitMacroDef(MacroDef macroDef) {
        return single("MacroDef", fields("name", macroDef.name(),
                                         "params", macroDef.parameters(),
                                         "body", statements(macroDef.body())));
    }

    @Override
    public Object visitMacroCall(MacroCall macroCall) {
        return single("MacroCall", fields("name", macroCall.name(), "args", expressions(macroCall.arguments())));
    }

    @Override
    public Object visitMatch(Match match) {
        var cases = match.cases()
                         .stream()
                         .map(this::matchCase)
                         .toList();
        return single("Match", fields("subject", match.subject().accept(this), "cases", cases));
    }

    @Override
    public Object visitExpressionStatement(ExpressionStatement statement) {
        return single("Expr", statement.expression().accept(this));
    }

    @Override
    public Object visitFunctionCall(FunctionCall call) {
        return single("FunctionCall", fields("name", call.name(), "args", expressions(call.arguments())));
    }

    @Override
    public Object visitBinaryOp(BinaryOp binaryOp) {
        return single("BinaryOp", fields("op", binaryOp.operator(),
                                         "left", binaryOp.left().accept(this),
                                         "right", binaryOp.right().accept(this)));
    }

    @Override
    public Object visitUnaryOp(UnaryOp unaryOp) {
        return single("UnaryOp", fields("op", unaryOp.operator(), "operand", unaryOp.operand().accept(this)));
    }

    @Override
    public Object visitAwait(Await await) {
        return single("Await", await.operand().accept(this));
    }

    @Override
    public Object visitListLiteral(ListLiteral list) {
        return single("List", expressions(list.elements()));
    }

    @Override
    public Object visitStringLiteral(StringLiteral literal) {
        return single("String", literal.value());
    }

    @Override
    public Object visitIntLiteral(IntLiteral literal) {
        return single("Int", literal.value());
    }

    @Override
    public Object visitName(Name name) {
        return single("Name", name.identifier());
    }

    @Override
    public Object visitWildcard(Wildcard wildcard) {
        return single("Pattern", "_");
    }

    @Override
    public Object visitName(NamePattern name) {
        return single("Pattern", single("name", name.name()));
    }

    @Override
    public Object visitLiteral(LiteralPattern literal) {
        return single("Pattern", single("lit", literal.literal().accept(this)));
    }

    @Override
    public Object visitList(ListPattern list) {
        var elements = list.elements()
                           .stream()
                           .map(p -> p.accept(this))
                           .toList();
        return single("Pattern", elements);
    }
}
