package org.pragmatica.metascript.codegen;

import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.Expression.Await;
import org.pragmatica.metascript.tree.Expression.BinaryOp;
import org.pragmatica.metascript.tree.Expression.FunctionCall;
import org.pragmatica.metascript.tree.Expression.IntLiteral;
import org.pragmatica.metascript.tree.Expression.ListLiteral;
import org.pragmatica.metascript.tree.Expression.Name;
import org.pragmatica.metascript.tree.Expression.StringLiteral;
import org.pragmatica.metascript.tree.Expression.UnaryOp;
import org.pragmatica.metascript.tree.Pattern;
import org.pragmatica.metascript.tree.Program;
import org.pragmatica.metascript.tree.Statement;
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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree back to MetaScript surface syntax in block layout.
 *
 * <p>Works on raw and expanded trees alike. Parsing the output yields a tree equal to the
 * input for every tree the parser can produce.
 */
public final class Unparser implements Statement.Visitor<Void>, Expression.Visitor<String>, Pattern.Visitor<String> {
    private static final int INDENT_WIDTH = 4;

    private final CodeWriter writer = new CodeWriter(INDENT_WIDTH);

    private Unparser() {}

    public static String unparse(Program program) {
        var unparser = new Unparser();
        program.statements().forEach(statement -> statement.accept(unparser));
        return unparser.writer.toString();
    }

    public static String unparse(Expression expression) {
        return expression.accept(new Unparser());
    }

    private void body(List<Statement> statements) {
        writer.indent();
        if (statements.isEmpty()) {
            writer.line("pass");
        }
        statements.forEach(statement -> statement.accept(this));
        writer.dedent();
    }

    private String expr(Expression expression) {
        return expression.accept(this);
    }

    private String exprs(List<Expression> expressions) {
        return expressions.stream()
                          .map(this::expr)
                          .collect(Collectors.joining(", "));
    }

    private static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    // === Statements ===

    @Override
    public Void visitSay(Say say) {
        writer.line("say " + expr(say.text()));
        return null;
    }

    @Override
    public Void visitPrint(Print print) {
        writer.line("print " + expr(print.text()));
        return null;
    }

    @Override
    public Void visitAssign(Assign assign) {
        writer.line("let " + assign.name() + " = " + expr(assign.value()));
        return null;
    }

    @Override
    public Void visitIf(If ifStatement) {
        writer.line("if " + expr(ifStatement.condition()) + ":");
        body(ifStatement.body());
        ifStatement.elseBody()
                   .ifPresent(elseBody -> {
                       writer.line("else:");
                       body(elseBody);
                   });
        return null;
    }

    @Override
    public Void visitWhile(While whileLoop) {
        writer.line("while " + expr(whileLoop.condition()) + ":");
        body(whileLoop.body());
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop forLoop) {
        writer.line("for " + forLoop.variable() + " in " + expr(forLoop.end()) + ":");
        body(forLoop.body());
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef function) {
        var keyword = function.async() ? "async def " : "def ";
        writer.line(keyword + function.name() + "(" + String.join(", ", function.parameters()) + "):");
        body(function.body());
        return null;
    }

    @Override
    public Void visitReturn(Return returnStatement) {
        writer.line("return " + expr(returnStatement.value()));
        return null;
    }

    @Override
    public Void visitDoBlock(DoBlock block) {
        writer.line("do:");
        body(block.body());
        return null;
    }

    @Override
    public Void visitAgentCall(AgentCall agentCall) {
        writer.line("agent " + agentCall.agent() + " [" + agentCall.payload() + "]");
        return null;
    }

    @Override
    public Void visitMacroDef(MacroDef macroDef) {
        writer.line("macro " + macroDef.name() + "(" + String.join(", ", macroDef.parameters()) + "):");
        body(macroDef.body());
        return null;
    }

    @Override
    public Void visitMacroCall(MacroCall macroCall) {
        writer.line("@" + macroCall.name() + "(" + exprs(macroCall.arguments()) + ")");
        return null;
    }

    @Override
    public Void visitMatch(Match match) {
        writer.line("match " + expr(match.subject()) + ":");
        writer.indent();
        for (var matchCase : match.cases()) {
            writer.line("case " + matchCase.pattern().accept(this) + ":");
            body(matchCase.body());
        }
        writer.dedent();
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement statement) {
        writer.line(expr(statement.expression()));
        return null;
    }

    // === Expressions ===

    @Override
    public String visitFunctionCall(FunctionCall call) {
        return call.name() + "(" + exprs(call.arguments()) + ")";
    }

    @Override
    public String visitBinaryOp(BinaryOp binaryOp) {
        return "(" + expr(binaryOp.left()) + " " + binaryOp.operator() + " " + expr(binaryOp.right()) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp unaryOp) {
        return unaryOp.operator().equals("not")
               ? "(not " + expr(unaryOp.operand()) + ")"
               : "-" + expr(unaryOp.operand());
    }

    @Override
    public String visitAwait(Await await) {
        return "await " + expr(await.operand());
    }

    @Override
    public String visitListLiteral(ListLiteral list) {
        return "[" + exprs(list.elements()) + "]";
    }

    @Override
    public String visitStringLiteral(StringLiteral literal) {
        return quote(literal.value());
    }

    @Override
    public String visitIntLiteral(IntLiteral literal) {
        return Long.toString(literal.value());
    }

    @Override
    public String visitName(Name name) {
        return name.identifier();
    }

    // === Patterns ===

    @Override
    public String visitWildcard(Pattern.Wildcard wildcard) {
        return "_";
    }

    @Override
    public String visitName(Pattern.NamePattern name) {
        return name.name();
    }

    @Override
    public String visitLiteral(Pattern.LiteralPattern literal) {
        return expr(literal.literal());
    }

    @Override
    public String visitList(Pattern.ListPattern list) {
        return list.elements()
                   .stream()
                   .map(element -> element.accept(this))
                   .collect(Collectors.joining(", ", "[", "]"));
    }
}
