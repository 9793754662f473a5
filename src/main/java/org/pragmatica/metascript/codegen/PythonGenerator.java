package org.pragmatica.metascript.codegen;

import org.pragmatica.metascript.macro.ExpanderConfig;
import org.pragmatica.metascript.tree.AgentPayloads;
import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.Expression.Await;
import org.pragmatica.metascript.tree.Expression.BinaryOp;
import org.pragmatica.metascript.tree.Expression.FunctionCall;
import org.pragmatica.metascript.tree.Expression.IntLiteral;
import org.pragmatica.metascript.tree.Expression.ListLiteral;
import org.pragmatica.metascript.tree.Expression.Name;
import org.pragmatica.metascript.tree.Expression.StringLiteral;
import org.pragmatica.metascript.tree.Expression.UnaryOp;
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
 * Lowers MetaScript to Python 3 source.
 *
 * <p>Example: {@code say "Hi"} becomes {@code print('Hi')}, {@code for i in range(3): say i}
 * becomes a native {@code for} loop, and {@code match} becomes an {@code if}/{@code elif} chain
 * over a temporary holding the subject.
 */
public final class PythonGenerator extends AbstractCodeGenerator {
    private static final int INDENT_WIDTH = 4;

    private PythonGenerator(GeneratorConfig config, ExpanderConfig expanderConfig) {
        super(config, expanderConfig);
    }

    public static PythonGenerator create() {
        return new PythonGenerator(GeneratorConfig.DEFAULT, ExpanderConfig.DEFAULT);
    }

    public static PythonGenerator create(GeneratorConfig config, ExpanderConfig expanderConfig) {
        return new PythonGenerator(config, expanderConfig);
    }

    @Override
    public String target() {
        return "python";
    }

    @Override
    protected String lower(Program expanded) {
        return new Emitter().emit(expanded);
    }

    @Override
    protected String placeholder(String construct) {
        return "# unsupported: " + construct;
    }

    @Override
    protected String isList(String subject) {
        return "isinstance(" + subject + ", list)";
    }

    @Override
    protected String hasLength(String subject, int length) {
        return "len(" + subject + ") == " + length;
    }

    @Override
    protected String isEqual(String subject, String literal) {
        return subject + " == " + literal;
    }

    @Override
    protected String alwaysTrue() {
        return "True";
    }

    @Override
    protected String conjunction() {
        return " and ";
    }

    /**
     * Per-call emission state.
     */
    private final class Emitter implements Statement.Visitor<Void>, Expression.Visitor<String> {
        private final CodeWriter writer = new CodeWriter(INDENT_WIDTH);
        private int matches;

        String emit(Program program) {
            writer.comment("# Generated by MetaScript (python target)");
            program.statements().forEach(statement -> statement.accept(this));
            return writer.toString();
        }

        private void body(List<Statement> statements) {
            body(statements, List.of());
        }

        private void body(List<Statement> statements, List<Binding> bindings) {
            writer.indent();
            int before = writer.lineCount();
            bindings.forEach(binding -> writer.line(binding.name() + " = " + binding.value()));
            statements.forEach(statement -> statement.accept(this));
            if (writer.lineCount() == before) {
                writer.line("pass");
            }
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

        // === Statements ===

        @Override
        public Void visitSay(Say say) {
            writer.line("print(" + expr(say.text()) + ")");
            return null;
        }

        @Override
        public Void visitPrint(Print print) {
            writer.line("print(" + expr(print.text()) + ")");
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            writer.line(assign.name() + " = " + expr(assign.value()));
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
            var iterable = countingRange(forLoop.end())
                .map(arguments -> "range(" + exprs(arguments) + ")")
                .orElseGet(() -> expr(forLoop.end()));
            writer.line("for " + forLoop.variable() + " in " + iterable + ":");
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

        // Python has no block scope; the body is emitted in place
        @Override
        public Void visitDoBlock(DoBlock block) {
            block.body().forEach(statement -> statement.accept(this));
            return null;
        }

        @Override
        public Void visitAgentCall(AgentCall agentCall) {
            AgentPayloads.decode(agentCall.payload())
                         .ifPresentOrElse(payload -> writer.line(config.pythonAgentEntryPoint()
                                                                 + "(" + Literals.pythonString(agentCall.agent())
                                                                 + ", " + Literals.pythonLiteral(payload) + ")"),
                                          () -> unsupported(writer, "undecodable payload for agent '" + agentCall.agent() + "'"));
            return null;
        }

        @Override
        public Void visitMacroDef(MacroDef macroDef) {
            unsupported(writer, "macro definition '" + macroDef.name() + "'");
            return null;
        }

        @Override
        public Void visitMacroCall(MacroCall macroCall) {
            unsupported(writer, "macro call '@" + macroCall.name() + "'");
            return null;
        }

        @Override
        public Void visitMatch(Match match) {
            var subject = matchTemporary(++matches);
            writer.line(subject + " = " + expr(match.subject()));
            boolean first = true;
            for (var matchCase : match.cases()) {
                var test = caseTest(matchCase.pattern(), subject, this::expr, writer);
                writer.line((first ? "if " : "elif ") + test.condition() + ":");
                body(matchCase.body(), test.bindings());
                first = false;
            }
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
                   : unaryOp.operator() + expr(unaryOp.operand());
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
            return Literals.pythonString(literal.value());
        }

        @Override
        public String visitIntLiteral(IntLiteral literal) {
            return Long.toString(literal.value());
        }

        @Override
        public String visitName(Name name) {
            return name.identifier();
        }
    }
}
