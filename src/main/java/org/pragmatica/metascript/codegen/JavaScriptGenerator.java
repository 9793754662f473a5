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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers MetaScript to JavaScript (ES2017, for {@code async}/{@code await}).
 *
 * <p>Assignments declare with {@code let} the first time a name is bound in a function (or
 * at top level), equality is strict, and counting loops become C-style {@code for} loops.
 * Names first assigned inside a nested block are declared together at the top of the
 * enclosing function, since {@code let} is block scoped.
 */
public final class JavaScriptGenerator extends AbstractCodeGenerator {
    private static final int INDENT_WIDTH = 2;

    private static final Map<String, String> OPERATORS = Map.of("==", "===", "!=", "!==");

    private JavaScriptGenerator(GeneratorConfig config, ExpanderConfig expanderConfig) {
        super(config, expanderConfig);
    }

    public static JavaScriptGenerator create() {
        return new JavaScriptGenerator(GeneratorConfig.DEFAULT, ExpanderConfig.DEFAULT);
    }

    public static JavaScriptGenerator create(GeneratorConfig config, ExpanderConfig expanderConfig) {
        return new JavaScriptGenerator(config, expanderConfig);
    }

    @Override
    public String target() {
        return "javascript";
    }

    @Override
    protected String lower(Program expanded) {
        return new Emitter().emit(expanded);
    }

    @Override
    protected String placeholder(String construct) {
        return "/* unsupported: " + construct + " */";
    }

    @Override
    protected String isList(String subject) {
        return "Array.isArray(" + subject + ")";
    }

    @Override
    protected String hasLength(String subject, int length) {
        return subject + ".length === " + length;
    }

    @Override
    protected String isEqual(String subject, String literal) {
        return subject + " === " + literal;
    }

    @Override
    protected String alwaysTrue() {
        return "true";
    }

    @Override
    protected String conjunction() {
        return " && ";
    }

    /**
     * Per-call emission state, including the names already declared in each enclosing
     * function.
     */
    private final class Emitter implements Statement.Visitor<Void>, Expression.Visitor<String> {
        private final CodeWriter writer = new CodeWriter(INDENT_WIDTH);
        private final Deque<Set<String>> functionScopes = new ArrayDeque<>();
        private int matches;

        String emit(Program program) {
            writer.comment("// Generated by MetaScript (javascript target)");
            functionScopes.push(new HashSet<>());
            declareHoisted(program.statements());
            program.statements().forEach(statement -> statement.accept(this));
            functionScopes.pop();
            return writer.toString();
        }

        private void declareHoisted(List<Statement> body) {
            var hoisted = HoistedNames.collect(body);
            hoisted.removeAll(functionScopes.peek());
            if (!hoisted.isEmpty()) {
                writer.line("let " + String.join(", ", hoisted) + ";");
                functionScopes.peek().addAll(hoisted);
            }
        }

        private void block(List<Statement> statements) {
            writer.indent();
            statements.forEach(statement -> statement.accept(this));
            writer.dedent();
        }

        /**
         * Emit a block in which some names are already declared by its header.
         */
        private void block(List<Statement> statements, Collection<String> declaredByHeader) {
            var added = new ArrayList<String>();
            for (var name : declaredByHeader) {
                if (functionScopes.peek().add(name)) {
                    added.add(name);
                }
            }
            block(statements);
            functionScopes.peek().removeAll(added);
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
            writer.line("console.log(" + expr(say.text()) + ");");
            return null;
        }

        @Override
        public Void visitPrint(Print print) {
            writer.line("console.log(" + expr(print.text()) + ");");
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            var declaration = functionScopes.peek().add(assign.name()) ? "let " : "";
            writer.line(declaration + assign.name() + " = " + expr(assign.value()) + ";");
            return null;
        }

        @Override
        public Void visitIf(If ifStatement) {
            writer.line("if (" + expr(ifStatement.condition()) + ") {");
            block(ifStatement.body());
            ifStatement.elseBody()
                       .ifPresent(elseBody -> {
                           writer.line("} else {");
                           block(elseBody);
                       });
            writer.line("}");
            return null;
        }

        @Override
        public Void visitWhile(While whileLoop) {
            writer.line("while (" + expr(whileLoop.condition()) + ") {");
            block(whileLoop.body());
            writer.line("}");
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop forLoop) {
            var variable = forLoop.variable();
            var header = countingRange(forLoop.end())
                .map(arguments -> countingHeader(variable, arguments))
                .orElseGet(() -> "for (let " + variable + " of " + expr(forLoop.end()) + ") {");
            writer.line(header);
            block(forLoop.body(), List.of(variable));
            writer.line("}");
            return null;
        }

        private String countingHeader(String variable, List<Expression> arguments) {
            var start = arguments.size() == 1 ? "0" : expr(arguments.get(0));
            var stop = arguments.size() == 1 ? expr(arguments.get(0)) : expr(arguments.get(1));
            var step = arguments.size() == 3 ? variable + " += " + expr(arguments.get(2)) : variable + "++";
            return "for (let " + variable + "=" + start + "; " + variable + "<" + stop + "; " + step + ") {";
        }

        @Override
        public Void visitFunctionDef(FunctionDef function) {
            var keyword = function.async() ? "async function " : "function ";
            var signature = keyword + function.name() + "(" + String.join(", ", function.parameters()) + ") {";
            // an already declared name is rebound with a function expression
            boolean declared = !functionScopes.peek().add(function.name());
            writer.line(declared ? function.name() + " = " + signature : signature);
            functionScopes.push(new HashSet<>(function.parameters()));
            writer.indent();
            declareHoisted(function.body());
            function.body().forEach(statement -> statement.accept(this));
            writer.dedent();
            functionScopes.pop();
            writer.line(declared ? "};" : "}");
            return null;
        }

        @Override
        public Void visitReturn(Return returnStatement) {
            writer.line("return " + expr(returnStatement.value()) + ";");
            return null;
        }

        @Override
        public Void visitDoBlock(DoBlock doBlock) {
            writer.line("{");
            block(doBlock.body());
            writer.line("}");
            return null;
        }

        @Override
        public Void visitAgentCall(AgentCall agentCall) {
            AgentPayloads.decode(agentCall.payload())
                         .ifPresentOrElse(payload -> writer.line(config.javaScriptAgentEntryPoint()
                                                                 + "(" + Literals.javaScriptString(agentCall.agent())
                                                                 + ", " + Literals.json(payload) + ");"),
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
            writer.line("const " + subject + " = " + expr(match.subject()) + ";");
            boolean first = true;
            for (var matchCase : match.cases()) {
                var test = caseTest(matchCase.pattern(), subject, this::expr, writer);
                writer.line((first ? "if (" : "} else if (") + test.condition() + ") {");
                writer.indent();
                test.bindings().forEach(binding -> writer.line("let " + binding.name() + " = " + binding.value() + ";"));
                writer.dedent();
                block(matchCase.body(), test.bindings().stream().map(Binding::name).toList());
                first = false;
            }
            if (!match.cases().isEmpty()) {
                writer.line("}");
            }
            return null;
        }

        @Override
        public Void visitExpressionStatement(ExpressionStatement statement) {
            writer.line(expr(statement.expression()) + ";");
            return null;
        }

        // === Expressions ===

        @Override
        public String visitFunctionCall(FunctionCall call) {
            return call.name() + "(" + exprs(call.arguments()) + ")";
        }

        @Override
        public String visitBinaryOp(BinaryOp binaryOp) {
            var operator = OPERATORS.getOrDefault(binaryOp.operator(), binaryOp.operator());
            return "(" + expr(binaryOp.left()) + " " + operator + " " + expr(binaryOp.right()) + ")";
        }

        @Override
        public String visitUnaryOp(UnaryOp unaryOp) {
            var operand = expr(unaryOp.operand());
            if (unaryOp.operator().equals("not")) {
                return "!" + operand;
            }
            // "--x" would be a decrement
            return operand.startsWith("-") ? "-(" + operand + ")" : "-" + operand;
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
            return Literals.javaScriptString(literal.value());
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

    /**
     * Names bound inside nested blocks of one function body, by assignment or by a nested
     * function declaration. Names a loop header or case pattern binds for the block are
     * skipped, as are the bodies of nested functions.
     */
    private static final class HoistedNames implements Statement.Visitor<Void> {
        private final Set<String> names = new LinkedHashSet<>();
        private final Deque<String> boundByHeader = new ArrayDeque<>();
        private int depth;

        static Set<String> collect(List<Statement> body) {
            var collector = new HoistedNames();
            body.forEach(statement -> statement.accept(collector));
            return collector.names;
        }

        private void nested(List<Statement> body) {
            depth++;
            body.forEach(statement -> statement.accept(this));
            depth--;
        }

        private void nested(List<Statement> body, List<String> declaredByHeader) {
            declaredByHeader.forEach(boundByHeader::push);
            nested(body);
            declaredByHeader.forEach(name -> boundByHeader.pop());
        }

        private void bind(String name) {
            if (depth > 0 && !boundByHeader.contains(name)) {
                names.add(name);
            }
        }

        private static void patternNames(Pattern pattern, List<String> names) {
            if (pattern instanceof Pattern.NamePattern name) {
                names.add(name.name());
            } else if (pattern instanceof Pattern.ListPattern list) {
                list.elements().forEach(element -> patternNames(element, names));
            }
        }

        @Override
        public Void visitAssign(Assign assign) {
            bind(assign.name());
            return null;
        }

        @Override
        public Void visitIf(If ifStatement) {
            nested(ifStatement.body());
            ifStatement.elseBody().ifPresent(this::nested);
            return null;
        }

        @Override
        public Void visitWhile(While whileLoop) {
            nested(whileLoop.body());
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop forLoop) {
            nested(forLoop.body(), List.of(forLoop.variable()));
            return null;
        }

        @Override
        public Void visitDoBlock(DoBlock doBlock) {
            nested(doBlock.body());
            return null;
        }

        @Override
        public Void visitMatch(Match match) {
            for (var matchCase : match.cases()) {
                var bound = new ArrayList<String>();
                patternNames(matchCase.pattern(), bound);
                nested(matchCase.body(), bound);
            }
            return null;
        }

        @Override
        public Void visitFunctionDef(FunctionDef function) {
            bind(function.name());
            return null;
        }

        @Override
        public Void visitSay(Say say) {
            return null;
        }

        @Override
        public Void visitPrint(Print print) {
            return null;
        }

        @Override
        public Void visitReturn(Return returnStatement) {
            return null;
        }

        @Override
        public Void visitAgentCall(AgentCall agentCall) {
            return null;
        }

        @Override
        public Void visitMacroDef(MacroDef macroDef) {
            return null;
        }

        @Override
        public Void visitMacroCall(MacroCall macroCall) {
            return null;
        }

        @Override
        public Void visitExpressionStatement(ExpressionStatement statement) {
            return null;
        }
    }
}
