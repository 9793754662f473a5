package org.pragmatica.metascript.tree;

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

import java.util.List;

/**
 * Rebuilds a tree node by node.
 *
 * <p>Used as is, it produces a deep copy that shares no node with its input. Subclasses
 * override {@link #identifier(String)} to rewrite every binding and reference of a name, or
 * override individual {@code visit} methods to replace whole subtrees.
 */
public class TreeCopier implements Statement.Visitor<Statement>, Expression.Visitor<Expression>, Pattern.Visitor<Pattern> {

    private static final TreeCopier IDENTITY = new TreeCopier();

    public static Program deepCopy(Program program) {
        return IDENTITY.copy(program);
    }

    public static Expression deepCopy(Expression expression) {
        return IDENTITY.copy(expression);
    }

    /**
     * Rewrites an identifier at a declaration or reference site. Identity by default.
     */
    protected String identifier(String name) {
        return name;
    }

    public Program copy(Program program) {
        return new Program(copyAll(program.statements()));
    }

    public Statement copy(Statement statement) {
        return statement.accept(this);
    }

    public Expression copy(Expression expression) {
        return expression.accept(this);
    }

    public Pattern copy(Pattern pattern) {
        return pattern.accept(this);
    }

    public MatchCase copy(MatchCase matchCase) {
        return new MatchCase(copy(matchCase.pattern()), copyAll(matchCase.body()));
    }

    public List<Statement> copyAll(List<Statement> statements) {
        return statements.stream()
                         .map(this::copy)
                         .toList();
    }

    protected List<Expression> copyExpressions(List<Expression> expressions) {
        return expressions.stream()
                          .map(this::copy)
                          .toList();
    }

    // === Statements ===

    @Override
    public Statement visitSay(Say say) {
        return new Say(copy(say.text()));
    }

    @Override
    public Statement visitPrint(Print print) {
        return new Print(copy(print.text()));
    }

    @Override
    public Statement visitAssign(Assign assign) {
        return new Assign(identifier(assign.name()), copy(assign.value()));
    }

    @Override
    public Statement visitIf(If ifStatement) {
        return new If(copy(ifStatement.condition()),
                      copyAll(ifStatement.body()),
                      ifStatement.elseBody().map(this::copyAll));
    }

    @Override
    public Statement visitWhile(While whileLoop) {
        return new While(copy(whileLoop.condition()), copyAll(whileLoop.body()));
    }

    @Override
    public Statement visitForLoop(ForLoop forLoop) {
        return new ForLoop(identifier(forLoop.variable()), copy(forLoop.end()), copyAll(forLoop.body()));
    }

    @Override
    public Statement visitFunctionDef(FunctionDef function) {
        var parameters = function.parameters()
                                 .stream()
                                 .map(this::identifier)
                                 .toList();
        return new FunctionDef(identifier(function.name()), parameters, copyAll(function.body()), function.async());
    }

    @Override
    public Statement visitReturn(Return returnStatement) {
        return new Return(copy(returnStatement.value()));
    }

    @Override
    public Statement visitDoBlock(DoBlock block) {
        return new DoBlock(copyAll(block.body()));
    }

    @Override
    public Statement visitAgentCall(AgentCall agentCall) {
        return new AgentCall(agentCall.agent(), agentCall.payload());
    }

    @Override
    public Statement visitMacroDef(MacroDef macroDef) {
        return new MacroDef(macroDef.name(), macroDef.parameters(), copyAll(macroDef.body()));
    }

    @Override
    public Statement visitMacroCall(MacroCall macroCall) {
        return new MacroCall(macroCall.name(), copyExpressions(macroCall.arguments()));
    }

    @Override
    public Statement visitMatch(Match match) {
        var cases = match.cases()
                         .stream()
                         .map(this::copy)
                         .toList();
        return new Match(copy(match.subject()), cases);
    }

    @Override
    public Statement visitExpressionStatement(ExpressionStatement statement) {
        return new ExpressionStatement(copy(statement.expression()));
    }

    // === Expressions ===

    @Override
    public Expression visitFunctionCall(FunctionCall call) {
        return new FunctionCall(identifier(call.name()), copyExpressions(call.arguments()));
    }

    @Override
    public Expression visitBinaryOp(BinaryOp binaryOp) {
        return new BinaryOp(binaryOp.operator(), copy(binaryOp.left()), copy(binaryOp.right()));
    }

    @Override
    public Expression visitUnaryOp(UnaryOp unaryOp) {
        return new UnaryOp(unaryOp.operator(), copy(unaryOp.operand()));
    }

    @Override
    public Expression visitAwait(Await await) {
        return new Await(copy(await.operand()));
    }

    @Override
    public Expression visitListLiteral(ListLiteral list) {
        return new ListLiteral(copyExpressions(list.elements()));
    }

    @Override
    public Expression visitStringLiteral(StringLiteral literal) {
        return new StringLiteral(literal.value());
    }

    @Override
    public Expression visitIntLiteral(IntLiteral literal) {
        return new IntLiteral(literal.value());
    }

    @Override
    public Expression visitName(Name name) {
        return new Name(identifier(name.identifier()));
    }

    // === Patterns ===

    @Override
    public Pattern visitWildcard(Wildcard wildcard) {
        return new Wildcard();
    }

    @Override
    public Pattern visitName(NamePattern name) {
        return new NamePattern(identifier(name.name()));
    }

    @Override
    public Pattern visitLiteral(LiteralPattern literal) {
        return new LiteralPattern(copy(literal.literal()));
    }

    @Override
    public Pattern visitList(ListPattern list) {
        return new ListPattern(list.elements()
                                   .stream()
                                   .map(this::copy)
                                   .toList());
    }
}
