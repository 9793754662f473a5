package org.pragmatica.metascript.macro;

import org.pragmatica.metascript.tree.MatchCase;
import org.pragmatica.metascript.tree.Pattern;
import org.pragmatica.metascript.tree.Statement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the names a macro body declares: assignment targets, function names and
 * parameters, loop variables and names bound by match patterns.
 *
 * <p>Nested bodies are searched too, except the bodies of nested macro definitions. Names
 * are returned in order of first declaration.
 */
final class BindingCollector implements Statement.Visitor<Void>, Pattern.Visitor<Void> {
    private final Set<String> names = new LinkedHashSet<>();

    private BindingCollector() {}

    static Set<String> collect(List<Statement> body, List<String> excluded) {
        var collector = new BindingCollector();
        collector.visitAll(body);
        collector.names.removeAll(excluded);
        return collector.names;
    }

    private Void visitAll(List<Statement> statements) {
        statements.forEach(statement -> statement.accept(this));
        return null;
    }

    @Override
    public Void visitSay(Statement.Say say) {
        return null;
    }

    @Override
    public Void visitPrint(Statement.Print print) {
        return null;
    }

    @Override
    public Void visitAssign(Statement.Assign assign) {
        names.add(assign.name());
        return null;
    }

    @Override
    public Void visitIf(Statement.If ifStatement) {
        visitAll(ifStatement.body());
        ifStatement.elseBody().ifPresent(this::visitAll);
        return null;
    }

    @Override
    public Void visitWhile(Statement.While whileLoop) {
        return visitAll(whileLoop.body());
    }

    @Override
    public Void visitForLoop(Statement.ForLoop forLoop) {
        names.add(forLoop.variable());
        return visitAll(forLoop.body());
    }

    @Override
    public Void visitFunctionDef(Statement.FunctionDef function) {
        names.add(function.name());
        names.addAll(function.parameters());
        return visitAll(function.body());
    }

    @Override
    public Void visitReturn(Statement.Return returnStatement) {
        return null;
    }

    @Override
    public Void visitDoBlock(Statement.DoBlock block) {
        return visitAll(block.body());
    }

    @Override
    public Void visitAgentCall(Statement.AgentCall agentCall) {
        return null;
    }

    @Override
    public Void visitMacroDef(Statement.MacroDef macroDef) {
        return null;
    }

    @Override
    public Void visitMacroCall(Statement.MacroCall macroCall) {
        return null;
    }

    @Override
    public Void visitMatch(Statement.Match match) {
        for (MatchCase matchCase : match.cases()) {
            matchCase.pattern().accept(this);
            visitAll(matchCase.body());
        }
        return null;
    }

    @Override
    public Void visitExpressionStatement(Statement.ExpressionStatement statement) {
        return null;
    }

    // === Patterns ===

    @Override
    public Void visitWildcard(Pattern.Wildcard wildcard) {
        return null;
    }

    @Override
    public Void visitName(Pattern.NamePattern name) {
        names.add(name.name());
        return null;
    }

    @Override
    public Void visitLiteral(Pattern.LiteralPattern literal) {
        return null;
    }

    @Override
    public Void visitList(Pattern.ListPattern list) {
        list.elements().forEach(element -> element.accept(this));
        return null;
    }
}
