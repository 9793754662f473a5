package org.pragmatica.metascript.tree;

import java.util.List;
import java.util.Optional;

/**
 * Statement nodes.
 */
public sealed interface Statement extends Node {

    <R> R accept(Visitor<R> visitor);

    /**
     * {@code say expr}
     */
    record Say(Expression text) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSay(this);
        }
    }

    /**
     * {@code print expr}
     */
    record Print(Expression text) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrint(this);
        }
    }

    /**
     * {@code let name = expr} or {@code name = expr}
     */
    record Assign(String name, Expression value) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    record If(Expression condition, List<Statement> body, Optional<List<Statement>> elseBody) implements Statement {
        public If {
            body = List.copyOf(body);
            elseBody = elseBody.map(List::copyOf);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record While(Expression condition, List<Statement> body) implements Statement {
        public While {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * {@code for variable in end: body}
     *
     * <p>The shape of {@code end} selects the lowering: an integer literal or a {@code range(...)}
     * call with one to three arguments is a counting loop, anything else is iterated.
     */
    record ForLoop(String variable, Expression end, List<Statement> body) implements Statement {
        public ForLoop {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForLoop(this);
        }
    }

    record FunctionDef(String name, List<String> parameters, List<Statement> body, boolean async) implements Statement {
        public FunctionDef {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    record Return(Expression value) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * {@code do: body} - grouping block, opens its own macro scope.
     */
    record DoBlock(List<Statement> body) implements Statement {
        public DoBlock {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDoBlock(this);
        }
    }

    /**
     * {@code agent name [payload]} - payload text is kept as written between the brackets.
     */
    record AgentCall(String agent, String payload) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAgentCall(this);
        }
    }

    record MacroDef(String name, List<String> parameters, List<Statement> body) implements Statement {
        public MacroDef {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMacroDef(this);
        }
    }

    /**
     * {@code @name(args)}
     */
    record MacroCall(String name, List<Expression> arguments) implements Statement {
        public MacroCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMacroCall(this);
        }
    }

    /**
     * Cases are kept in source order; the first matching case wins.
     */
    record Match(Expression subject, List<MatchCase> cases) implements Statement {
        public Match {
            cases = List.copyOf(cases);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    /**
     * An expression in statement position: bare call, {@code await}, or name reference.
     */
    record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    interface Visitor<R> {
        R visitSay(Say say);

        R visitPrint(Print print);

        R visitAssign(Assign assign);

        R visitIf(If ifStatement);

        R visitWhile(While whileLoop);

        R visitForLoop(ForLoop forLoop);

        R visitFunctionDef(FunctionDef function);

        R visitReturn(Return returnStatement);

        R visitDoBlock(DoBlock block);

        R visitAgentCall(AgentCall agentCall);

        R visitMacroDef(MacroDef macroDef);

        R visitMacroCall(MacroCall macroCall);

        R visitMatch(Match match);

        R visitExpressionStatement(ExpressionStatement statement);
    }
}
