package org.pragmatica.metascript.tree;

import java.util.List;

/**
 * Expression nodes.
 */
public sealed interface Expression extends Node {

    <R> R accept(Visitor<R> visitor);

    record FunctionCall(String name, List<Expression> arguments) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        public static FunctionCall of(String name, Expression... arguments) {
            return new FunctionCall(name, List.of(arguments));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * Binary operation; {@code operator} is the surface token ({@code +}, {@code ==}, ...).
     */
    record BinaryOp(String operator, Expression left, Expression right) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Unary operation: {@code -} or {@code not}.
     */
    record UnaryOp(String operator, Expression operand) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    record Await(Expression operand) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    record ListLiteral(List<Expression> elements) implements Expression {
        public ListLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLiteral(this);
        }
    }

    record StringLiteral(String value) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    record IntLiteral(long value) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntLiteral(this);
        }
    }

    /**
     * Identifier reference.
     */
    record Name(String identifier) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    interface Visitor<R> {
        R visitFunctionCall(FunctionCall call);

        R visitBinaryOp(BinaryOp binaryOp);

        R visitUnaryOp(UnaryOp unaryOp);

        R visitAwait(Await await);

        R visitListLiteral(ListLiteral list);

        R visitStringLiteral(StringLiteral literal);

        R visitIntLiteral(IntLiteral literal);

        R visitName(Name name);
    }
}
