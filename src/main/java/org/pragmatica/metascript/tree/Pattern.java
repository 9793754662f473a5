package org.pragmatica.metascript.tree;

import java.util.List;

/**
 * Match patterns.
 */
public sealed interface Pattern extends Node {

    <R> R accept(Visitor<R> visitor);

    /**
     * {@code _} - matches anything, binds nothing.
     */
    record Wildcard() implements Pattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWildcard(this);
        }
    }

    /**
     * Matches anything and binds the subject to {@code name}.
     */
    record NamePattern(String name) implements Pattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * Exact equality against a string or integer literal.
     */
    record LiteralPattern(Expression literal) implements Pattern {
        public LiteralPattern {
            if (!(literal instanceof Expression.StringLiteral) && !(literal instanceof Expression.IntLiteral)) {
                throw new IllegalArgumentException("Literal pattern requires a string or integer literal, got " + literal);
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * Fixed-length positional destructuring.
     */
    record ListPattern(List<Pattern> elements) implements Pattern {
        public ListPattern {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    interface Visitor<R> {
        R visitWildcard(Wildcard wildcard);

        R visitName(NamePattern name);

        R visitLiteral(LiteralPattern literal);

        R visitList(ListPattern list);
    }
}
