package org.pragmatica.metascript.tree;

import java.util.List;

/**
 * Root of a tree: ordered top-level statements.
 */
public record Program(List<Statement> statements) implements Node {
    public Program {
        statements = List.copyOf(statements);
    }

    public static Program of(Statement... statements) {
        return new Program(List.of(statements));
    }
}
