package org.pragmatica.metascript.tree;

import java.util.List;

/**
 * One {@code case pattern: body} arm of a {@link Statement.Match}.
 */
public record MatchCase(Pattern pattern, List<Statement> body) implements Node {
    public MatchCase {
        body = List.copyOf(body);
    }
}
