package org.pragmatica.metascript.parser;

/**
 * How statement bodies are laid out in source text.
 *
 * <p>Both layouts share one lexer and one grammar, so they cannot drift apart; they differ
 * only in how physical lines become statements.
 */
public enum Layout {
    /**
     * Full block nesting: a body is an inline statement after {@code :} or an indented block
     * of any number of statements on the following lines.
     */
    BLOCK,

    /**
     * Reduced line layout: a line ending in {@code :} is joined with the more-indented lines
     * that follow it (and a following {@code else} line) into one logical line, and each
     * logical line is parsed on its own. Every compound statement body holds exactly one
     * nested statement; a joined line carrying more is rejected with a syntax error.
     */
    LINE
}
