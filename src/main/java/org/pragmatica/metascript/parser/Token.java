package org.pragmatica.metascript.parser;

import org.pragmatica.metascript.tree.SourceSpan;

/**
 * Token types produced by {@link Lexer}.
 */
public sealed interface Token {
    SourceSpan span();

    // Identifiers and literals (keywords are identifiers; the parser tells them apart)
    record Identifier(SourceSpan span, String name) implements Token {}

    record IntLiteral(SourceSpan span, long value) implements Token {}

    record StringLiteral(SourceSpan span, String value) implements Token {}

    // Operators and delimiters: ( ) [ ] , : ; = + - * / < > @ .. == != <= >=
    record Symbol(SourceSpan span, String text) implements Token {}

    // Raw text between the brackets of `agent name [ ... ]`
    record Payload(SourceSpan span, String text) implements Token {}

    // Layout
    record Newline(SourceSpan span) implements Token {}

    record Indent(SourceSpan span) implements Token {}

    record Dedent(SourceSpan span) implements Token {}

    // Special
    record Eof(SourceSpan span) implements Token {}

    record Error(SourceSpan span, String message) implements Token {}
}
