package org.pragmatica.metascript.error;

import org.pragmatica.metascript.tree.SourceLocation;
import org.pragmatica.metascript.tree.SourceSpan;

/**
 * Thrown when source text is malformed: unexpected token, unterminated string, bad
 * indentation, undecodable agent payload. No partial tree is produced.
 */
public final class SyntaxError extends MetaScriptException {

    private static final long serialVersionUID = 1L;

    private final transient Diagnostic diagnostic;

    private SyntaxError(String message, Diagnostic diagnostic) {
        super(message);
        this.diagnostic = diagnostic;
    }

    public static SyntaxError unexpectedInput(SourceSpan span, String found, String expected) {
        var diagnostic = Diagnostic.error("unexpected input", span)
                                   .withLabel("found " + found)
                                   .withHelp("expected " + expected);
        return new SyntaxError("Unexpected " + found + " at " + span.start() + ", expected " + expected, diagnostic);
    }

    public static SyntaxError unexpectedEof(SourceSpan span, String expected) {
        var diagnostic = Diagnostic.error("unexpected end of input", span)
                                   .withHelp("expected " + expected);
        return new SyntaxError("Unexpected end of input at " + span.start() + ", expected " + expected, diagnostic);
    }

    public static SyntaxError invalid(SourceSpan span, String reason) {
        var diagnostic = Diagnostic.error(reason, span);
        return new SyntaxError(reason + " at " + span.start(), diagnostic);
    }

    public SourceLocation location() {
        return diagnostic.span().start();
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    /**
     * Render the error with the offending source line.
     */
    public String format(String source, String filename) {
        return diagnostic.format(source, filename);
    }
}
