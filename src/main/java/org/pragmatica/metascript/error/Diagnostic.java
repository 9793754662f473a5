package org.pragmatica.metascript.error;

import org.pragmatica.metascript.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style diagnostic message for source-level errors.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected input
 *   --> hello.ms:3:9
 *   |
 * 3 | let x = )
 *   |         ^ found ')'
 *   |
 *   = help: expected expression
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param label   Text printed next to the underline (may be empty)
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(String message, SourceSpan span, String label, List<String> notes) {

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, "", List.of());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, span, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source lines underlined.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int firstLine = span.start().line();
        int lastLine = Math.max(firstLine, span.end().line());
        int gutterWidth = String.valueOf(lastLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            int startCol = lineNum == firstLine ? span.start().column() : 1;
            int endCol = lineNum == span.end().line() ? span.end().column() : lineContent.length() + 1;
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(Math.max(0, startCol - 1)))
              .append("^".repeat(Math.max(1, endCol - startCol)));
            if (lineNum == lastLine && !label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Single-line format, {@code input:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s",
                             filename == null ? "input" : filename, loc.line(), loc.column(), message);
    }
}
