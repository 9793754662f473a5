package org.pragmatica.metascript.codegen;

/**
 * Line-oriented text builder with a current indentation level.
 *
 * <p>Only code lines are counted by {@link #lineCount()}; comments are not, so a body made of
 * comments alone can still be detected as empty.
 */
final class CodeWriter {
    private final StringBuilder sb = new StringBuilder();
    private final String indentUnit;
    private int level;
    private int lines;

    CodeWriter(int indentWidth) {
        this.indentUnit = " ".repeat(indentWidth);
    }

    CodeWriter line(String text) {
        sb.append(indentUnit.repeat(level)).append(text).append('\n');
        lines++;
        return this;
    }

    CodeWriter comment(String text) {
        sb.append(indentUnit.repeat(level)).append(text).append('\n');
        return this;
    }

    CodeWriter indent() {
        level++;
        return this;
    }

    CodeWriter dedent() {
        level--;
        return this;
    }

    int lineCount() {
        return lines;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
