package org.pragmatica.metascript.parser;

import org.pragmatica.metascript.tree.SourceLocation;
import org.pragmatica.metascript.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lexer for MetaScript source text.
 *
 * <p>Besides ordinary tokens it produces the layout tokens the parser needs: {@code Newline}
 * at the end of every logical line, and, in {@link Layout#BLOCK}, {@code Indent}/{@code Dedent}
 * when indentation grows or shrinks. Line breaks inside parentheses or brackets are ignored.
 * Blank lines and {@code #} comments produce nothing. Lexical problems are reported as
 * {@link Token.Error} tokens.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final int TAB_WIDTH = 8;

    private enum AgentState { NONE, NAME, PAYLOAD }

    private final String input;
    private final Layout layout;
    private final List<Token> tokens;
    private final Deque<Integer> indents;

    private int pos;
    private int line;
    private int column;
    private int bracketDepth;
    private boolean lineHasContent;
    private boolean headerGroup;
    private AgentState agentState;

    private Lexer(String input, Layout layout) {
        this.input = input;
        this.layout = layout;
        this.tokens = new ArrayList<>();
        this.indents = new ArrayDeque<>();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.agentState = AgentState.NONE;
    }

    public static List<Token> tokenize(String input, Layout layout) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input, layout).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        indents.push(0);
        startLine(currentSpan());
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t') {
                advance();
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                var lineBreak = currentSpan();
                consumeLineBreak();
                if (bracketDepth == 0) {
                    startLine(lineBreak);
                }
            } else {
                tokens.add(nextToken());
                lineHasContent = true;
            }
        }
        finish();
        return tokens;
    }

    // === Layout ===

    private void startLine(SourceSpan lineBreak) {
        int width = skipBlankLinesAndMeasureIndent();
        agentState = AgentState.NONE;
        if (layout == Layout.LINE) {
            joinOrBreakLogicalLine(lineBreak, width);
            return;
        }
        if (lineHasContent) {
            tokens.add(new Token.Newline(lineBreak));
            lineHasContent = false;
        }
        if (!isAtEnd()) {
            adjustIndentation(width);
        }
    }

    private void adjustIndentation(int width) {
        var span = currentSpan();
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new Token.Indent(span));
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            tokens.add(new Token.Dedent(span));
        }
        if (width != indents.peek()) {
            tokens.add(new Token.Error(span, "Unindent does not match any outer indentation level"));
        }
    }

    private void joinOrBreakLogicalLine(SourceSpan lineBreak, int width) {
        if (!lineHasContent) {
            return;
        }
        headerGroup |= lastTokenIsSymbol(":");
        boolean joins = !isAtEnd() && ((headerGroup && width > 0) || nextWordIs("else"));
        if (!joins) {
            tokens.add(new Token.Newline(lineBreak));
            lineHasContent = false;
            headerGroup = false;
        }
    }

    private int skipBlankLinesAndMeasureIndent() {
        while (true) {
            int width = 0;
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
                width = advance() == '\t'
                        ? (width / TAB_WIDTH + 1) * TAB_WIDTH
                        : width + 1;
            }
            if (!isAtEnd() && peek() == '#') {
                skipComment();
            }
            if (!isAtEnd() && (peek() == '\n' || peek() == '\r')) {
                consumeLineBreak();
                continue;
            }
            return width;
        }
    }

    private void finish() {
        var span = currentSpan();
        if (lineHasContent) {
            tokens.add(new Token.Newline(span));
        }
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token.Dedent(span));
        }
        tokens.add(new Token.Eof(span));
    }

    // === Tokens ===

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        var state = agentState;
        agentState = AgentState.NONE;

        if (state == AgentState.PAYLOAD && c == '[') {
            return scanPayload(start);
        }
        if (isIdentifierStart(c)) {
            boolean statementStart = atStatementStart();
            var identifier = scanIdentifier(start);
            if (state == AgentState.NAME) {
                agentState = AgentState.PAYLOAD;
            } else if (statementStart && identifier.name().equals("agent")) {
                agentState = AgentState.NAME;
            }
            return identifier;
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"' || c == '\'') {
            return scanStringLiteral(start);
        }
        return scanSymbol(start);
    }

    private Token.Identifier scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Identifier(span(start), sb.toString());
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        try {
            return new Token.IntLiteral(span(start), Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            return new Token.Error(span(start), "Integer literal out of range: " + sb);
        }
    }

    private Token scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd() || peek() == '\n') {
            return new Token.Error(span(start), "Unterminated string literal");
        }
        advance();
        return new Token.StringLiteral(span(start), sb.toString());
    }

    private String scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> "\n";
            case 'r' -> "\r";
            case 't' -> "\t";
            case '\\' -> "\\";
            case '\'' -> "'";
            case '"' -> "\"";
            default -> "\\" + c;
        };
    }

    /**
     * Agent payloads are kept verbatim: brackets nest, and quoted text may contain brackets.
     */
    private Token scanPayload(SourceLocation start) {
        advance();
        int contentStart = pos;
        int depth = 1;
        char quote = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (quote != 0) {
                if (c == '\\' && pos + 1 < input.length()) {
                    advance();
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                break;
            }
            advance();
        }
        if (isAtEnd()) {
            return new Token.Error(span(start), "Unterminated agent payload");
        }
        var text = input.substring(contentStart, pos);
        advance();
        return new Token.Payload(span(start), text);
    }

    private Token scanSymbol(SourceLocation start) {
        if (pos + 1 < input.length()) {
            var pair = input.substring(pos, pos + 2);
            switch (pair) {
                case "..", "==", "!=", "<=", ">=" -> {
                    advance();
                    advance();
                    return new Token.Symbol(span(start), pair);
                }
                default -> {}
            }
        }
        char c = advance();
        return switch (c) {
            case '(', '[' -> {
                bracketDepth++;
                yield new Token.Symbol(span(start), String.valueOf(c));
            }
            case ')', ']' -> {
                bracketDepth = Math.max(0, bracketDepth - 1);
                yield new Token.Symbol(span(start), String.valueOf(c));
            }
            case ',', ':', ';', '=', '+', '-', '*', '/', '<', '>', '@' -> new Token.Symbol(span(start), String.valueOf(c));
            default -> new Token.Error(span(start), "Unexpected character: " + c);
        };
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            advance();
        }
    }

    private void consumeLineBreak() {
        if (peek() == '\r') {
            pos++;
            if (!isAtEnd() && peek() == '\n') {
                pos++;
            }
            line++;
            column = 1;
            return;
        }
        advance();
    }

    // === Helpers ===

    private boolean atStatementStart() {
        if (tokens.isEmpty()) {
            return true;
        }
        var last = tokens.get(tokens.size() - 1);
        return last instanceof Token.Newline
               || last instanceof Token.Indent
               || last instanceof Token.Dedent
               || lastTokenIsSymbol(":")
               || lastTokenIsSymbol(";");
    }

    private boolean lastTokenIsSymbol(String text) {
        return !tokens.isEmpty()
               && tokens.get(tokens.size() - 1) instanceof Token.Symbol symbol
               && symbol.text().equals(text);
    }

    private boolean nextWordIs(String word) {
        int end = pos + word.length();
        return input.startsWith(word, pos)
               && (end >= input.length() || !isIdentifierPart(input.charAt(end)));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
