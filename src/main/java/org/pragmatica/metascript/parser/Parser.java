package org.pragmatica.metascript.parser;

import org.pragmatica.metascript.error.SyntaxError;
import org.pragmatica.metascript.tree.AgentPayloads;
import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.MatchCase;
import org.pragmatica.metascript.tree.Pattern;
import org.pragmatica.metascript.tree.Program;
import org.pragmatica.metascript.tree.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for MetaScript.
 *
 * <p>One grammar serves both layouts. The layout only changes how the lexer delimits logical
 * lines and whether a block header may own more than one inline statement.
 */
public final class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> KEYWORDS = Set.of(
        "say", "print", "let", "if", "else", "while", "for", "in", "def", "async", "return",
        "macro", "match", "case", "agent", "do", "pass", "await", "not");

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private final List<Token> tokens;
    private final Layout layout;
    private int pos;

    private Parser(List<Token> tokens, Layout layout) {
        this.tokens = tokens;
        this.layout = layout;
        this.pos = 0;
    }

    public static Program parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    /**
     * Parse source text into a program.
     *
     * @throws SyntaxError if the text is malformed
     */
    public static Program parse(String source, ParserConfig config) {
        var tokens = Lexer.tokenize(source, config.layout());

        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof Token.Error error) {
                throw SyntaxError.invalid(error.span(), error.message());
            }
        }

        var program = new Parser(tokens, config.layout()).parseProgram();
        LOG.debug("Parsed {} top-level statements ({} layout)", program.statements().size(), config.layout());
        return program;
    }

    private Program parseProgram() {
        var statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            parseLine(statements);
        }
        return new Program(statements);
    }

    // === Lines and blocks ===

    private void parseLine(List<Statement> into) {
        statement().ifPresent(into::add);
        while (!atLineEnd()) {
            if (!matchSymbol(";")) {
                throw unexpected("end of line");
            }
            if (atLineEnd()) {
                break;
            }
            statement().ifPresent(into::add);
        }
        if (peek() instanceof Token.Newline) {
            advance();
        }
    }

    private List<Statement> body() {
        expectSymbol(":");
        if (peek() instanceof Token.Newline) {
            if (layout == Layout.LINE) {
                throw unexpected("statement after ':'");
            }
            advance();
            if (!(peek() instanceof Token.Indent)) {
                throw unexpected("indented block");
            }
            advance();
            var statements = new ArrayList<Statement>();
            while (!(peek() instanceof Token.Dedent)) {
                parseLine(statements);
            }
            advance();
            return statements;
        }
        return inlineBody();
    }

    private List<Statement> inlineBody() {
        var statements = new ArrayList<Statement>();
        statement().ifPresent(statements::add);
        if (layout == Layout.LINE) {
            if (!atLineEnd() && !continuesClause("case") && !continuesClause("else")) {
                throw SyntaxError.invalid(peek().span(),
                                          "Line layout allows a single statement per block header");
            }
            return statements;
        }
        while (peekSymbol(";") && !keywordAt(pos + 1, "case") && !keywordAt(pos + 1, "else") && !lineEndAt(pos + 1)) {
            advance();
            statement().ifPresent(statements::add);
        }
        return statements;
    }

    /**
     * True at a clause keyword, or at a {@code ;} directly before it.
     */
    private boolean continuesClause(String keyword) {
        return peekKeyword(keyword) || (peekSymbol(";") && keywordAt(pos + 1, keyword));
    }

    /**
     * Checks for a continuation clause ({@code else}, {@code case}), optionally preceded by
     * {@code ;} or a line break, and consumes the separator.
     */
    private boolean continuation(String keyword) {
        if (peekKeyword(keyword)) {
            return true;
        }
        if ((peekSymbol(";") || peek() instanceof Token.Newline) && keywordAt(pos + 1, keyword)) {
            advance();
            return true;
        }
        return false;
    }

    // === Statements ===

    private Optional<Statement> statement() {
        if (peekSymbol("@")) {
            return Optional.of(macroCall());
        }
        if (!(peek() instanceof Token.Identifier id)) {
            if (peek() instanceof Token.Indent) {
                throw SyntaxError.invalid(peek().span(), "Unexpected indent");
            }
            return Optional.of(expressionStatement());
        }
        return switch (id.name()) {
            case "pass" -> {
                advance();
                yield Optional.empty();
            }
            case "say" -> {
                advance();
                yield Optional.of(new Statement.Say(expression()));
            }
            case "print" -> {
                advance();
                yield Optional.of(new Statement.Print(expression()));
            }
            case "let" -> {
                advance();
                var name = expectName("variable name");
                expectSymbol("=");
                yield Optional.of(new Statement.Assign(name, expression()));
            }
            case "if" -> Optional.of(ifStatement());
            case "while" -> {
                advance();
                var condition = expression();
                yield Optional.of(new Statement.While(condition, body()));
            }
            case "for" -> Optional.of(forLoop());
            case "def" -> {
                advance();
                yield Optional.of(functionDef(false));
            }
            case "async" -> {
                advance();
                expectKeyword("def");
                yield Optional.of(functionDef(true));
            }
            case "return" -> {
                advance();
                yield Optional.of(new Statement.Return(expression()));
            }
            case "macro" -> Optional.of(macroDef());
            case "match" -> Optional.of(match());
            case "agent" -> Optional.of(agentCall());
            case "do" -> {
                advance();
                yield Optional.of(new Statement.DoBlock(body()));
            }
            default -> Optional.of(expressionStatement());
        };
    }

    private Statement expressionStatement() {
        if (peek() instanceof Token.Identifier id && !isKeyword(id.name()) && symbolAt(pos + 1, "=")) {
            advance();
            advance();
            return new Statement.Assign(id.name(), expression());
        }
        return new Statement.ExpressionStatement(expression());
    }

    private Statement ifStatement() {
        advance();
        var condition = expression();
        var body = body();
        if (continuation("else")) {
            advance();
            return new Statement.If(condition, body, Optional.of(body()));
        }
        return new Statement.If(condition, body, Optional.empty());
    }

    private Statement forLoop() {
        advance();
        var variable = expectName("loop variable");
        expectKeyword("in");
        var start = peek().span();
        var iterable = expression();
        if (matchSymbol("..")) {
            var last = expression();
            iterable = Expression.FunctionCall.of("range",
                                                  iterable,
                                                  new Expression.BinaryOp("+", last, new Expression.IntLiteral(1)));
        }
        if (iterable instanceof Expression.FunctionCall call
            && call.name().equals("range")
            && (call.arguments().isEmpty() || call.arguments().size() > 3)) {
            throw SyntaxError.invalid(start, "range() takes 1 to 3 arguments, got " + call.arguments().size());
        }
        return new Statement.ForLoop(variable, iterable, body());
    }

    private Statement functionDef(boolean async) {
        var name = expectName("function name");
        var parameters = parameterList();
        return new Statement.FunctionDef(name, parameters, body(), async);
    }

    private Statement macroDef() {
        advance();
        var name = expectName("macro name");
        var parameters = parameterList();
        return new Statement.MacroDef(name, parameters, body());
    }

    private Statement macroCall() {
        advance();
        var name = expectName("macro name");
        expectSymbol("(");
        return new Statement.MacroCall(name, expressionList(")"));
    }

    private Statement agentCall() {
        advance();
        var agent = expectName("agent name");
        if (!(peek() instanceof Token.Payload payload)) {
            throw unexpected("agent payload '[...]'");
        }
        advance();
        if (AgentPayloads.decode(payload.text()).isEmpty()) {
            throw SyntaxError.invalid(payload.span(), "Malformed agent payload");
        }
        return new Statement.AgentCall(agent, payload.text());
    }

    private Statement match() {
        advance();
        var subject = expression();
        expectSymbol(":");
        var cases = new ArrayList<MatchCase>();
        if (peek() instanceof Token.Newline && layout == Layout.BLOCK) {
            advance();
            if (!(peek() instanceof Token.Indent)) {
                throw unexpected("indented 'case' block");
            }
            advance();
            while (!(peek() instanceof Token.Dedent)) {
                cases.add(matchCase());
                while (continuation("case")) {
                    cases.add(matchCase());
                }
                if (!atLineEnd()) {
                    throw unexpected("end of line");
                }
                if (peek() instanceof Token.Newline) {
                    advance();
                }
            }
            advance();
            return new Statement.Match(subject, cases);
        }
        cases.add(matchCase());
        while (continuation("case")) {
            cases.add(matchCase());
        }
        return new Statement.Match(subject, cases);
    }

    private MatchCase matchCase() {
        expectKeyword("case");
        var pattern = pattern();
        return new MatchCase(pattern, body());
    }

    private List<String> parameterList() {
        expectSymbol("(");
        var parameters = new ArrayList<String>();
        if (matchSymbol(")")) {
            return parameters;
        }
        do {
            parameters.add(expectName("parameter name"));
        } while (matchSymbol(","));
        expectSymbol(")");
        return parameters;
    }

    // === Patterns ===

    private Pattern pattern() {
        var token = peek();
        if (token instanceof Token.Identifier id && id.name().equals("_")) {
            advance();
            return new Pattern.Wildcard();
        }
        if (token instanceof Token.IntLiteral literal) {
            advance();
            return new Pattern.LiteralPattern(new Expression.IntLiteral(literal.value()));
        }
        if (peekSymbol("-") && tokenAt(pos + 1) instanceof Token.IntLiteral literal) {
            advance();
            advance();
            return new Pattern.LiteralPattern(new Expression.IntLiteral(-literal.value()));
        }
        if (token instanceof Token.StringLiteral literal) {
            advance();
            return new Pattern.LiteralPattern(new Expression.StringLiteral(literal.value()));
        }
        if (matchSymbol("[")) {
            var elements = new ArrayList<Pattern>();
            if (!matchSymbol("]")) {
                do {
                    elements.add(pattern());
                } while (matchSymbol(","));
                expectSymbol("]");
            }
            return new Pattern.ListPattern(elements);
        }
        if (token instanceof Token.Identifier id && !isKeyword(id.name())) {
            advance();
            return new Pattern.NamePattern(id.name());
        }
        throw unexpected("pattern");
    }

    // === Expressions ===

    private Expression expression() {
        if (peekKeyword("not")) {
            advance();
            return new Expression.UnaryOp("not", expression());
        }
        return comparison();
    }

    private Expression comparison() {
        var left = additive();
        if (peek() instanceof Token.Symbol symbol && COMPARISONS.contains(symbol.text())) {
            advance();
            return new Expression.BinaryOp(symbol.text(), left, additive());
        }
        return left;
    }

    private Expression additive() {
        var left = term();
        while (peekSymbol("+") || peekSymbol("-")) {
            var operator = ((Token.Symbol) peek()).text();
            advance();
            left = new Expression.BinaryOp(operator, left, term());
        }
        return left;
    }

    private Expression term() {
        var left = unary();
        while (peekSymbol("*") || peekSymbol("/")) {
            var operator = ((Token.Symbol) peek()).text();
            advance();
            left = new Expression.BinaryOp(operator, left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (matchSymbol("-")) {
            return new Expression.UnaryOp("-", unary());
        }
        if (peekKeyword("await")) {
            advance();
            return new Expression.Await(unary());
        }
        return primary();
    }

    private Expression primary() {
        var token = peek();
        if (token instanceof Token.IntLiteral literal) {
            advance();
            return new Expression.IntLiteral(literal.value());
        }
        if (token instanceof Token.StringLiteral literal) {
            advance();
            return new Expression.StringLiteral(literal.value());
        }
        if (token instanceof Token.Identifier id && !isKeyword(id.name())) {
            advance();
            if (matchSymbol("(")) {
                return new Expression.FunctionCall(id.name(), expressionList(")"));
            }
            return new Expression.Name(id.name());
        }
        if (matchSymbol("(")) {
            var inner = expression();
            expectSymbol(")");
            return inner;
        }
        if (matchSymbol("[")) {
            return new Expression.ListLiteral(expressionList("]"));
        }
        throw unexpected("expression");
    }

    /**
     * Comma-separated expressions up to and including the closing symbol.
     */
    private List<Expression> expressionList(String closing) {
        var expressions = new ArrayList<Expression>();
        if (matchSymbol(closing)) {
            return expressions;
        }
        do {
            if (peekSymbol(closing)) {
                break;
            }
            expressions.add(expression());
        } while (matchSymbol(","));
        expectSymbol(closing);
        return expressions;
    }

    // === Token helpers ===

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private boolean atLineEnd() {
        return lineEndAt(pos) || (pos > 0 && tokens.get(pos - 1) instanceof Token.Dedent);
    }

    private boolean lineEndAt(int index) {
        var token = tokenAt(index);
        return token instanceof Token.Newline || token instanceof Token.Eof || token instanceof Token.Dedent;
    }

    private boolean peekSymbol(String text) {
        return symbolAt(pos, text);
    }

    private boolean symbolAt(int index, String text) {
        return tokenAt(index) instanceof Token.Symbol symbol && symbol.text().equals(text);
    }

    private boolean peekKeyword(String keyword) {
        return keywordAt(pos, keyword);
    }

    private boolean keywordAt(int index, String keyword) {
        return tokenAt(index) instanceof Token.Identifier id && id.name().equals(keyword);
    }

    private boolean matchSymbol(String text) {
        if (peekSymbol(text)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectSymbol(String text) {
        if (!matchSymbol(text)) {
            throw unexpected("'" + text + "'");
        }
    }

    private void expectKeyword(String keyword) {
        if (!peekKeyword(keyword)) {
            throw unexpected("'" + keyword + "'");
        }
        advance();
    }

    private String expectName(String what) {
        if (peek() instanceof Token.Identifier id && !isKeyword(id.name())) {
            advance();
            return id.name();
        }
        throw unexpected(what);
    }

    private static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    private SyntaxError unexpected(String expected) {
        var token = peek();
        if (token instanceof Token.Eof) {
            return SyntaxError.unexpectedEof(token.span(), expected);
        }
        return SyntaxError.unexpectedInput(token.span(), tokenDescription(token), expected);
    }

    private static String tokenDescription(Token token) {
        if (token instanceof Token.Identifier id) {
            return isKeyword(id.name()) ? "keyword '" + id.name() + "'" : "identifier '" + id.name() + "'";
        }
        if (token instanceof Token.IntLiteral literal) {
            return "number " + literal.value();
        }
        if (token instanceof Token.StringLiteral) {
            return "string literal";
        }
        if (token instanceof Token.Symbol symbol) {
            return "'" + symbol.text() + "'";
        }
        if (token instanceof Token.Payload) {
            return "agent payload";
        }
        if (token instanceof Token.Newline) {
            return "end of line";
        }
        if (token instanceof Token.Indent) {
            return "indent";
        }
        if (token instanceof Token.Dedent) {
            return "dedent";
        }
        if (token instanceof Token.Eof) {
            return "end of input";
        }
        return "invalid token";
    }
}
