package org.pragmatica.metascript.macro;

import org.pragmatica.metascript.error.UndefinedMacroError;
import org.pragmatica.metascript.tree.Expression;
import org.pragmatica.metascript.tree.MatchCase;
import org.pragmatica.metascript.tree.Program;
import org.pragmatica.metascript.tree.Statement;
import org.pragmatica.metascript.tree.Statement.AgentCall;
import org.pragmatica.metascript.tree.Statement.Assign;
import org.pragmatica.metascript.tree.Statement.DoBlock;
import org.pragmatica.metascript.tree.Statement.ExpressionStatement;
import org.pragmatica.metascript.tree.Statement.ForLoop;
import org.pragmatica.metascript.tree.Statement.FunctionDef;
import org.pragmatica.metascript.tree.Statement.If;
import org.pragmatica.metascript.tree.Statement.MacroCall;
import org.pragmatica.metascript.tree.Statement.MacroDef;
import org.pragmatica.metascript.tree.Statement.Match;
import org.pragmatica.metascript.tree.Statement.Print;
import org.pragmatica.metascript.tree.Statement.Return;
import org.pragmatica.metascript.tree.Statement.Say;
import org.pragmatica.metascript.tree.Statement.While;
import org.pragmatica.metascript.tree.TreeSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compile-time macro expansion.
 *
 * <p>Every block opens a scope. A {@code macro} definition is visible in the block that
 * declares it and in blocks nested inside it, and produces no output of its own. A call is
 * replaced by the macro body after two rewrites: names the body declares are renamed to
 * fresh {@code __ms_macro_<name>_<n>} identifiers, and parameters are replaced by copies of
 * the call arguments. The result is expanded again in a scope of its own.
 *
 * <p>Fresh names are numbered per {@link #expand} call, so output is reproducible and
 * concurrent calls do not interfere.
 */
public final class MacroExpander implements Statement.Visitor<List<Statement>> {
    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final ExpansionContext context;

    private MacroExpander(ExpansionContext context) {
        this.context = context;
    }

    public static Program expand(Program program) {
        return expand(program, ExpanderConfig.DEFAULT);
    }

    /**
     * Expand all macros in a program.
     *
     * @throws UndefinedMacroError if a call names a macro not visible at the call site
     * @throws org.pragmatica.metascript.error.MacroExpansionDepthError if expansions nest deeper than allowed
     */
    public static Program expand(Program program, ExpanderConfig config) {
        var expander = new MacroExpander(new ExpansionContext(config));
        var expanded = new Program(expander.block(program.statements()));
        LOG.debug("Expanded program: {} -> {} top-level statements",
                  program.statements().size(), expanded.statements().size());
        if (LOG.isTraceEnabled()) {
            LOG.trace("Expanded tree: {}", TreeSerializer.toJson(expanded));
        }
        return expanded;
    }

    private List<Statement> block(List<Statement> statements) {
        context.pushScope();
        try {
            var result = new ArrayList<Statement>();
            for (var statement : statements) {
                result.addAll(statement.accept(this));
            }
            return result;
        } finally {
            context.popScope();
        }
    }

    // === Macro nodes ===

    @Override
    public List<Statement> visitMacroDef(MacroDef macroDef) {
        context.define(macroDef);
        return List.of();
    }

    @Override
    public List<Statement> visitMacroCall(MacroCall call) {
        var macro = context.resolve(call.name())
                           .orElseThrow(() -> new UndefinedMacroError(call.name()));
        context.enter(macro.name());
        try {
            var renames = new LinkedHashMap<String, String>();
            for (var name : BindingCollector.collect(macro.body(), macro.parameters())) {
                renames.put(name, context.freshName(name));
            }
            var renamed = new BindingRenamer(renames).copyAll(macro.body());
            var substituted = new ParameterSubstitution(bindArguments(macro, call)).copyAll(renamed);
            LOG.trace("Expanding @{} at depth {} with renames {}", macro.name(), context.depth(), renames);
            return block(substituted);
        } finally {
            context.exit();
        }
    }

    private static Map<String, Expression> bindArguments(MacroDef macro, MacroCall call) {
        var parameters = macro.parameters();
        var arguments = call.arguments();
        if (parameters.size() != arguments.size()) {
            LOG.warn("Macro '{}' expects {} argument(s) but was called with {}",
                     macro.name(), parameters.size(), arguments.size());
        }
        var bound = new HashMap<String, Expression>();
        for (int i = 0; i < parameters.size() && i < arguments.size(); i++) {
            bound.put(parameters.get(i), arguments.get(i));
        }
        return bound;
    }

    // === Blocks ===

    @Override
    public List<Statement> visitIf(If ifStatement) {
        return List.of(new If(ifStatement.condition(),
                              block(ifStatement.body()),
                              ifStatement.elseBody().map(this::block)));
    }

    @Override
    public List<Statement> visitWhile(While whileLoop) {
        return List.of(new While(whileLoop.condition(), block(whileLoop.body())));
    }

    @Override
    public List<Statement> visitForLoop(ForLoop forLoop) {
        return List.of(new ForLoop(forLoop.variable(), forLoop.end(), block(forLoop.body())));
    }

    @Override
    public List<Statement> visitFunctionDef(FunctionDef function) {
        return List.of(new FunctionDef(function.name(), function.parameters(), block(function.body()), function.async()));
    }

    @Override
    public List<Statement> visitDoBlock(DoBlock doBlock) {
        return List.of(new DoBlock(block(doBlock.body())));
    }

    @Override
    public List<Statement> visitMatch(Match match) {
        var cases = new ArrayList<MatchCase>();
        for (var matchCase : match.cases()) {
            cases.add(new MatchCase(matchCase.pattern(), block(matchCase.body())));
        }
        return List.of(new Match(match.subject(), cases));
    }

    // === Leaves ===

    @Override
    public List<Statement> visitSay(Say say) {
        return List.of(say);
    }

    @Override
    public List<Statement> visitPrint(Print print) {
        return List.of(print);
    }

    @Override
    public List<Statement> visitAssign(Assign assign) {
        return List.of(assign);
    }

    @Override
    public List<Statement> visitReturn(Return returnStatement) {
        return List.of(returnStatement);
    }

    @Override
    public List<Statement> visitAgentCall(AgentCall agentCall) {
        return List.of(agentCall);
    }

    @Override
    public List<Statement> visitExpressionStatement(ExpressionStatement statement) {
        return List.of(statement);
    }
}
