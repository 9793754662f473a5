package org.pragmatica.metascript.macro;

import org.pragmatica.metascript.error.MacroExpansionDepthError;
import org.pragmatica.metascript.tree.Statement.MacroDef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of one top-level expansion: visible macro definitions, the fresh-name counter and
 * the chain of macros currently being expanded.
 *
 * <p>A new context is created for every {@link MacroExpander#expand} call and never shared
 * between threads.
 */
final class ExpansionContext {
    private final ExpanderConfig config;
    private final Deque<Map<String, MacroDef>> scopes = new ArrayDeque<>();
    private final Deque<String> chain = new ArrayDeque<>();
    private int counter;

    ExpansionContext(ExpanderConfig config) {
        this.config = config;
    }

    void pushScope() {
        scopes.push(new HashMap<>());
    }

    void popScope() {
        scopes.pop();
    }

    void define(MacroDef macro) {
        scopes.peek().put(macro.name(), macro);
    }

    /**
     * Innermost definition wins.
     */
    Optional<MacroDef> resolve(String name) {
        for (var scope : scopes) {
            var macro = scope.get(name);
            if (macro != null) {
                return Optional.of(macro);
            }
        }
        return Optional.empty();
    }

    String freshName(String original) {
        counter++;
        return "__ms_macro_" + original + "_" + counter;
    }

    void enter(String macroName) {
        chain.addLast(macroName);
        if (chain.size() > config.maxDepth()) {
            throw new MacroExpansionDepthError(config.maxDepth(), new ArrayList<>(chain));
        }
    }

    void exit() {
        chain.removeLast();
    }

    int depth() {
        return chain.size();
    }
}
