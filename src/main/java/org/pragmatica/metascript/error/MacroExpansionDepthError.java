package org.pragmatica.metascript.error;

import java.util.List;

/**
 * Thrown when nested macro expansion exceeds the configured depth, which is how directly or
 * mutually recursive macros are reported.
 */
public final class MacroExpansionDepthError extends MetaScriptException {

    private static final long serialVersionUID = 1L;

    private final int limit;
    private final List<String> chain;

    public MacroExpansionDepthError(int limit, List<String> chain) {
        super("Macro expansion exceeded depth " + limit + ": " + describe(chain));
        this.limit = limit;
        this.chain = List.copyOf(chain);
    }

    public int limit() {
        return limit;
    }

    public List<String> chain() {
        return chain;
    }

    private static String describe(List<String> chain) {
        if (chain.size() <= 8) {
            return String.join(" -> ", chain);
        }
        return String.join(" -> ", chain.subList(0, 4)) + " -> ... -> "
               + String.join(" -> ", chain.subList(chain.size() - 3, chain.size()));
    }
}
