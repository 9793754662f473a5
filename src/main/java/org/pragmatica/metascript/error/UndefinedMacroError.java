package org.pragmatica.metascript.error;

/**
 * Thrown when a macro call names a macro that is not visible in the lexical scope of the call.
 */
public final class UndefinedMacroError extends MetaScriptException {

    private static final long serialVersionUID = 1L;

    private final String macroName;

    public UndefinedMacroError(String macroName) {
        super("Undefined macro '" + macroName + "'");
        this.macroName = macroName;
    }

    public String macroName() {
        return macroName;
    }
}
