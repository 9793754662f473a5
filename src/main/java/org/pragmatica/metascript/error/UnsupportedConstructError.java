package org.pragmatica.metascript.error;

/**
 * Thrown by a code generator configured to fail on constructs it cannot lower.
 */
public final class UnsupportedConstructError extends MetaScriptException {

    private static final long serialVersionUID = 1L;

    private final String target;
    private final String construct;

    public UnsupportedConstructError(String target, String construct) {
        super("Unsupported construct for " + target + " target: " + construct);
        this.target = target;
        this.construct = construct;
    }

    public String target() {
        return target;
    }

    public String construct() {
        return construct;
    }
}
