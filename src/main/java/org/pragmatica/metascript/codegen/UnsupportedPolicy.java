package org.pragmatica.metascript.codegen;

/**
 * What a code generator does with a construct it has no lowering for.
 */
public enum UnsupportedPolicy {
    /**
     * Throw {@link org.pragmatica.metascript.error.UnsupportedConstructError}. No partial output.
     */
    FAIL,
    /**
     * Emit a marked comment in place of the construct and keep going.
     *
     * <p>Example output (Python target):
     * <pre>
     * # unsupported: nested list pattern
     * </pre>
     */
    PLACEHOLDER
}
