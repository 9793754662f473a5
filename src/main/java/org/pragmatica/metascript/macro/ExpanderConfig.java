package org.pragmatica.metascript.macro;

/**
 * Macro expander configuration.
 *
 * @param maxDepth deepest allowed nesting of macro expansions; recursive macros hit this limit
 */
public record ExpanderConfig(int maxDepth) {
    public static final ExpanderConfig DEFAULT = new ExpanderConfig(64);

    public ExpanderConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }
}
