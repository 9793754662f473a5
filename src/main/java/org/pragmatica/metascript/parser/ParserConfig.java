package org.pragmatica.metascript.parser;

/**
 * Parser configuration options.
 */
public record ParserConfig(Layout layout) {
    public static final ParserConfig DEFAULT = new ParserConfig(Layout.BLOCK);
}
