package org.pragmatica.metascript.codegen;

import org.pragmatica.metascript.tree.Program;

/**
 * Lowers a program to source text of some target language.
 *
 * <p>Implementations are immutable and may be shared between threads.
 */
public interface CodeGenerator {
    /**
     * Target name used in headers and error messages.
     */
    String target();

    String generate(Program program);
}
