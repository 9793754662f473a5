package org.pragmatica.metascript.error;

/**
 * Abstract parent for every error raised while compiling MetaScript.
 *
 * <p>Parse and macro errors are fatal to the compilation call that raised them; nothing in
 * the compiler catches or retries them.
 */
public abstract class MetaScriptException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected MetaScriptException(String message) {
        super(message);
    }
}
