package com.coinscript.error;

/**
 * Semantic failure while lowering the AST: unknown identifier, illegal assignment,
 * state access outside a stateful action, misplaced decorator and the like.
 */
public final class GenerationError extends CoinScriptException {

    private final String name;

    public GenerationError(SourcePosition position, String name, String message) {
        super(ErrorKind.GENERATION, position, message);
        this.name = name;
    }

    /** The offending identifier, action or decorator name; may be null. */
    public String getName() {
        return name;
    }
}
