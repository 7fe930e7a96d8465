package com.coinscript.error;

/**
 * Base of every compiler error. Unchecked: no stage recovers, the first error
 * aborts the whole compilation.
 */
public abstract class CoinScriptException extends RuntimeException {

    private final ErrorKind kind;
    private final SourcePosition position;

    protected CoinScriptException(ErrorKind kind, SourcePosition position, String message) {
        super(format(position, message));
        this.kind = kind;
        this.position = position;
    }

    protected CoinScriptException(ErrorKind kind, SourcePosition position, String message, Throwable cause) {
        super(format(position, message), cause);
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Position of the offending input, or null when the error is not tied to source text. */
    public SourcePosition getPosition() {
        return position;
    }

    private static String format(SourcePosition position, String message) {
        if (position == null) return message;
        return "[line " + position.line + ", column " + position.column + "] " + message;
    }
}
