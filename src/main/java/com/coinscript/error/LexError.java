package com.coinscript.error;

public final class LexError extends CoinScriptException {

    private final char offendingChar;

    public LexError(SourcePosition position, char offendingChar, String message) {
        super(ErrorKind.LEX, position, message);
        this.offendingChar = offendingChar;
    }

    public LexError(SourcePosition position, char offendingChar) {
        this(position, offendingChar, "Unexpected character '" + offendingChar + "'");
    }

    public char getOffendingChar() {
        return offendingChar;
    }
}
