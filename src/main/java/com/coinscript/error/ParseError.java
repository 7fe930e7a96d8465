package com.coinscript.error;

/** Bad token or structure, raised by both the Language parser and the Tree IR parser. */
public final class ParseError extends CoinScriptException {

    private final String expected;
    private final String found;

    public ParseError(SourcePosition position, String expected, String found) {
        super(ErrorKind.PARSE, position, "Expected " + expected + " but found " + found);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
