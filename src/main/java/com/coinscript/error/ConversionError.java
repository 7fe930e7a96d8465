package com.coinscript.error;

/** Input that cannot be converted between representations (hex, address, bytes, state tuple). */
public final class ConversionError extends CoinScriptException {

    private final String input;

    public ConversionError(String input, String message) {
        super(ErrorKind.CONVERSION, null, message);
        this.input = input;
    }

    public ConversionError(String input, String message, Throwable cause) {
        super(ErrorKind.CONVERSION, null, message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
