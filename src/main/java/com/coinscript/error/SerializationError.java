package com.coinscript.error;

/** A tree that is malformed for a known special form (mod, defun, if, include). */
public final class SerializationError extends CoinScriptException {

    private final String form;

    public SerializationError(String form, String message) {
        super(ErrorKind.SERIALIZATION, null, message);
        this.form = form;
    }

    public String getForm() {
        return form;
    }
}
