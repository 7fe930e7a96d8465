package com.coinscript.error;

/** Nesting exceeded the configured recursion bound of the parser or generator. */
public final class ExpressionTooDeepError extends CoinScriptException {

    private final int limit;

    public ExpressionTooDeepError(SourcePosition position, int limit) {
        super(ErrorKind.EXPRESSION_TOO_DEEP, position, "Expression too deep (limit " + limit + ")");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
