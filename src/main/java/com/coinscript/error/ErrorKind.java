package com.coinscript.error;

/** Category of a compiler failure. */
public enum ErrorKind {
    LEX,
    PARSE,
    GENERATION,
    SERIALIZATION,
    CONVERSION,
    EXPRESSION_TOO_DEEP
}
