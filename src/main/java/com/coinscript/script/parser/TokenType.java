package com.coinscript.script.parser;

public enum TokenType {
    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, SEMICOLON, DOT, AT, ARROW, FAT_ARROW,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, GREATER_S,
    LESS_LESS, GREATER_GREATER,
    AMP, AMP_AMP, PIPE, PIPE_PIPE, CARET, TILDE,

    // Literals
    IDENTIFIER, NUMBER, HEX, STRING,

    // Keywords
    COIN, STORAGE, STATE, ACTION, EVENT, CONST, FUNCTION, INLINE, MODIFIER,
    RETURN, REQUIRE, EXCEPTION, EMIT, SEND, IF, ELSE, LET, INCLUDE,
    TRUE, FALSE, TYPE, MAPPING,

    EOF
}
