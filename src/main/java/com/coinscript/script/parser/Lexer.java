package com.coinscript.script.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.coinscript.debug.Debug;
import com.coinscript.error.LexError;
import com.coinscript.error.SourcePosition;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startColumn = 1;
    private int startLine = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("coin", TokenType.COIN);
        map.put("storage", TokenType.STORAGE);
        map.put("state", TokenType.STATE);
        map.put("action", TokenType.ACTION);
        map.put("event", TokenType.EVENT);
        map.put("const", TokenType.CONST);
        map.put("function", TokenType.FUNCTION);
        map.put("inline", TokenType.INLINE);
        map.put("modifier", TokenType.MODIFIER);
        map.put("return", TokenType.RETURN);
        map.put("require", TokenType.REQUIRE);
        map.put("exception", TokenType.EXCEPTION);
        map.put("emit", TokenType.EMIT);
        map.put("send", TokenType.SEND);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("let", TokenType.LET);
        map.put("include", TokenType.INCLUDE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("mapping", TokenType.MAPPING);
        for (int bits = 8; bits <= 256; bits += 8) {
            map.put("uint" + bits, TokenType.TYPE);
            map.put("int" + bits, TokenType.TYPE);
        }
        map.put("address", TokenType.TYPE);
        map.put("bool", TokenType.TYPE);
        map.put("bytes32", TokenType.TYPE);
        map.put("bytes", TokenType.TYPE);
        map.put("string", TokenType.TYPE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1));
        Debug.get().d("Lexer", tokens.size() + " tokens");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '@': addToken(TokenType.AT); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=':
                if (match('>')) addToken(TokenType.FAT_ARROW);
                else addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
                break;
            case '<':
                if (match('<')) addToken(TokenType.LESS_LESS);
                else addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                break;
            case '>':
                if (match('>')) addToken(TokenType.GREATER_GREATER);
                else if (match('=')) addToken(TokenType.GREATER_EQUAL);
                else if (peek() == 's' && !isAlphaNumeric(peekNext())) {
                    advance();
                    addToken(TokenType.GREATER_S);
                } else addToken(TokenType.GREATER);
                break;
            case '&': addToken(match('&') ? TokenType.AMP_AMP : TokenType.AMP); break;
            case '|': addToken(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE); break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newLine();
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (c == '0' && (peek() == 'x' || peek() == 'X') && isHexDigit(peekNext())) hex();
                else if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw new LexError(startPosition(), c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
        if (isAlpha(peek())) throw new LexError(currentPosition(), peek(), "Invalid character '" + peek() + "' in number");
        String digits = source.substring(start, current).replace("_", "");
        addToken(TokenType.NUMBER, new BigInteger(digits));
    }

    private void hex() {
        advance(); // x
        while (isHexDigit(peek()) || (peek() == '_' && isHexDigit(peekNext()))) advance();
        if (isAlpha(peek())) throw new LexError(currentPosition(), peek(), "Invalid hex digit '" + peek() + "'");
        String digits = source.substring(start + 2, current).replace("_", "");
        addToken(TokenType.HEX, "0x" + digits.toLowerCase(Locale.ROOT));
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') newLine();
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '0': sb.append('\0'); break;
                    case '\\': sb.append('\\'); break;
                    case '"': sb.append('"'); break;
                    case '\'': sb.append('\''); break;
                    default:
                        throw new LexError(currentPosition(), e, "Invalid escape '\\" + e + "'");
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw new LexError(startPosition(), quote, "Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') newLine();
        }
        if (isAtEnd()) throw new LexError(startPosition(), '/', "Unterminated comment");
        advance();
        advance();
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) { return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'); }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private SourcePosition startPosition() {
        return new SourcePosition(startLine, startColumn, start);
    }

    private SourcePosition currentPosition() {
        return new SourcePosition(line, current - lineStart + 1, current);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }
}
