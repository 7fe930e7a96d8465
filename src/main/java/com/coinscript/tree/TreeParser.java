package com.coinscript.tree;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.coinscript.error.ExpressionTooDeepError;
import com.coinscript.error.ParseError;
import com.coinscript.error.SourcePosition;

/**
 * Recursive-descent parser for raw Tree IR text.
 *
 * <pre>
 *   node   := atom | '(' ')' | '(' node+ ( '.' node )? ')'
 *   atom   := integer | 0x-hex | "string" | 'string' | symbol
 * </pre>
 *
 * Line comments start with ';'. No partial result is ever returned: the first
 * problem raises {@link ParseError}.
 */
public final class TreeParser {

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final String source;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int depth = 0;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public TreeParser(String source) {
        this.source = source == null ? "" : source;
    }

    public static Node parse(String source) {
        return new TreeParser(source).parse();
    }

    public TreeParser setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }

    public Node parse() {
        skipTrivia();
        if (isAtEnd()) throw error("expression", "end of input");
        Node node = node();
        skipTrivia();
        if (!isAtEnd()) throw error("end of input", describe(peek()));
        return node;
    }

    private Node node() {
        skipTrivia();
        if (isAtEnd()) throw error("expression", "end of input");
        char c = peek();
        if (c == '(') return list();
        if (c == ')') throw error("expression", "')'");
        if (c == '"' || c == '\'') return string();
        return bareAtom();
    }

    private Node list() {
        SourcePosition open = position();
        if (++depth > maxDepth) throw new ExpressionTooDeepError(open, maxDepth);
        advance(); // (
        List<Node> items = new ArrayList<>();
        Node tail = null;
        while (true) {
            skipTrivia();
            if (isAtEnd()) throw error("')'", "end of input");
            char c = peek();
            if (c == ')') {
                advance();
                break;
            }
            if (c == '.' && isDelimiter(peekNext())) {
                if (items.isEmpty()) throw error("expression before '.'", "'.'");
                advance();
                tail = node();
                skipTrivia();
                if (isAtEnd()) throw error("')'", "end of input");
                if (peek() != ')') throw error("')' after dotted tail", describe(peek()));
                advance();
                break;
            }
            items.add(node());
        }
        depth--;
        if (tail != null) return Nodes.dotted(items, tail);
        return Nodes.list(items);
    }

    private Node string() {
        char quote = advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) throw error("closing " + quote, "end of input");
            char c = advance();
            if (c == quote) break;
            if (c == '\n') newLine();
            if (c == '\\') {
                if (isAtEnd()) throw error("escape character", "end of input");
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '\\': sb.append('\\'); break;
                    case '"': sb.append('"'); break;
                    case '\'': sb.append('\''); break;
                    default: sb.append(e);
                }
            } else {
                sb.append(c);
            }
        }
        return Atom.string(sb.toString());
    }

    private Node bareAtom() {
        SourcePosition at = position();
        int start = current;
        while (!isAtEnd() && !isDelimiter(peek())) advance();
        String text = source.substring(start, current);
        if (text.startsWith("0x") || text.startsWith("0X")) {
            if (!Converters.isHex(text)) {
                throw new ParseError(at, "hex digits", "'" + text + "'");
            }
            return Atom.hex(text);
        }
        if (isInteger(text)) return Atom.integer(new BigInteger(text));
        return Atom.symbol(text);
    }

    private static boolean isInteger(String text) {
        int i = text.startsWith("-") ? 1 : 0;
        if (i >= text.length()) return false;
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ';') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private boolean isDelimiter(char c) {
        return c == '\0' || c == '(' || c == ')' || c == ';' || c == '"' || c == '\'' || Character.isWhitespace(c);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private SourcePosition position() {
        return new SourcePosition(line, current - lineStart + 1, current);
    }

    private static String describe(char c) {
        return "'" + c + "'";
    }

    private ParseError error(String expected, String found) {
        return new ParseError(position(), expected, found);
    }
}
