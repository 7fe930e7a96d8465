package com.coinscript.tree;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

public final class Atom extends Node {

    public static final Atom NIL = new Atom(AtomKind.NIL, null, new byte[0]);

    private final AtomKind kind;
    private final Object value;
    private final byte[] bytes;

    private Atom(AtomKind kind, Object value, byte[] bytes) {
        this.kind = kind;
        this.value = value;
        this.bytes = bytes;
    }

    public static Atom nil() {
        return NIL;
    }

    public static Atom integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static Atom integer(BigInteger value) {
        if (value == null) throw new IllegalArgumentException("integer atom value is null");
        return new Atom(AtomKind.INTEGER, value, Converters.bigIntegerToBytes(value));
    }

    public static Atom bytes(byte[] value) {
        if (value == null) throw new IllegalArgumentException("bytes atom value is null");
        byte[] copy = value.clone();
        return new Atom(AtomKind.BYTES, copy, copy);
    }

    /** Bytes atom from hex text, with or without the 0x prefix. */
    public static Atom hex(String hex) {
        return bytes(Converters.hexToBytes(hex));
    }

    public static Atom symbol(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("symbol name is empty");
        return new Atom(AtomKind.SYMBOL, name, name.getBytes(StandardCharsets.UTF_8));
    }

    public static Atom string(String text) {
        if (text == null) throw new IllegalArgumentException("string atom value is null");
        return new Atom(AtomKind.STRING, text, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Atom bool(boolean value) {
        return new Atom(AtomKind.BOOLEAN, value, value ? new byte[] { 1 } : new byte[0]);
    }

    public AtomKind getKind() {
        return kind;
    }

    /** The atom's byte form (a fresh copy). */
    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean isAtom() {
        return true;
    }

    @Override
    public boolean isNil() {
        return bytes.length == 0;
    }

    @Override
    public Node first() {
        throw new IllegalStateException("first of atom " + this);
    }

    @Override
    public Node rest() {
        throw new IllegalStateException("rest of atom " + this);
    }

    public boolean isSymbol() {
        return kind == AtomKind.SYMBOL;
    }

    public boolean isSymbol(String name) {
        return kind == AtomKind.SYMBOL && value.equals(name);
    }

    /** Symbol name or string text; for other kinds the bytes decoded as UTF-8. */
    public String asText() {
        if (kind == AtomKind.SYMBOL || kind == AtomKind.STRING) return (String) value;
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /** Integer value; non-integer atoms are read as signed big-endian two's complement. */
    public BigInteger asBigInteger() {
        if (kind == AtomKind.INTEGER) return (BigInteger) value;
        return Converters.bytesToBigInteger(bytes);
    }

    public boolean asBoolean() {
        return bytes.length != 0;
    }

    Object rawValue() {
        return value;
    }

    byte[] rawBytes() {
        return bytes;
    }

    @Override
    byte[] computeHash() {
        return TreeHash.atomHash(bytes);
    }
}
