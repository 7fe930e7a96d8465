package com.coinscript.tree;

/** Primitive carried by an {@link Atom}. Only the atom's byte form takes part in hashing. */
public enum AtomKind {
    NIL,
    INTEGER,
    BYTES,
    /** Quoted text; rendered with quotes, hashed as its UTF-8 bytes. */
    STRING,
    /** Bare identifier or operator; hashed as its UTF-8 bytes. */
    SYMBOL,
    BOOLEAN
}
