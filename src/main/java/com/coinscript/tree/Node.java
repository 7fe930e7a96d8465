package com.coinscript.tree;

import java.util.Arrays;

/**
 * Immutable Tree IR node: an {@link Atom}, a nil-terminated {@link ListNode} or an
 * improper {@link Cons} pair.
 *
 * <p>Equality and hashing are structural: a {@link ListNode} and the equivalent
 * right-nested {@link Cons} chain are equal and share one structural hash. The
 * structural hash is computed once per instance and memoized.
 */
public abstract class Node {

    private byte[] cachedHash;

    Node() {}

    /** True for atoms, including nil. */
    public abstract boolean isAtom();

    public final boolean isPair() {
        return !isAtom();
    }

    public boolean isNil() {
        return false;
    }

    /** Left half of the pair view of this node. */
    public abstract Node first();

    /** Right half of the pair view of this node; for a list, the remaining items. */
    public abstract Node rest();

    abstract byte[] computeHash();

    /** 32-byte structural hash (a fresh copy). */
    public final byte[] hash() {
        return hashBytes().clone();
    }

    public final String hashHex() {
        return Converters.toHex(hashBytes());
    }

    final boolean isHashed() {
        return cachedHash != null;
    }

    final void cacheHash(byte[] h) {
        cachedHash = h;
    }

    final byte[] hashBytes() {
        byte[] h = cachedHash;
        if (h == null) {
            h = computeHash();
            cachedHash = h;
        }
        return h;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        return Arrays.equals(hashBytes(), ((Node) o).hashBytes());
    }

    @Override
    public final int hashCode() {
        byte[] h = hashBytes();
        return ((h[0] & 0xff) << 24) | ((h[1] & 0xff) << 16) | ((h[2] & 0xff) << 8) | (h[3] & 0xff);
    }

    @Override
    public String toString() {
        return Serializer.serialize(this);
    }
}
