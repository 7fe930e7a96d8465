package com.coinscript.tree;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Domain-separated SHA-256 tree hashing:
 * {@code hash(atom) = H(0x01 || bytes)}, {@code hash(pair) = H(0x02 || hash(first) || hash(rest))}.
 */
public final class TreeHash {

    static final byte ATOM_PREFIX = 0x01;
    static final byte PAIR_PREFIX = 0x02;

    private TreeHash() {}

    public static byte[] sha256(byte[]... parts) {
        MessageDigest md = newDigest();
        for (byte[] part : parts) {
            md.update(part);
        }
        return md.digest();
    }

    public static byte[] atomHash(byte[] atomBytes) {
        MessageDigest md = newDigest();
        md.update(ATOM_PREFIX);
        md.update(atomBytes);
        return md.digest();
    }

    public static byte[] pairHash(byte[] firstHash, byte[] restHash) {
        MessageDigest md = newDigest();
        md.update(PAIR_PREFIX);
        md.update(firstHash);
        md.update(restHash);
        return md.digest();
    }

    public static byte[] structuralHash(Node node) {
        return node.hash();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
