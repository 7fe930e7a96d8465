package com.coinscript.tree;

import java.util.List;

/**
 * Computes the hash of {@code curry(P, args)} from hashes alone, without building the
 * tree. The same formula is emitted into stateful coins so they can recreate
 * themselves on chain.
 */
public final class CurryHash {

    /** Hash of atom 1: quote opcode and the environment atom. */
    public static final byte[] ONE_HASH = TreeHash.atomHash(new byte[] { 1 });
    public static final byte[] APPLY_HASH = TreeHash.atomHash(new byte[] { 2 });
    public static final byte[] CONS_HASH = TreeHash.atomHash(new byte[] { 4 });
    public static final byte[] NIL_HASH = TreeHash.atomHash(new byte[0]);

    private CurryHash() {}

    /** Hash of {@code (q . X)} given the hash of X. */
    public static byte[] quotedHash(byte[] hash) {
        return TreeHash.pairHash(ONE_HASH, hash);
    }

    /** Hash of the curried environment {@code (c (q . a1) ... 1)}. */
    public static byte[] environmentHash(List<byte[]> argHashes) {
        byte[] env = ONE_HASH;
        for (int i = argHashes.size() - 1; i >= 0; i--) {
            env = TreeHash.pairHash(CONS_HASH,
                    TreeHash.pairHash(quotedHash(argHashes.get(i)),
                            TreeHash.pairHash(env, NIL_HASH)));
        }
        return env;
    }

    public static byte[] curriedHash(byte[] modHash, List<byte[]> argHashes) {
        return TreeHash.pairHash(APPLY_HASH,
                TreeHash.pairHash(quotedHash(modHash),
                        TreeHash.pairHash(environmentHash(argHashes), NIL_HASH)));
    }
}
