package com.coinscript.layer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.coinscript.debug.Debug;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Program;
import com.coinscript.tree.TreeHash;

/**
 * Binary merkle tree over action puzzle hashes, leaves in insertion order.
 *
 * <p>Leaf value is {@code sha256(0x01 || actionHash)}, a parent is
 * {@code sha256(0x02 || left || right)}. An odd node at the end of a level is promoted
 * unchanged. A one-leaf tree's root is the leaf value and its proof is empty.
 */
public final class ActionMerkleTree {

    private final List<byte[]> actionHashes;
    private final List<List<byte[]>> levels = new ArrayList<>();

    public ActionMerkleTree(List<byte[]> actionHashes) {
        if (actionHashes.isEmpty()) throw new IllegalArgumentException("merkle tree needs at least one action");
        List<byte[]> hashes = new ArrayList<>();
        List<byte[]> leaves = new ArrayList<>();
        for (byte[] h : actionHashes) {
            byte[] copy = Converters.requireLength(h.clone(), 32, "Action hash");
            hashes.add(copy);
            leaves.add(leafValue(copy));
        }
        this.actionHashes = Collections.unmodifiableList(hashes);

        List<byte[]> level = leaves;
        levels.add(level);
        while (level.size() > 1) {
            List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                if (i + 1 < level.size()) next.add(TreeHash.pairHash(level.get(i), level.get(i + 1)));
                else next.add(level.get(i));
            }
            levels.add(next);
            level = next;
        }
        Debug.get().d("ActionMerkleTree", actionHashes.size() + " leaves, root " + Converters.toHex(root()));
    }

    public static ActionMerkleTree of(List<Program> actions) {
        List<byte[]> hashes = new ArrayList<>(actions.size());
        for (Program p : actions) hashes.add(p.hash());
        return new ActionMerkleTree(hashes);
    }

    public static byte[] leafValue(byte[] actionHash) {
        return TreeHash.atomHash(actionHash);
    }

    public byte[] root() {
        return levels.get(levels.size() - 1).get(0).clone();
    }

    public int size() {
        return actionHashes.size();
    }

    public int indexOf(byte[] actionHash) {
        for (int i = 0; i < actionHashes.size(); i++) {
            if (Arrays.equals(actionHashes.get(i), actionHash)) return i;
        }
        return -1;
    }

    public MerkleProof proof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= actionHashes.size()) {
            throw new IndexOutOfBoundsException("leaf " + leafIndex + " of " + actionHashes.size());
        }
        List<MerkleProof.Step> steps = new ArrayList<>();
        int index = leafIndex;
        for (int l = 0; l < levels.size() - 1; l++) {
            List<byte[]> level = levels.get(l);
            if (index % 2 == 1) {
                steps.add(new MerkleProof.Step(true, level.get(index - 1)));
            } else if (index + 1 < level.size()) {
                steps.add(new MerkleProof.Step(false, level.get(index + 1)));
            }
            index /= 2;
        }
        return new MerkleProof(steps);
    }

    public MerkleProof proof(byte[] actionHash) {
        int index = indexOf(actionHash);
        if (index < 0) throw new IllegalArgumentException("action " + Converters.toHex(actionHash) + " is not in the tree");
        return proof(index);
    }

    /** Folds the proof from the action's leaf value and compares against the root. */
    public static boolean verifyInclusion(byte[] root, byte[] actionHash, MerkleProof proof) {
        byte[] current = leafValue(actionHash);
        for (MerkleProof.Step step : proof.getSteps()) {
            current = step.siblingOnLeft
                    ? TreeHash.pairHash(step.rawSibling(), current)
                    : TreeHash.pairHash(current, step.rawSibling());
        }
        return Arrays.equals(current, root);
    }
}
