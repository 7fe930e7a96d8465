package com.coinscript.layer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.coinscript.tree.Atom;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;

/** Sibling path from one leaf of an {@link ActionMerkleTree} up to the root, leaf end first. */
public final class MerkleProof {

    public static final class Step {
        public final boolean siblingOnLeft;
        private final byte[] sibling;

        public Step(boolean siblingOnLeft, byte[] sibling) {
            this.siblingOnLeft = siblingOnLeft;
            this.sibling = Converters.requireLength(sibling.clone(), 32, "Merkle sibling");
        }

        public byte[] getSibling() {
            return sibling.clone();
        }

        byte[] rawSibling() {
            return sibling;
        }
    }

    private final List<Step> steps;

    public MerkleProof(List<Step> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /** A copy with one sibling digest replaced. */
    public MerkleProof withSibling(int index, byte[] sibling) {
        List<Step> copy = new ArrayList<>(steps);
        copy.set(index, new Step(steps.get(index).siblingOnLeft, sibling));
        return new MerkleProof(copy);
    }

    /** Solution form: a list of {@code (flag . sibling)} pairs, flag 1 when the sibling is on the left. */
    public Node toNode() {
        List<Node> items = new ArrayList<>(steps.size());
        for (Step step : steps) {
            items.add(Nodes.cons(step.siblingOnLeft ? Atom.integer(1) : Atom.NIL, Atom.bytes(step.sibling)));
        }
        return Nodes.list(items);
    }

    public static MerkleProof fromNode(Node node) {
        List<Step> steps = new ArrayList<>();
        for (Node item : Nodes.items(node)) {
            if (!item.isPair() || !item.rest().isAtom()) {
                throw new IllegalArgumentException("Merkle proof step must be (flag . sibling): " + item);
            }
            boolean left = !item.first().isNil();
            steps.add(new Step(left, ((Atom) item.rest()).getBytes()));
        }
        return new MerkleProof(steps);
    }
}
