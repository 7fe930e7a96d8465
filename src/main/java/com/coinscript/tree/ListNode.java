package com.coinscript.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Proper, nil-terminated list. Never empty: the empty list is {@link Atom#NIL}. */
public final class ListNode extends Node {

    private final List<Node> items;

    ListNode(List<Node> items) {
        if (items.isEmpty()) throw new IllegalArgumentException("empty list; use Atom.NIL");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<Node> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public Node get(int index) {
        return items.get(index);
    }

    @Override
    public boolean isAtom() {
        return false;
    }

    @Override
    public Node first() {
        return items.get(0);
    }

    /** Copies the remaining items; walks over a whole list should use {@link #items()}. */
    @Override
    public Node rest() {
        if (items.size() == 1) return Atom.NIL;
        return new ListNode(items.subList(1, items.size()));
    }

    /** True when the head item is the given symbol. */
    public boolean isForm(String head) {
        Node h = items.get(0);
        return h instanceof Atom && ((Atom) h).isSymbol(head);
    }

    @Override
    byte[] computeHash() {
        byte[] h = Atom.NIL.hashBytes();
        for (int i = items.size() - 1; i >= 0; i--) {
            h = TreeHash.pairHash(items.get(i).hashBytes(), h);
        }
        return h;
    }
}
