package com.coinscript.tree;

import java.util.ArrayList;
import java.util.List;

/** A single pair {@code (first . rest)}. */
public final class Cons extends Node {

    private final Node first;
    private final Node rest;

    Cons(Node first, Node rest) {
        if (first == null || rest == null) throw new IllegalArgumentException("cons half is null");
        this.first = first;
        this.rest = rest;
    }

    @Override
    public boolean isAtom() {
        return false;
    }

    @Override
    public Node first() {
        return first;
    }

    @Override
    public Node rest() {
        return rest;
    }

    // Walks the rest spine iteratively: decoded lists nest only along it.
    @Override
    byte[] computeHash() {
        List<Cons> spine = new ArrayList<>();
        Node cur = this;
        while (cur instanceof Cons && (cur == this || !cur.isHashed())) {
            spine.add((Cons) cur);
            cur = ((Cons) cur).rest;
        }
        byte[] h = cur.hashBytes();
        for (int i = spine.size() - 1; i >= 0; i--) {
            h = TreeHash.pairHash(spine.get(i).first.hashBytes(), h);
            if (i > 0) spine.get(i).cacheHash(h);
        }
        return h;
    }
}
