package com.coinscript.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces symbol atoms by name. Shape is preserved: a list stays a list and a dotted
 * pair stays a dotted pair. Unchanged subtrees are returned as the same instances.
 */
public final class Substitution {

    private final Map<String, Node> replacements;

    public Substitution(Map<String, ? extends Node> replacements) {
        this.replacements = Collections.unmodifiableMap(new HashMap<String, Node>(replacements));
    }

    public static Node substitute(Node tree, Map<String, ? extends Node> replacements) {
        if (replacements.isEmpty()) return tree;
        return new Substitution(replacements).apply(tree);
    }

    public Node apply(Node node) {
        if (node instanceof Atom) {
            Atom atom = (Atom) node;
            if (atom.isSymbol()) {
                Node replacement = replacements.get(atom.asText());
                if (replacement != null) return replacement;
            }
            return atom;
        }
        if (node instanceof ListNode) {
            List<Node> items = ((ListNode) node).items();
            List<Node> out = null;
            for (int i = 0; i < items.size(); i++) {
                Node before = items.get(i);
                Node after = apply(before);
                if (after != before && out == null) {
                    out = new ArrayList<>(items.subList(0, i));
                }
                if (out != null) out.add(after);
            }
            return out == null ? node : new ListNode(out);
        }
        Node first = apply(node.first());
        Node rest = apply(node.rest());
        if (first == node.first() && rest == node.rest()) return node;
        return new Cons(first, rest);
    }
}
