package com.coinscript.tree;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Factories and small structural helpers for building trees by hand. */
public final class Nodes {

    private Nodes() {}

    public static Atom nil() { return Atom.NIL; }
    public static Atom sym(String name) { return Atom.symbol(name); }
    public static Atom str(String text) { return Atom.string(text); }
    public static Atom integer(long value) { return Atom.integer(value); }
    public static Atom integer(BigInteger value) { return Atom.integer(value); }
    public static Atom hex(String hex) { return Atom.hex(hex); }
    public static Atom bytes(byte[] value) { return Atom.bytes(value); }

    public static Node list(Node... items) {
        return list(Arrays.asList(items));
    }

    public static Node list(List<? extends Node> items) {
        if (items.isEmpty()) return Atom.NIL;
        return new ListNode(new ArrayList<Node>(items));
    }

    /** Form whose head is the given symbol: {@code (head args...)}. */
    public static Node form(String head, Node... args) {
        List<Node> items = new ArrayList<>(args.length + 1);
        items.add(Atom.symbol(head));
        items.addAll(Arrays.asList(args));
        return new ListNode(items);
    }

    public static Node form(String head, List<? extends Node> args) {
        List<Node> items = new ArrayList<>(args.size() + 1);
        items.add(Atom.symbol(head));
        items.addAll(args);
        return new ListNode(items);
    }

    public static Node cons(Node first, Node rest) {
        return new Cons(first, rest);
    }

    /** Right-nested cons chain {@code (a b c . tail)}. */
    public static Node dotted(List<? extends Node> items, Node tail) {
        Node result = tail;
        for (int i = items.size() - 1; i >= 0; i--) {
            result = new Cons(items.get(i), result);
        }
        return result;
    }

    /**
     * Items of the pair view of a node, stopping at the first non-pair tail.
     * For a proper list the tail is nil.
     */
    public static List<Node> items(Node node) {
        if (node instanceof ListNode) return ((ListNode) node).items();
        List<Node> out = new ArrayList<>();
        Node cur = node;
        while (cur.isPair()) {
            if (cur instanceof ListNode) {
                out.addAll(((ListNode) cur).items());
                break;
            }
            out.add(cur.first());
            cur = cur.rest();
        }
        return out;
    }

    /** The terminating atom of a node's pair view. */
    public static Node tail(Node node) {
        if (node instanceof ListNode) return Atom.NIL;
        Node cur = node;
        while (cur.isPair()) {
            if (cur instanceof ListNode) return Atom.NIL;
            cur = cur.rest();
        }
        return cur;
    }

    /** Head symbol name of a form, or null when the node is not a form headed by a symbol. */
    public static String headSymbol(Node node) {
        if (!node.isPair()) return null;
        Node head = node.first();
        if (head instanceof Atom && ((Atom) head).isSymbol()) return ((Atom) head).asText();
        return null;
    }
}
