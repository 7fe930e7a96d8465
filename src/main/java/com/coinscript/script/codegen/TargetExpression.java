package com.coinscript.script.codegen;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.coinscript.tree.Atom;
import com.coinscript.tree.AtomKind;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;

/** A lowered expression: the Tree IR form the generator emits for one source expression. */
public final class TargetExpression {

    private final Node node;

    private TargetExpression(Node node) {
        this.node = node;
    }

    public static TargetExpression of(Node node) {
        return new TargetExpression(node);
    }

    public static TargetExpression symbol(String name) {
        return new TargetExpression(Atom.symbol(name));
    }

    public static TargetExpression integer(BigInteger value) {
        return new TargetExpression(Atom.integer(value));
    }

    public static TargetExpression integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static TargetExpression nil() {
        return new TargetExpression(Atom.NIL);
    }

    /** {@code (op a b ...)}. */
    public static TargetExpression call(String op, TargetExpression... args) {
        List<Node> nodes = new ArrayList<>(args.length);
        for (TargetExpression a : args) nodes.add(a.node);
        return new TargetExpression(Nodes.form(op, nodes));
    }

    public static TargetExpression call(String op, List<TargetExpression> args) {
        return call(op, args.toArray(new TargetExpression[0]));
    }

    public Node node() {
        return node;
    }

    public boolean isIntegerLiteral() {
        return node instanceof Atom && ((Atom) node).getKind() == AtomKind.INTEGER;
    }

    public BigInteger integerValue() {
        return ((Atom) node).asBigInteger();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
