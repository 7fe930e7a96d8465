package com.coinscript.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Binds leading arguments of a program:
 * {@code curry(P, [a1..an]) = (a (q . P) (c (q . a1) (c (q . a2) ... 1)))},
 * with every operator written as its integer opcode.
 */
public final class Curry {

    private static final Atom APPLY = Opcode.APPLY.atom();
    private static final Atom QUOTE = Opcode.QUOTE.atom();
    private static final Atom CONS = Opcode.CONS.atom();
    private static final Atom ENV = Atom.integer(1);

    private Curry() {}

    public static Node curry(Node program, List<? extends Node> args) {
        Node env = ENV;
        for (int i = args.size() - 1; i >= 0; i--) {
            env = Nodes.list(CONS, Nodes.cons(QUOTE, args.get(i)), env);
        }
        return Nodes.list(APPLY, Nodes.cons(QUOTE, program), env);
    }

    /** Inverse of {@link #curry}: the program and its bound arguments, when the tree has the curried shape. */
    public static Optional<Curried> uncurry(Node tree) {
        List<Node> top = Nodes.items(tree);
        if (top.size() != 3 || !Nodes.tail(tree).isNil() || !isOp(top.get(0), APPLY)) return Optional.empty();
        Node quotedProgram = top.get(1);
        if (!quotedProgram.isPair() || !isOp(quotedProgram.first(), QUOTE)) return Optional.empty();

        List<Node> args = new ArrayList<>();
        Node env = top.get(2);
        while (!(env.isAtom() && env.equals(ENV))) {
            List<Node> step = Nodes.items(env);
            if (step.size() != 3 || !Nodes.tail(env).isNil() || !isOp(step.get(0), CONS)) return Optional.empty();
            Node quotedArg = step.get(1);
            if (!quotedArg.isPair() || !isOp(quotedArg.first(), QUOTE)) return Optional.empty();
            args.add(quotedArg.rest());
            env = step.get(2);
        }
        return Optional.of(new Curried(quotedProgram.rest(), args));
    }

    private static boolean isOp(Node node, Atom op) {
        return node.isAtom() && node.equals(op);
    }

    /** A program together with the arguments bound to it. */
    public static final class Curried {
        public final Node program;
        public final List<Node> args;

        Curried(Node program, List<Node> args) {
            this.program = program;
            this.args = Collections.unmodifiableList(args);
        }
    }
}
