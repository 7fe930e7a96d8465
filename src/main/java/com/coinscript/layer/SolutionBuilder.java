package com.coinscript.layer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.coinscript.error.ConversionError;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.SerializeOptions;
import com.coinscript.tree.Serializer;
import com.coinscript.tree.TreeEncoding;
import com.coinscript.tree.TreeParser;

/**
 * Ordered solution arguments, in the order the program declares its solution
 * parameters. The built tree is exactly the list of the added values.
 */
public final class SolutionBuilder {

    private final List<Node> args = new ArrayList<>();
    private boolean cons = false;

    public static SolutionBuilder create() {
        return new SolutionBuilder();
    }

    /**
     * Adds a value: numbers become integer atoms, 0x strings byte atoms, other strings
     * string atoms, byte arrays byte atoms, booleans 1 or nil, nodes as given.
     */
    public SolutionBuilder add(Object value) {
        args.add(toNode(value));
        return this;
    }

    public SolutionBuilder addInt(long value) {
        args.add(Atom.integer(value));
        return this;
    }

    public SolutionBuilder addInt(BigInteger value) {
        args.add(Atom.integer(value));
        return this;
    }

    public SolutionBuilder addHex(String hex) {
        args.add(Atom.hex(hex));
        return this;
    }

    public SolutionBuilder addString(String text) {
        args.add(Atom.string(text));
        return this;
    }

    public SolutionBuilder addBool(boolean value) {
        args.add(value ? Atom.integer(1) : Atom.NIL);
        return this;
    }

    public SolutionBuilder addNode(Node node) {
        args.add(node);
        return this;
    }

    public SolutionBuilder addNil() {
        args.add(Atom.NIL);
        return this;
    }

    /** Adds a nested list built by the callback. */
    public SolutionBuilder addList(Consumer<SolutionBuilder> callback) {
        SolutionBuilder nested = new SolutionBuilder();
        callback.accept(nested);
        args.add(nested.build());
        return this;
    }

    public SolutionBuilder addConditions(Consumer<ConditionListBuilder> callback) {
        ConditionListBuilder conditions = new ConditionListBuilder();
        callback.accept(conditions);
        args.add(conditions.build());
        return this;
    }

    /** Adds the encoded state tuple. */
    public SolutionBuilder addState(StateSchema schema, Map<String, ? extends Node> values) {
        args.add(schema.encode(values));
        return this;
    }

    /**
     * Adds an action selector followed by its parameters, matching a routed program's
     * {@code (selector . action_args)} parameter shape.
     */
    public SolutionBuilder addAction(String actionName, Object... params) {
        args.add(Atom.string(actionName));
        for (Object p : params) args.add(toNode(p));
        return this;
    }

    public SolutionBuilder addMerkleProof(MerkleProof proof) {
        args.add(proof.toNode());
        return this;
    }

    /** Adds a value written as raw Tree IR text. */
    public SolutionBuilder addRaw(String treeSource) {
        args.add(TreeParser.parse(treeSource));
        return this;
    }

    /** Build a two-argument solution as a single pair {@code (a . b)} instead of a list. */
    public SolutionBuilder asCons() {
        this.cons = true;
        return this;
    }

    public int size() {
        return args.size();
    }

    public Node build() {
        if (cons) {
            if (args.size() != 2) {
                throw new IllegalStateException("cons solution needs exactly 2 arguments, has " + args.size());
            }
            return Nodes.cons(args.get(0), args.get(1));
        }
        return Nodes.list(args);
    }

    public String serialize() {
        return Serializer.serialize(build());
    }

    public String serialize(SerializeOptions options) {
        return Serializer.serialize(build(), options);
    }

    public String toHex() {
        return TreeEncoding.toHex(build());
    }

    static Node toNode(Object value) {
        if (value == null) return Atom.NIL;
        if (value instanceof Node) return (Node) value;
        if (value instanceof BigInteger) return Atom.integer((BigInteger) value);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Atom.integer(((Number) value).longValue());
        }
        if (value instanceof Boolean) return ((Boolean) value) ? Atom.integer(1) : Atom.NIL;
        if (value instanceof byte[]) return Atom.bytes((byte[]) value);
        if (value instanceof SolutionBuilder) return ((SolutionBuilder) value).build();
        if (value instanceof String) {
            String s = (String) value;
            if (Converters.isHex(s) && s.length() > 2) return Atom.hex(s);
            return Atom.string(s);
        }
        throw new ConversionError(String.valueOf(value), "Cannot use " + value.getClass().getSimpleName() + " as a solution value");
    }
}
