package com.coinscript.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.coinscript.error.SerializationError;

/**
 * A compiled module: {@code (mod params include* body)} plus the bookkeeping the
 * builder collected while assembling it.
 *
 * <p>Curried parameters are ALL-CAPS names bound at compile time; solution parameters
 * are supplied at spend time. Values already substituted into the tree are kept in
 * {@link #getBakedValues()} for reporting.
 */
public final class Program {

    private final String name;
    private final Node tree;
    private final List<String> curriedParams;
    private final List<String> solutionParams;
    private final Set<String> includes;
    private final Map<Node, String> comments;
    private final Map<String, Node> bakedValues;

    public Program(String name, Node tree, List<String> curriedParams, List<String> solutionParams,
                   Set<String> includes, Map<Node, String> comments, Map<String, Node> bakedValues) {
        this.name = name;
        this.tree = tree;
        this.curriedParams = Collections.unmodifiableList(new ArrayList<>(curriedParams));
        this.solutionParams = Collections.unmodifiableList(new ArrayList<>(solutionParams));
        this.includes = Collections.unmodifiableSet(new LinkedHashSet<>(includes));
        this.comments = Collections.unmodifiableMap(new IdentityHashMap<>(comments));
        this.bakedValues = Collections.unmodifiableMap(new LinkedHashMap<>(bakedValues));
    }

    public Program(String name, Node tree) {
        this(name, tree, Collections.emptyList(), Collections.emptyList(), Collections.emptySet(),
                Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * Parses raw Tree IR text. A {@code mod} form has its parameters classified by the
     * ALL-CAPS convention and its include forms collected.
     */
    public static Program fromSource(String name, String source) {
        Node tree = TreeParser.parse(source);
        List<String> curried = new ArrayList<>();
        List<String> solution = new ArrayList<>();
        Set<String> includes = new LinkedHashSet<>();
        if ("mod".equals(Nodes.headSymbol(tree))) {
            List<Node> items = Nodes.items(tree);
            if (items.size() < 3) throw new SerializationError("mod", "mod form needs parameters and a body");
            collectParams(items.get(1), curried, solution);
            for (int i = 2; i < items.size(); i++) {
                Node item = items.get(i);
                if ("include".equals(Nodes.headSymbol(item))) {
                    List<Node> inc = Nodes.items(item);
                    if (inc.size() == 2 && inc.get(1).isAtom()) includes.add(((Atom) inc.get(1)).asText());
                }
            }
        }
        return new Program(name, tree, curried, solution, includes, Collections.emptyMap(), Collections.emptyMap());
    }

    private static void collectParams(Node params, List<String> curried, List<String> solution) {
        Node cur = params;
        while (cur.isPair()) {
            if (cur instanceof ListNode) {
                for (Node item : ((ListNode) cur).items()) collectParams(item, curried, solution);
                return;
            }
            collectParams(cur.first(), curried, solution);
            cur = cur.rest();
        }
        if (cur instanceof Atom && ((Atom) cur).isSymbol()) {
            String n = ((Atom) cur).asText();
            if (isCurriedName(n)) curried.add(n);
            else solution.add(n);
        }
    }

    /** ALL-CAPS convention: at least one letter and no lowercase letters. */
    public static boolean isCurriedName(String name) {
        boolean letter = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLowerCase(c)) return false;
            if (Character.isLetter(c)) letter = true;
        }
        return letter;
    }

    public String getName() { return name; }
    public Node getTree() { return tree; }
    public List<String> getCurriedParams() { return curriedParams; }
    public List<String> getSolutionParams() { return solutionParams; }
    public Set<String> getIncludes() { return includes; }
    public Map<Node, String> getComments() { return comments; }
    public Map<String, Node> getBakedValues() { return bakedValues; }

    public byte[] hash() {
        return tree.hash();
    }

    public String hashHex() {
        return tree.hashHex();
    }

    /** Canonical byte serialization as hex. */
    public String toHex() {
        return TreeEncoding.toHex(tree);
    }

    public String serialize() {
        return serialize(SerializeOptions.pretty());
    }

    /** Renders the tree; the program's own comments are attached unless the options already carry some. */
    public String serialize(SerializeOptions options) {
        if (!comments.isEmpty() && options.comments().isEmpty()) {
            for (Map.Entry<Node, String> e : comments.entrySet()) {
                options.comment(e.getKey(), e.getValue());
            }
        }
        return Serializer.serialize(tree, options);
    }

    /** The program curried with the given arguments, as a bare tree. */
    public Node curry(List<? extends Node> args) {
        return Curry.curry(tree, args);
    }

    /** Puzzle hash of {@link #curry} computed from hashes alone. */
    public byte[] curriedHash(List<? extends Node> args) {
        List<byte[]> hashes = new ArrayList<>(args.size());
        for (Node arg : args) hashes.add(arg.hashBytes());
        return CurryHash.curriedHash(tree.hashBytes(), hashes);
    }

    @Override
    public String toString() {
        return Serializer.serialize(tree);
    }
}
