package com.coinscript.layer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.coinscript.debug.Debug;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Curry;
import com.coinscript.tree.CurryHash;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;

/**
 * Wraps a set of action programs behind one self-recreating coin.
 *
 * <p>The wrapper template takes {@code (SELF_MOD_HASH ACTION_MERKLE_ROOT STATE)} as
 * curried parameters and {@code (my_amount action_puzzle action_proof action_args)} as
 * its solution. A spend proves the action puzzle is a leaf of the merkle root, runs it
 * on {@code (STATE . action_args)} to get {@code (new_state . conditions)}, and emits a
 * CREATE_COIN to the wrapper curried with {@code new_state}. The destination hash is
 * computed on chain with the curry-hash formula of {@link CurryHash}.
 */
public final class StateActionLayer {

    public static final String SELF_MOD_HASH = "SELF_MOD_HASH";
    public static final String ACTION_MERKLE_ROOT = "ACTION_MERKLE_ROOT";
    public static final String STATE = "STATE";

    private static final String TAG = "StateActionLayer";

    private final StateSchema schema;
    private final Map<String, Program> actions;
    private final ActionMerkleTree merkleTree;
    private final Program template;
    private final byte[] modHash;

    public StateActionLayer(String name, StateSchema schema, Map<String, Program> actions) {
        if (actions.isEmpty()) throw new IllegalArgumentException("state layer needs at least one action");
        this.schema = schema;
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        this.merkleTree = ActionMerkleTree.of(new ArrayList<>(this.actions.values()));
        this.template = buildTemplate(name);
        this.modHash = template.hash();
        Debug.get().i(TAG, name + ": " + actions.size() + " actions, merkle root "
                + Converters.toHex(merkleTree.root()) + ", template " + template.hashHex());
    }

    public StateSchema getSchema() { return schema; }
    public Map<String, Program> getActions() { return actions; }
    public ActionMerkleTree getMerkleTree() { return merkleTree; }
    public Program getTemplate() { return template; }

    public byte[] getModHash() {
        return modHash.clone();
    }

    public byte[] getMerkleRoot() {
        return merkleTree.root();
    }

    /** Curried arguments of the wrapper for the given state. */
    public List<Node> curriedArgs(Node state) {
        List<Node> args = new ArrayList<>(3);
        args.add(Atom.bytes(modHash));
        args.add(Atom.bytes(merkleTree.root()));
        args.add(state);
        return args;
    }

    /** The full coin puzzle holding the given state. */
    public Node programFor(Node state) {
        return Curry.curry(template.getTree(), curriedArgs(state));
    }

    public byte[] puzzleHashFor(Node state) {
        return successorPuzzleHash(state);
    }

    /**
     * Puzzle hash of the coin recreated with {@code newState}, from hashes only: the
     * same computation the wrapper's finalizer performs on chain.
     */
    public byte[] successorPuzzleHash(Node newState) {
        List<byte[]> argHashes = new ArrayList<>(3);
        argHashes.add(Atom.bytes(modHash).hash());
        argHashes.add(Atom.bytes(merkleTree.root()).hash());
        argHashes.add(newState.hash());
        return CurryHash.curriedHash(modHash, argHashes);
    }

    /** The puzzle and solution that invoke one action against the current state. */
    public Dispatch dispatch(String actionName, Node currentState, List<? extends Node> args, BigInteger amount) {
        Program action = actions.get(actionName);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action '" + actionName + "'; known: " + actions.keySet());
        }
        int index = new ArrayList<>(actions.keySet()).indexOf(actionName);
        MerkleProof proof = merkleTree.proof(index);
        if (!ActionMerkleTree.verifyInclusion(merkleTree.root(), action.hash(), proof)) {
            throw new IllegalStateException("Merkle proof for '" + actionName + "' does not verify");
        }
        Node solution = SolutionBuilder.create()
                .addInt(amount)
                .addNode(action.getTree())
                .addMerkleProof(proof)
                .addNode(Nodes.list(args))
                .build();
        Debug.get().d(TAG, "dispatch " + actionName + " with " + args.size() + " args");
        return new Dispatch(action, programFor(currentState), solution, proof);
    }

    public static final class Dispatch {
        public final Program action;
        public final Node puzzle;
        public final Node solution;
        public final MerkleProof proof;

        Dispatch(Program action, Node puzzle, Node solution, MerkleProof proof) {
            this.action = action;
            this.puzzle = puzzle;
            this.solution = solution;
            this.proof = proof;
        }
    }

    // -------------------------
    // Template
    // -------------------------

    private static Program buildTemplate(String name) {
        Node params = Nodes.list(sym(SELF_MOD_HASH), sym(ACTION_MERKLE_ROOT), sym(STATE),
                sym("my_amount"), sym("action_puzzle"), sym("action_proof"), sym("action_args"));

        Node proofStep = f("if", f("f", f("f", sym("proof"))),
                f("sha256", num(2), f("r", f("f", sym("proof"))), sym("leaf")),
                f("sha256", num(2), sym("leaf"), f("r", f("f", sym("proof")))));
        Node merkleRoot = f("defun", sym("merkle-root-for-proof"), Nodes.list(sym("leaf"), sym("proof")),
                f("if", sym("proof"),
                        f("merkle-root-for-proof", proofStep, f("r", sym("proof"))),
                        sym("leaf")));

        Node quotedHash = f("defun", sym("quoted-hash"), Nodes.list(sym("value-hash")),
                f("sha256", num(2), hex(CurryHash.ONE_HASH), sym("value-hash")));

        Node envHash = f("defun", sym("curried-env-hash"), Nodes.list(sym("arg-hashes")),
                f("if", sym("arg-hashes"),
                        f("sha256", num(2), hex(CurryHash.CONS_HASH),
                                f("sha256", num(2), f("quoted-hash", f("f", sym("arg-hashes"))),
                                        f("sha256", num(2), f("curried-env-hash", f("r", sym("arg-hashes"))),
                                                hex(CurryHash.NIL_HASH)))),
                        hex(CurryHash.ONE_HASH)));

        Node puzzleHash = f("defun", sym("curried-puzzle-hash"), Nodes.list(sym("mod-hash"), sym("arg-hashes")),
                f("sha256", num(2), hex(CurryHash.APPLY_HASH),
                        f("sha256", num(2), f("quoted-hash", sym("mod-hash")),
                                f("sha256", num(2), f("curried-env-hash", sym("arg-hashes")),
                                        hex(CurryHash.NIL_HASH)))));

        Node successor = f("curried-puzzle-hash", sym("self-mod-hash"),
                f("list",
                        f("sha256", num(1), sym("self-mod-hash")),
                        f("sha256", num(1), sym("merkle-root")),
                        f("sha256tree", f("f", sym("result")))));
        Node finalize = f("defun", sym("finalize"),
                Nodes.list(sym("self-mod-hash"), sym("merkle-root"), sym("amount"), sym("result")),
                f("c", f("list", sym("ASSERT_MY_AMOUNT"), sym("amount")),
                        f("c", f("list", sym("CREATE_COIN"), successor, sym("amount")),
                                f("r", sym("result")))));

        Node body = f("if",
                f("=", f("merkle-root-for-proof", f("sha256", num(1), f("sha256tree", sym("action_puzzle"))),
                        sym("action_proof")), sym(ACTION_MERKLE_ROOT)),
                f("finalize", sym(SELF_MOD_HASH), sym(ACTION_MERKLE_ROOT), sym("my_amount"),
                        f("a", sym("action_puzzle"), f("c", sym(STATE), sym("action_args")))),
                f("x", Atom.string("Action not in merkle tree")));

        Node tree = Nodes.list(sym("mod"), params,
                f("include", sym(IncludeLibrary.CONDITION_CODES.fileName())),
                f("include", sym(IncludeLibrary.SHA256TREE.fileName())),
                merkleRoot, quotedHash, envHash, puzzleHash, finalize, body);

        return new Program(name + "_state_layer", tree,
                Arrays.asList(SELF_MOD_HASH, ACTION_MERKLE_ROOT, STATE),
                Arrays.asList("my_amount", "action_puzzle", "action_proof", "action_args"),
                new LinkedHashSet<>(Arrays.asList(IncludeLibrary.CONDITION_CODES.fileName(),
                        IncludeLibrary.SHA256TREE.fileName())),
                Collections.emptyMap(), Collections.emptyMap());
    }

    private static Node f(String head, Node... args) {
        return Nodes.form(head, args);
    }

    private static Node sym(String name) {
        return Atom.symbol(name);
    }

    private static Node num(long value) {
        return Atom.integer(value);
    }

    private static Node hex(byte[] bytes) {
        return Atom.bytes(bytes);
    }
}
