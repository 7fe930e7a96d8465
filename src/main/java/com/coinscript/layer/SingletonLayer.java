package com.coinscript.layer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import com.coinscript.tree.Atom;
import com.coinscript.tree.Curry;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;
import com.coinscript.tree.TreeHash;

/**
 * Uniqueness wrapper for {@code @singleton} coins plus the launcher that creates them.
 * The wrapper is curried with the singleton struct
 * {@code (SINGLETON_MOD_HASH . (LAUNCHER_ID . LAUNCHER_PUZZLE_HASH))} and the inner puzzle.
 */
public final class SingletonLayer {

    private static final Program TEMPLATE = buildTemplate();
    private static final Program LAUNCHER = buildLauncher();

    private SingletonLayer() {}

    public static Program template() {
        return TEMPLATE;
    }

    public static Program launcher() {
        return LAUNCHER;
    }

    /** Launcher id used when the coin does not fix one: sha256 of the coin name. */
    public static byte[] defaultLauncherId(String coinName) {
        return TreeHash.sha256(coinName.getBytes(StandardCharsets.UTF_8));
    }

    public static Node struct(byte[] launcherId) {
        return Nodes.cons(Atom.bytes(TEMPLATE.hash()),
                Nodes.cons(Atom.bytes(launcherId), Atom.bytes(LAUNCHER.hash())));
    }

    public static Node wrap(Node innerPuzzle, byte[] launcherId) {
        return Curry.curry(TEMPLATE.getTree(), Arrays.asList(struct(launcherId), innerPuzzle));
    }

    private static Program buildTemplate() {
        Node tree = Nodes.list(Atom.symbol("mod"),
                Nodes.list(Atom.symbol("SINGLETON_STRUCT"), Atom.symbol("INNER_PUZZLE"), Atom.symbol("inner_solution")),
                Nodes.form("include", Atom.symbol(IncludeLibrary.CONDITION_CODES.fileName())),
                Nodes.form("c",
                        Nodes.form("list", Atom.symbol("ASSERT_MY_AMOUNT"), Atom.integer(1)),
                        Nodes.form("a", Atom.symbol("INNER_PUZZLE"), Atom.symbol("inner_solution"))));
        return new Program("singleton_top_layer", tree,
                Arrays.asList("SINGLETON_STRUCT", "INNER_PUZZLE"),
                Collections.singletonList("inner_solution"),
                new LinkedHashSet<>(Collections.singletonList(IncludeLibrary.CONDITION_CODES.fileName())),
                Collections.emptyMap(), Collections.emptyMap());
    }

    private static Program buildLauncher() {
        Node ph = Atom.symbol("singleton_puzzle_hash");
        Node amount = Atom.symbol("amount");
        Node kv = Atom.symbol("key_value_list");
        Node tree = Nodes.list(Atom.symbol("mod"),
                Nodes.list(ph, amount, kv),
                Nodes.form("include", Atom.symbol(IncludeLibrary.CONDITION_CODES.fileName())),
                Nodes.form("include", Atom.symbol(IncludeLibrary.SHA256TREE.fileName())),
                Nodes.form("list",
                        Nodes.form("list", Atom.symbol("CREATE_COIN"), ph, amount),
                        Nodes.form("list", Atom.symbol("CREATE_COIN_ANNOUNCEMENT"),
                                Nodes.form("sha256tree", Nodes.form("list", ph, amount, kv)))));
        return new Program("singleton_launcher", tree,
                Collections.emptyList(),
                Arrays.asList("singleton_puzzle_hash", "amount", "key_value_list"),
                new LinkedHashSet<>(Arrays.asList(IncludeLibrary.CONDITION_CODES.fileName(),
                        IncludeLibrary.SHA256TREE.fileName())),
                Collections.emptyMap(), Collections.emptyMap());
    }
}
