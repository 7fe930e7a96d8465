package com.coinscript.tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The fixed set of Chialisp include files the generator may reference, with the
 * names each one exports. Declaration order is the order includes are emitted in.
 */
public enum IncludeLibrary {
    CONDITION_CODES("condition_codes.clib", conditionNames()),
    SHA256TREE("sha256tree.clib", names("sha256tree")),
    CURRY_AND_TREEHASH("curry-and-treehash.clinc", names(
            "update-hash-for-parameter-hash",
            "build-curry-list",
            "tree-hash-of-apply",
            "puzzle-hash-of-curried-function")),
    UTILITY_MACROS("utility_macros.clib", names("assert", "or", "and")),
    SINGLETON_TRUTHS("singleton_truths.clib", names(
            "truth_data_to_truth_struct",
            "my_id_truth",
            "my_full_puzzle_hash_truth",
            "my_inner_puzzle_hash_truth",
            "my_amount_truth",
            "my_lineage_proof_truth",
            "singleton_struct_truth",
            "singleton_mod_hash_truth",
            "singleton_launcher_id_truth",
            "singleton_launcher_puzzle_hash_truth",
            "parent_info_for_lineage_proof",
            "puzzle_hash_for_lineage_proof",
            "amount_for_lineage_proof",
            "is_not_eve_proof",
            "parent_info_for_eve_proof",
            "amount_for_eve_proof")),
    CAT_TRUTHS("cat_truths.clib", names(
            "cat_truth_data_to_truth_struct",
            "my_inner_puzzle_hash_cat_truth",
            "cat_struct_truth",
            "my_id_cat_truth",
            "my_coin_info_truth",
            "my_amount_cat_truth",
            "my_full_puzzle_hash_cat_truth",
            "my_parent_cat_truth",
            "cat_mod_hash_truth",
            "cat_mod_hash_hash_truth",
            "cat_tail_program_hash_truth")),
    OPCODES("opcodes.clib", opcodeNames());

    private final String fileName;
    private final Set<String> exports;

    IncludeLibrary(String fileName, Set<String> exports) {
        this.fileName = fileName;
        this.exports = Collections.unmodifiableSet(exports);
    }

    public String fileName() {
        return fileName;
    }

    public Set<String> exports() {
        return exports;
    }

    public boolean exports(String name) {
        return exports.contains(name);
    }

    public static IncludeLibrary byFileName(String fileName) {
        for (IncludeLibrary lib : values()) {
            if (lib.fileName.equals(fileName)) return lib;
        }
        return null;
    }

    /** First library exporting the name, or null. */
    public static IncludeLibrary providerOf(String name) {
        for (IncludeLibrary lib : values()) {
            if (lib.exports.contains(name)) return lib;
        }
        return null;
    }

    private static Set<String> names(String... names) {
        return new LinkedHashSet<>(Arrays.asList(names));
    }

    private static Set<String> conditionNames() {
        Set<String> out = new LinkedHashSet<>();
        for (ConditionCode c : ConditionCode.values()) out.add(c.name());
        return out;
    }

    private static Set<String> opcodeNames() {
        Set<String> out = new LinkedHashSet<>();
        for (Opcode op : Opcode.values()) out.add(op.constantName());
        return out;
    }
}
