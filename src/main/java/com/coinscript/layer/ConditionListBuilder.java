package com.coinscript.layer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.coinscript.tree.Atom;
import com.coinscript.tree.ConditionCode;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;

/** Builds a list of output conditions with numeric condition codes, e.g. {@code (51 ph amount)}. */
public final class ConditionListBuilder {

    private final List<Node> conditions = new ArrayList<>();

    public ConditionListBuilder createCoin(byte[] puzzleHash, BigInteger amount) {
        return add(ConditionCode.CREATE_COIN, Atom.bytes(puzzleHash), Atom.integer(amount));
    }

    public ConditionListBuilder createCoin(byte[] puzzleHash, long amount) {
        return createCoin(puzzleHash, BigInteger.valueOf(amount));
    }

    public ConditionListBuilder createCoin(byte[] puzzleHash, long amount, byte[] memo) {
        return add(ConditionCode.CREATE_COIN, Atom.bytes(puzzleHash), Atom.integer(amount),
                Nodes.list(Atom.bytes(memo)));
    }

    public ConditionListBuilder reserveFee(long amount) {
        return add(ConditionCode.RESERVE_FEE, Atom.integer(amount));
    }

    public ConditionListBuilder aggSigMe(byte[] publicKey, byte[] message) {
        return add(ConditionCode.AGG_SIG_ME, Atom.bytes(publicKey), Atom.bytes(message));
    }

    public ConditionListBuilder aggSigUnsafe(byte[] publicKey, byte[] message) {
        return add(ConditionCode.AGG_SIG_UNSAFE, Atom.bytes(publicKey), Atom.bytes(message));
    }

    public ConditionListBuilder createCoinAnnouncement(byte[] message) {
        return add(ConditionCode.CREATE_COIN_ANNOUNCEMENT, Atom.bytes(message));
    }

    public ConditionListBuilder assertCoinAnnouncement(byte[] announcementId) {
        return add(ConditionCode.ASSERT_COIN_ANNOUNCEMENT, Atom.bytes(announcementId));
    }

    public ConditionListBuilder createPuzzleAnnouncement(byte[] message) {
        return add(ConditionCode.CREATE_PUZZLE_ANNOUNCEMENT, Atom.bytes(message));
    }

    public ConditionListBuilder assertPuzzleAnnouncement(byte[] announcementId) {
        return add(ConditionCode.ASSERT_PUZZLE_ANNOUNCEMENT, Atom.bytes(announcementId));
    }

    public ConditionListBuilder assertMyAmount(long amount) {
        return add(ConditionCode.ASSERT_MY_AMOUNT, Atom.integer(amount));
    }

    public ConditionListBuilder assertSecondsRelative(long seconds) {
        return add(ConditionCode.ASSERT_SECONDS_RELATIVE, Atom.integer(seconds));
    }

    public ConditionListBuilder assertSecondsAbsolute(long seconds) {
        return add(ConditionCode.ASSERT_SECONDS_ABSOLUTE, Atom.integer(seconds));
    }

    public ConditionListBuilder assertHeightRelative(long height) {
        return add(ConditionCode.ASSERT_HEIGHT_RELATIVE, Atom.integer(height));
    }

    public ConditionListBuilder assertHeightAbsolute(long height) {
        return add(ConditionCode.ASSERT_HEIGHT_ABSOLUTE, Atom.integer(height));
    }

    public ConditionListBuilder add(ConditionCode code, Node... args) {
        List<Node> items = new ArrayList<>(args.length + 1);
        items.add(code.number());
        for (Node a : args) items.add(a);
        conditions.add(Nodes.list(items));
        return this;
    }

    /** Raw condition with a numeric code that may not be in {@link ConditionCode}. */
    public ConditionListBuilder addRaw(int code, Node... args) {
        List<Node> items = new ArrayList<>(args.length + 1);
        items.add(Atom.integer(code));
        for (Node a : args) items.add(a);
        conditions.add(Nodes.list(items));
        return this;
    }

    public int size() {
        return conditions.size();
    }

    public Node build() {
        return Nodes.list(conditions);
    }
}
