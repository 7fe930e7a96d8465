package com.coinscript.tree;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Output condition codes, as exported by condition_codes.clib. */
public enum ConditionCode {
    REMARK(1),
    AGG_SIG_PARENT(43),
    AGG_SIG_PUZZLE(44),
    AGG_SIG_AMOUNT(45),
    AGG_SIG_PUZZLE_AMOUNT(46),
    AGG_SIG_PARENT_AMOUNT(47),
    AGG_SIG_PARENT_PUZZLE(48),
    AGG_SIG_UNSAFE(49),
    AGG_SIG_ME(50),
    CREATE_COIN(51),
    RESERVE_FEE(52),
    CREATE_COIN_ANNOUNCEMENT(60),
    ASSERT_COIN_ANNOUNCEMENT(61),
    CREATE_PUZZLE_ANNOUNCEMENT(62),
    ASSERT_PUZZLE_ANNOUNCEMENT(63),
    ASSERT_CONCURRENT_SPEND(64),
    ASSERT_CONCURRENT_PUZZLE(65),
    SEND_MESSAGE(66),
    RECEIVE_MESSAGE(67),
    ASSERT_MY_COIN_ID(70),
    ASSERT_MY_PARENT_ID(71),
    ASSERT_MY_PUZZLEHASH(72),
    ASSERT_MY_AMOUNT(73),
    ASSERT_MY_BIRTH_SECONDS(74),
    ASSERT_MY_BIRTH_HEIGHT(75),
    ASSERT_EPHEMERAL(76),
    ASSERT_SECONDS_RELATIVE(80),
    ASSERT_SECONDS_ABSOLUTE(81),
    ASSERT_HEIGHT_RELATIVE(82),
    ASSERT_HEIGHT_ABSOLUTE(83),
    ASSERT_BEFORE_SECONDS_RELATIVE(84),
    ASSERT_BEFORE_SECONDS_ABSOLUTE(85),
    ASSERT_BEFORE_HEIGHT_RELATIVE(86),
    ASSERT_BEFORE_HEIGHT_ABSOLUTE(87);

    private static final Map<Integer, ConditionCode> BY_CODE;
    static {
        Map<Integer, ConditionCode> map = new HashMap<>();
        for (ConditionCode c : values()) {
            map.put(c.code, c);
        }
        BY_CODE = Collections.unmodifiableMap(map);
    }

    private final int code;

    ConditionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** The symbolic reference used in generated source. */
    public Atom symbol() {
        return Atom.symbol(name());
    }

    public Atom number() {
        return Atom.integer(code);
    }

    public static ConditionCode byCode(int code) {
        return BY_CODE.get(code);
    }

    public static ConditionCode byName(String name) {
        for (ConditionCode c : values()) {
            if (c.name().equals(name)) return c;
        }
        return null;
    }
}
