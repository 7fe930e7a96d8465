package com.coinscript.tree;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** CLVM operator table: numeric opcode, source keyword and opcodes.clib constant name. */
public enum Opcode {
    QUOTE(1, "q"),
    APPLY(2, "a"),
    IF(3, "i"),
    CONS(4, "c"),
    FIRST(5, "f"),
    REST(6, "r"),
    LISTP(7, "l"),
    RAISE(8, "x"),
    EQ(9, "="),
    GTS(10, ">s"),
    SHA256(11, "sha256"),
    SUBSTR(12, "substr"),
    STRLEN(13, "strlen"),
    CONCAT(14, "concat"),
    ADD(16, "+"),
    SUBTRACT(17, "-"),
    MULTIPLY(18, "*"),
    DIVIDE(19, "/"),
    DIVMOD(20, "divmod"),
    GT(21, ">"),
    ASH(22, "ash"),
    LSH(23, "lsh"),
    LOGAND(24, "logand"),
    LOGIOR(25, "logior"),
    LOGXOR(26, "logxor"),
    LOGNOT(27, "lognot"),
    POINT_ADD(29, "point_add"),
    PUBKEY_FOR_EXP(30, "pubkey_for_exp"),
    NOT(32, "not"),
    ANY(33, "any"),
    ALL(34, "all"),
    SOFTFORK(36, "softfork"),
    COINID(48, "coinid"),
    G1_SUBTRACT(49, "g1_subtract"),
    G1_MULTIPLY(50, "g1_multiply"),
    G1_NEGATE(51, "g1_negate"),
    G2_ADD(52, "g2_add"),
    G2_SUBTRACT(53, "g2_subtract"),
    G2_MULTIPLY(54, "g2_multiply"),
    G2_NEGATE(55, "g2_negate"),
    G1_MAP(56, "g1_map"),
    G2_MAP(57, "g2_map"),
    BLS_PAIRING_IDENTITY(58, "bls_pairing_identity"),
    BLS_VERIFY(59, "bls_verify"),
    MODPOW(60, "modpow"),
    MOD(61, "%"),
    KECCAK256(62, "keccak256");

    private static final Map<Integer, Opcode> BY_CODE;
    private static final Map<String, Opcode> BY_KEYWORD;
    static {
        Map<Integer, Opcode> byCode = new HashMap<>();
        Map<String, Opcode> byKeyword = new HashMap<>();
        for (Opcode op : values()) {
            byCode.put(op.code, op);
            byKeyword.put(op.keyword, op);
        }
        BY_CODE = Collections.unmodifiableMap(byCode);
        BY_KEYWORD = Collections.unmodifiableMap(byKeyword);
    }

    private final int code;
    private final String keyword;

    Opcode(int code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    public int code() { return code; }
    public String keyword() { return keyword; }

    /** Name exported by opcodes.clib. */
    public String constantName() { return name(); }

    public Atom atom() {
        return Atom.integer(code);
    }

    public static Opcode byCode(int code) {
        return BY_CODE.get(code);
    }

    public static Opcode byKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }
}
