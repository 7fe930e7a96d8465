package com.coinscript.tree;

import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.coinscript.error.SerializationError;

/**
 * Renders trees as Chialisp-style source text.
 *
 * <p>Pretty mode: mod forms are always multi-line; defun, if and list forms go
 * multi-line once they contain nested forms or outgrow their width limit; every
 * other form stays on one line up to {@link #LINE_LIMIT} characters. A node carrying
 * a comment forces its parent onto multiple lines.
 */
public final class Serializer {

    public static final int DEFUN_LIMIT = 40;
    public static final int IF_LIMIT = 60;
    public static final int LINE_LIMIT = 80;

    private enum Slot { PLAIN, OPERATOR, CONDITION }

    private final SerializeOptions options;
    private final boolean conditionNames;
    private final boolean opcodeConstants;
    private final Map<Node, String> flatCache = new IdentityHashMap<>();

    private Serializer(SerializeOptions options) {
        this.options = options;
        this.conditionNames = options.getIncludes().contains(IncludeLibrary.CONDITION_CODES.fileName());
        this.opcodeConstants = options.getIncludes().contains(IncludeLibrary.OPCODES.fileName());
    }

    public static String serialize(Node node) {
        return serialize(node, SerializeOptions.defaults());
    }

    public static String serialize(Node node, SerializeOptions options) {
        Serializer s = new Serializer(options == null ? SerializeOptions.defaults() : options);
        if (!s.options.isIndent()) return s.flat(node, Slot.PLAIN);
        return s.pretty(node, 0, Slot.PLAIN) + s.commentSuffix(node);
    }

    // -------------------------
    // Single-line rendering
    // -------------------------

    private String flat(Node node, Slot slot) {
        if (node.isAtom()) return atom((Atom) node, slot);
        String cached = flatCache.get(node);
        if (cached != null) return cached;

        List<Node> items = Nodes.items(node);
        Node tail = Nodes.tail(node);
        boolean listForm = isListForm(items);
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(flat(items.get(i), slotFor(i, listForm)));
        }
        if (!tail.isNil()) sb.append(" . ").append(flat(tail, Slot.PLAIN));
        sb.append(')');
        String out = sb.toString();
        if (options.isIndent()) flatCache.put(node, out);
        return out;
    }

    // -------------------------
    // Pretty rendering
    // -------------------------

    private String pretty(Node node, int depth, Slot slot) {
        if (node.isAtom()) return atom((Atom) node, slot);

        List<Node> items = Nodes.items(node);
        Node tail = Nodes.tail(node);
        String head = Nodes.headSymbol(node);
        String flat = flat(node, slot);
        int width = flat.length() + depth * options.getIndentUnit().length();

        int lead;
        boolean multiline;
        if (head == null) {
            lead = 1;
            multiline = width > LINE_LIMIT;
        } else {
            switch (head) {
                case "mod":
                    if (items.size() < 3 || !tail.isNil()) {
                        throw new SerializationError("mod", "mod form needs parameters and a body: " + flat);
                    }
                    lead = 2;
                    multiline = true;
                    break;
                case "defun":
                case "defun-inline":
                case "defmacro":
                    if (items.size() < 4 || !isSymbolAtom(items.get(1)) || !tail.isNil()) {
                        throw new SerializationError(head, head + " form needs a name, parameters and a body: " + flat);
                    }
                    lead = 3;
                    multiline = width > DEFUN_LIMIT || nested(items, 3);
                    break;
                case "if":
                    if (items.size() < 3 || items.size() > 4 || !tail.isNil()) {
                        throw new SerializationError("if", "if form needs a condition and one or two branches: " + flat);
                    }
                    lead = 2;
                    multiline = width > IF_LIMIT || nested(items, 1);
                    break;
                case "list":
                    lead = items.size() > 1 && items.get(1).isAtom() ? 2 : 1;
                    multiline = width > LINE_LIMIT || nested(items, 1);
                    break;
                case "include":
                    if (items.size() != 2 || !items.get(1).isAtom()) {
                        throw new SerializationError("include", "include form takes exactly one file name: " + flat);
                    }
                    return flat;
                default:
                    lead = 1;
                    multiline = width > LINE_LIMIT;
            }
        }
        if (!multiline && hasComment(items, tail)) multiline = true;
        if (!multiline) return flat;

        boolean listForm = isListForm(items);
        String inner = indent(depth + 1);
        StringBuilder sb = new StringBuilder("(");
        StringBuilder leadComments = new StringBuilder();
        int leadCount = Math.min(lead, items.size());
        for (int i = 0; i < leadCount; i++) {
            if (i > 0) sb.append(' ');
            sb.append(flat(items.get(i), slotFor(i, listForm)));
            leadComments.append(commentSuffix(items.get(i)));
        }
        sb.append(leadComments);
        for (int i = leadCount; i < items.size(); i++) {
            Node item = items.get(i);
            sb.append('\n').append(inner).append(pretty(item, depth + 1, slotFor(i, listForm))).append(commentSuffix(item));
        }
        if (!tail.isNil()) {
            sb.append('\n').append(inner).append(". ").append(pretty(tail, depth + 1, Slot.PLAIN));
        }
        sb.append('\n').append(indent(depth)).append(')');
        return sb.toString();
    }

    private static boolean nested(List<Node> items, int from) {
        for (int i = from; i < items.size(); i++) {
            Node child = items.get(i);
            if (!child.isPair()) continue;
            for (Node grandChild : Nodes.items(child)) {
                if (grandChild.isPair()) return true;
            }
        }
        return false;
    }

    private boolean hasComment(List<Node> items, Node tail) {
        if (options.comments().isEmpty()) return false;
        for (Node item : items) {
            if (options.comments().containsKey(item)) return true;
        }
        return options.comments().containsKey(tail);
    }

    private String commentSuffix(Node node) {
        String text = options.comments().get(node);
        if (text == null) return "";
        return " ;; " + text.replace('\n', ' ');
    }

    private String indent(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) sb.append(options.getIndentUnit());
        return sb.toString();
    }

    // -------------------------
    // Atoms
    // -------------------------

    private static boolean isListForm(List<Node> items) {
        return !items.isEmpty() && items.get(0) instanceof Atom && ((Atom) items.get(0)).isSymbol("list");
    }

    private static Slot slotFor(int index, boolean listForm) {
        if (index == 0) return Slot.OPERATOR;
        if (index == 1 && listForm) return Slot.CONDITION;
        return Slot.PLAIN;
    }

    private static boolean isSymbolAtom(Node node) {
        return node instanceof Atom && ((Atom) node).isSymbol();
    }

    private String atom(Atom atom, Slot slot) {
        switch (atom.getKind()) {
            case NIL:
                return "()";
            case INTEGER:
                return integer((BigInteger) atom.rawValue(), slot);
            case BYTES:
                return atom.length() == 0 ? "()" : "0x" + Converters.toHex(atom.rawBytes());
            case STRING:
                return quote(atom.asText());
            case SYMBOL:
                return atom.asText();
            case BOOLEAN:
                return atom.asBoolean() ? "1" : "()";
            default:
                throw new SerializationError("atom", "Unknown atom kind " + atom.getKind());
        }
    }

    private String integer(BigInteger value, Slot slot) {
        if (value.bitLength() < 16) {
            int code = value.intValue();
            if (slot == Slot.OPERATOR && (opcodeConstants || options.isKeywords())) {
                Opcode op = Opcode.byCode(code);
                if (op != null) return opcodeConstants ? op.constantName() : op.keyword();
            }
            if (slot == Slot.CONDITION && conditionNames) {
                ConditionCode cc = ConditionCode.byCode(code);
                if (cc != null) return cc.name();
            }
        }
        return value.toString();
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
