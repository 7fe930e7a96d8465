package com.coinscript.layer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.coinscript.error.ConversionError;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;

/**
 * Field order and types of a coin's state tuple. Field {@code i} lives at
 * {@code i} rest steps plus one first step from the tuple root.
 */
public final class StateSchema {

    public static final class Field {
        public final String name;
        public final String type;

        public Field(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    private final List<Field> fields;

    public StateSchema(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<Field> getFields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public int indexOf(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name.equals(name)) return i;
        }
        return -1;
    }

    public Node encode(List<? extends Node> values) {
        if (values.size() != fields.size()) {
            throw new ConversionError(String.valueOf(values.size()),
                    "State has " + fields.size() + " fields, got " + values.size() + " values");
        }
        return Nodes.list(values);
    }

    /** Encodes by name; every field must be present and no others. */
    public Node encode(Map<String, ? extends Node> values) {
        List<Node> ordered = new ArrayList<>(fields.size());
        for (Field f : fields) {
            Node v = values.get(f.name);
            if (v == null) throw new ConversionError(f.name, "Missing value for state field '" + f.name + "'");
            ordered.add(v);
        }
        if (values.size() != fields.size()) {
            throw new ConversionError(values.keySet().toString(), "Unknown state fields in " + values.keySet());
        }
        return encode(ordered);
    }

    public Map<String, Node> decode(Node state) {
        List<Node> items = Nodes.items(state);
        if (!Nodes.tail(state).isNil() || items.size() != fields.size()) {
            throw new ConversionError(state.toString(),
                    "State tuple must be a list of " + fields.size() + " values: " + state);
        }
        Map<String, Node> out = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            out.put(fields.get(i).name, items.get(i));
        }
        return out;
    }

    /** The initial state: every field at its type's zero value. */
    public Node defaults() {
        List<Node> values = new ArrayList<>(fields.size());
        for (Field f : fields) values.add(defaultValue(f.type));
        return Nodes.list(values);
    }

    public static Node defaultValue(String type) {
        if (type.startsWith("uint") || type.startsWith("int")) return Atom.integer(BigInteger.ZERO);
        switch (type) {
            case "address":
            case "bytes32":
                return Atom.bytes(new byte[32]);
            case "string":
                return Atom.string("");
            default:
                // bool, bytes, mapping, arrays
                return Atom.NIL;
        }
    }

    /** {@code (f (r (r tuple)))} style extraction of element {@code index}. */
    public static Node accessor(Node tuple, int index) {
        Node cur = tuple;
        for (int i = 0; i < index; i++) {
            cur = Nodes.form("r", cur);
        }
        return Nodes.form("f", cur);
    }
}
