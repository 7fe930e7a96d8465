package com.coinscript.tree;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.coinscript.error.ConversionError;

/**
 * Canonical CLVM byte serialization. Pairs are {@code 0xff first rest}; nil is
 * {@code 0x80}; a single byte up to {@code 0x7f} stands for itself; any other atom
 * carries a 1 to 5 byte length prefix. Decoded atoms are plain byte atoms, so the
 * structural hash survives the round trip.
 */
public final class TreeEncoding {

    private static final int PAIR = 0xff;
    private static final int NIL = 0x80;

    private TreeEncoding() {}

    public static byte[] encode(Node node) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(node, out);
        return out.toByteArray();
    }

    public static String toHex(Node node) {
        return Converters.toHex(encode(node));
    }

    public static Node fromHex(String hex) {
        return decode(Converters.hexToBytes(hex));
    }

    private static void write(Node node, ByteArrayOutputStream out) {
        Node cur = node;
        while (cur.isPair()) {
            if (cur instanceof ListNode) {
                for (Node item : ((ListNode) cur).items()) {
                    out.write(PAIR);
                    write(item, out);
                }
                cur = Atom.NIL;
                break;
            }
            out.write(PAIR);
            write(cur.first(), out);
            cur = cur.rest();
        }
        writeAtom(((Atom) cur).rawBytes(), out);
    }

    private static void writeAtom(byte[] bytes, ByteArrayOutputStream out) {
        int len = bytes.length;
        if (len == 0) {
            out.write(NIL);
            return;
        }
        if (len == 1 && (bytes[0] & 0xff) <= 0x7f) {
            out.write(bytes[0]);
            return;
        }
        if (len < 0x40) {
            out.write(0x80 | len);
        } else if (len < 0x2000) {
            out.write(0xc0 | (len >> 8));
            out.write(len & 0xff);
        } else if (len < 0x100000) {
            out.write(0xe0 | (len >> 16));
            out.write((len >> 8) & 0xff);
            out.write(len & 0xff);
        } else if (len < 0x8000000) {
            out.write(0xf0 | (len >> 24));
            out.write((len >> 16) & 0xff);
            out.write((len >> 8) & 0xff);
            out.write(len & 0xff);
        } else {
            out.write(0xf8);
            out.write((len >> 24) & 0xff);
            out.write((len >> 16) & 0xff);
            out.write((len >> 8) & 0xff);
            out.write(len & 0xff);
        }
        out.write(bytes, 0, len);
    }

    public static Node decode(byte[] data) {
        Reader reader = new Reader(data);
        Node node = reader.read();
        if (reader.pos != data.length) {
            throw new ConversionError(Converters.toHex(data), "Trailing bytes after tree at offset " + reader.pos);
        }
        return node;
    }

    private static final class Reader {
        private final byte[] data;
        private int pos = 0;

        Reader(byte[] data) {
            this.data = data;
        }

        // Iterative over pairs so long lists do not exhaust the call stack.
        Node read() {
            Deque<List<Node>> pending = new ArrayDeque<>();
            Deque<Integer> needed = new ArrayDeque<>();
            Node result = null;
            while (true) {
                int b = next();
                if (b == PAIR) {
                    pending.push(new ArrayList<>(2));
                    needed.push(2);
                    continue;
                }
                Node value = atom(b);
                while (true) {
                    if (pending.isEmpty()) {
                        result = value;
                        break;
                    }
                    List<Node> top = pending.peek();
                    top.add(value);
                    if (top.size() < needed.peek()) break;
                    pending.pop();
                    needed.pop();
                    value = Nodes.cons(top.get(0), top.get(1));
                }
                if (result != null) return result;
            }
        }

        private Node atom(int b) {
            if (b == NIL) return Atom.NIL;
            if (b <= 0x7f) return Atom.bytes(new byte[] { (byte) b });
            int len;
            if ((b & 0xc0) == 0x80) {
                len = b & 0x3f;
            } else if ((b & 0xe0) == 0xc0) {
                len = ((b & 0x1f) << 8) | next();
            } else if ((b & 0xf0) == 0xe0) {
                len = ((b & 0x0f) << 16) | (next() << 8) | next();
            } else if ((b & 0xf8) == 0xf0) {
                len = ((b & 0x07) << 24) | (next() << 16) | (next() << 8) | next();
            } else if (b == 0xf8) {
                long l = ((long) next() << 24) | (next() << 16) | (next() << 8) | next();
                if (l > Integer.MAX_VALUE) throw fail("Atom length " + l + " too large");
                len = (int) l;
            } else {
                throw fail("Invalid length prefix 0x" + Integer.toHexString(b));
            }
            if (pos + len > data.length) throw fail("Atom of " + len + " bytes runs past end of input");
            byte[] bytes = new byte[len];
            System.arraycopy(data, pos, bytes, 0, len);
            pos += len;
            return Atom.bytes(bytes);
        }

        private int next() {
            if (pos >= data.length) throw fail("Unexpected end of input");
            return data[pos++] & 0xff;
        }

        private ConversionError fail(String message) {
            return new ConversionError(Converters.toHex(data), message + " (offset " + pos + ")");
        }
    }
}
