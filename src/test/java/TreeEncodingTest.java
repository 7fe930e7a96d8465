import org.junit.jupiter.api.Test;

import com.coinscript.error.ConversionError;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Bech32m;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.TreeEncoding;
import com.coinscript.tree.TreeParser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeEncodingTest {

    @Test
    void encode_knownVectors() {
        assertEquals("80", TreeEncoding.toHex(Atom.NIL));
        assertEquals("01", TreeEncoding.toHex(Atom.integer(1)));
        assertEquals("ff0102", TreeEncoding.toHex(Nodes.cons(Atom.integer(1), Atom.integer(2))));
        assertEquals("820080", TreeEncoding.toHex(Atom.integer(128)));
        assertEquals("81ff", TreeEncoding.toHex(Atom.integer(-1)));
        assertEquals("8568656c6c6f", TreeEncoding.toHex(Atom.string("hello")));
        assertEquals("ff01ff0280", TreeEncoding.toHex(Nodes.list(Atom.integer(1), Atom.integer(2))));
    }

    @Test
    void decode_reversesEncode() {
        Node tree = TreeParser.parse("(mod (A B) (if (= A \"yes\") (list 51 0x" + "cd".repeat(32) + " B) (x)))");
        Node back = TreeEncoding.fromHex(TreeEncoding.toHex(tree));

        assertEquals(tree, back);
    }

    @Test
    void longList_encodesWithoutCopyingTails() {
        List<Node> items = new ArrayList<>();
        for (int i = 0; i < 50_000; i++) items.add(Atom.integer(i % 100));
        Node list = Nodes.list(items);

        byte[] encoded = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> TreeEncoding.encode(list));

        Node back = TreeEncoding.decode(encoded);
        assertEquals(list, back);
        assertEquals(50_000, Nodes.items(back).size());
        assertEquals(Atom.NIL, Nodes.tail(Nodes.cons(Atom.integer(1), list)));
        assertEquals(50_001, Nodes.items(Nodes.cons(Atom.integer(1), list)).size());
    }

    @Test
    void longAtom_usesTwoByteLengthPrefix() {
        byte[] payload = new byte[100];
        byte[] encoded = TreeEncoding.encode(Atom.bytes(payload));

        assertEquals(102, encoded.length);
        assertEquals(0xc0, encoded[0] & 0xff);
        assertEquals(100, encoded[1] & 0xff);
        assertEquals(Atom.bytes(payload), TreeEncoding.decode(encoded));
    }

    @Test
    void decode_rejectsTruncatedAndTrailingInput() {
        assertThrows(ConversionError.class, () -> TreeEncoding.fromHex("ff01"));
        assertThrows(ConversionError.class, () -> TreeEncoding.fromHex("0101"));
        assertThrows(ConversionError.class, () -> TreeEncoding.fromHex("85aabb"));
    }

    @Test
    void bech32m_acceptsReferenceVector() {
        assertEquals(0, Bech32m.decode("a1lqfn3a").length);
        assertEquals(0, Bech32m.decode("A1LQFN3A").length);
    }

    @Test
    void bech32m_addressRoundTrips() {
        byte[] puzzleHash = Converters.hexToBytes("b6a2d7a4e9c64f1f5e9d2c3b4a5968778695a4b3c2d1e0f0e1d2c3b4a5968778");
        String address = Bech32m.encodeAddress(puzzleHash, "xch");

        assertTrue(address.startsWith("xch1"));
        assertTrue(Bech32m.isAddress(address));
        assertArrayEquals(puzzleHash, Bech32m.decodeAddress(address));

        String testnet = Bech32m.encodeAddress(puzzleHash, "txch");
        assertArrayEquals(puzzleHash, Bech32m.decodeAddress(testnet));
    }

    @Test
    void bech32m_rejectsCorruptedAddresses() {
        String address = Bech32m.encodeAddress(new byte[32], "xch");
        char last = address.charAt(address.length() - 1);
        String corrupted = address.substring(0, address.length() - 1) + (last == 'q' ? 'p' : 'q');

        assertThrows(ConversionError.class, () -> Bech32m.decodeAddress(corrupted));
        assertThrows(ConversionError.class, () -> Bech32m.decode("xch1" + address.substring(4).toUpperCase()));
        assertThrows(ConversionError.class, () -> Bech32m.decode("xch1bbbbbbbbbb"));
        assertThrows(ConversionError.class, () -> Bech32m.decodeAddress(Bech32m.encode("xch", new byte[20])));
    }

    @Test
    void hexHelpers() {
        assertEquals("00ff10", Converters.toHex(Converters.hexToBytes("0x00ff10")));
        assertArrayEquals(new byte[] { 0x0a }, Converters.hexToBytes("a"));
        assertThrows(ConversionError.class, () -> Converters.hexToBytes("0xzz"));
        assertThrows(ConversionError.class, () -> Converters.requireLength(new byte[3], 32, "hash"));
    }
}
