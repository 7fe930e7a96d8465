import org.junit.jupiter.api.Test;

import com.coinscript.tree.Atom;
import com.coinscript.tree.Curry;
import com.coinscript.tree.CurryHash;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;
import com.coinscript.tree.Serializer;
import com.coinscript.tree.TreeParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CurryHashTest {

    private static final Node ADDER = TreeParser.parse("(mod (A B) (+ A B))");

    @Test
    void curry_hasApplyQuoteConsShape() {
        Node curried = Curry.curry(Atom.integer(42), Arrays.asList(Atom.integer(7), Atom.integer(8)));

        assertEquals("(2 (1 . 42) (4 (1 . 7) (4 (1 . 8) 1)))", Serializer.serialize(curried));
    }

    @Test
    void curriedHash_matchesHashOfCurriedTree() {
        byte[] expected = Curry.curry(ADDER, Collections.singletonList(Atom.integer(7))).hash();
        byte[] fromHashes = CurryHash.curriedHash(ADDER.hash(), Collections.singletonList(Atom.integer(7).hash()));

        assertArrayEquals(expected, fromHashes);
    }

    @Test
    void curriedHash_agreesForManyArgumentShapes() {
        List<Node> pool = Arrays.asList(
                Atom.NIL,
                Atom.integer(0),
                Atom.integer(-300),
                Atom.string("owner"),
                Atom.hex("0x" + "ab".repeat(32)),
                Nodes.list(Atom.integer(1), Atom.integer(2)),
                Nodes.cons(Atom.symbol("x"), Atom.integer(9)),
                TreeParser.parse("(q . (1 2 (3 . 4)))"));

        for (int n = 0; n <= pool.size(); n++) {
            List<Node> args = pool.subList(0, n);
            List<byte[]> hashes = new ArrayList<>();
            for (Node a : args) hashes.add(a.hash());

            assertArrayEquals(Curry.curry(ADDER, args).hash(),
                    CurryHash.curriedHash(ADDER.hash(), hashes), "args=" + n);
        }
    }

    @Test
    void zeroArguments_stillWrapsProgram() {
        Node curried = Curry.curry(ADDER, Collections.emptyList());

        assertEquals("(2 (1 . 42) 1)", Serializer.serialize(Curry.curry(Atom.integer(42), Collections.emptyList())));
        assertFalse(Arrays.equals(ADDER.hash(), curried.hash()));
        assertArrayEquals(curried.hash(), CurryHash.curriedHash(ADDER.hash(), Collections.emptyList()));
    }

    @Test
    void environmentHash_ofNoArgumentsIsOneHash() {
        assertArrayEquals(CurryHash.ONE_HASH, CurryHash.environmentHash(Collections.emptyList()));
        assertArrayEquals(Atom.integer(1).hash(), CurryHash.ONE_HASH);
    }

    @Test
    void quotedHash_isHashOfQuotedPair() {
        Node value = Atom.string("payload");
        assertArrayEquals(Nodes.cons(Atom.integer(1), value).hash(), CurryHash.quotedHash(value.hash()));
    }

    @Test
    void uncurry_recoversProgramAndArguments() {
        List<Node> args = Arrays.asList(Atom.integer(7), Atom.string("x"), Nodes.list(Atom.integer(1)));
        Node curried = Curry.curry(ADDER, args);

        Optional<Curry.Curried> back = Curry.uncurry(curried);
        assertTrue(back.isPresent());
        assertEquals(ADDER, back.get().program);
        assertEquals(args, back.get().args);
    }

    @Test
    void uncurry_rejectsOtherShapes() {
        assertFalse(Curry.uncurry(ADDER).isPresent());
        assertFalse(Curry.uncurry(Atom.integer(2)).isPresent());
        assertFalse(Curry.uncurry(TreeParser.parse("(2 (1 . 5) (4 (2 . 3) 1))")).isPresent());
    }

    @Test
    void program_curryAgreesWithCurriedHash() {
        Program p = Program.fromSource("adder", "(mod (A B) (+ A B))");
        List<Node> args = Collections.singletonList(Atom.integer(7));

        assertArrayEquals(p.curry(args).hash(), p.curriedHash(args));
    }
}
