import org.junit.jupiter.api.Test;

import com.coinscript.error.ParseError;
import com.coinscript.error.SerializationError;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;
import com.coinscript.tree.SerializeOptions;
import com.coinscript.tree.Serializer;
import com.coinscript.tree.Substitution;
import com.coinscript.tree.TreeHash;
import com.coinscript.tree.TreeParser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TreeIrTest {

    @Test
    void modForm_parsesToNestedLists() {
        Node tree = TreeParser.parse("(mod (A B) (+ A B))");

        List<Node> items = Nodes.items(tree);
        assertEquals(3, items.size());
        assertEquals(Atom.symbol("mod"), items.get(0));
        assertEquals(Nodes.list(Atom.symbol("A"), Atom.symbol("B")), items.get(1));
        assertEquals(Nodes.list(Atom.symbol("+"), Atom.symbol("A"), Atom.symbol("B")), items.get(2));
        assertEquals("(mod (A B) (+ A B))", Serializer.serialize(tree));
    }

    @Test
    void listAndConsChain_hashIdentically() {
        Node list = Nodes.list(Atom.integer(1), Atom.integer(2), Atom.integer(3));
        Node cons = Nodes.cons(Atom.integer(1), Nodes.cons(Atom.integer(2), Nodes.cons(Atom.integer(3), Atom.NIL)));

        assertArrayEquals(list.hash(), cons.hash());
        assertEquals(list, cons);
        assertArrayEquals(TreeHash.structuralHash(list), cons.hash());
    }

    @Test
    void atomAndPair_useDisjointDomains() {
        Node pair = Nodes.cons(Atom.integer(1), Atom.integer(2));
        byte[] pairHash = pair.hash();
        // an atom holding the exact bytes a pair is hashed over still hashes differently
        byte[] first = Atom.integer(1).hash();
        byte[] rest = Atom.integer(2).hash();
        byte[] body = new byte[64];
        System.arraycopy(first, 0, body, 0, 32);
        System.arraycopy(rest, 0, body, 32, 32);

        assertFalse(Arrays.equals(pairHash, Atom.bytes(body).hash()));
        assertArrayEquals(TreeHash.pairHash(first, rest), pairHash);
    }

    @Test
    void nilHashesAsEmptyAtom() {
        assertArrayEquals(TreeHash.atomHash(new byte[0]), Atom.NIL.hash());
        assertArrayEquals(Atom.NIL.hash(), TreeParser.parse("()").hash());
    }

    @Test
    void serializeThenParse_roundTrips() {
        String[] sources = {
                "(mod (A B) (+ A B))",
                "(a (q . 7) (c (q . \"hi there\") 1))",
                "(x \"quote \\\" and backslash \\\\\")",
                "(0xdeadbeef -5 0 () (1 2 . 3))",
                "(mod (SELF . args) (if (= (f args) 'go') (list 51 SELF 100) (x)))",
                "((((((deep))))))",
        };
        for (String s : sources) {
            Node parsed = TreeParser.parse(s);
            Node again = TreeParser.parse(Serializer.serialize(parsed));
            assertEquals(parsed, again, s);

            Node pretty = TreeParser.parse(Serializer.serialize(parsed, SerializeOptions.pretty()));
            assertEquals(parsed, pretty, s);
        }
    }

    @Test
    void parse_reportsPositionOfUnbalancedInput() {
        ParseError e = assertThrows(ParseError.class, () -> TreeParser.parse("(mod (A)\n  (+ A 1)"));
        assertEquals("')'", e.getExpected());
        assertEquals(2, e.getPosition().line);

        assertThrows(ParseError.class, () -> TreeParser.parse("(a b))"));
        assertThrows(ParseError.class, () -> TreeParser.parse("(. a)"));
        assertThrows(ParseError.class, () -> TreeParser.parse("0xzz"));
    }

    @Test
    void pretty_breaksModFormAcrossLines() {
        Node tree = TreeParser.parse("(mod (A) (include condition_codes.clib) (list (list CREATE_COIN A 1)))");
        String out = Serializer.serialize(tree, SerializeOptions.pretty());

        assertEquals(String.join("\n",
                "(mod (A)",
                "  (include condition_codes.clib)",
                "  (list (list CREATE_COIN A 1))",
                ")"), out);
    }

    @Test
    void pretty_keepsShortFormsOnOneLine() {
        Node tree = TreeParser.parse("(+ 1 2)");
        assertEquals("(+ 1 2)", Serializer.serialize(tree, SerializeOptions.pretty()));
    }

    @Test
    void pretty_rejectsMalformedSpecialForms() {
        assertThrows(SerializationError.class,
                () -> Serializer.serialize(TreeParser.parse("(mod (A))"), SerializeOptions.pretty()));
        assertThrows(SerializationError.class,
                () -> Serializer.serialize(TreeParser.parse("(defun 7 (x) x)"), SerializeOptions.pretty()));
        assertThrows(SerializationError.class,
                () -> Serializer.serialize(TreeParser.parse("(if 1 2 3 4)"), SerializeOptions.pretty()));
        assertThrows(SerializationError.class,
                () -> Serializer.serialize(TreeParser.parse("(include a b)"), SerializeOptions.pretty()));
        // flat rendering does not validate forms
        assertEquals("(mod (A))", Serializer.serialize(TreeParser.parse("(mod (A))")));
    }

    @Test
    void conditionNames_renderOnlyWhenIncluded() {
        Node tree = TreeParser.parse("(list 51 0xaa 100)");
        assertEquals("(list 51 0xaa 100)", Serializer.serialize(tree));

        SerializeOptions opts = SerializeOptions.defaults()
                .setIncludes(Collections.singleton("condition_codes.clib"));
        assertEquals("(list CREATE_COIN 0xaa 100)", Serializer.serialize(tree, opts));
    }

    @Test
    void opcodeRendering_followsOptions() {
        Node curried = TreeParser.parse("(2 (1 . 7) 1)");
        assertEquals("(2 (1 . 7) 1)", Serializer.serialize(curried));
        assertEquals("(a (q . 7) 1)", Serializer.serialize(curried, SerializeOptions.defaults().setKeywords(true)));

        SerializeOptions constants = SerializeOptions.defaults().setKeywords(true)
                .setIncludes(Collections.singleton("opcodes.clib"));
        assertEquals("(APPLY (QUOTE . 7) 1)", Serializer.serialize(curried, constants));
    }

    @Test
    void comments_attachToNodesInPrettyMode() {
        Node body = TreeParser.parse("(+ A 1)");
        Node tree = Nodes.list(Atom.symbol("mod"), Nodes.list(Atom.symbol("A")), body);
        String out = Serializer.serialize(tree, SerializeOptions.pretty().comment(body, "increment"));

        assertTrue(out.contains("(+ A 1) ;; increment"), out);
        assertEquals(tree, TreeParser.parse(out));
    }

    @Test
    void substitution_replacesBoundSymbolsOnly() {
        Node tree = TreeParser.parse("(mod (x) (+ OWNER x \"OWNER\" (f (OWNER . OWNER))))");
        Node out = Substitution.substitute(tree, Map.of("OWNER", Atom.integer(9)));

        assertEquals(TreeParser.parse("(mod (x) (+ 9 x \"OWNER\" (f (9 . 9))))"), out);
        assertSame(tree, Substitution.substitute(tree, Map.of("NOPE", Atom.integer(1))));
    }

    @Test
    void programFromSource_classifiesParameters() {
        Program p = Program.fromSource("p", "(mod (OWNER AMOUNT to_ph . rest) (include condition_codes.clib) (list (list CREATE_COIN to_ph AMOUNT)))");

        assertEquals(Arrays.asList("OWNER", "AMOUNT"), p.getCurriedParams());
        assertEquals(Arrays.asList("to_ph", "rest"), p.getSolutionParams());
        assertTrue(p.getIncludes().contains("condition_codes.clib"));
        assertEquals(p.getTree().hashHex(), p.hashHex());
    }
}
