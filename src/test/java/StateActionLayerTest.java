import org.junit.jupiter.api.Test;

import com.coinscript.error.ConversionError;
import com.coinscript.layer.ActionMerkleTree;
import com.coinscript.layer.SingletonLayer;
import com.coinscript.layer.SolutionBuilder;
import com.coinscript.layer.StateActionLayer;
import com.coinscript.layer.StateSchema;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Curry;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;
import com.coinscript.tree.TreeParser;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StateActionLayerTest {

    private static final StateSchema SCHEMA = new StateSchema(Arrays.asList(
            new StateSchema.Field("count", "uint256"),
            new StateSchema.Field("owner", "address"),
            new StateSchema.Field("open", "bool")));

    private static StateActionLayer counterLayer() {
        Map<String, Program> actions = new LinkedHashMap<>();
        actions.put("increment", Program.fromSource("counter_increment",
                "(mod (current_state . action_args) (c (list (+ (f current_state) 1) (f (r current_state)) (f (r (r current_state)))) ()))"));
        actions.put("reset", Program.fromSource("counter_reset",
                "(mod (current_state . action_args) (c (list 0 (f (r current_state)) ()) ()))"));
        actions.put("noop", Program.fromSource("counter_noop",
                "(mod (current_state . action_args) (c current_state ()))"));
        return new StateActionLayer("counter", SCHEMA, actions);
    }

    @Test
    void schema_defaultsAndCodec() {
        Node defaults = SCHEMA.defaults();
        assertEquals(Nodes.list(Atom.integer(0), Atom.bytes(new byte[32]), Atom.NIL), defaults);

        Map<String, Node> values = new LinkedHashMap<>();
        values.put("count", Atom.integer(5));
        values.put("owner", Atom.hex("0x" + "11".repeat(32)));
        values.put("open", Atom.integer(1));
        Node encoded = SCHEMA.encode(values);
        assertEquals(values, SCHEMA.decode(encoded));
        assertEquals(1, SCHEMA.indexOf("owner"));

        values.remove("open");
        assertThrows(ConversionError.class, () -> SCHEMA.encode(values));
        assertThrows(ConversionError.class, () -> SCHEMA.decode(Nodes.list(Atom.integer(1))));
    }

    @Test
    void accessor_walksRestThenFirst() {
        Node tuple = Atom.symbol("current_state");
        assertEquals(TreeParser.parse("(f current_state)"), StateSchema.accessor(tuple, 0));
        assertEquals(TreeParser.parse("(f (r (r current_state)))"), StateSchema.accessor(tuple, 2));
    }

    @Test
    void successorPuzzleHash_equalsHashOfRecreatedProgram() {
        StateActionLayer layer = counterLayer();
        Node next = Nodes.list(Atom.integer(6), Atom.bytes(new byte[32]), Atom.integer(1));

        assertArrayEquals(layer.programFor(next).hash(), layer.successorPuzzleHash(next));
        assertArrayEquals(layer.programFor(SCHEMA.defaults()).hash(), layer.puzzleHashFor(SCHEMA.defaults()));
    }

    @Test
    void programFor_isTemplateCurriedWithModHashRootAndState() {
        StateActionLayer layer = counterLayer();
        Node state = SCHEMA.defaults();

        Optional<Curry.Curried> curried = Curry.uncurry(layer.programFor(state));
        assertTrue(curried.isPresent());
        assertEquals(layer.getTemplate().getTree(), curried.get().program);
        assertEquals(Arrays.asList(Atom.bytes(layer.getModHash()), Atom.bytes(layer.getMerkleRoot()), state),
                curried.get().args);
        assertEquals(Arrays.asList("SELF_MOD_HASH", "ACTION_MERKLE_ROOT", "STATE"),
                layer.getTemplate().getCurriedParams());
    }

    @Test
    void differentStates_giveDifferentPuzzleHashes() {
        StateActionLayer layer = counterLayer();
        Node a = Nodes.list(Atom.integer(1), Atom.bytes(new byte[32]), Atom.NIL);
        Node b = Nodes.list(Atom.integer(2), Atom.bytes(new byte[32]), Atom.NIL);

        assertFalse(Arrays.equals(layer.puzzleHashFor(a), layer.puzzleHashFor(b)));
    }

    @Test
    void dispatch_buildsVerifiedSolution() {
        StateActionLayer layer = counterLayer();
        Node state = SCHEMA.defaults();

        StateActionLayer.Dispatch d = layer.dispatch("reset", state, Arrays.asList(Atom.integer(3)), BigInteger.ONE);

        assertEquals("counter_reset", d.action.getName());
        assertTrue(ActionMerkleTree.verifyInclusion(layer.getMerkleRoot(), d.action.hash(), d.proof));
        assertEquals(layer.programFor(state), d.puzzle);

        List<Node> parts = Nodes.items(d.solution);
        assertEquals(4, parts.size());
        assertEquals(Atom.integer(1), parts.get(0));
        assertEquals(d.action.getTree(), parts.get(1));
        assertEquals(d.proof.toNode(), parts.get(2));
        assertEquals(Nodes.list(Atom.integer(3)), parts.get(3));

        assertThrows(IllegalArgumentException.class,
                () -> layer.dispatch("explode", state, Arrays.asList(), BigInteger.ONE));
    }

    @Test
    void template_includesFinalizerAndMerkleCheck() {
        String source = counterLayer().getTemplate().serialize();

        assertTrue(source.contains("(defun finalize"), source);
        assertTrue(source.contains("merkle-root-for-proof"), source);
        assertTrue(source.contains("Action not in merkle tree"), source);
    }

    @Test
    void solutionBuilder_matchesHandBuiltList() {
        Node built = SolutionBuilder.create()
                .add(7)
                .add("0xabcd")
                .add("hello")
                .addBool(true)
                .addNil()
                .addList(l -> l.addInt(1).addInt(2))
                .addConditions(c -> c.createCoin(new byte[32], 100))
                .build();

        Node expected = Nodes.list(
                Atom.integer(7),
                Atom.hex("0xabcd"),
                Atom.string("hello"),
                Atom.integer(1),
                Atom.NIL,
                Nodes.list(Atom.integer(1), Atom.integer(2)),
                Nodes.list(Nodes.list(Atom.integer(51), Atom.bytes(new byte[32]), Atom.integer(100))));
        assertEquals(expected, built);
    }

    @Test
    void solutionBuilder_actionAndConsForms() {
        Node action = SolutionBuilder.create().addInt(1000).addAction("transfer", "0x" + "22".repeat(32), 5).build();
        assertEquals(Nodes.list(Atom.integer(1000), Atom.string("transfer"),
                Atom.hex("0x" + "22".repeat(32)), Atom.integer(5)), action);

        Node pair = SolutionBuilder.create().addInt(1).addRaw("(q . 2)").asCons().build();
        assertEquals(Nodes.cons(Atom.integer(1), TreeParser.parse("(q . 2)")), pair);

        assertThrows(IllegalStateException.class, () -> SolutionBuilder.create().addInt(1).asCons().build());
        assertThrows(ConversionError.class, () -> SolutionBuilder.create().add(new Object()));
    }

    @Test
    void singleton_wrapsInnerPuzzleWithStruct() {
        Node inner = TreeParser.parse("(mod (x) x)");
        byte[] launcherId = SingletonLayer.defaultLauncherId("Vault");

        Optional<Curry.Curried> curried = Curry.uncurry(SingletonLayer.wrap(inner, launcherId));
        assertTrue(curried.isPresent());
        assertEquals(SingletonLayer.template().getTree(), curried.get().program);
        assertEquals(SingletonLayer.struct(launcherId), curried.get().args.get(0));
        assertEquals(inner, curried.get().args.get(1));
        assertEquals(32, launcherId.length);
    }
}
