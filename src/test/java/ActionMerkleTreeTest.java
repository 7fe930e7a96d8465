import org.junit.jupiter.api.Test;

import com.coinscript.layer.ActionMerkleTree;
import com.coinscript.layer.MerkleProof;
import com.coinscript.tree.TreeHash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ActionMerkleTreeTest {

    private static byte[] action(String name) {
        return TreeHash.sha256(name.getBytes(StandardCharsets.UTF_8));
    }

    private static List<byte[]> actions(int n) {
        List<byte[]> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(action("action-" + i));
        return out;
    }

    @Test
    void threeLeaves_proofForMiddleLeafVerifies_andCorruptionFails() {
        List<byte[]> hashes = actions(3);
        ActionMerkleTree tree = new ActionMerkleTree(hashes);

        MerkleProof proof = tree.proof(1);
        assertTrue(ActionMerkleTree.verifyInclusion(tree.root(), hashes.get(1), proof));

        byte[] bad = proof.getSteps().get(0).getSibling();
        bad[0] ^= 0x01;
        MerkleProof corrupted = proof.withSibling(0, bad);
        assertFalse(ActionMerkleTree.verifyInclusion(tree.root(), hashes.get(1), corrupted));
    }

    @Test
    void everyLeafVerifies_forSizesOneThroughNine() {
        for (int n = 1; n <= 9; n++) {
            List<byte[]> hashes = actions(n);
            ActionMerkleTree tree = new ActionMerkleTree(hashes);
            assertEquals(n, tree.size());
            for (int i = 0; i < n; i++) {
                MerkleProof proof = tree.proof(i);
                assertTrue(ActionMerkleTree.verifyInclusion(tree.root(), hashes.get(i), proof), "n=" + n + " i=" + i);
                for (int s = 0; s < proof.size(); s++) {
                    MerkleProof broken = proof.withSibling(s, action("intruder"));
                    assertFalse(ActionMerkleTree.verifyInclusion(tree.root(), hashes.get(i), broken));
                }
            }
        }
    }

    @Test
    void singleLeaf_rootIsLeafValueAndProofIsEmpty() {
        byte[] only = action("only");
        ActionMerkleTree tree = new ActionMerkleTree(Collections.singletonList(only));

        assertArrayEquals(ActionMerkleTree.leafValue(only), tree.root());
        assertEquals(0, tree.proof(0).size());
        assertTrue(ActionMerkleTree.verifyInclusion(tree.root(), only, tree.proof(only)));
    }

    @Test
    void twoLeaves_rootIsPairHashOfLeafValues() {
        List<byte[]> hashes = actions(2);
        ActionMerkleTree tree = new ActionMerkleTree(hashes);

        byte[] expected = TreeHash.pairHash(ActionMerkleTree.leafValue(hashes.get(0)),
                ActionMerkleTree.leafValue(hashes.get(1)));
        assertArrayEquals(expected, tree.root());
    }

    @Test
    void actionNotInTree_failsToVerify() {
        List<byte[]> hashes = actions(4);
        ActionMerkleTree tree = new ActionMerkleTree(hashes);

        assertFalse(ActionMerkleTree.verifyInclusion(tree.root(), action("stranger"), tree.proof(2)));
        assertEquals(-1, tree.indexOf(action("stranger")));
        assertThrows(IllegalArgumentException.class, () -> tree.proof(action("stranger")));
        assertThrows(IndexOutOfBoundsException.class, () -> tree.proof(4));
    }

    @Test
    void proofSurvivesSolutionForm() {
        List<byte[]> hashes = actions(5);
        ActionMerkleTree tree = new ActionMerkleTree(hashes);
        MerkleProof proof = tree.proof(4);

        MerkleProof back = MerkleProof.fromNode(proof.toNode());
        assertEquals(proof.size(), back.size());
        assertTrue(ActionMerkleTree.verifyInclusion(tree.root(), hashes.get(4), back));
    }

    @Test
    void rejectsEmptyOrMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> new ActionMerkleTree(Collections.emptyList()));
        assertThrows(RuntimeException.class, () -> new ActionMerkleTree(Collections.singletonList(new byte[31])));
    }
}
