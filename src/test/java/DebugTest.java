import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.coinscript.debug.Debug;
import com.coinscript.debug.DebugLevel;
import com.coinscript.layer.ActionMerkleTree;
import com.coinscript.script.CoinScript;
import com.coinscript.script.codegen.CompilationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(null);
    }

    @Test
    void withoutSink_everyStageRunsSilently() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));

        CoinScript compiler = new CoinScript();
        assertFalse(compiler.tokenize("coin C { }").isEmpty());
        CompilationResult result = compiler.compile(
                "coin C { action default() { send(0x" + "aa".repeat(32) + ", 100); } }");
        assertEquals(64, result.getMainProgram().hashHex().length());
        assertEquals(32, new ActionMerkleTree(Arrays.asList(new byte[32], new byte[32])).root().length);

        Debug.get().e("DebugTest", "dropped", new IllegalStateException("no sink"));
    }

    @Test
    void installedSink_receivesMessagesAtOrAboveThreshold() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message));
        Debug.get().setThreshold(DebugLevel.INFO);

        Debug.get().d("T", "hidden");
        Debug.get().i("T", "shown");
        Debug.get().w("T", "also shown");

        assertEquals(Arrays.asList("INFO T shown", "WARN T also shown"), seen);
        assertFalse(Debug.get().isEnabled(DebugLevel.DEBUG));
        assertTrue(Debug.get().isEnabled(DebugLevel.ERROR));
    }

    @Test
    void clearingSink_restoresNoOp() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(message));
        Debug.get().setSink(null);

        Debug.get().e("T", "dropped");

        assertTrue(seen.isEmpty());
        assertNotNull(Debug.get().getSink());
    }
}
