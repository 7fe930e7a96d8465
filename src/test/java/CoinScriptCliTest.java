import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coinscript.script.CoinScript;
import com.coinscript.script.CoinScriptCli;
import com.coinscript.script.codegen.CompilerOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CoinScriptCliTest {

    private static final String AA = "0x" + "aa".repeat(32);
    private static final ObjectMapper om = new ObjectMapper();

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @BeforeEach
    void capture() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(savedOut);
        System.setErr(savedErr);
    }

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }

    private String stderr() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void compile_textReportListsPuzzleHashAndSource() throws Exception {
        Path src = write("pay.cs", "coin Pay { action default() { send(" + AA + ", 100); } }");

        assertEquals(0, CoinScriptCli.run(new String[]{"--file=" + src}));

        String report = stdout();
        String hash = new CoinScript().compile(Files.readString(src)).getMainProgram().hashHex();
        assertTrue(report.startsWith("coin Pay puzzle hash 0x" + hash), report);
        assertTrue(report.contains("CREATE_COIN"), report);
        assertEquals("", stderr());
    }

    @Test
    void compile_jsonReportForStatefulCoinCarriesLayer() throws Exception {
        Path src = write("counter.cs", "coin Counter { state { uint256 count; } "
                + "@stateful action bump(uint256 by) { state.count += by; } }");

        assertEquals(0, CoinScriptCli.run(new String[]{"--file=" + src, "--format=json"}));

        JsonNode report = om.readTree(stdout());
        assertEquals("Counter", report.get("coin").asText());
        assertEquals(64, report.get("puzzleHash").asText().length());
        assertTrue(report.get("programs").size() >= 2);
        assertTrue(report.get("layer").get("actions").has("bump"));
        assertEquals(64, report.get("layer").get("merkleRoot").asText().length());
        assertFalse(report.has("launcherId"));
    }

    @Test
    void config_isReadAsCompilerOptions() throws Exception {
        String launcher = "cd".repeat(32);
        Path src = write("s.cs", "@singleton coin S { action default() { } }");
        Path cfg = write("options.json", "{\"launcherId\":\"" + launcher + "\",\"prettyPrint\":false}");

        assertEquals(0, CoinScriptCli.run(new String[]{"--file=" + src, "--config=" + cfg, "--format=json"}));

        JsonNode report = om.readTree(stdout());
        assertEquals(launcher, report.get("launcherId").asText());
        for (JsonNode p : report.get("programs")) {
            assertFalse(p.get("source").asText().contains("\n"), p.get("source").asText());
        }
    }

    @Test
    void tree_reportsClassifiedParams() throws Exception {
        Path src = write("add.clsp", "(mod (A b) (+ A b))");

        assertEquals(0, CoinScriptCli.run(new String[]{"--tree=" + src, "--format=json"}));

        JsonNode report = om.readTree(stdout());
        assertEquals("add.clsp", report.get("name").asText());
        JsonNode program = report.get("programs").get(0);
        assertEquals("A", program.get("curriedParams").get(0).asText());
        assertEquals("b", program.get("solutionParams").get(0).asText());
    }

    @Test
    void compileError_exitsOneWithKind() throws Exception {
        Path src = write("bad.cs", "coin { }");

        assertEquals(1, CoinScriptCli.run(new String[]{"--file=" + src}));
        assertTrue(stderr().startsWith("PARSE: "), stderr());
        assertEquals("", stdout());
    }

    @Test
    void usageErrors_exitTwo() throws Exception {
        Path src = write("x.cs", "coin X { action default() { } }");

        assertEquals(2, CoinScriptCli.run(new String[0]));
        assertEquals(2, CoinScriptCli.run(new String[]{"--file=" + src, "--tree=" + src}));
        assertEquals(2, CoinScriptCli.run(new String[]{"--file=" + src, "--format=yaml"}));
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    void missingFile_exitsThree() {
        assertEquals(3, CoinScriptCli.run(new String[]{"--file=" + dir.resolve("missing.cs")}));
        assertTrue(stderr().startsWith("Failed to read input"), stderr());
    }

    @Test
    void facade_optionsAreCopied() {
        CoinScript compiler = new CoinScript();
        CompilerOptions options = new CompilerOptions();
        options.setPrettyPrint(false);
        compiler.setOptions(options);
        options.setPrettyPrint(true);

        assertFalse(compiler.getOptions().isPrettyPrint());
        compiler.getOptions().setPrettyPrint(true);
        assertFalse(compiler.getOptions().isPrettyPrint());
        assertEquals("(mod (A) (+ A 1))", compiler.render(compiler.parseTree("p", "(mod (A) (+ A 1))")));
    }
}
