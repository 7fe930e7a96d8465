package com.coinscript.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.coinscript.debug.Debug;
import com.coinscript.debug.DebugLevel;
import com.coinscript.debug.StreamDebugSink;
import com.coinscript.error.CoinScriptException;
import com.coinscript.layer.StateActionLayer;
import com.coinscript.script.codegen.CompilationResult;
import com.coinscript.script.codegen.CompilerOptions;
import com.coinscript.tree.Converters;
import com.coinscript.tree.Program;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Command line compiler.
 *
 *   --file=coin.cs            CoinScript source
 *   --tree=puzzle.clsp        raw Tree IR source instead
 *   --config=options.json     CompilerOptions as JSON
 *   --format=text|json
 *   --verbose                 debug log on stderr
 *
 * Exit codes: 0 ok, 1 compile error, 2 usage, 3 I/O.
 */
public final class CoinScriptCli {

    private static final ObjectMapper om = new ObjectMapper();
    private static final String TAG = "CoinScriptCli";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the CLI and returns its exit code instead of exiting. */
    public static int run(String[] args) {
        Map<String, String> flags = parseArgs(args);
        String file = flags.get("file");
        String tree = flags.get("tree");
        String format = flags.getOrDefault("format", "text");
        if ((file == null) == (tree == null) || !(format.equals("text") || format.equals("json"))) {
            System.err.println("Usage: CoinScriptCli (--file=<coin source> | --tree=<tree source>) "
                    + "[--config=<options.json>] [--format=text|json] [--verbose]");
            return 2;
        }
        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new StreamDebugSink(System.err, DebugLevel.DEBUG));
        }

        CoinScript compiler = new CoinScript();
        final String source;
        try {
            if (flags.containsKey("config")) {
                compiler.setOptions(om.readValue(Files.readString(Path.of(flags.get("config")), StandardCharsets.UTF_8),
                        CompilerOptions.class));
            }
            source = Files.readString(Path.of(file != null ? file : tree), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read input: " + e.getMessage());
            Debug.get().e(TAG, "input", e);
            return 3;
        }

        try {
            ObjectNode report = om.createObjectNode();
            if (tree != null) {
                Program program = compiler.parseTree(Path.of(tree).getFileName().toString(), source);
                report.put("name", program.getName());
                report.set("programs", om.createArrayNode().add(describe(compiler, program)));
            } else {
                CompilationResult result = compiler.compile(source);
                report.put("coin", result.getCoinName());
                report.put("puzzleHash", result.getMainProgram().hashHex());
                ArrayNode programs = report.putArray("programs");
                for (Program p : result.allPrograms()) {
                    programs.add(describe(compiler, p));
                }
                if (result.isStateful()) report.set("layer", describe(result.getLayer()));
                if (result.isSingleton()) report.put("launcherId", Converters.toHex(result.getLauncherId()));
            }
            System.out.println(format.equals("json") ? pretty(report) : text(report));
            return 0;
        } catch (CoinScriptException e) {
            System.err.println(e.getKind() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Failed to write report: " + e.getMessage());
            return 3;
        }
    }

    private static ObjectNode describe(CoinScript compiler, Program p) {
        ObjectNode n = om.createObjectNode();
        n.put("name", p.getName());
        n.put("hash", p.hashHex());
        n.put("source", compiler.render(p));
        strings(n.putArray("curriedParams"), p.getCurriedParams());
        strings(n.putArray("solutionParams"), p.getSolutionParams());
        strings(n.putArray("includes"), List.copyOf(p.getIncludes()));
        return n;
    }

    private static ObjectNode describe(StateActionLayer layer) {
        ObjectNode n = om.createObjectNode();
        n.put("merkleRoot", Converters.toHex(layer.getMerkleRoot()));
        n.put("templateHash", Converters.toHex(layer.getModHash()));
        ObjectNode actions = n.putObject("actions");
        for (Map.Entry<String, Program> e : layer.getActions().entrySet()) {
            actions.put(e.getKey(), e.getValue().hashHex());
        }
        return n;
    }

    private static void strings(ArrayNode array, List<String> values) {
        for (String v : values) array.add(v);
    }

    private static String text(ObjectNode report) {
        StringBuilder sb = new StringBuilder();
        if (report.has("coin")) {
            sb.append("coin ").append(report.get("coin").asText())
                    .append(" puzzle hash 0x").append(report.get("puzzleHash").asText()).append('\n');
        }
        report.get("programs").forEach(p -> sb.append('\n')
                .append(";; ").append(p.get("name").asText()).append(" 0x").append(p.get("hash").asText()).append('\n')
                .append(p.get("source").asText()).append('\n'));
        if (report.has("layer")) {
            sb.append("\nmerkle root 0x").append(report.get("layer").get("merkleRoot").asText()).append('\n');
        }
        if (report.has("launcherId")) {
            sb.append("launcher id 0x").append(report.get("launcherId").asText()).append('\n');
        }
        return sb.toString();
    }

    private static String pretty(ObjectNode n) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
    }

    /**
     * Minimal arg parser:
     *   --file=/path/coin.cs --format=json --verbose
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private CoinScriptCli() {}
}
