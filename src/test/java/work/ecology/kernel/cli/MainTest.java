package work.ecology.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void execPrintsResult(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("double.js");
        Files.writeString(script, "function run(x) { return x * 2; }");

        int exit = run("exec", script.toString(), "--arg", "21");

        assertEquals(0, exit, err.toString());
        JsonNode report = JSON.readTree(out.toString());
        assertTrue(report.path("result").path("success").asBoolean());
        assertEquals(42, report.path("result").path("result").asInt());
    }

    @Test
    void execWithWalletReportsBalances(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("pay.js");
        Files.writeString(script, "function run(to) { return pay(to, 30); }");

        int exit = run("exec", script.toString(), "--artifact-id", "c", "--fund", "100", "--arg", "alice");

        assertEquals(0, exit, err.toString());
        JsonNode balances = JSON.readTree(out.toString()).path("balances");
        assertEquals(70, balances.path("c").asLong());
        assertEquals(30, balances.path("alice").asLong());
    }

    @Test
    void execFailureExitsNonZero(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("bad.js");
        Files.writeString(script, "function run() { return require('fs'); }");

        int exit = run("exec", script.toString(), "--format", "yaml");

        assertEquals(1, exit);
        assertTrue(out.toString().contains("sandbox_violation"), out.toString());
    }

    @Test
    void fundWithoutArtifactIsUsageError(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("noop.js");
        Files.writeString(script, "function run() {}");
        assertEquals(2, run("exec", script.toString(), "--fund", "5"));
        assertTrue(err.toString().contains("--fund requires --artifact-id"));
    }

    @Test
    void checkActionValidatesFile(@TempDir Path dir) throws Exception {
        Path good = dir.resolve("good.txt");
        Files.writeString(good, "{\"action_type\": \"read_artifact\", \"artifact_id\": \"a\"}");
        assertEquals(0, run("check-action", good.toString()));
        assertTrue(JSON.readTree(out.toString()).path("valid").asBoolean());

        out.getBuffer().setLength(0);
        Path bad = dir.resolve("bad.txt");
        Files.writeString(bad, "{\"action_type\": \"transfer\"}");
        assertEquals(1, run("check-action", bad.toString()));
        assertTrue(JSON.readTree(out.toString()).path("error").asText().contains("genesis_ledger"));
    }

    @Test
    void checkCodeReportsMissingRun(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("norun.js");
        Files.writeString(script, "function go() {}");
        assertEquals(1, run("check-code", script.toString()));
        assertEquals("Code must define a run() function", JSON.readTree(out.toString()).path("message").asText());
    }

    @Test
    void badInputFailsWithOneLineUsageError(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("ok.js");
        Files.writeString(script, "function run() { return 1; }");

        assertEquals(2, run("exec", script.toString(), "--config", dir.resolve("missing.toml").toString()));
        assertTrue(err.toString().startsWith("exec: Config file not found: "), err.toString());

        err.getBuffer().setLength(0);
        assertEquals(2, run("check-code", dir.resolve("absent.js").toString()));
        assertTrue(err.toString().startsWith("check-code: No such file: "), err.toString());
    }

    @Test
    void versionAndMissingSubcommand() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("agent-kernel (java)"), out.toString());
        assertTrue(out.toString().contains("sandbox: ECMAScript 2023, modules math, json, random, datetime"), out.toString());
        assertTrue(run() != 0);
    }
}
