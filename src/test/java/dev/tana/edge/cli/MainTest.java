package dev.tana.edge.cli;

import static dev.tana.edge.support.EdgeTestSupport.writeContract;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path contracts;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        return Main.commandLine()
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true));
    }

    @Test
    void invokePrintsTheResultEnvelope() throws Exception {
        writeContract(contracts, "echo", "post.js",
            "export function Post(req, body) { return { status: 202, body: { got: body.value, path: req.path } }; }");

        int exit = commandLine().execute("--log-level", "warn", "invoke", "echo",
            "--contracts", contracts.toString(), "-X", "post", "-d", "{\"value\":7}", "--path", "/x");

        assertEquals(0, exit, err.toString());
        JsonNode printed = JSON.readTree(out.toString());
        assertEquals(202, printed.get("status").asInt());
        assertEquals(7, printed.get("body").get("got").asInt());
        assertEquals("/x", printed.get("body").get("path").asText());
        assertTrue(printed.get("logs").isArray());
    }

    @Test
    void invokeExitsNonZeroOnContractErrors() throws Exception {
        int exit = commandLine().execute("invoke", "missing", "--contracts", contracts.toString());

        assertEquals(1, exit);
        assertEquals(500, JSON.readTree(out.toString()).get("status").asInt());
    }

    @Test
    void invalidMethodIsAUsageError() {
        int exit = commandLine().execute("invoke", "echo", "--contracts", contracts.toString(), "-X", "DELETE");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("DELETE"));
    }

    @Test
    void scriptFailuresSetTheExitCode() throws Exception {
        Path script = writeContract(contracts, "scripts", "fail.js", "throw new Error('script broke');");

        int exit = commandLine().execute("script", script.toString(), "--contracts", contracts.toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("script broke"));
    }

    @Test
    void versionNamesTheRuntime() {
        int exit = commandLine().execute("--version");

        assertEquals(0, exit);
        assertTrue(out.toString().startsWith("tana-edge (java) "));
    }
}
