package io.act.engine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.act.engine.support.ActTestSupport;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return Main.execute(new PrintWriter(out, true), new PrintWriter(err, true), args);
    }

    @Test
    void runPrintsResultAsJson() {
        int code = run("run", "--flow", ActTestSupport.resource("flows", "hello.act").toString(),
            "--input", "{\"name\":\"Ada\"}", "--log-level", "error");

        assertEquals(0, code);
        assertTrue(out.toString().contains("Hello, Ada!"), out.toString());
        assertTrue(out.toString().contains("\"status\" : \"success\""));
    }

    @Test
    void runReadsInputFromFile(@TempDir Path dir) throws Exception {
        var input = dir.resolve("input.json");
        Files.writeString(input, "{\"name\":\"Grace\"}");

        int code = run("run", "-f", ActTestSupport.resource("flows", "hello.act").toString(), "-i", "@" + input);

        assertEquals(0, code);
        assertTrue(out.toString().contains("Hello, Grace!"));
    }

    @Test
    void planShowsDispatchModeWithoutRunning() {
        int code = run("run", "--flow", ActTestSupport.resource("flows", "server.act").toString(), "--plan");

        assertEquals(0, code);
        assertTrue(out.toString().contains("\"planned\""));
        assertTrue(out.toString().contains("\"server\""));
    }

    @Test
    void failedRunExitsWithFailureCode(@TempDir Path dir) {
        int code = run("run", "--flow", dir.resolve("missing.act").toString());

        assertEquals(1, code);
        assertTrue(out.toString().contains("flow_not_found"));
    }

    @Test
    void invalidOptionsAreUsageErrors() {
        assertEquals(2, run("run", "--flow", ActTestSupport.resource("flows", "hello.act").toString(), "--log-level", "loud"));
        assertTrue(err.toString().contains("Unsupported log level"));

        assertEquals(2, run("run", "--flow", ActTestSupport.resource("flows", "hello.act").toString(), "--input", "[1]"));
        assertEquals(2, run("run", "--timeout", "soon", "--flow", "x.act"));
    }

    @Test
    void execReportsCapabilityOutcome() {
        int code = run("exec", "--profile", ActTestSupport.resource("profiles", "team.toml").toString(), "fake_remote", "fail");

        assertEquals(1, code);
        assertTrue(out.toString().contains("remote refused"));
        assertTrue(out.toString().contains("capability_error"));
    }

    @Test
    void execValidateReportsMergedParameters() {
        int code = run("exec", "--profile", ActTestSupport.resource("profiles", "team.toml").toString(),
            "fake_remote", "fail", "--params", "{\"folder\":\"inbox\"}", "--validate");

        assertEquals(0, code);
        assertTrue(out.toString().contains("\"valid\" : true"));
        assertTrue(out.toString().contains("\"region\" : \"eu-west-1\""));
    }

    @Test
    void execRequiresProfile() {
        assertEquals(2, run("exec", "fake_remote", "fail"));
    }

    @Test
    void jsonArgumentsAcceptStdin() {
        var commandLine = new CommandLine(new ActCommand());
        var stdin = new ByteArrayInputStream("{\"from\":\"stdin\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals("{\"from\":\"stdin\"}", JsonArguments.readText("-", commandLine, stdin));
        assertEquals("{}", JsonArguments.readText(null, commandLine, stdin));
        assertEquals("stdin", JsonArguments.parse("{\"from\":\"stdin\"}", commandLine).get("from"));
    }

    @Test
    void rootCommandPrintsUsage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("run"));
        assertTrue(out.toString().contains("exec"));
    }
}
