package io.act.engine.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.act.engine.error.FlowNotFoundException;
import io.act.engine.error.FlowSyntaxException;
import io.act.engine.support.ActTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowLoaderTest {
    private final FlowLoader loader = new FlowLoader(Map.of("API_HOST", "api.example.com")::get);

    @Test
    void loadsActfileWithParametersSubstituted() {
        var flow = loader.load(ActTestSupport.resource("flows", "hello.act"));

        assertEquals("hello", flow.name());
        assertEquals("Greets whoever is named in the input", flow.description());
        assertEquals("begin", flow.startStep().orElseThrow());
        assertEquals(List.of("begin", "compose", "announce"), flow.stepIds());
        assertEquals("Hello, {{begin.result.name | \"world\"}}!", flow.step("compose").orElseThrow().params().get("value"));
        assertEquals(List.of("compose"), flow.edges().get("begin"));
        assertTrue(flow.agent().isEmpty());
        assertTrue(flow.routes().isEmpty());
    }

    @Test
    void loadsYamlFlowWithTypedParameterReference() {
        var flow = loader.load(ActTestSupport.resource("flows", "pipeline.yaml"));

        assertEquals("pipeline", flow.name());
        assertEquals("start", flow.startStep().orElseThrow());
        var total = flow.step("total").orElseThrow();
        assertEquals("add", total.type());
        assertEquals(10, total.params().get("b"));
        assertEquals("{{input.left}}", total.params().get("a"));
        assertEquals(List.of("report"), flow.edges().get("total"));
    }

    @Test
    void identicalContentProducesEqualDefinitions() {
        String content = "[workflow]\nname = twin\n\n[node:start]\ntype = start\n";
        assertEquals(loader.parse(content, "x"), loader.parse(content, "x"));
    }

    @Test
    void readsConfigurationDeploymentAndRoutes() {
        var flow = loader.load(ActTestSupport.resource("flows", "server.act"));

        var agent = flow.agent().orElseThrow();
        assertTrue(agent.enabled());
        assertEquals("0.0.0.0", agent.host());
        assertEquals(9001, agent.port());
        assertTrue(agent.corsEnabled());
        assertFalse(agent.autoExecute());
        assertEquals("staging", flow.deployment().orElseThrow().environment());
        assertEquals(2, flow.deployment().orElseThrow().workers());

        assertEquals(1, flow.routes().size());
        var route = flow.routes().get(0);
        assertEquals("/orders", route.path());
        assertEquals(List.of("GET", "POST"), route.methods());
        assertEquals("list_orders", route.handler());
        assertTrue(route.authRequired());
        assertEquals(List.of("list_orders"), route.targets());
    }

    @Test
    void parsesTripleQuotedBlocksAndMultilineJson() {
        String content = String.join("\n",
            "[workflow]",
            "name = blocks",
            "[node:script]",
            "type = py",
            "code = \"\"\"",
            "def run():",
            "    return 1",
            "\"\"\"",
            "options = {",
            "  \"retries\": 3,",
            "  \"tags\": [\"a\", \"b\"]",
            "}",
            "enabled = true",
            "ratio = 0.5");

        var params = loader.parse(content, "blocks").step("script").orElseThrow().params();

        assertEquals("def run():\n    return 1", params.get("code"));
        assertEquals(Map.of("retries", 3, "tags", List.of("a", "b")), params.get("options"));
        assertEquals(Boolean.TRUE, params.get("enabled"));
        assertEquals(0.5, params.get("ratio"));
    }

    @Test
    void resolvesEnvSectionAndDollarReferences() {
        String content = String.join("\n",
            "[workflow]",
            "name = env",
            "[env]",
            "HOST = ${API_HOST}",
            "REGION = eu",
            "MISSING = ${NOT_SET_ANYWHERE}",
            "[node:call]",
            "type = set",
            "value = https://${API_HOST}/${REGION}/${UNKNOWN}");

        var flow = loader.parse(content, "env");

        assertEquals("api.example.com", flow.env().get("HOST"));
        assertEquals("", flow.env().get("MISSING"));
        assertEquals("https://api.example.com/eu/${UNKNOWN}", flow.step("call").orElseThrow().params().get("value"));
    }

    @Test
    void implicitStartPrefersStepNamedStart() {
        String content = "[node:first]\ntype = start\n[node:start]\ntype = set\nvalue = 1\n";
        assertEquals("start", loader.parse(content, "implicit").startStep().orElseThrow());

        String byType = "[node:a]\ntype = set\nvalue = 1\n[node:b]\ntype = start\n";
        assertEquals("b", loader.parse(byType, "implicit").startStep().orElseThrow());
    }

    @Test
    void emptyContentYieldsEmptyFlow() {
        var flow = loader.parse("# nothing yet\n", "draft");
        assertTrue(flow.isEmpty());
        assertEquals("draft", flow.name());
        assertTrue(flow.startStep().isEmpty());
    }

    @Test
    void rejectsDuplicateSectionsWithLineNumber() {
        String content = "[workflow]\nname = a\n\n[workflow]\nname = b\n";
        var error = assertThrows(FlowSyntaxException.class, () -> loader.parse(content, "dup"));
        assertEquals(4, error.line());
    }

    @Test
    void rejectsNodeWithoutType() {
        assertThrows(FlowSyntaxException.class, () -> loader.parse("[node:x]\nvalue = 1\n", "bad"));
    }

    @Test
    void rejectsUnknownStartNodeAndDanglingEdges() {
        assertThrows(FlowSyntaxException.class,
            () -> loader.parse("[workflow]\nstart_node = nope\n[node:a]\ntype = start\n", "bad"));
        assertThrows(FlowSyntaxException.class,
            () -> loader.parse("[node:a]\ntype = start\n[edges]\na = ghost\n", "bad"));
    }

    @Test
    void rejectsDuplicateYamlKeys() {
        String yaml = "nodes:\n  a:\n    type: start\n  a:\n    type: set\n";
        assertThrows(FlowSyntaxException.class, () -> loader.parseYaml(yaml, "dup"));
    }

    @Test
    void reportsMissingFile(@TempDir Path dir) {
        assertThrows(FlowNotFoundException.class, () -> loader.load(dir.resolve("Actfile")));
    }

    @Test
    void findsFlowFileInParentDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("Actfile"), "[node:start]\ntype = start\n");
        var nested = Files.createDirectories(dir.resolve("a").resolve("b"));

        assertEquals(dir.resolve("Actfile").toAbsolutePath().normalize(), FlowLoader.find(nested));
    }

    @Test
    void parsesScalarValues() {
        assertEquals(42, FlowLoader.parseValue("42"));
        assertEquals(-7, FlowLoader.parseValue("-7"));
        assertEquals(1.5, FlowLoader.parseValue("1.5"));
        assertEquals(Boolean.FALSE, FlowLoader.parseValue("False"));
        assertEquals("quoted text", FlowLoader.parseValue("\"quoted text\""));
        assertEquals("{{a.result}}", FlowLoader.parseValue("{{a.result}}"));
        assertEquals(List.of(1, 2), FlowLoader.parseValue("[1, 2]"));
    }
}
