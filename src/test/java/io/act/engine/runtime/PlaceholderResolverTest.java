package io.act.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlaceholderResolverTest {
    private final PlaceholderResolver resolver = new PlaceholderResolver(Map.of("REGION", "eu-west-1")::get);
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context = new ExecutionContext(Map.of("user", Map.of("name", "Ada", "roles", List.of("admin", "dev"))));
        context.record("fetch", StepResult.success(Map.of("items", List.of(Map.of("id", 7), Map.of("id", 9)), "count", 2), 3));
        context.record("broken", StepResult.error("upstream refused", 1));
    }

    @Test
    void wholeStringPlaceholderKeepsStructuredValue() {
        assertEquals(List.of(Map.of("id", 7), Map.of("id", 9)), resolver.resolve("{{fetch.result.items}}", context));
        assertEquals(2, resolver.resolve("{{ fetch.count }}", context));
    }

    @Test
    void walksStepRecordFields() {
        assertEquals("error", resolver.resolve("{{broken.status}}", context));
        assertEquals("upstream refused", resolver.resolve("{{broken.error}}", context));
        assertEquals("{{broken.result}}", resolver.resolve("{{broken.result}}", context));
    }

    @Test
    void indexesListsWithBracketsOrDots() {
        assertEquals(9, resolver.resolve("{{fetch.result.items[1].id}}", context));
        assertEquals(7, resolver.resolve("{{fetch.result.items.0.id}}", context));
        assertEquals("dev", resolver.resolve("{{input.user.roles[1]}}", context));
    }

    @Test
    void embeddedPlaceholdersAreStringified() {
        assertEquals("Ada has 2 items", resolver.resolve("{{input.user.name}} has {{fetch.result.count}} items", context));
        assertEquals("ids: [{\"id\":7},{\"id\":9}]", resolver.resolve("ids: {{fetch.result.items}}", context));
        assertEquals("error was ", resolver.resolve("error was {{fetch.error}}", context));
    }

    @Test
    void resolvesEnvironmentReferences() {
        assertEquals("eu-west-1", resolver.resolve("{{.env.REGION}}", context));
        assertEquals("{{.env.MISSING}}", resolver.resolve("{{.env.MISSING}}", context));
    }

    @Test
    void fallbackAppliesToMissingAndNullValues() {
        assertEquals(25, resolver.resolve("{{fetch.result.limit | 25}}", context));
        assertEquals("none", resolver.resolve("{{broken.result | 'none'}}", context));
        assertEquals(Boolean.TRUE, resolver.resolve("{{ghost.result | true}}", context));
        assertEquals(2, resolver.resolve("{{fetch.result.count | 99}}", context));
    }

    @Test
    void unresolvedPlaceholdersStayVerbatim() {
        assertEquals("{{ghost.result}}", resolver.resolve("{{ghost.result}}", context));
        assertEquals("see {{fetch.result.items[5]}}", resolver.resolve("see {{fetch.result.items[5]}}", context));
    }

    @Test
    void resolvesNestedStructures() {
        var params = Map.<String, Object>of(
            "query", Map.of("id", "{{fetch.result.items[0].id}}", "tags", List.of("{{input.user.name}}", "static")));

        var resolved = resolver.resolveParams(params, context);

        assertEquals(Map.of("id", 7, "tags", List.of("Ada", "static")), resolved.get("query"));
    }

    @Test
    void collectsReferencedRootsExcludingEnvironment() {
        var value = Map.of("a", "{{fetch.result}} and {{.env.REGION}}", "b", List.of("{{broken.error | 'x'}}", "{{input.user}}"));
        assertEquals(Set.of("fetch", "broken", "input"), PlaceholderResolver.references(value));
        assertTrue(PlaceholderResolver.hasUnresolved(List.of("plain", Map.of("k", "{{x}}"))));
        assertFalse(PlaceholderResolver.hasUnresolved("plain text with {single} braces"));
    }

    @Test
    void splitsPathSegments() {
        assertEquals(List.of("a", "b", "0", "c", "1"), PlaceholderResolver.segments("a.b[0].c[1]"));
    }
}
