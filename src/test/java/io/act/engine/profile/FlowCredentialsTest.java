package io.act.engine.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.act.engine.runtime.FlowScheduler;
import io.act.engine.runtime.PlaceholderResolver;
import io.act.engine.support.ActTestSupport;
import io.act.engine.support.FakeRemoteProvider;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlowCredentialsTest {
    private static final String FLOW = String.join("\n",
        "[node:list]",
        "type = fake_remote",
        "operation = list_items",
        "page_size = 5",
        "[node:note]",
        "type = set",
        "value = {{list.result.region}}");

    @Test
    void injectsDefaultsAndAuthUnderStepParameters() {
        var profile = CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), name -> null);

        var flow = FlowCredentials.inject(ActTestSupport.flow(FLOW), profile);

        var params = flow.step("list").orElseThrow().params();
        assertEquals("eu-west-1", params.get("region"));
        assertEquals(5, params.get("page_size"));
        assertEquals("{{.env.FAKE_REMOTE_TOKEN}}", params.get("token"));
        assertEquals(Map.of("value", "{{list.result.region}}"), flow.step("note").orElseThrow().params());
    }

    @Test
    void authReferencesResolveWhenTheStepRuns() {
        var profile = CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), name -> null);
        var registry = ActTestSupport.registry().register("fake_remote", new FakeRemoteProvider()::create);
        var scheduler = new FlowScheduler(registry,
            new PlaceholderResolver(Map.of("FAKE_REMOTE_TOKEN", "from-env")::get), Optional.empty());

        var result = scheduler.run(FlowCredentials.inject(ActTestSupport.flow(FLOW), profile), Map.of());

        @SuppressWarnings("unchecked")
        var received = (Map<String, Object>) result.step("list").result();
        assertEquals("from-env", received.get("token"));
        assertEquals("eu-west-1", result.output());
    }

    @Test
    void profileWithoutAuthenticatedTypesLeavesFlowUntouched() {
        var flow = ActTestSupport.flow(FLOW);
        assertSame(flow, FlowCredentials.inject(flow, CredentialProfile.empty(name -> null)));
    }
}
