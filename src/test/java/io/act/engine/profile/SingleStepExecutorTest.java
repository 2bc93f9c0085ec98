package io.act.engine.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.act.engine.error.MissingRequiredParameterException;
import io.act.engine.error.NodeNotAuthenticatedException;
import io.act.engine.error.UnknownOperationException;
import io.act.engine.runtime.CapabilityRegistry;
import io.act.engine.support.ActTestSupport;
import io.act.engine.support.FakeRemoteProvider;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SingleStepExecutorTest {
    private final CapabilityRegistry registry = ActTestSupport.registry()
        .register("fake_remote", new FakeRemoteProvider()::create);
    private final SingleStepExecutor executor = new SingleStepExecutor(registry);

    private static CredentialProfile team(Map<String, String> env) {
        return CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), env::get);
    }

    @Test
    void mergesDefaultsThenAuthThenRuntimeParameters() {
        var profile = CredentialProfile.empty(Map.of("FAKE_REMOTE_B", "3")::get);
        profile.addNode("fake_remote", Map.of("b", "ignored"), Map.of("a", 1, "b", 2),
            Map.of("sync", new OperationDescriptor("sync", List.of(), "")), Map.of());

        var merged = executor.mergeParams(profile, "fake_remote", "sync", Map.of("c", 5));

        assertEquals(Map.of("a", 1, "b", "3", "c", 5, "operation", "sync"), merged);
        assertEquals(7, executor.mergeParams(profile, "fake_remote", "sync", Map.of("b", 7)).get("b"));
    }

    @Test
    void executesWithResolvedCredentials() {
        var response = executor.execute(team(Map.of("FAKE_REMOTE_TOKEN", "s3cret")), "fake_remote", "list_items",
            Map.of("folder", "inbox", "page_size", 10));

        assertEquals("success", response.get("status"));
        assertEquals("fake_remote", response.get("node_type"));
        assertEquals("list_items", response.get("operation"));
        @SuppressWarnings("unchecked")
        var received = (Map<String, Object>) response.get("result");
        assertEquals("s3cret", received.get("token"));
        assertEquals("eu-west-1", received.get("region"));
        assertEquals(10, received.get("page_size"));
        assertEquals("inbox", received.get("folder"));
        assertEquals("list_items", received.get("operation"));
    }

    @Test
    void reportsEveryMissingParameter() {
        var profile = team(Map.of());

        var error = assertThrows(MissingRequiredParameterException.class,
            () -> executor.invoke(profile, "fake_remote", "list_items", Map.of()));

        assertEquals(List.of("folder", "token"), error.missing());
        var response = executor.execute(profile, "fake_remote", "list_items", Map.of());
        assertEquals("error", response.get("status"));
        assertEquals("missing_required_parameter", response.get("error_type"));
    }

    @Test
    void rejectsUnauthenticatedTypesAndUnknownOperations() {
        var profile = team(Map.of("FAKE_REMOTE_TOKEN", "s3cret"));

        assertThrows(NodeNotAuthenticatedException.class, () -> executor.invoke(profile, "github", "list_repos", Map.of()));
        var unknown = assertThrows(UnknownOperationException.class,
            () -> executor.invoke(profile, "fake_remote", "delete_all", Map.of()));
        assertEquals(List.of("list_items", "fail"), unknown.available());

        var response = executor.execute(profile, "github", "list_repos", Map.of());
        assertEquals("node_not_authenticated", response.get("error_type"));
        assertEquals("github", response.get("node_type"));
    }

    @Test
    void capabilityErrorIsReportedNotThrown() {
        var response = executor.execute(team(Map.of("FAKE_REMOTE_TOKEN", "s3cret")), "fake_remote", "fail", Map.of());

        assertEquals("error", response.get("status"));
        assertEquals("remote refused", response.get("error"));
        assertEquals("capability_error", response.get("error_type"));
    }

    @Test
    void missingCapabilityIsReported() {
        var bare = new SingleStepExecutor(new CapabilityRegistry());
        var response = bare.execute(team(Map.of("FAKE_REMOTE_TOKEN", "s3cret")), "fake_remote", "list_items",
            Map.of("folder", "inbox"));
        assertEquals("unknown_capability", response.get("error_type"));
    }

    @Test
    void missingProfileIsReported(@TempDir Path dir) {
        var response = executor.execute(dir.resolve("absent.toml"), "fake_remote", "list_items", Map.of());
        assertEquals("profile_not_found", response.get("error_type"));
    }

    @Test
    void validationRedactsResolvedSecrets() {
        var report = executor.validateParams(team(Map.of("FAKE_REMOTE_TOKEN", "s3cret")), "fake_remote", "list_items",
            Map.of("folder", "inbox"));

        assertEquals(Boolean.TRUE, report.get("valid"));
        assertEquals(List.of(), report.get("errors"));
        @SuppressWarnings("unchecked")
        var merged = (Map<String, Object>) report.get("merged_params");
        assertEquals("***", merged.get("token"));
        assertEquals("inbox", merged.get("folder"));
    }

    @Test
    void validationCollectsErrorsAndWarnings() {
        var report = executor.validateParams(team(Map.of()), "fake_remote", "list_items", Map.of());

        assertEquals(Boolean.FALSE, report.get("valid"));
        assertEquals(List.of("Missing required parameters for fake_remote.list_items: folder, token"), report.get("errors"));
        @SuppressWarnings("unchecked")
        var warnings = (List<String>) report.get("warnings");
        assertTrue(warnings.get(0).contains("unset environment variable"));

        var notAuthenticated = executor.validateParams(team(Map.of()), "github", "x", Map.of());
        assertFalse((Boolean) notAuthenticated.get("valid"));
        assertEquals(Map.of(), notAuthenticated.get("merged_params"));
    }
}
