package io.act.engine.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.act.engine.error.ActEngineException;
import io.act.engine.support.ActTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CredentialProfileTest {
    private static final Map<String, String> ENV = Map.of("FAKE_REMOTE_TOKEN", "s3cret");

    private static CredentialProfile team() {
        return CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), ENV::get);
    }

    @Test
    void readsNodeSections() {
        var profile = team();

        assertTrue(profile.isAuthenticated("fake_remote"));
        assertFalse(profile.isAuthenticated("github"));
        assertEquals(List.of("fake_remote"), profile.authenticatedTypes());
        assertEquals(Map.of("region", "eu-west-1", "page_size", 50L), profile.getDefaults("fake_remote"));
        assertEquals("Fake Remote", profile.getMetadata("fake_remote").get("display_name"));
        assertEquals("1.0", profile.signature().get("version"));
    }

    @Test
    void resolvesAuthFromEnvironmentOnlyWhenAsked(@TempDir Path dir) throws Exception {
        var profile = team();

        assertEquals(Map.of("token", "{{.env.FAKE_REMOTE_TOKEN}}"), profile.getAuth("fake_remote", false));
        assertEquals(Map.of("token", "s3cret"), profile.getAuth("fake_remote", true));

        var unset = CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), name -> null);
        assertEquals("{{.env.FAKE_REMOTE_TOKEN}}", unset.getAuth("fake_remote", true).get("token"));

        var file = dir.resolve("composite.toml");
        Files.writeString(file, String.join("\n",
            "[\"node:api\"]",
            "type = \"api\"",
            "authenticated = true",
            "",
            "[\"node:api.auth\"]",
            "header = \"Bearer {{.env.API_TOKEN}}\"",
            "pair = \"{{.env.API_USER}}:{{ .env.API_TOKEN }}\"",
            "missing = \"key={{.env.API_SECRET}};user={{.env.API_USER}}\"",
            ""));
        var env = Map.of("API_TOKEN", "abc", "API_USER", "bot");
        var auth = CredentialProfile.load(file, env::get).getAuth("api", true);
        assertEquals("Bearer abc", auth.get("header"));
        assertEquals("bot:abc", auth.get("pair"));
        assertEquals("key={{.env.API_SECRET}};user=bot", auth.get("missing"));
    }

    @Test
    void readsOperationCatalog() {
        var operations = team().getOperations("fake_remote");

        assertEquals(List.of("list_items", "fail"), List.copyOf(operations.keySet()));
        assertEquals(List.of("folder", "token"), operations.get("list_items").requiredParams());
        assertEquals("List items in a folder", operations.get("list_items").description());
    }

    @Test
    void addNodeStoresAuthAsEnvironmentReferences() {
        var profile = CredentialProfile.empty(name -> null);

        profile.addNode("github", Map.of("token", "ghp_real_secret"), Map.of("owner", "acme"),
            Map.of("list_repos", new OperationDescriptor("list_repos", List.of("owner"), "List repositories")), Map.of());

        assertTrue(profile.isAuthenticated("github"));
        assertEquals(Map.of("token", "{{.env.GITHUB_TOKEN}}"), profile.getAuth("github", false));
        assertFalse(profile.toMap().toString().contains("ghp_real_secret"));
        assertEquals(1L, metadataCount(profile));
    }

    @Test
    void reAddingExistingNodeDoesNotInflateCount() {
        var profile = CredentialProfile.empty(name -> null);
        profile.addNode("slack", Map.of("token", "x"), Map.of(), Map.of(), Map.of());
        profile.addNode("slack", Map.of("token", "y"), Map.of(), Map.of(), Map.of());
        assertEquals(1L, metadataCount(profile));

        assertTrue(profile.removeNode("slack"));
        assertEquals(0L, metadataCount(profile));
        assertFalse(profile.removeNode("slack"));
        assertEquals(0L, metadataCount(profile));
        assertFalse(profile.isAuthenticated("slack"));
    }

    @Test
    void removingUnauthenticatedNodeKeepsCount(@TempDir Path dir) throws Exception {
        var file = dir.resolve("mixed.toml");
        Files.writeString(file, String.join("\n",
            "[metadata]",
            "authenticated_nodes = 1",
            "",
            "[\"node:api\"]",
            "type = \"api\"",
            "authenticated = true",
            "",
            "[\"node:api.auth\"]",
            "token = \"{{.env.API_TOKEN}}\"",
            "",
            "[\"node:draft\"]",
            "type = \"draft\"",
            "authenticated = false",
            ""));
        var profile = CredentialProfile.load(file, name -> null);

        assertTrue(profile.removeNode("draft"));
        assertEquals(1L, metadataCount(profile));
        assertTrue(profile.removeNode("api"));
        assertEquals(0L, metadataCount(profile));
    }

    @Test
    void updatesDefaultsOnlyForAuthenticatedTypes() {
        var profile = team();
        assertTrue(profile.updateDefaults("fake_remote", Map.of("region", "us-east-1")));
        assertEquals(Map.of("region", "us-east-1"), profile.getDefaults("fake_remote"));
        assertFalse(profile.updateDefaults("github", Map.of("owner", "acme")));
    }

    @Test
    void savesAndReloadsRoundTrip(@TempDir Path dir) throws Exception {
        var profile = team();
        profile.addNode("github", Map.of("token", "x"), Map.of("owner", "acme", "per_page", 30L),
            Map.of("list_repos", new OperationDescriptor("list_repos", List.of("owner", "token"), "List repositories")),
            Map.of("scopes", List.of("repo", "read:org")));
        var path = dir.resolve("nested").resolve("profile.toml");

        profile.save(path);
        var reloaded = CredentialProfile.load(path, ENV::get);

        assertTrue(Files.readString(path).contains("[\"node:github.auth\"]"));
        assertEquals(List.of("fake_remote", "github"), reloaded.authenticatedTypes());
        assertEquals(Map.of("owner", "acme", "per_page", 30L), reloaded.getDefaults("github"));
        assertEquals(List.of("owner", "token"), reloaded.getOperations("github").get("list_repos").requiredParams());
        assertEquals(List.of("repo", "read:org"), reloaded.getMetadata("github").get("scopes"));
        assertNotEquals("2026-01-05T10:00:00Z", reloaded.signature().get("updated_at"));
        assertEquals(2L, ((Map<?, ?>) reloaded.toMap().get("metadata")).get("authenticated_nodes"));
    }

    @Test
    void validatesStructure() {
        var valid = team().validate();
        assertTrue(valid.valid());
        assertTrue(valid.warnings().isEmpty());
        assertEquals(1, valid.authenticatedNodes());

        var unsetEnv = CredentialProfile.load(ActTestSupport.resource("profiles", "team.toml"), name -> null).validate();
        assertTrue(unsetEnv.valid());
        assertEquals(List.of("Environment variable 'FAKE_REMOTE_TOKEN' not set for fake_remote.token"), unsetEnv.warnings());

        var invalid = CredentialProfile.load(ActTestSupport.resource("profiles", "invalid.toml"), name -> null).validate();
        assertFalse(invalid.valid());
        assertTrue(invalid.errors().contains("Node 'github' is authenticated but missing .auth section"));
        assertTrue(invalid.errors().contains("Node 'slack' missing 'authenticated' field"));
        assertTrue(invalid.warnings().contains("Missing [signature] section"));
    }

    @Test
    void authenticatedNodeWithEmptyAuthIsInvalid(@TempDir Path dir) {
        var profile = CredentialProfile.empty(name -> null);
        profile.addNode("api", Map.of(), Map.of("base_url", "https://api.example.com"), Map.of(), Map.of());
        var file = dir.resolve("empty-auth.toml");
        profile.save(file);

        var report = CredentialProfile.load(file, name -> null).validate();
        assertFalse(report.valid());
        assertEquals(List.of("Node 'api' is authenticated but missing .auth section"), report.errors());
    }

    @Test
    void loadFailuresCarryCodes(@TempDir Path dir) throws Exception {
        var missing = assertThrows(ActEngineException.class, () -> CredentialProfile.load(dir.resolve("none.toml")));
        assertEquals("profile_not_found", missing.code());

        var broken = dir.resolve("broken.toml");
        Files.writeString(broken, "[signature\nversion = ");
        var syntax = assertThrows(ActEngineException.class, () -> CredentialProfile.load(broken));
        assertEquals("profile_syntax", syntax.code());
    }

    private static Object metadataCount(CredentialProfile profile) {
        return ((Map<?, ?>) profile.toMap().get("metadata")).get("authenticated_nodes");
    }
}
