package io.act.engine.profile;

import io.act.engine.error.ActEngineException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Per step-type credentials, defaults and operation catalog, stored as TOML.
 *
 * <p>Sections are keyed {@code "node:<type>"} with companions {@code "node:<type>.auth"},
 * {@code .defaults}, {@code .operations} and {@code .metadata}. Auth values are never stored
 * inline: they are {@code {{.env.TYPE_FIELD}}} references resolved from the environment on use.
 */
public final class CredentialProfile {
    private static final Logger log = LoggerFactory.getLogger(CredentialProfile.class);
    private static final Pattern ENV_REFERENCE = Pattern.compile("\\{\\{\\s*\\.env\\.(\\w+)\\s*\\}\\}");

    static final String NODE_PREFIX = "node:";
    static final String METADATA = "metadata";
    static final String SIGNATURE = "signature";
    static final String AUTHENTICATED_COUNT = "authenticated_nodes";
    static final String UNAUTHENTICATED_COUNT = "unauthenticated_nodes";

    private final Map<String, Object> document;
    private final Function<String, String> environment;

    private CredentialProfile(Map<String, Object> document, Function<String, String> environment) {
        this.document = document;
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public static CredentialProfile empty() {
        return empty(System::getenv);
    }

    public static CredentialProfile empty(Function<String, String> environment) {
        var document = new LinkedHashMap<String, Object>();
        var signature = new LinkedHashMap<String, Object>();
        signature.put("version", "1.0");
        signature.put("updated_at", timestamp());
        document.put(SIGNATURE, signature);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(AUTHENTICATED_COUNT, 0L);
        metadata.put(UNAUTHENTICATED_COUNT, 0L);
        document.put(METADATA, metadata);
        return new CredentialProfile(document, environment);
    }

    public static CredentialProfile load(Path path) {
        return load(path, System::getenv);
    }

    public static CredentialProfile load(Path path, Function<String, String> environment) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ActEngineException("profile_not_found", "Credential profile not found: " + path);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ActEngineException("profile_read", "Failed to read credential profile: " + path, ex);
        }
        if (result.hasErrors()) {
            var first = result.errors().get(0);
            throw new ActEngineException("profile_syntax",
                "Invalid credential profile " + path + ": " + first.getMessage() + " (line " + first.position().line() + ")");
        }
        log.debug("Loaded credential profile {}", path);
        return new CredentialProfile(convertTomlMap(result.toMap()), environment);
    }

    /**
     * Writes the profile, refreshing {@code [signature].updated_at} when a signature section exists.
     */
    public void save(Path path) {
        var signature = section(SIGNATURE);
        if (signature != null) {
            signature.put("updated_at", timestamp());
        }
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, TomlWriter.write(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ActEngineException("profile_write", "Failed to write credential profile: " + path, ex);
        }
        log.debug("Saved credential profile {}", path);
    }

    public boolean isAuthenticated(String type) {
        var base = section(nodeKey(type));
        return base != null && truthy(base.get("authenticated"));
    }

    public Map<String, Object> getAuth(String type, boolean resolveEnv) {
        var auth = copy(section(nodeKey(type) + ".auth"));
        if (!resolveEnv) {
            return auth;
        }
        @SuppressWarnings("unchecked")
        var resolved = (Map<String, Object>) resolveEnvReferences(auth);
        return resolved;
    }

    public Map<String, Object> getDefaults(String type) {
        return copy(section(nodeKey(type) + ".defaults"));
    }

    public Map<String, OperationDescriptor> getOperations(String type) {
        var operations = new LinkedHashMap<String, OperationDescriptor>();
        var raw = section(nodeKey(type) + ".operations");
        if (raw != null) {
            raw.forEach((name, value) -> operations.put(name, OperationDescriptor.fromValue(name, value)));
        }
        return operations;
    }

    public Map<String, Object> getMetadata(String type) {
        return copy(section(nodeKey(type) + ".metadata"));
    }

    public Map<String, Object> signature() {
        return copy(section(SIGNATURE));
    }

    /**
     * Adds or replaces a step type. Each auth field is stored as {@code {{.env.TYPE_FIELD}}}.
     */
    public void addNode(
        String type,
        Map<String, Object> auth,
        Map<String, Object> defaults,
        Map<String, OperationDescriptor> operations,
        Map<String, Object> metadata
    ) {
        String key = nodeKey(type);
        boolean isNew = !document.containsKey(key);

        var base = new LinkedHashMap<String, Object>();
        base.put("type", type);
        base.put("enabled", true);
        base.put("authenticated", true);
        base.put("auth_configured_at", timestamp());
        document.put(key, base);

        var references = new LinkedHashMap<String, Object>();
        if (auth != null) {
            for (String field : auth.keySet()) {
                references.put(field, envReference(type, field));
            }
        }
        document.put(key + ".auth", references);

        if (defaults != null && !defaults.isEmpty()) {
            document.put(key + ".defaults", new LinkedHashMap<>(defaults));
        }
        if (operations != null && !operations.isEmpty()) {
            var ops = new LinkedHashMap<String, Object>();
            operations.forEach((name, descriptor) -> ops.put(name, descriptor.toMap()));
            document.put(key + ".operations", ops);
        }
        if (metadata != null && !metadata.isEmpty()) {
            document.put(key + ".metadata", new LinkedHashMap<>(metadata));
        }

        var globalMetadata = globalMetadata();
        if (isNew) {
            globalMetadata.put(AUTHENTICATED_COUNT, count(globalMetadata.get(AUTHENTICATED_COUNT)) + 1);
        }
        log.info("Added node '{}' to credential profile", type);
    }

    /**
     * Removes every section of {@code type}. Returns {@code false} when the type is not present.
     */
    public boolean removeNode(String type) {
        String key = nodeKey(type);
        if (!document.containsKey(key)) {
            return false;
        }
        boolean wasAuthenticated = isAuthenticated(type);
        document.keySet().removeIf(existing -> existing.equals(key) || existing.startsWith(key + "."));
        var globalMetadata = section(METADATA);
        if (globalMetadata != null && wasAuthenticated) {
            globalMetadata.put(AUTHENTICATED_COUNT, Math.max(0L, count(globalMetadata.get(AUTHENTICATED_COUNT)) - 1));
        }
        log.info("Removed node '{}' from credential profile", type);
        return true;
    }

    public boolean updateDefaults(String type, Map<String, Object> defaults) {
        if (!isAuthenticated(type)) {
            return false;
        }
        document.put(nodeKey(type) + ".defaults", defaults == null ? new LinkedHashMap<>() : new LinkedHashMap<>(defaults));
        return true;
    }

    public List<String> authenticatedTypes() {
        var types = new ArrayList<String>();
        for (String type : nodeTypes()) {
            if (isAuthenticated(type)) {
                types.add(type);
            }
        }
        return types;
    }

    public ProfileValidation validate() {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        var signature = section(SIGNATURE);
        if (signature == null) {
            warnings.add("Missing [signature] section");
        } else if (!signature.containsKey("version")) {
            warnings.add("Missing signature.version");
        }

        for (String type : nodeTypes()) {
            var base = section(nodeKey(type));
            if (!base.containsKey("authenticated")) {
                errors.add("Node '" + type + "' missing 'authenticated' field");
            }
            if (!truthy(base.get("authenticated"))) {
                continue;
            }
            var auth = section(nodeKey(type) + ".auth");
            if (auth == null || auth.isEmpty()) {
                errors.add("Node '" + type + "' is authenticated but missing .auth section");
                continue;
            }
            for (var entry : auth.entrySet()) {
                if (!(entry.getValue() instanceof String text)) {
                    continue;
                }
                Matcher matcher = ENV_REFERENCE.matcher(text);
                if (matcher.find() && environment.apply(matcher.group(1)) == null) {
                    warnings.add("Environment variable '" + matcher.group(1) + "' not set for " + type + "." + entry.getKey());
                }
            }
        }
        return new ProfileValidation(errors.isEmpty(), errors, warnings, authenticatedTypes().size());
    }

    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(copy(document));
    }

    static String envReference(String type, String field) {
        return "{{.env." + type.toUpperCase(Locale.ROOT) + "_" + field.toUpperCase(Locale.ROOT) + "}}";
    }

    static boolean isEnvReference(Object value) {
        return value instanceof String text && ENV_REFERENCE.matcher(text).find();
    }

    private List<String> nodeTypes() {
        var types = new ArrayList<String>();
        for (var entry : document.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(NODE_PREFIX) && key.indexOf('.', NODE_PREFIX.length()) < 0 && entry.getValue() instanceof Map<?, ?>) {
                types.add(key.substring(NODE_PREFIX.length()));
            }
        }
        return types;
    }

    private Object resolveEnvReferences(Object value) {
        if (value instanceof Map<?, ?> map) {
            var resolved = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> resolved.put(String.valueOf(key), resolveEnvReferences(item)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            var resolved = new ArrayList<Object>(list.size());
            for (Object item : list) {
                resolved.add(resolveEnvReferences(item));
            }
            return resolved;
        }
        if (value instanceof String text) {
            // unset variables keep their reference so callers can report them
            Matcher matcher = ENV_REFERENCE.matcher(text);
            var out = new StringBuilder();
            while (matcher.find()) {
                String resolved = environment.apply(matcher.group(1));
                matcher.appendReplacement(out, Matcher.quoteReplacement(resolved == null ? matcher.group() : resolved));
            }
            matcher.appendTail(out);
            return out.toString();
        }
        return value;
    }

    private Map<String, Object> globalMetadata() {
        var metadata = section(METADATA);
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
            metadata.put(AUTHENTICATED_COUNT, 0L);
            metadata.put(UNAUTHENTICATED_COUNT, 0L);
            document.put(METADATA, metadata);
        }
        return metadata;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(String key) {
        Object value = document.get(key);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    private static String nodeKey(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Node type must not be blank");
        }
        return NODE_PREFIX + type.trim();
    }

    private static boolean truthy(Object value) {
        return Boolean.TRUE.equals(value) || (value instanceof String text && "true".equalsIgnoreCase(text.trim()));
    }

    private static long count(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return value == null ? 0L : Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    private static String timestamp() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> copy(Map<String, Object> source) {
        var copy = new LinkedHashMap<String, Object>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> {
            if (value instanceof Map<?, ?> map) {
                copy.put(key, copy((Map<String, Object>) map));
            } else if (value instanceof List<?> list) {
                copy.put(key, new ArrayList<>(list));
            } else {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private static Map<String, Object> convertTomlMap(Map<String, Object> source) {
        var converted = new LinkedHashMap<String, Object>();
        for (var entry : source.entrySet()) {
            converted.put(String.valueOf(entry.getKey()), convertTomlValue(entry.getValue()));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlMap(table.toMap());
        }
        if (value instanceof TomlArray array) {
            var items = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        return value;
    }
}
