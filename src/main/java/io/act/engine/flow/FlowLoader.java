package io.act.engine.flow;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.act.engine.error.ActEngineException;
import io.act.engine.error.FlowNotFoundException;
import io.act.engine.error.FlowSyntaxException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads flow sources (Actfile INI dialect or YAML) into {@link FlowDefinition} instances.
 * Identical content always produces an equal definition.
 */
public final class FlowLoader {
    private static final Logger log = LoggerFactory.getLogger(FlowLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    private static final Pattern SECTION_HEADER = Pattern.compile("^\\s*\\[([^\\]]+)\\]\\s*(?:[#;].*)?$");
    private static final Pattern PARAMETER_REF =
        Pattern.compile("\\{\\{\\s*\\.Parameter\\.([A-Za-z_][A-Za-z0-9_]*)\\s*\\}\\}");
    private static final Pattern ENV_REF = Pattern.compile("\\$\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\}");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    private static final String TRIPLE_QUOTE = "\"\"\"";
    private static final String NODE_PREFIX = "node:";
    private static final List<String> FLOW_FILE_NAMES =
        List.of("Actfile", "actfile", "actfile.ini", "Actfile.ini", "flow", "flow.yaml", "flow.yml");

    private final Function<String, String> environment;

    public FlowLoader() {
        this(System::getenv);
    }

    public FlowLoader(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public FlowDefinition load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new FlowNotFoundException(path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ActEngineException("flow_read", "Failed to read flow: " + path, ex);
        }
        var definition = fromSource(path, content);
        log.debug("Loaded flow '{}' from {} with {} steps", definition.name(), path, definition.steps().size());
        return definition;
    }

    /**
     * Parses content read from {@code origin}; the file name selects the syntax and the default flow name.
     */
    public FlowDefinition fromSource(Path origin, String content) {
        String defaultName = stripExtension(origin.getFileName().toString());
        return isYaml(origin) ? parseYaml(content, defaultName) : parse(content, defaultName);
    }

    /**
     * Parses Actfile content.
     */
    public FlowDefinition parse(String content, String defaultName) {
        return build(readActfile(content == null ? "" : content), defaultName);
    }

    public FlowDefinition parseYaml(String content, String defaultName) {
        return build(readYaml(content == null ? "" : content), defaultName);
    }

    /**
     * Looks for a flow file in {@code startDir} and its parents.
     */
    public static Path find(Path startDir) {
        Path origin = startDir.toAbsolutePath().normalize();
        Path current = origin;
        while (current != null) {
            for (String name : FLOW_FILE_NAMES) {
                Path candidate = current.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    return candidate;
                }
            }
            current = current.getParent();
        }
        throw new FlowNotFoundException(origin.resolve(FLOW_FILE_NAMES.get(0)));
    }

    // ---------------------------------------------------------------- Actfile

    private RawFlow readActfile(String content) {
        var raw = new RawFlow();
        for (var section : splitSections(content)) {
            String name = section.name();
            if (name.startsWith(NODE_PREFIX)) {
                String id = name.substring(NODE_PREFIX.length()).trim();
                if (id.isEmpty()) {
                    throw new FlowSyntaxException("Node section without an id: [" + name + "]", section.line());
                }
                var values = parseKeyValues(section);
                if (!values.containsKey("type")) {
                    throw new FlowSyntaxException("Node '" + id + "' must have a 'type' field", section.line());
                }
                raw.nodes.put(id, values);
                continue;
            }
            switch (name) {
                case "workflow" -> raw.workflow.putAll(parseKeyValues(section));
                case "parameters" -> raw.parameters.putAll(parseKeyValues(section));
                case "settings" -> raw.settings.putAll(parseKeyValues(section));
                case "configuration" -> raw.configuration = parseKeyValues(section);
                case "deployment" -> raw.deployment = parseKeyValues(section);
                case "env" -> raw.env.putAll(parseEnv(section));
                case "edges" -> raw.edges.putAll(parseEdges(section));
                default -> log.debug("Ignoring unknown flow section [{}]", name);
            }
        }
        return raw;
    }

    private static List<Section> splitSections(String content) {
        var sections = new ArrayList<Section>();
        var seen = new LinkedHashMap<String, Integer>();
        Section current = null;
        String[] lines = content.split("\\R", -1);
        for (int index = 0; index < lines.length; index++) {
            String line = lines[index];
            int number = index + 1;
            Matcher header = SECTION_HEADER.matcher(line);
            if (header.matches()) {
                String name = header.group(1).trim();
                Integer previous = seen.putIfAbsent(name, number);
                if (previous != null) {
                    throw new FlowSyntaxException("Duplicate section [" + name + "], first declared on line " + previous, number);
                }
                current = new Section(name, number, new ArrayList<>());
                sections.add(current);
                continue;
            }
            if (current == null) {
                if (!isBlankOrComment(line)) {
                    throw new FlowSyntaxException("Content outside of any [section]", number);
                }
                continue;
            }
            current.lines().add(new Line(number, line));
        }
        return sections;
    }

    private static Map<String, Object> parseKeyValues(Section section) {
        var values = new LinkedHashMap<String, Object>();
        var lines = section.lines();
        int i = 0;
        while (i < lines.size()) {
            var line = lines.get(i);
            String text = line.text();
            if (isBlankOrComment(text)) {
                i++;
                continue;
            }
            int eq = text.indexOf('=');
            if (eq < 0) {
                throw new FlowSyntaxException("Expected 'key = value' in [" + section.name() + "]", line.number());
            }
            String key = text.substring(0, eq).trim();
            String value = text.substring(eq + 1).trim();
            if (key.isEmpty()) {
                throw new FlowSyntaxException("Missing key in [" + section.name() + "]", line.number());
            }

            if (("code".equals(key) || "prompt".equals(key)) && value.startsWith(TRIPLE_QUOTE)) {
                if (value.length() > 6 && value.endsWith(TRIPLE_QUOTE)) {
                    values.put(key, value.substring(3, value.length() - 3));
                    i++;
                    continue;
                }
                var block = new ArrayList<String>();
                if (!TRIPLE_QUOTE.equals(value)) {
                    block.add(value.substring(3));
                }
                i++;
                boolean closed = false;
                while (i < lines.size()) {
                    String blockLine = lines.get(i).text();
                    i++;
                    int close = blockLine.indexOf(TRIPLE_QUOTE);
                    if (close >= 0) {
                        String before = blockLine.substring(0, close);
                        if (!before.isEmpty()) {
                            block.add(before);
                        }
                        closed = true;
                        break;
                    }
                    block.add(blockLine);
                }
                if (!closed) {
                    throw new FlowSyntaxException("Unterminated \"\"\" block for '" + key + "'", line.number());
                }
                values.put(key, String.join("\n", block));
                continue;
            }

            if (opensMultilineJson(value)) {
                char open = value.charAt(0);
                char close = open == '[' ? ']' : '}';
                var json = new ArrayList<String>();
                json.add(value);
                int level = count(value, open) - count(value, close);
                i++;
                while (level > 0 && i < lines.size()) {
                    String jsonLine = lines.get(i).text();
                    i++;
                    if (isBlankOrComment(jsonLine)) {
                        continue;
                    }
                    json.add(jsonLine);
                    level += count(jsonLine, open) - count(jsonLine, close);
                }
                if (level > 0) {
                    throw new FlowSyntaxException("Unterminated " + open + " block for '" + key + "'", line.number());
                }
                values.put(key, parseValue(String.join(" ", json)));
                continue;
            }

            values.put(key, parseValue(value));
            i++;
        }
        return values;
    }

    private Map<String, String> parseEnv(Section section) {
        var values = new LinkedHashMap<String, String>();
        for (var line : section.lines()) {
            String text = line.text();
            if (isBlankOrComment(text)) {
                continue;
            }
            int eq = text.indexOf('=');
            if (eq < 0) {
                throw new FlowSyntaxException("Expected 'KEY = value' in [env]", line.number());
            }
            String key = text.substring(0, eq).trim();
            String value = unquote(stripInlineComment(text.substring(eq + 1)).trim());
            if (key.isEmpty()) {
                continue;
            }
            if (value.startsWith("${") && value.endsWith("}")) {
                String variable = value.substring(2, value.length() - 1).trim();
                String resolved = variable.isEmpty() ? null : environment.apply(variable);
                if (resolved == null) {
                    log.warn("Environment variable '{}' referenced by [env] {} is not set", variable, key);
                    resolved = "";
                }
                value = resolved;
            }
            values.put(key, value);
        }
        return values;
    }

    private static Map<String, List<String>> parseEdges(Section section) {
        var edges = new LinkedHashMap<String, List<String>>();
        for (var line : section.lines()) {
            String text = line.text();
            if (isBlankOrComment(text)) {
                continue;
            }
            int eq = text.indexOf('=');
            if (eq < 0) {
                throw new FlowSyntaxException("Expected 'source = target, ...' in [edges]", line.number());
            }
            String source = stripInlineComment(text.substring(0, eq)).trim();
            if (source.isEmpty()) {
                continue;
            }
            var targets = splitList(stripInlineComment(text.substring(eq + 1)));
            if (!targets.isEmpty()) {
                edges.computeIfAbsent(source, ignored -> new ArrayList<>()).addAll(targets);
            }
        }
        return edges;
    }

    // ---------------------------------------------------------------- YAML

    private RawFlow readYaml(String content) {
        var raw = new RawFlow();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException ex) {
            int line = ex.getLocation() == null ? -1 : ex.getLocation().getLineNr();
            throw new FlowSyntaxException("Invalid YAML flow: " + ex.getOriginalMessage(), line, ex);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return raw;
        }
        if (!root.isObject()) {
            throw new FlowSyntaxException("YAML flow root must be a mapping");
        }
        raw.workflow.putAll(objectField(root, "workflow"));
        raw.parameters.putAll(objectField(root, "parameters"));
        raw.settings.putAll(objectField(root, "settings"));
        if (root.has("configuration")) {
            raw.configuration = objectField(root, "configuration");
        }
        if (root.has("deployment")) {
            raw.deployment = objectField(root, "deployment");
        }
        for (var entry : objectField(root, "env").entrySet()) {
            String value = entry.getValue() == null ? "" : String.valueOf(entry.getValue());
            if (value.startsWith("${") && value.endsWith("}")) {
                String resolved = environment.apply(value.substring(2, value.length() - 1).trim());
                value = resolved == null ? "" : resolved;
            }
            raw.env.put(entry.getKey(), value);
        }
        var nodes = root.get("nodes");
        if (nodes != null && !nodes.isNull()) {
            if (!nodes.isObject()) {
                throw new FlowSyntaxException("'nodes' must be a mapping of step id to step definition");
            }
            var fields = nodes.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (!field.getValue().isObject()) {
                    throw new FlowSyntaxException("Node '" + field.getKey() + "' must be a mapping");
                }
                @SuppressWarnings("unchecked")
                var values = (Map<String, Object>) convertNode(field.getValue());
                if (!values.containsKey("type")) {
                    throw new FlowSyntaxException("Node '" + field.getKey() + "' must have a 'type' field");
                }
                raw.nodes.put(field.getKey(), values);
            }
        }
        for (var entry : objectField(root, "edges").entrySet()) {
            Object targets = entry.getValue();
            var list = new ArrayList<String>();
            if (targets instanceof List<?> items) {
                for (Object item : items) {
                    list.add(String.valueOf(item).trim());
                }
            } else if (targets != null) {
                list.addAll(splitList(String.valueOf(targets)));
            }
            if (!list.isEmpty()) {
                raw.edges.put(entry.getKey(), list);
            }
        }
        return raw;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> objectField(JsonNode root, String name) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new FlowSyntaxException("'" + name + "' must be a mapping");
        }
        return (Map<String, Object>) convertNode(node);
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    // ---------------------------------------------------------------- assembly

    private FlowDefinition build(RawFlow raw, String defaultName) {
        var parameters = raw.parameters;
        var workflow = substituteMap(raw.workflow, raw);

        var steps = new ArrayList<StepSpec>();
        for (var entry : raw.nodes.entrySet()) {
            var values = substituteMap(entry.getValue(), raw);
            String type = Objects.toString(values.remove("type"), "").trim();
            if (type.isEmpty()) {
                throw new FlowSyntaxException("Node '" + entry.getKey() + "' has an empty 'type'");
            }
            steps.add(new StepSpec(entry.getKey(), type, values));
        }

        String name = stringValue(workflow, "name", null);
        if (name == null || name.isBlank()) {
            if (!steps.isEmpty()) {
                log.warn("Workflow section has no 'name'; using '{}'", defaultName);
            }
            name = defaultName;
        }

        Optional<String> start = Optional.ofNullable(stringValue(workflow, "start_node", null))
            .filter(value -> !value.isBlank());
        if (start.isPresent()) {
            if (!raw.nodes.containsKey(start.get())) {
                throw new FlowSyntaxException("Workflow 'start_node' ('" + start.get() + "') does not match any node");
            }
        } else {
            start = implicitStart(steps);
        }

        for (var edge : raw.edges.entrySet()) {
            if (!raw.nodes.containsKey(edge.getKey())) {
                throw new FlowSyntaxException("Edge source node '" + edge.getKey() + "' is not defined");
            }
            for (String target : edge.getValue()) {
                if (!raw.nodes.containsKey(target)) {
                    throw new FlowSyntaxException("Edge target node '" + target + "' is not defined");
                }
            }
        }

        String flowName = name;
        Optional<AgentConfig> agent = Optional.ofNullable(raw.configuration)
            .map(section -> toAgentConfig(substituteMap(section, raw), flowName));
        Optional<DeploymentConfig> deployment = Optional.ofNullable(raw.deployment)
            .map(section -> toDeploymentConfig(substituteMap(section, raw)));

        return new FlowDefinition(
            name,
            stringValue(workflow, "description", ""),
            start,
            steps,
            parameters,
            raw.env,
            raw.edges,
            substituteMap(raw.settings, raw),
            agent,
            deployment,
            discoverRoutes(steps, raw.edges)
        );
    }

    private static Optional<String> implicitStart(List<StepSpec> steps) {
        for (var step : steps) {
            if (FlowDefinition.START_TYPE.equals(step.id())) {
                return Optional.of(step.id());
            }
        }
        return steps.stream()
            .filter(step -> FlowDefinition.START_TYPE.equalsIgnoreCase(step.type()))
            .map(StepSpec::id)
            .findFirst();
    }

    private static AgentConfig toAgentConfig(Map<String, Object> section, String flowName) {
        return new AgentConfig(
            stringValue(section, "name", flowName),
            booleanValue(section, "agent_enabled", false),
            stringValue(section, "host", AgentConfig.DEFAULT_HOST),
            intValue(section, "port", AgentConfig.DEFAULT_PORT),
            booleanValue(section, "debug", false),
            booleanValue(section, "cors_enabled", true),
            booleanValue(section, "auto_reload", false),
            booleanValue(section, "auto_execute", false)
        );
    }

    private static DeploymentConfig toDeploymentConfig(Map<String, Object> section) {
        return new DeploymentConfig(
            stringValue(section, "environment", DeploymentConfig.DEFAULT_ENVIRONMENT),
            intValue(section, "workers", 1),
            booleanValue(section, "ssl_enabled", false),
            stringValue(section, "ssl_cert", null),
            stringValue(section, "ssl_key", null)
        );
    }

    private static List<RouteSpec> discoverRoutes(List<StepSpec> steps, Map<String, List<String>> edges) {
        var routes = new ArrayList<RouteSpec>();
        for (var step : steps) {
            if (!"aci".equalsIgnoreCase(step.type())) {
                continue;
            }
            var params = step.params();
            Map<String, Object> block = params.get("params") instanceof Map<?, ?> nested ? castMap(nested) : Map.of();
            String operation = firstString(params, block, "operation");
            if (!"add_route".equals(operation)) {
                continue;
            }
            String path = firstString(params, block, "route_path");
            String handler = firstString(params, block, "handler");
            if (path == null || handler == null) {
                log.warn("Route step '{}' is missing route_path or handler; ignoring it", step.id());
                continue;
            }
            Object methods = params.containsKey("methods") ? params.get("methods") : block.get("methods");
            Object auth = params.containsKey("auth_required") ? params.get("auth_required") : block.get("auth_required");
            routes.add(new RouteSpec(
                step.id(),
                path,
                normalizeMethods(methods),
                handler,
                Objects.toString(params.get("description"), ""),
                Boolean.TRUE.equals(auth) || "true".equalsIgnoreCase(String.valueOf(auth)),
                edges.getOrDefault(step.id(), List.of())
            ));
        }
        return routes;
    }

    private static List<String> normalizeMethods(Object raw) {
        var methods = new ArrayList<String>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                String method = String.valueOf(item).trim();
                if (!method.isEmpty()) {
                    methods.add(method.toUpperCase(Locale.ROOT));
                }
            }
        } else if (raw instanceof String text) {
            Object parsed = text.startsWith("[") && text.endsWith("]") ? parseValue(text) : null;
            if (parsed instanceof List<?>) {
                return normalizeMethods(parsed);
            }
            for (String method : splitList(text)) {
                methods.add(method.toUpperCase(Locale.ROOT));
            }
        }
        return methods;
    }

    // ---------------------------------------------------------------- static placeholders

    private Map<String, Object> substituteMap(Map<String, Object> source, RawFlow raw) {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : source.entrySet()) {
            result.put(entry.getKey(), substitute(entry.getValue(), raw));
        }
        return result;
    }

    private Object substitute(Object value, RawFlow raw) {
        if (value instanceof Map<?, ?> map) {
            return substituteMap(castMap(map), raw);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(substitute(item, raw));
            }
            return copy;
        }
        if (!(value instanceof String text)) {
            return value;
        }
        Matcher whole = PARAMETER_REF.matcher(text.trim());
        if (whole.matches() && raw.parameters.containsKey(whole.group(1))) {
            return raw.parameters.get(whole.group(1));
        }
        String replaced = replaceAll(PARAMETER_REF, text, key -> {
            if (raw.parameters.containsKey(key)) {
                return String.valueOf(raw.parameters.get(key));
            }
            log.warn("Parameter '{}' is not declared in [parameters]", key);
            return null;
        });
        return replaceAll(ENV_REF, replaced, key -> {
            String resolved = environment.apply(key);
            if (resolved == null) {
                resolved = raw.env.get(key);
            }
            if (resolved == null) {
                log.warn("Environment variable '{}' is not set; leaving placeholder", key);
            }
            return resolved;
        });
    }

    private static String replaceAll(Pattern pattern, String text, Function<String, String> lookup) {
        Matcher matcher = pattern.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            String replacement = lookup.apply(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement == null ? matcher.group() : replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // ---------------------------------------------------------------- values

    static Object parseValue(String raw) {
        String value = raw.trim();
        if ((value.startsWith("{{") && value.endsWith("}}")) || (value.startsWith("${") && value.endsWith("}"))) {
            return value;
        }
        if ((value.startsWith("{") && value.endsWith("}")) || (value.startsWith("[") && value.endsWith("]"))) {
            try {
                return JSON.readValue(value, Object.class);
            } catch (JsonProcessingException ex) {
                log.debug("Value is not valid JSON, keeping it as text: {}", value);
            }
        }
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                long number = Long.parseLong(value);
                if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                    return (int) number;
                }
                return number;
            } catch (NumberFormatException ex) {
                return value;
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return unquote(value);
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean opensMultilineJson(String value) {
        return (value.startsWith("[") && !value.endsWith("]")) || (value.startsWith("{") && !value.endsWith("}"));
    }

    private static int count(String text, char target) {
        int total = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                total++;
            }
        }
        return total;
    }

    private static boolean isBlankOrComment(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() || stripped.startsWith("#") || stripped.startsWith(";");
    }

    private static String stripInlineComment(String text) {
        int cut = text.length();
        int hash = text.indexOf('#');
        int semicolon = text.indexOf(';');
        if (hash >= 0) {
            cut = Math.min(cut, hash);
        }
        if (semicolon >= 0) {
            cut = Math.min(cut, semicolon);
        }
        return text.substring(0, cut);
    }

    private static List<String> splitList(String text) {
        var items = new ArrayList<String>();
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static String firstString(Map<String, Object> primary, Map<String, Object> fallback, String key) {
        Object value = primary.containsKey(key) ? primary.get(key) : fallback.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    private static boolean booleanValue(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new FlowSyntaxException("'" + key + "' must be true or false, got: " + text);
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new FlowSyntaxException("'" + key + "' must be an integer, got: " + value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private record Line(int number, String text) {}

    private record Section(String name, int line, List<Line> lines) {}

    private static final class RawFlow {
        private final Map<String, Object> workflow = new LinkedHashMap<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private final Map<String, Object> settings = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
        private final Map<String, List<String>> edges = new LinkedHashMap<>();
        private Map<String, Object> configuration;
        private Map<String, Object> deployment;
    }
}
