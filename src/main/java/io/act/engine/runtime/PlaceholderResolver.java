package io.act.engine.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{...}}} references inside step parameters.
 *
 * <p>Supported forms: {@code stepId.result.a.b} (walks the recorded {@code status/result/error}
 * of a step; the result of a step that did not succeed stays unresolved), {@code .env.VAR}, {@code input.a.b} (the run's initial input). Path segments may
 * be numeric or use {@code [n]} to index lists, and {@code expr | literal} supplies a fallback.
 * Anything that cannot be resolved is left exactly as written.
 */
public final class PlaceholderResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*\\}\\}");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final Pattern INDEX = Pattern.compile("\\[([^\\]]*)\\]");
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String ENV_PREFIX = ".env.";
    static final String INPUT_ROOT = "input";
    private static final String RESULT = "result";
    private static final Object UNRESOLVED = new Object();

    private final Function<String, String> environment;

    public PlaceholderResolver() {
        this(System::getenv);
    }

    public PlaceholderResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public Object resolve(Object value, ExecutionContext context) {
        return resolveDeep(value, context);
    }

    public Object resolveDeep(Object value, ExecutionContext context) {
        if (value instanceof String text) {
            return resolveString(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            var resolved = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> resolved.put(String.valueOf(key), resolveDeep(item, context)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            var resolved = new ArrayList<Object>(list.size());
            for (Object item : list) {
                resolved.add(resolveDeep(item, context));
            }
            return resolved;
        }
        return value;
    }

    public Map<String, Object> resolveParams(Map<String, Object> params, ExecutionContext context) {
        var resolved = new LinkedHashMap<String, Object>();
        if (params != null) {
            params.forEach((key, value) -> resolved.put(key, resolveDeep(value, context)));
        }
        return resolved;
    }

    private Object resolveString(String text, ExecutionContext context) {
        Matcher whole = PLACEHOLDER.matcher(text.trim());
        if (whole.matches()) {
            Object value = evaluate(whole.group(1), context);
            return value == UNRESOLVED ? text : value;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            Object value = evaluate(matcher.group(1), context);
            String replacement = value == UNRESOLVED ? matcher.group() : stringify(value);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Object evaluate(String expression, ExecutionContext context) {
        String path = expression;
        String fallback = null;
        int pipe = expression.indexOf('|');
        if (pipe >= 0) {
            path = expression.substring(0, pipe).trim();
            fallback = expression.substring(pipe + 1).trim();
        }
        Object value = lookup(path, context);
        if ((value == UNRESOLVED || value == null) && fallback != null) {
            return parseLiteral(fallback);
        }
        return value;
    }

    private Object lookup(String path, ExecutionContext context) {
        if (path.isEmpty()) {
            return UNRESOLVED;
        }
        if (path.startsWith(ENV_PREFIX)) {
            String name = path.substring(ENV_PREFIX.length()).trim();
            String value = name.isEmpty() ? null : environment.apply(name);
            return value == null ? UNRESOLVED : value;
        }
        var segments = segments(path);
        if (segments.isEmpty()) {
            return UNRESOLVED;
        }
        String root = segments.get(0);
        var rest = segments.subList(1, segments.size());
        var step = context == null ? null : context.result(root).orElse(null);
        if (step != null) {
            Map<String, Object> recorded = step.toMap();
            if (rest.isEmpty()) {
                return recorded;
            }
            String field = rest.get(0);
            if (!RESULT.equals(field) && recorded.containsKey(field)) {
                return walk(recorded, rest);
            }
            // a step that did not succeed has no result to walk into
            if (!step.succeeded()) {
                return UNRESOLVED;
            }
            return walk(step.result(), RESULT.equals(field) ? rest.subList(1, rest.size()) : rest);
        }
        if (INPUT_ROOT.equals(root) && context != null) {
            return walk(context.input(), rest);
        }
        return UNRESOLVED;
    }

    private static Object walk(Object start, List<String> segments) {
        Object current = start;
        for (String segment : segments) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    return UNRESOLVED;
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException ex) {
                    return UNRESOLVED;
                }
                if (index < 0 || index >= list.size()) {
                    return UNRESOLVED;
                }
                current = list.get(index);
            } else {
                return UNRESOLVED;
            }
        }
        return current;
    }

    /**
     * Splits {@code a.b[0].c} into {@code [a, b, 0, c]}.
     */
    static List<String> segments(String path) {
        var parts = new ArrayList<String>();
        for (String raw : path.split("\\.")) {
            String piece = raw.trim();
            int bracket = piece.indexOf('[');
            if (bracket < 0) {
                if (!piece.isEmpty()) {
                    parts.add(piece);
                }
                continue;
            }
            if (bracket > 0) {
                parts.add(piece.substring(0, bracket));
            }
            var indexes = INDEX.matcher(piece.substring(bracket));
            while (indexes.find()) {
                parts.add(indexes.group(1).trim());
            }
        }
        return parts;
    }

    private static Object parseLiteral(String literal) {
        if ("null".equals(literal)) {
            return null;
        }
        if ("true".equals(literal)) {
            return Boolean.TRUE;
        }
        if ("false".equals(literal)) {
            return Boolean.FALSE;
        }
        if (NUMBER.matcher(literal).matches()) {
            if (literal.contains(".") || literal.contains("e") || literal.contains("E")) {
                return Double.parseDouble(literal);
            }
            try {
                return Integer.parseInt(literal);
            } catch (NumberFormatException ex) {
                return Long.parseLong(literal);
            }
        }
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Root identifiers referenced by placeholders in {@code value}; environment references are excluded.
     */
    public static Set<String> references(Object value) {
        var refs = new LinkedHashSet<String>();
        collectReferences(value, refs);
        return refs;
    }

    private static void collectReferences(Object value, Set<String> refs) {
        if (value instanceof String text) {
            Matcher matcher = PLACEHOLDER.matcher(text);
            while (matcher.find()) {
                String expression = matcher.group(1);
                int pipe = expression.indexOf('|');
                String path = (pipe >= 0 ? expression.substring(0, pipe) : expression).trim();
                if (path.isEmpty() || path.startsWith(".")) {
                    continue;
                }
                var segments = segments(path);
                if (!segments.isEmpty()) {
                    refs.add(segments.get(0));
                }
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object item : map.values()) {
                collectReferences(item, refs);
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                collectReferences(item, refs);
            }
        }
    }

    public static boolean hasUnresolved(Object value) {
        if (value instanceof String text) {
            return PLACEHOLDER.matcher(text).find();
        }
        if (value instanceof Map<?, ?> map) {
            for (Object item : map.values()) {
                if (hasUnresolved(item)) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (hasUnresolved(item)) {
                    return true;
                }
            }
        }
        return false;
    }
}
