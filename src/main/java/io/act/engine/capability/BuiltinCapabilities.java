package io.act.engine.capability;

import io.act.engine.runtime.Capability;
import io.act.engine.runtime.CapabilityDescriptor;
import io.act.engine.runtime.CapabilityRegistry;
import io.act.engine.runtime.CapabilityResult;
import io.act.engine.runtime.ParameterSpec;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility capabilities available to every flow without plugins.
 */
public final class BuiltinCapabilities {
    private static final Logger flowLog = LoggerFactory.getLogger("io.act.engine.flow.log");

    static final CapabilityDescriptor START = new CapabilityDescriptor(
        "start", "1.0.0", "Entry point; passes its parameters and the run input through.",
        List.of(), Map.of("result", "object"));
    static final CapabilityDescriptor SET = new CapabilityDescriptor(
        "set", "1.0.0", "Produces a value, optionally wrapped under a key.",
        List.of(
            ParameterSpec.required("value", "any", "Value to produce"),
            ParameterSpec.optional("key", "string", "Wraps the value as {key: value}")),
        Map.of("result", "any"));
    static final CapabilityDescriptor LOG_MESSAGE = new CapabilityDescriptor(
        "log_message", "1.0.0", "Writes a message to the engine log.",
        List.of(
            ParameterSpec.required("message", "string", "Text to log"),
            ParameterSpec.optional("level", "string", "trace, debug, info, warn or error")),
        Map.of("message", "string", "level", "string"));

    private BuiltinCapabilities() {}

    public static CapabilityRegistry register(CapabilityRegistry registry) {
        registry.register("start", () -> simple(START, BuiltinCapabilities::start));
        registry.register("set", () -> simple(SET, BuiltinCapabilities::set));
        registry.register("log_message", () -> simple(LOG_MESSAGE, BuiltinCapabilities::logMessage), "log");
        registry.register("delay", DelayCapability::new, "sleep");
        return registry;
    }

    private static CapabilityResult start(Map<String, Object> input) {
        return CapabilityResult.success(new LinkedHashMap<>(input));
    }

    private static CapabilityResult set(Map<String, Object> input) {
        if (!input.containsKey("value")) {
            return CapabilityResult.error("'value' is required");
        }
        Object value = input.get("value");
        Object key = input.get("key");
        if (key == null) {
            return CapabilityResult.success(value);
        }
        var wrapped = new LinkedHashMap<String, Object>();
        wrapped.put(String.valueOf(key), value);
        return CapabilityResult.success(wrapped);
    }

    private static CapabilityResult logMessage(Map<String, Object> input) {
        Object message = input.get("message");
        if (message == null) {
            return CapabilityResult.error("'message' is required");
        }
        String level = String.valueOf(input.getOrDefault("level", "info")).toLowerCase(Locale.ROOT);
        String text = String.valueOf(message);
        switch (level) {
            case "trace" -> flowLog.trace(text);
            case "debug" -> flowLog.debug(text);
            case "warn", "warning" -> flowLog.warn(text);
            case "error" -> flowLog.error(text);
            default -> {
                level = "info";
                flowLog.info(text);
            }
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("message", text);
        result.put("level", level);
        return CapabilityResult.success(result);
    }

    private static Capability simple(CapabilityDescriptor descriptor, Body body) {
        return new Capability() {
            @Override
            public CapabilityDescriptor describe() {
                return descriptor;
            }

            @Override
            public CapabilityResult execute(Map<String, Object> input) {
                return body.apply(input == null ? Map.of() : input);
            }
        };
    }

    @FunctionalInterface
    private interface Body {
        CapabilityResult apply(Map<String, Object> input);
    }
}
