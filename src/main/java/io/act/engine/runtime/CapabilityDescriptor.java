package io.act.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Self-description returned by {@link Capability#describe()}.
 */
public record CapabilityDescriptor(
    String name,
    String version,
    String description,
    List<ParameterSpec> parameters,
    Map<String, String> outputs
) {
    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name");
        version = version == null ? "1.0.0" : version;
        description = description == null ? "" : description;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static CapabilityDescriptor of(String name, String description) {
        return new CapabilityDescriptor(name, null, description, List.of(), Map.of());
    }

    public Optional<ParameterSpec> parameter(String parameterName) {
        return parameters.stream().filter(spec -> spec.name().equals(parameterName)).findFirst();
    }

    /**
     * Undeclared parameters count as required.
     */
    public boolean isRequired(String parameterName) {
        return parameter(parameterName).map(ParameterSpec::required).orElse(true);
    }
}
