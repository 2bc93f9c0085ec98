package io.act.engine.runtime;

import java.util.Map;

/**
 * Uniform contract every step type implements. Instances are created per step through a
 * {@link CapabilityFactory} and are not shared between steps.
 */
public interface Capability {
    CapabilityDescriptor describe();

    CapabilityResult execute(Map<String, Object> input) throws Exception;
}
