package io.act.engine.runtime;

import io.act.engine.capability.BuiltinCapabilities;

/**
 * Startup registration table shared by the CLI, the embedding API and tests.
 */
public final class CapabilityCatalog {
    private CapabilityCatalog() {}

    public static CapabilityRegistry create() {
        return create(false);
    }

    public static CapabilityRegistry create(boolean strict) {
        var registry = new CapabilityRegistry(strict);
        BuiltinCapabilities.register(registry);
        return registry;
    }
}
