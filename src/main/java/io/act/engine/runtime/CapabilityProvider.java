package io.act.engine.runtime;

import java.util.List;

/**
 * Service interface for capabilities shipped in separate jars. Implementations are listed in
 * {@code META-INF/services/io.act.engine.runtime.CapabilityProvider} and picked up by
 * {@link CapabilityRegistry#discover(java.nio.file.Path)}.
 */
public interface CapabilityProvider {
    String type();

    default List<String> aliases() {
        return List.of();
    }

    Capability create();
}
