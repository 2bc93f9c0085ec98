package io.act.engine.runtime;

@FunctionalInterface
public interface CapabilityFactory {
    Capability create();
}
