package io.act.engine.support;

import io.act.engine.runtime.Capability;
import io.act.engine.runtime.CapabilityProvider;
import io.act.engine.runtime.CapabilityResult;
import io.act.engine.runtime.ParameterSpec;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Stand-in for an authenticated integration: echoes the operation and the parameters it received.
 */
public final class FakeRemoteProvider implements CapabilityProvider {
    @Override
    public String type() {
        return "fake_remote";
    }

    @Override
    public Capability create() {
        return ActTestSupport.capability("fake_remote",
            List.of(ParameterSpec.required("operation", "string", "operation"),
                ParameterSpec.optional("token", "string", "auth token")),
            input -> {
                if ("fail".equals(input.get("operation"))) {
                    return CapabilityResult.error("remote refused");
                }
                return CapabilityResult.success(new LinkedHashMap<>(input));
            });
    }
}
