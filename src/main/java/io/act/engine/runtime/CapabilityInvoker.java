package io.act.engine.runtime;

import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Calls blocking and asynchronous capabilities the same way: both return once the work is done.
 */
public final class CapabilityInvoker {
    private CapabilityInvoker() {}

    public static CapabilityResult invoke(Capability capability, Map<String, Object> input) throws Exception {
        if (capability instanceof AsyncCapability async) {
            try {
                return async.executeAsync(input).toCompletableFuture().get();
            } catch (ExecutionException ex) {
                var cause = ex.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw ex;
            }
        }
        return capability.execute(input);
    }
}
