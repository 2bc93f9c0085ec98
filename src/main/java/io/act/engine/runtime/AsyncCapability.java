package io.act.engine.runtime;

import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Capability whose work completes asynchronously. The scheduler waits on the returned stage.
 */
public interface AsyncCapability extends Capability {
    CompletionStage<CapabilityResult> executeAsync(Map<String, Object> input);

    @Override
    default CapabilityResult execute(Map<String, Object> input) throws Exception {
        try {
            return executeAsync(input).toCompletableFuture().get();
        } catch (ExecutionException ex) {
            var cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw ex;
        }
    }
}
