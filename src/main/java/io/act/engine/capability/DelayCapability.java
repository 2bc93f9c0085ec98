package io.act.engine.capability;

import io.act.engine.runtime.AsyncCapability;
import io.act.engine.runtime.CapabilityDescriptor;
import io.act.engine.runtime.CapabilityResult;
import io.act.engine.runtime.ParameterSpec;
import io.act.engine.shared.DurationParser;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Completes after {@code duration} (milliseconds or a string such as {@code 2s}) without blocking a thread.
 */
public final class DelayCapability implements AsyncCapability {
    static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
        "delay", "1.0.0", "Waits for the given duration.",
        List.of(ParameterSpec.required("duration", "duration", "Milliseconds or 500ms/2s/1m")),
        Map.of("delayed_ms", "number"));

    @Override
    public CapabilityDescriptor describe() {
        return DESCRIPTOR;
    }

    @Override
    public CompletionStage<CapabilityResult> executeAsync(Map<String, Object> input) {
        Duration duration;
        try {
            duration = DurationParser.fromValue(input.get("duration"));
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.completedFuture(CapabilityResult.error(ex.getMessage()));
        }
        long millis = duration.toMillis();
        var executor = CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> CapabilityResult.success(Map.of("delayed_ms", millis)), executor);
    }
}
