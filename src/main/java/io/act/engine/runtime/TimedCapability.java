package io.act.engine.runtime;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the duration of a wrapped capability call. A call that exceeds the bound completes
 * exceptionally with {@link java.util.concurrent.TimeoutException}.
 */
public final class TimedCapability implements AsyncCapability {
    private static final ExecutorService BLOCKING_CALLS = Executors.newCachedThreadPool(runnable -> {
        var thread = new Thread(runnable, "act-step");
        thread.setDaemon(true);
        return thread;
    });

    private final Capability delegate;
    private final Duration timeout;

    public TimedCapability(Capability delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public CapabilityDescriptor describe() {
        return delegate.describe();
    }

    @Override
    public CompletionStage<CapabilityResult> executeAsync(Map<String, Object> input) {
        CompletableFuture<CapabilityResult> call;
        if (delegate instanceof AsyncCapability async) {
            call = async.executeAsync(input).toCompletableFuture();
        } else {
            call = CompletableFuture.supplyAsync(() -> {
                try {
                    return delegate.execute(input);
                } catch (RuntimeException ex) {
                    throw ex;
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, BLOCKING_CALLS);
        }
        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
