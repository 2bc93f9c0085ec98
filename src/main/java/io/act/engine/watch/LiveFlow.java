package io.act.engine.watch;

import io.act.engine.flow.FlowDefinition;
import io.act.engine.flow.FlowLoader;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The flow currently served. Reloads swap in a freshly parsed definition; runs that already
 * captured the previous instance keep using it.
 */
public final class LiveFlow {
    private static final Logger log = LoggerFactory.getLogger(LiveFlow.class);

    private final ReentrantLock lock = new ReentrantLock();
    private FlowDefinition current;
    private long generation;

    public LiveFlow(FlowDefinition initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public FlowDefinition get() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the definition that was replaced
     */
    public FlowDefinition swap(FlowDefinition next) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            var previous = current;
            current = next;
            generation++;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    public ReloadCallback reloadCallback(FlowLoader loader) {
        return reloadCallback(loader, UnaryOperator.identity());
    }

    /**
     * Callback that re-parses the event content, passes it through {@code prepare} and swaps it in.
     * A parse failure propagates to the watcher, which logs it, and the previous definition stays live.
     */
    public ReloadCallback reloadCallback(FlowLoader loader, UnaryOperator<FlowDefinition> prepare) {
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(prepare, "prepare");
        return event -> {
            if (event.content().isEmpty()) {
                log.warn("Flow file {} disappeared; keeping flow '{}'", event.path(), get().name());
                return;
            }
            var next = prepare.apply(loader.fromSource(event.path(), event.content().get()));
            swap(next);
            log.info("Reloaded flow '{}' ({} steps)", next.name(), next.steps().size());
        };
    }
}
