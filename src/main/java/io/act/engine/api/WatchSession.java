package io.act.engine.api;

import io.act.engine.dispatch.RunOnceExecutor;
import io.act.engine.watch.FlowWatcher;
import io.act.engine.watch.LiveFlow;
import java.util.concurrent.CountDownLatch;

/**
 * Handle on a watched flow started by {@link ActRunner#watch}. Closing it stops the watcher.
 */
public final class WatchSession implements AutoCloseable {
    private final FlowWatcher watcher;
    private final LiveFlow flow;
    private final RunOnceExecutor executor;
    private final CountDownLatch closed = new CountDownLatch(1);

    WatchSession(FlowWatcher watcher, LiveFlow flow, RunOnceExecutor executor) {
        this.watcher = watcher;
        this.flow = flow;
        this.executor = executor;
    }

    public FlowWatcher watcher() {
        return watcher;
    }

    public LiveFlow flow() {
        return flow;
    }

    public RunOnceExecutor executor() {
        return executor;
    }

    /**
     * Blocks until {@link #close()} is called from another thread.
     */
    public void awaitClose() throws InterruptedException {
        closed.await();
    }

    @Override
    public void close() {
        watcher.stop();
        closed.countDown();
    }
}
