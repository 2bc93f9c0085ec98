package io.act.engine.watch;

import io.act.engine.error.ReloadCallbackException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a flow file and notifies callbacks when its content really changes.
 *
 * <p>Each tick compares the modification time first and the full content only when the time
 * moved. A touch that leaves the content unchanged just refreshes the remembered time. A
 * detected change is confirmed after the debounce interval before callbacks run; the
 * remembered state is committed together with the notification, under the callback lock.
 */
public final class FlowWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FlowWatcher.class);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(500);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final Path path;
    private final Duration pollInterval;
    private final Duration debounce;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Subscription> callbacks = new ArrayList<>();
    private final Object lifecycle = new Object();
    private FileState lastKnown;
    private Thread worker;
    private volatile boolean running;

    public FlowWatcher(Path path) {
        this(path, DEFAULT_POLL_INTERVAL, DEFAULT_DEBOUNCE);
    }

    public FlowWatcher(Path path, Duration pollInterval, Duration debounce) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("Debounce must not be negative: " + debounce);
        }
    }

    public Path path() {
        return path;
    }

    public void register(ReloadCallback callback) {
        register(callback.getClass().getSimpleName(), callback);
    }

    public void register(String name, ReloadCallback callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            callbacks.add(new Subscription(name == null || name.isBlank() ? "callback-" + callbacks.size() : name, callback));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Captures the current file state as the baseline and starts the polling thread.
     */
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                log.warn("Watcher for {} is already running", path);
                return;
            }
            prime();
            running = true;
            worker = new Thread(this::loop, "act-flow-watcher");
            worker.setDaemon(true);
            worker.start();
            log.info("Watching {} (poll {} ms, debounce {} ms)", path, pollInterval.toMillis(), debounce.toMillis());
        }
    }

    public void stop() {
        Thread thread;
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            thread = worker;
            worker = null;
        }
        thread.interrupt();
        try {
            thread.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Watcher thread for {} did not stop within {} ms", path, STOP_TIMEOUT.toMillis());
        } else {
            log.info("Stopped watching {}", path);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Remembers the current state without notifying anyone.
     */
    public void prime() {
        var current = readState();
        lock.lock();
        try {
            lastKnown = current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one detection cycle, debounce included.
     *
     * @return {@code true} when callbacks were notified
     */
    public boolean poll() {
        var observed = readState();
        lock.lock();
        try {
            if (!differs(observed)) {
                return false;
            }
        } finally {
            lock.unlock();
        }

        if (!debounce.isZero()) {
            try {
                Thread.sleep(debounce.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        var confirmed = readState();
        lock.lock();
        try {
            if (!differs(confirmed)) {
                log.debug("Change to {} did not persist through debounce", path);
                return false;
            }
            var event = confirmed == null
                ? new ReloadEvent(ReloadEvent.Kind.DISAPPEARED, path, Optional.empty())
                : new ReloadEvent(ReloadEvent.Kind.CHANGED, path, Optional.of(confirmed.content()));
            log.info("Flow file {} {}", path, confirmed == null ? "disappeared" : "changed");
            notifyCallbacks(event);
            lastKnown = confirmed;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Notifies callbacks with the current content regardless of change detection.
     */
    public void forceReload() {
        var current = readState();
        lock.lock();
        try {
            log.info("Forced reload of {}", path);
            var content = current == null ? Optional.<String>empty() : Optional.of(current.content());
            notifyCallbacks(new ReloadEvent(ReloadEvent.Kind.FORCED, path, content));
            lastKnown = current;
        } finally {
            lock.unlock();
        }
    }

    public WatcherInfo info() {
        try {
            var modified = Files.getLastModifiedTime(path);
            return new WatcherInfo(path, true, Files.size(path), Optional.of(modified.toInstant()), running);
        } catch (IOException ex) {
            return new WatcherInfo(path, false, 0L, Optional.empty(), running);
        }
    }

    /**
     * Compares against the remembered state; a touch-only change refreshes the remembered time.
     * Must be called with the lock held.
     */
    private boolean differs(FileState observed) {
        if (lastKnown == null || observed == null) {
            return lastKnown != observed;
        }
        if (observed.modified().equals(lastKnown.modified())) {
            return false;
        }
        if (observed.content().equals(lastKnown.content())) {
            lastKnown = observed;
            return false;
        }
        return true;
    }

    /**
     * Must be called with the lock held. Iterates a snapshot, so a callback may register
     * further callbacks; those see the next event.
     */
    private void notifyCallbacks(ReloadEvent event) {
        for (var subscription : List.copyOf(callbacks)) {
            try {
                subscription.callback().onReload(event);
            } catch (Exception ex) {
                var failure = new ReloadCallbackException(subscription.name(), ex);
                log.error(failure.getMessage(), failure);
            }
        }
    }

    private void loop() {
        while (running) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                poll();
            } catch (RuntimeException ex) {
                log.error("Watcher tick for {} failed", path, ex);
            }
        }
    }

    private FileState readState() {
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return new FileState(modified, content);
        } catch (NoSuchFileException ex) {
            return null;
        } catch (IOException ex) {
            log.warn("Unable to read {}: {}", path, ex.getMessage());
            return lastKnownSnapshot();
        }
    }

    private FileState lastKnownSnapshot() {
        lock.lock();
        try {
            return lastKnown;
        } finally {
            lock.unlock();
        }
    }

    private record FileState(FileTime modified, String content) {}

    private record Subscription(String name, ReloadCallback callback) {}
}
