package io.act.engine.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowWatcherTest {
    @TempDir
    Path dir;

    private Path file;
    private Instant clock;
    private final List<ReloadEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        file = dir.resolve("Actfile");
        clock = Instant.parse("2026-01-01T00:00:00Z");
        write("[node:start]\ntype = start\n");
    }

    private FlowWatcher watcher() {
        var watcher = new FlowWatcher(file, Duration.ofMillis(20), Duration.ZERO);
        watcher.register("record", events::add);
        watcher.prime();
        return watcher;
    }

    private void write(String content) throws Exception {
        Files.writeString(file, content, StandardCharsets.UTF_8);
        touch();
    }

    private void touch() throws Exception {
        clock = clock.plusSeconds(5);
        Files.setLastModifiedTime(file, FileTime.from(clock));
    }

    @Test
    void unchangedFileDoesNotNotify() {
        var watcher = watcher();
        assertFalse(watcher.poll());
        assertTrue(events.isEmpty());
    }

    @Test
    void touchWithoutContentChangeDoesNotNotify() throws Exception {
        var watcher = watcher();
        touch();
        assertFalse(watcher.poll());
        assertFalse(watcher.poll());
        assertTrue(events.isEmpty());
    }

    @Test
    void contentChangeNotifiesOnceWithNewContent() throws Exception {
        var watcher = watcher();
        write("[node:start]\ntype = start\n[node:next]\ntype = set\nvalue = 1\n");

        assertTrue(watcher.poll());
        assertFalse(watcher.poll());

        assertEquals(1, events.size());
        assertEquals(ReloadEvent.Kind.CHANGED, events.get(0).kind());
        assertTrue(events.get(0).content().orElseThrow().contains("[node:next]"));
    }

    @Test
    void deletionAndReappearanceAreBothChanges() throws Exception {
        var watcher = watcher();
        Files.delete(file);

        assertTrue(watcher.poll());
        assertEquals(ReloadEvent.Kind.DISAPPEARED, events.get(0).kind());
        assertEquals(Optional.empty(), events.get(0).content());
        assertFalse(watcher.poll());

        write("[node:start]\ntype = start\n");
        assertTrue(watcher.poll());
        assertEquals(ReloadEvent.Kind.CHANGED, events.get(1).kind());
    }

    @Test
    void failingCallbackDoesNotStopLaterCallbacks() throws Exception {
        var watcher = new FlowWatcher(file, Duration.ofMillis(20), Duration.ZERO);
        watcher.register("explodes", event -> {
            throw new IllegalStateException("bad reload");
        });
        watcher.register("record", events::add);
        watcher.prime();
        write("[node:other]\ntype = start\n");

        assertTrue(watcher.poll());
        assertEquals(1, events.size());
        assertFalse(watcher.poll());
    }

    @Test
    void callbackRegisteringAnotherDoesNotStopTheRest() throws Exception {
        var watcher = new FlowWatcher(file, Duration.ofMillis(20), Duration.ZERO);
        var late = new CopyOnWriteArrayList<ReloadEvent>();
        watcher.register("subscriber", event -> watcher.register("late", late::add));
        watcher.register("record", events::add);
        watcher.prime();

        watcher.forceReload();
        assertEquals(1, events.size());
        assertTrue(late.isEmpty());

        write("[node:other]\ntype = start\n");
        assertTrue(watcher.poll());
        assertEquals(2, events.size());
        assertEquals(1, late.size());
        assertFalse(watcher.poll());
    }

    @Test
    void changeReversedDuringDebounceIsIgnored() throws Exception {
        var original = Files.readString(file);
        var watcher = new FlowWatcher(file, Duration.ofMillis(20), Duration.ofMillis(200));
        watcher.register("record", events::add);
        watcher.prime();

        write("[node:temp]\ntype = start\n");
        var revert = new Thread(() -> {
            try {
                Thread.sleep(50);
                write(original);
            } catch (Exception ex) {
                throw new IllegalStateException(ex);
            }
        });
        revert.start();

        assertFalse(watcher.poll());
        revert.join();
        assertTrue(events.isEmpty());
    }

    @Test
    void forceReloadBypassesDetection() {
        var watcher = watcher();

        watcher.forceReload();

        assertEquals(1, events.size());
        assertEquals(ReloadEvent.Kind.FORCED, events.get(0).kind());
        assertTrue(events.get(0).content().isPresent());
    }

    @Test
    void backgroundLoopPicksUpChangesAndStops() throws Exception {
        var latch = new CountDownLatch(1);
        var watcher = new FlowWatcher(file, Duration.ofMillis(20), Duration.ofMillis(10));
        watcher.register("latch", event -> latch.countDown());

        watcher.start();
        watcher.start();
        assertTrue(watcher.isRunning());
        write("[node:start]\ntype = start\n# edited\n");

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        watcher.close();
        assertFalse(watcher.isRunning());
        watcher.stop();
    }

    @Test
    void reportsFileInfo() throws Exception {
        var watcher = watcher();
        var info = watcher.info();

        assertTrue(info.exists());
        assertEquals(Files.size(file), info.size());
        assertEquals(Optional.of(clock), info.modified());
        assertFalse(info.watching());

        Files.delete(file);
        assertFalse(watcher.info().exists());
    }
}
