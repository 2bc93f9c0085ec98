package io.act.engine.watch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

public record WatcherInfo(Path path, boolean exists, long size, Optional<Instant> modified, boolean watching) {}
