package io.act.engine.watch;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivered to reload callbacks. {@code content} is the latest file content, absent when the file disappeared.
 */
public record ReloadEvent(Kind kind, Path path, Optional<String> content) {
    public enum Kind {
        CHANGED,
        DISAPPEARED,
        FORCED
    }

    public ReloadEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        content = content == null ? Optional.empty() : content;
    }
}
