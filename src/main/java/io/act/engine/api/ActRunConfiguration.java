package io.act.engine.api;

import io.act.engine.watch.FlowWatcher;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for one {@link ActRunner} invocation.
 */
public record ActRunConfiguration(
    Path flowPath,
    Path workingDirectory,
    Optional<Path> profilePath,
    List<Path> capabilityDirectories,
    String inputPayload,
    Optional<Duration> stepTimeout,
    boolean watch,
    Duration pollInterval,
    Duration debounce,
    boolean planOnly,
    LogLevel logLevel
) {
    public ActRunConfiguration {
        Objects.requireNonNull(flowPath, "flowPath");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(profilePath, "profilePath");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(logLevel, "logLevel");
        capabilityDirectories = capabilityDirectories == null ? List.of() : List.copyOf(capabilityDirectories);
    }

    /**
     * Flow path resolved against the working directory.
     */
    public Path resolvedFlowPath() {
        return workingDirectory.resolve(flowPath).normalize();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path flowPath;
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private Optional<Path> profilePath = Optional.empty();
        private List<Path> capabilityDirectories = List.of();
        private String inputPayload = "{}";
        private Optional<Duration> stepTimeout = Optional.empty();
        private boolean watch;
        private Duration pollInterval = FlowWatcher.DEFAULT_POLL_INTERVAL;
        private Duration debounce = FlowWatcher.DEFAULT_DEBOUNCE;
        private boolean planOnly;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder flowPath(Path flowPath) {
            this.flowPath = flowPath;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder profilePath(Optional<Path> profilePath) {
            this.profilePath = profilePath;
            return this;
        }

        public Builder capabilityDirectories(List<Path> capabilityDirectories) {
            this.capabilityDirectories = capabilityDirectories;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder stepTimeout(Optional<Duration> stepTimeout) {
            this.stepTimeout = stepTimeout;
            return this;
        }

        public Builder watch(boolean watch) {
            this.watch = watch;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder debounce(Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder planOnly(boolean planOnly) {
            this.planOnly = planOnly;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ActRunConfiguration build() {
            return new ActRunConfiguration(
                flowPath,
                workingDirectory,
                profilePath,
                capabilityDirectories,
                inputPayload,
                stepTimeout,
                watch,
                pollInterval,
                debounce,
                planOnly,
                logLevel
            );
        }
    }
}
