package work.mcps.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for running one script file.
 */
public record McpsRunConfiguration(
    Path scriptPath,
    Path workingDirectory,
    Optional<Duration> timeout,
    Optional<Path> envFile,
    LogLevel logLevel
) {
    public McpsRunConfiguration {
        Objects.requireNonNull(scriptPath, "scriptPath");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(envFile, "envFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path scriptPath;
        private Path workingDirectory;
        private Optional<Duration> timeout = Optional.empty();
        private Optional<Path> envFile = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder scriptPath(Path scriptPath) {
            this.scriptPath = scriptPath;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder envFile(Optional<Path> envFile) {
            this.envFile = envFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public McpsRunConfiguration build() {
            Path script = scriptPath;
            Path directory = workingDirectory;
            if (directory == null && script != null) {
                Path parent = script.toAbsolutePath().getParent();
                directory = parent != null ? parent : Path.of(".").toAbsolutePath();
            }
            return new McpsRunConfiguration(script, directory, timeout, envFile, logLevel);
        }
    }
}
