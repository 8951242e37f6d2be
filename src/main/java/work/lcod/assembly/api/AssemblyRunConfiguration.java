package work.lcod.assembly.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of an {@link AssemblyRunner} run. An absent log level defers to the
 * settings file, then to {@link LogLevel#WARN}.
 */
public record AssemblyRunConfiguration(ModelTarget modelTarget, Optional<Path> settingsFile, Optional<LogLevel> logLevel) {
    public AssemblyRunConfiguration {
        Objects.requireNonNull(modelTarget, "modelTarget");
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ModelTarget modelTarget;
        private Optional<Path> settingsFile = Optional.empty();
        private Optional<LogLevel> logLevel = Optional.empty();

        public Builder modelTarget(ModelTarget modelTarget) {
            this.modelTarget = modelTarget;
            return this;
        }

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = Optional.ofNullable(settingsFile);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Optional.ofNullable(logLevel);
            return this;
        }

        public AssemblyRunConfiguration build() {
            return new AssemblyRunConfiguration(modelTarget, settingsFile, logLevel);
        }
    }
}
