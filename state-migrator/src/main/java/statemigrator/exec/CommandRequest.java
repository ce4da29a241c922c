package statemigrator.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One external command invocation: an argument vector, never a shell string.
 *
 * @param argv executable followed by its arguments
 * @param workingDir directory the process runs in, or null for the current directory
 * @param timeout maximum wall-clock time before the process tree is destroyed
 * @param dryRun when true the command is logged and not executed
 * @param environment extra environment entries; values are never logged
 */
public record CommandRequest(
        List<String> argv,
        Path workingDir,
        Duration timeout,
        boolean dryRun,
        Map<String, String> environment
) {

    public CommandRequest {
        Objects.requireNonNull(argv, "argv");
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("argv must not be empty");
        }
        argv = List.copyOf(argv);
        timeout = timeout != null ? timeout : Duration.ZERO;
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }

    /** Returns the executable name, used in log lines and timeout messages. */
    public String executable() {
        return argv.get(0);
    }

    /** Returns the invocation as a single display string; not for execution. */
    public String display() {
        return String.join(" ", argv);
    }

    public static Builder builder(List<String> argv) {
        return new Builder(argv);
    }

    public static Builder builder(String... argv) {
        return new Builder(List.of(argv));
    }

    /**
     * Builder for {@link CommandRequest}.
     */
    public static final class Builder {
        private final List<String> argv;
        private Path workingDir;
        private Duration timeout = Duration.ZERO;
        private boolean dryRun;
        private final Map<String, String> environment = new LinkedHashMap<>();

        private Builder(List<String> argv) {
            this.argv = argv;
        }

        public Builder workingDir(Path workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            return timeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder env(String name, String value) {
            if (value != null) {
                this.environment.put(name, value);
            }
            return this;
        }

        public CommandRequest build() {
            return new CommandRequest(argv, workingDir, timeout, dryRun, environment);
        }
    }
}
