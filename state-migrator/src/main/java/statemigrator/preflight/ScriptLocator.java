package statemigrator.preflight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.stage.impl.StateCopyStage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the directory holding the state-copy script.
 *
 * <p>Search order: the explicit path, the {@code PLATFORM_SCRIPTS_PATH} environment
 * variable, then {@code ~/repos/platform-scripts}, {@code ~/source/repos/platform-scripts},
 * {@code /opt/platform-scripts} and {@code /usr/local/platform-scripts}.
 */
public final class ScriptLocator {

    private static final Logger log = LoggerFactory.getLogger(ScriptLocator.class);

    public static final String ENV_VAR = "PLATFORM_SCRIPTS_PATH";

    private ScriptLocator() {}

    /**
     * Locates the scripts directory using the process environment and home directory.
     */
    public static Optional<Path> locate(Path explicit) {
        return locate(explicit, System.getenv(), Path.of(System.getProperty("user.home")));
    }

    static Optional<Path> locate(Path explicit, Map<String, String> env, Path home) {
        for (Path candidate : candidates(explicit, env, home)) {
            if (Files.isRegularFile(candidate.resolve(StateCopyStage.SCRIPT_NAME))) {
                log.debug("Found {} in {}", StateCopyStage.SCRIPT_NAME, candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static List<Path> candidates(Path explicit, Map<String, String> env, Path home) {
        List<Path> candidates = new ArrayList<>();
        if (explicit != null) {
            // an explicit path is authoritative
            candidates.add(explicit);
            return candidates;
        }
        String fromEnv = env.get(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            candidates.add(Path.of(fromEnv));
        }
        candidates.add(home.resolve("repos").resolve("platform-scripts"));
        candidates.add(home.resolve("source").resolve("repos").resolve("platform-scripts"));
        candidates.add(Path.of("/opt/platform-scripts"));
        candidates.add(Path.of("/usr/local/platform-scripts"));
        return candidates;
    }
}
