package statemigrator.preflight;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import statemigrator.stage.impl.StateCopyStage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ScriptLocatorTest {

    @TempDir
    Path home;

    private static Path withScript(Path dir) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(StateCopyStage.SCRIPT_NAME), "#!/bin/bash\n");
        return dir;
    }

    @Test
    void explicitPathIsTheOnlyCandidate() throws IOException {
        Path explicit = home.resolve("explicit");
        withScript(home.resolve("repos").resolve("platform-scripts"));

        assertEquals(Optional.empty(), ScriptLocator.locate(explicit, Map.of(), home));

        withScript(explicit);
        assertEquals(Optional.of(explicit), ScriptLocator.locate(explicit, Map.of(), home));
    }

    @Test
    void environmentVariableWinsOverHomeDirectory() throws IOException {
        Path fromEnv = withScript(home.resolve("env-scripts"));
        withScript(home.resolve("repos").resolve("platform-scripts"));

        Optional<Path> found = ScriptLocator.locate(null, Map.of(ScriptLocator.ENV_VAR, fromEnv.toString()), home);

        assertEquals(Optional.of(fromEnv), found);
    }

    @Test
    void fallsBackToHomeLocations() throws IOException {
        Path sourceRepos = withScript(home.resolve("source").resolve("repos").resolve("platform-scripts"));

        assertEquals(Optional.of(sourceRepos), ScriptLocator.locate(null, Map.of(ScriptLocator.ENV_VAR, " "), home));
    }

    @Test
    void candidateOrderIsStable() {
        assertEquals(home.resolve("repos").resolve("platform-scripts"),
                ScriptLocator.candidates(null, Map.of(), home).get(0));
        assertEquals(Path.of("/usr/local/platform-scripts"),
                ScriptLocator.candidates(null, Map.of(), home).get(3));
        assertFalse(ScriptLocator.candidates(home, Map.of(), home).size() > 1);
    }
}
