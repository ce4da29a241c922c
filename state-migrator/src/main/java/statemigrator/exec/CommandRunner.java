package statemigrator.exec;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs external commands. The only way the pipeline touches the outside world
 * besides reading and writing files inside a clone.
 *
 * <p>Implementations must never route arguments through a shell, must honor the
 * request timeout by destroying the whole process tree and raising
 * {@link statemigrator.exceptions.CommandTimeoutException}, and must sanitize all
 * captured output before returning or logging it.
 *
 * @see ProcessCommandRunner
 */
public interface CommandRunner {

    /**
     * Runs a command.
     *
     * @param request the invocation
     * @return the result; a non-zero exit code is not an exception
     * @throws statemigrator.exceptions.CommandTimeoutException if the timeout expires
     * @throws statemigrator.exceptions.CommandInterruptedException if the waiting thread is interrupted
     */
    CommandResult run(CommandRequest request);

    /**
     * Convenience form of {@link #run(CommandRequest)}.
     */
    default CommandResult run(List<String> argv, Path workingDir, long timeoutSeconds, boolean dryRun) {
        return run(CommandRequest.builder(argv)
                .workingDir(workingDir)
                .timeoutSeconds(timeoutSeconds)
                .dryRun(dryRun)
                .build());
    }
}
