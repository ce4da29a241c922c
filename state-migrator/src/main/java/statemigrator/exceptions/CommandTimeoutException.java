package statemigrator.exceptions;

import java.time.Duration;

/**
 * Exception thrown when an external command exceeds its configured timeout.
 *
 * <p>The command runner destroys the process tree before throwing, so nothing is
 * leaked. The owning stage reports the timeout as a fatal failure; other
 * repositories in the batch are unaffected.
 *
 * <p>Unchecked so stage bodies need not declare it.
 *
 * @see statemigrator.exec.ProcessCommandRunner
 */
public class CommandTimeoutException extends RuntimeException {

    private final String command;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param command the name of the command that timed out (executable only, never arguments)
     * @param timeout the configured timeout that was exceeded
     */
    public CommandTimeoutException(String command, Duration timeout) {
        super(formatMessage(command, timeout));
        this.command = command;
        this.timeout = timeout;
    }

    /** Returns the name of the command that timed out. */
    public String getCommand() {
        return command;
    }

    /** Returns the configured timeout that was exceeded. */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String command, Duration timeout) {
        return String.format("Command '%s' timed out after %d s", command, timeout.toSeconds());
    }
}
