package statemigrator.exceptions;

/**
 * Thrown when the thread waiting on an external command is interrupted, typically
 * because the batch is shutting down. The process tree is destroyed first and the
 * thread's interrupt flag stays set.
 *
 * @see statemigrator.exec.ProcessCommandRunner
 */
public class CommandInterruptedException extends RuntimeException {

    private final String command;

    /**
     * @param command the name of the interrupted command (executable only, never arguments)
     * @param cause the interrupt
     */
    public CommandInterruptedException(String command, InterruptedException cause) {
        super(String.format("Command '%s' was interrupted before it finished", command), cause);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
