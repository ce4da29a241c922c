package statemigrator.exec;

/**
 * Outcome of an external command. Output is already sanitized.
 *
 * @param exitCode process exit code; 0 for dry-run results
 * @param stdout sanitized standard output
 * @param stderr sanitized standard error
 * @param dryRun true when no process was spawned
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean dryRun) {

    /** Exit code reported when the executable cannot be started. */
    public static final int NOT_FOUND = 127;

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    /** Synthetic success returned in dry-run mode. */
    public static CommandResult dryRunResult() {
        return new CommandResult(0, "", "", true);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Returns the most useful one-line reason for a failure: the last non-blank
     * line of stderr, falling back to stdout.
     */
    public String failureReason() {
        String reason = lastLine(stderr);
        if (reason.isEmpty()) {
            reason = lastLine(stdout);
        }
        return reason.isEmpty() ? "exit code " + exitCode : reason + " (exit code " + exitCode + ")";
    }

    private static String lastLine(String text) {
        String[] lines = text.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1].strip();
    }
}
