package statemigrator.exceptions;

import java.util.List;

/**
 * Exception thrown when the pre-flight check finds the environment unusable.
 *
 * <p>A missing tool or state-copy script aborts the whole batch before any
 * repository starts, unless validation is explicitly skipped.
 *
 * @see statemigrator.preflight.PreflightReport#requireSuccess()
 */
public class EnvironmentException extends Exception {

    private final List<String> failedChecks;

    public EnvironmentException(String message, List<String> failedChecks) {
        super(message);
        this.failedChecks = List.copyOf(failedChecks);
    }

    /** Returns the names of the checks that failed. */
    public List<String> getFailedChecks() {
        return failedChecks;
    }
}
