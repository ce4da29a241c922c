package statemigrator.preflight;

/**
 * One environment check run before a batch starts.
 *
 * <p>Implementations may throw; {@link PreflightRunner} records the exception as a
 * failed result and continues with the next check.
 */
@FunctionalInterface
public interface PreflightCheck {

    /**
     * Runs the check.
     *
     * @param name the name the check was registered under
     * @return the result, never null
     * @throws Exception if the check cannot be performed
     */
    PreflightResult run(String name) throws Exception;
}
