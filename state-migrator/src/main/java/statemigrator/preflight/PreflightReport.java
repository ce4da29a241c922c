package statemigrator.preflight;

import statemigrator.exceptions.EnvironmentException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated result of all pre-flight checks.
 */
public final class PreflightReport {

    private final boolean success;
    private final List<PreflightResult> results;

    PreflightReport(boolean success, List<PreflightResult> results) {
        this.success = success;
        this.results = List.copyOf(results);
    }

    /** Returns true if every check passed. */
    public boolean success() {
        return success;
    }

    /** Returns every result in the order the checks ran. */
    public List<PreflightResult> results() {
        return results;
    }

    /** Returns the failed results. */
    public List<PreflightResult> failures() {
        return results.stream().filter(r -> !r.isOk()).collect(Collectors.toList());
    }

    /**
     * Throws if any check failed.
     *
     * @throws EnvironmentException listing every failed check
     */
    public void requireSuccess() throws EnvironmentException {
        if (success) {
            return;
        }
        List<PreflightResult> failed = failures();
        String detail = failed.stream()
                .map(r -> r.name() + " (" + r.message() + ")")
                .collect(Collectors.joining(", "));
        throw new EnvironmentException("Environment check failed: " + detail,
                failed.stream().map(PreflightResult::name).collect(Collectors.toList()));
    }
}
