package statemigrator.preflight;

/**
 * Immutable result of a single pre-flight check.
 *
 * <p>Use {@link #ok(String, String)} and {@link #fail(String, String, Throwable)} to create
 * instances.
 */
public final class PreflightResult {

    private final String name;
    private final boolean ok;
    private final String message;
    private final Throwable error;

    private PreflightResult(String name, boolean ok, String message, Throwable error) {
        this.name = name;
        this.ok = ok;
        this.message = message;
        this.error = error;
    }

    /**
     * Creates a passing result.
     *
     * @param name the check name
     * @param message what was found, e.g. a tool version
     */
    public static PreflightResult ok(String name, String message) {
        return new PreflightResult(name, true, message, null);
    }

    /**
     * Creates a failed result.
     *
     * @param name the check name
     * @param message the failure message
     * @param error the exception that caused the failure (may be null)
     */
    public static PreflightResult fail(String name, String message, Throwable error) {
        return new PreflightResult(name, false, message, error);
    }

    /** Returns the check name. */
    public String name() { return name; }

    /** Returns true if the check passed. */
    public boolean isOk() { return ok; }

    /** Returns the detail or failure message. */
    public String message() { return message; }

    /** Returns the exception that caused the failure, or null if none. */
    public Throwable error() { return error; }

    @Override
    public String toString() {
        return (ok ? "OK   " : "FAIL ") + name + (message != null ? ": " + message : "");
    }
}
