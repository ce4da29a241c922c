package statemigrator.exceptions;

/**
 * Exception thrown when an input value is rejected before any side effect happens.
 *
 * <p>Raised by {@link statemigrator.security.InputValidator} for repository names,
 * organization and branch names, paths, regions and numeric parameters. A target
 * whose identity fails validation is marked skipped; its pipeline never starts.
 *
 * @see statemigrator.security.InputValidator
 */
public class ValidationException extends Exception {

    private final String field;

    /**
     * Creates a new validation exception.
     *
     * @param field name of the rejected input (e.g. "repository", "path")
     * @param message a description of the validation failure
     */
    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Returns the name of the rejected input.
     *
     * @return the field name, never null
     */
    public String getField() {
        return field;
    }

    @Override
    public String getMessage() {
        return "Invalid " + field + ": " + super.getMessage();
    }
}
