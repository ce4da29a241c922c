package statemigrator.exceptions;

/**
 * Exception thrown when a pipeline stage cannot complete its work.
 *
 * <p>Stage executors throw this from their body; {@link statemigrator.stage.AbstractStageExecutor}
 * turns it into a failed {@link statemigrator.stage.StageResult}, so it never crosses
 * a repository boundary. The stage and repository are appended to the message to keep
 * log lines self-describing.
 *
 * @see statemigrator.stage.AbstractStageExecutor
 */
public class StageException extends Exception {

    private final String stage;
    private final String repository;

    /**
     * Creates a new stage exception without context.
     *
     * @param message the error message
     */
    public StageException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new stage exception with a cause and no context.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public StageException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new stage exception with full context.
     *
     * @param message the error message
     * @param stage the stage that failed
     * @param repository the repository being migrated
     * @param cause the underlying cause, may be null
     */
    public StageException(String message, String stage, String repository, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.repository = repository;
    }

    /** Returns the failing stage name, or null if not set. */
    public String getStage() {
        return stage;
    }

    /** Returns the repository name, or null if not set. */
    public String getRepository() {
        return repository;
    }

    /** Returns the message without the appended context. */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));
        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (repository != null) sb.append(" [repo=").append(repository).append("]");
        return sb.toString();
    }
}
