package statemigrator.config;

/**
 * Exception thrown when pipeline configuration cannot be loaded or is invalid.
 *
 * <p>Unchecked: configuration is resolved once at startup, and the CLI turns this
 * into a usage error.
 *
 * @see PipelineConfigLoader
 */
public class PipelineConfigException extends RuntimeException {

    public PipelineConfigException(String message) {
        super(message);
    }

    public PipelineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
