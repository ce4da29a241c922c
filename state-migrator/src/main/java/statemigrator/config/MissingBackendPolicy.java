package statemigrator.config;

/**
 * What the backend update does when no file in a repository declares a remote backend.
 */
public enum MissingBackendPolicy {
    /** Fail the repository: it is already migrated or malformed. */
    FAIL,
    /** Treat the repository as already migrated and continue. */
    IGNORE
}
