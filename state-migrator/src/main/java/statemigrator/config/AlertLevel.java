package statemigrator.config;

/**
 * Minimum severity of pipeline events logged by {@link statemigrator.alert.PipelineAlertLogger}.
 *
 * <ul>
 *   <li>{@link #DEBUG} - every event: batch and repository start, each stage, completion</li>
 *   <li>{@link #WARNING} - non-fatal stage failures, skipped repositories and errors</li>
 *   <li>{@link #ERROR} - failed repositories only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
