package statemigrator.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.batch.BatchSummary;
import statemigrator.config.AlertLevel;
import statemigrator.pipeline.PipelineListener;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.pipeline.RepositoryTarget;
import statemigrator.stage.Stage;
import statemigrator.stage.StageResult;

import java.util.List;

/**
 * Structured logging for pipeline events.
 *
 * <p>Entries start with a marker such as REPO_STARTED or STAGE_FAILED followed by
 * key=value pairs, so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: every event</li>
 *   <li>WARNING: non-fatal stage failures, skipped repositories and errors</li>
 *   <li>ERROR: failed repositories only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  pipeline - BATCH_STARTED repos=3
 * 12:00:00.010 INFO  pipeline - REPO_STARTED repo=acme/alpha branch=migrate-to-s3-backend
 * 12:00:04.500 INFO  pipeline - STAGE_COMPLETED repo=acme/alpha stage=StateCopy duration_ms=4490
 * 12:00:09.000 ERROR pipeline - REPO_FAILED repo=acme/beta stage=StateCopy message="State copy failed: exit code 1"
 * </pre>
 */
public final class PipelineAlertLogger implements PipelineListener {

    private static final Logger log = LoggerFactory.getLogger("pipeline");

    private final AlertLevel alertLevel;

    public PipelineAlertLogger(AlertLevel alertLevel) {
        this.alertLevel = alertLevel != null ? alertLevel : AlertLevel.WARNING;
    }

    public AlertLevel alertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    @Override
    public void batchStarted(List<RepositoryTarget> targets) {
        if (shouldLogInfo()) {
            log.info("BATCH_STARTED repos={}", targets.size());
        }
    }

    @Override
    public void repositoryStarted(RepositoryTarget target) {
        if (shouldLogInfo()) {
            log.info("REPO_STARTED repo={} branch={}", target.fullName(), target.branch());
        }
    }

    @Override
    public void stageStarted(RepositoryTarget target, Stage stage) {
        if (shouldLogInfo()) {
            log.info("STAGE_STARTED repo={} stage={} step={}/{}", target.fullName(), stage.displayName(),
                    stage.number(), Stage.values().length);
        }
    }

    @Override
    public void stageCompleted(RepositoryTarget target, StageResult result) {
        if (result.isFailed()) {
            if (shouldLogWarn()) {
                log.warn("STAGE_FAILED repo={} stage={} fatal={} duration_ms={} message=\"{}\"",
                        target.fullName(), result.stage().displayName(), result.haltsPipeline(),
                        result.duration().toMillis(), result.message());
            }
            return;
        }
        if (shouldLogInfo()) {
            log.info("STAGE_COMPLETED repo={} stage={} outcome={} duration_ms={}",
                    target.fullName(), result.stage().displayName(), result.outcome(), result.duration().toMillis());
        }
    }

    @Override
    public void repositoryCompleted(RepositoryOutcome outcome) {
        String repo = outcome.target().fullName();
        switch (outcome.status()) {
            case SUCCEEDED:
                if (shouldLogInfo()) {
                    log.info("REPO_COMPLETED repo={} duration_ms={} proposal={} state={}",
                            repo, outcome.duration().toMillis(), outcome.proposalUrl(), outcome.stateLocation());
                }
                break;
            case SKIPPED:
                if (shouldLogWarn()) {
                    log.warn("REPO_SKIPPED repo={} reason=\"{}\"", repo, outcome.reason());
                }
                break;
            case FAILED:
            default:
                // Always log errors
                log.error("REPO_FAILED repo={} stage={} message=\"{}\"",
                        repo,
                        outcome.firstFailedStage().map(Stage::displayName).orElse("none"),
                        outcome.firstFailure().map(StageResult::message).orElse(outcome.reason()));
                break;
        }
    }

    @Override
    public void batchCompleted(BatchSummary summary) {
        if (summary.failedCount() > 0) {
            log.error("BATCH_COMPLETED total={} succeeded={} failed={} skipped={} duration_ms={}",
                    summary.total(), summary.succeededCount(), summary.failedCount(),
                    summary.skippedCount(), summary.duration().toMillis());
        } else if (shouldLogInfo()) {
            log.info("BATCH_COMPLETED total={} succeeded={} failed=0 skipped={} duration_ms={}",
                    summary.total(), summary.succeededCount(), summary.skippedCount(), summary.duration().toMillis());
        }
    }
}
