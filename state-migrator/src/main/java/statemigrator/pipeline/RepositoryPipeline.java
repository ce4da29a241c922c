package statemigrator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.ValidationException;
import statemigrator.logging.MdcContext;
import statemigrator.security.InputValidator;
import statemigrator.security.SecretSanitizer;
import statemigrator.stage.Stage;
import statemigrator.stage.StageExecutor;
import statemigrator.stage.StagePlan;
import statemigrator.stage.StageResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State machine driving one repository through the stages of a {@link StagePlan}.
 *
 * <p>Transitions (see {@link PipelineState}):
 * <ul>
 *   <li>PENDING to SKIPPED when the target's names are rejected</li>
 *   <li>VALIDATING to SKIPPED when the clone directory would leave the working directory</li>
 *   <li>RUNNING advances stage by stage; a failed fatal stage moves to FAILED and no
 *       further stage runs; a failed non-fatal stage is recorded and the next stage runs</li>
 *   <li>RUNNING to SUCCEEDED after the last stage</li>
 * </ul>
 *
 * <p>Results are appended in order and pass through the {@link SecretSanitizer} before
 * they are stored or handed to listeners. An executor that throws or returns null is
 * recorded as a fatal failure of its stage. A pipeline instance runs once; it shares no
 * mutable state with other pipelines.
 */
public final class RepositoryPipeline {

    private static final Logger log = LoggerFactory.getLogger(RepositoryPipeline.class);

    private final RepositoryTarget target;
    private final StagePlan plan;
    private final PipelineConfig config;
    private final PipelineListener listener;
    private final SecretSanitizer sanitizer;

    private final List<StageResult> results = new ArrayList<>();
    private volatile PipelineState state = PipelineState.PENDING;
    private volatile Stage currentStage;

    public RepositoryPipeline(RepositoryTarget target, StagePlan plan, PipelineConfig config) {
        this(target, plan, config, NoopPipelineListener.INSTANCE, SecretSanitizer.INSTANCE);
    }

    public RepositoryPipeline(RepositoryTarget target,
                              StagePlan plan,
                              PipelineConfig config,
                              PipelineListener listener,
                              SecretSanitizer sanitizer) {
        this.target = Objects.requireNonNull(target, "target");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener != null ? listener : NoopPipelineListener.INSTANCE;
        this.sanitizer = sanitizer != null ? sanitizer : SecretSanitizer.INSTANCE;
    }

    /** Returns the current state. Safe to read from any thread. */
    public PipelineState state() {
        return state;
    }

    /** Returns the stage currently running, or null outside RUNNING. */
    public Stage currentStage() {
        return currentStage;
    }

    /** Returns a snapshot of the results recorded so far. */
    public synchronized List<StageResult> results() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    /**
     * Runs the pipeline to a terminal state.
     *
     * @return the repository outcome, never null
     * @throws IllegalStateException if the pipeline already ran
     */
    public RepositoryOutcome run() {
        if (state != PipelineState.PENDING) {
            throw new IllegalStateException("Pipeline for " + target + " already ran (state " + state + ")");
        }
        long start = System.nanoTime();
        MdcContext.setRepository(target.name());
        try {
            try {
                InputValidator.validateOrganization(target.organization());
                InputValidator.validateRepoName(target.name());
                InputValidator.validateBranchName(target.branch());
            } catch (ValidationException e) {
                return skip(e);
            }
            transition(PipelineState.VALIDATING);
            Path repoPath = config.repositoryDir(target.name());
            try {
                InputValidator.validatePathWithin(config.workDir(), repoPath);
            } catch (ValidationException e) {
                return skip(e);
            }

            transition(PipelineState.RUNNING);
            notifySafely(() -> listener.repositoryStarted(target));
            log.info("Starting pipeline for {} ({} stages{})", target.fullName(), plan.size(),
                    config.dryRun() ? ", dry-run" : "");

            for (StageExecutor executor : plan.executors()) {
                currentStage = executor.stage();
                notifySafely(() -> listener.stageStarted(target, executor.stage()));
                StageResult result = sanitize(executeGuarded(executor, repoPath));
                append(result);
                notifySafely(() -> listener.stageCompleted(target, result));
                if (result.haltsPipeline()) {
                    log.warn("{} failed at {}: {}", target.name(), result.stage().displayName(), result.message());
                    return finish(PipelineState.FAILED, start);
                }
                if (result.isFailed()) {
                    log.warn("{} non-fatal failure at {}: {}", target.name(), result.stage().displayName(), result.message());
                }
            }
            return finish(PipelineState.SUCCEEDED, start);
        } finally {
            currentStage = null;
            MdcContext.clear();
        }
    }

    private StageResult executeGuarded(StageExecutor executor, Path repoPath) {
        try {
            StageResult result = executor.execute(repoPath, target, config);
            if (result == null) {
                return StageResult.failed(executor.stage(), "Stage returned no result", true);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Stage {} threw for {}", executor.stage().displayName(), target.name(), e);
            return StageResult.failed(executor.stage(), "Unexpected error: " + e, true);
        }
    }

    private StageResult sanitize(StageResult result) {
        return result.mapText(sanitizer::sanitize);
    }

    private synchronized void append(StageResult result) {
        results.add(result);
    }

    private RepositoryOutcome skip(ValidationException e) {
        transition(PipelineState.SKIPPED);
        String reason = sanitizer.sanitize(e.getMessage());
        log.warn("Skipping {}: {}", target.name(), reason);
        RepositoryOutcome outcome = RepositoryOutcome.skipped(target, reason);
        notifySafely(() -> listener.repositoryCompleted(outcome));
        return outcome;
    }

    private RepositoryOutcome finish(PipelineState terminal, long startNanos) {
        transition(terminal);
        List<StageResult> snapshot = results();
        boolean succeeded = terminal == PipelineState.SUCCEEDED;
        RepositoryOutcome outcome = new RepositoryOutcome(
                target,
                snapshot,
                succeeded ? OutcomeStatus.SUCCEEDED : OutcomeStatus.FAILED,
                succeeded ? referenceOf(snapshot, Stage.PUBLISH_PROPOSAL) : null,
                succeeded ? referenceOf(snapshot, Stage.VERIFY) : null,
                null,
                Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Pipeline for {} finished: {}", target.fullName(), outcome.status());
        notifySafely(() -> listener.repositoryCompleted(outcome));
        return outcome;
    }

    private static String referenceOf(List<StageResult> results, Stage stage) {
        return results.stream()
                .filter(r -> r.stage() == stage && r.isSucceeded())
                .map(StageResult::reference)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private void transition(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + target);
        }
        log.debug("{}: {} -> {}", target.name(), state, next);
        state = next;
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Pipeline listener failed for {}", target.name(), e);
        }
    }
}
