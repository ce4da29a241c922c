package statemigrator.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.config.PipelineConfig;
import statemigrator.pipeline.NoopPipelineListener;
import statemigrator.pipeline.PipelineListener;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.pipeline.RepositoryPipeline;
import statemigrator.pipeline.RepositoryTarget;
import statemigrator.security.SecretSanitizer;
import statemigrator.stage.StagePlan;
import statemigrator.state.BatchProgress;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link RepositoryPipeline} per target with bounded concurrency.
 *
 * <p>A fixed pool of {@code min(concurrency, targets)} worker threads takes targets from
 * the pool's queue; each worker runs one pipeline to completion before taking the next.
 * Every target has its own future, and the futures are the only place outcomes are
 * collected. A failing repository never cancels or blocks the others, and nothing is
 * re-raised: a pipeline that does not return is recorded as an aborted failure.
 */
public final class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final StagePlan plan;
    private final PipelineListener listener;
    private final SecretSanitizer sanitizer;

    private volatile BatchProgress progress;

    public BatchScheduler(StagePlan plan) {
        this(plan, NoopPipelineListener.INSTANCE, SecretSanitizer.INSTANCE);
    }

    public BatchScheduler(StagePlan plan, PipelineListener listener, SecretSanitizer sanitizer) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.listener = listener != null ? listener : NoopPipelineListener.INSTANCE;
        this.sanitizer = sanitizer != null ? sanitizer : SecretSanitizer.INSTANCE;
    }

    /**
     * Returns the progress of the running or most recent batch, or null before the first batch.
     */
    public BatchProgress progress() {
        return progress;
    }

    /**
     * Runs every target and waits for all of them to reach a terminal state.
     *
     * <p>A repository listed more than once runs only for its first occurrence, since
     * every pipeline owns its clone directory.
     *
     * @param targets the repositories, in submission order
     * @param config the run configuration; {@link PipelineConfig#concurrency()} bounds parallelism
     * @return the summary, with outcomes in submission order
     */
    public BatchSummary runBatch(List<RepositoryTarget> targets, PipelineConfig config) {
        List<RepositoryTarget> work = distinct(targets);
        BatchProgress batch = new BatchProgress(work.size());
        this.progress = batch;
        long start = System.nanoTime();
        notifySafely(() -> listener.batchStarted(work));

        if (work.isEmpty()) {
            BatchSummary empty = BatchSummary.of(List.of(), Duration.ZERO, 0);
            notifySafely(() -> listener.batchCompleted(empty));
            return empty;
        }

        int workers = Math.max(1, Math.min(config.concurrency(), work.size()));
        log.info("Running {} repositories with concurrency {}{}", work.size(), workers,
                config.dryRun() ? " (dry-run)" : "");

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerFactory());
        List<Future<RepositoryOutcome>> futures = new ArrayList<>(work.size());
        try {
            for (RepositoryTarget target : work) {
                futures.add(pool.submit(() -> runOne(target, config, batch)));
            }
            List<RepositoryOutcome> outcomes = collect(work, futures, start);
            BatchSummary summary = BatchSummary.of(outcomes, elapsed(start), batch.peakActive());
            log.info("Batch finished: {}", summary);
            notifySafely(() -> listener.batchCompleted(summary));
            return summary;
        } finally {
            pool.shutdownNow();
        }
    }

    private RepositoryOutcome runOne(RepositoryTarget target, PipelineConfig config, BatchProgress batch) {
        batch.pipelineStarted(target);
        RepositoryOutcome outcome = null;
        try {
            outcome = new RepositoryPipeline(target, plan, config, listener, sanitizer).run();
            return outcome;
        } finally {
            batch.pipelineFinished(outcome != null
                    ? outcome
                    : RepositoryOutcome.aborted(target, "pipeline did not complete", Duration.ZERO));
        }
    }

    private List<RepositoryOutcome> collect(List<RepositoryTarget> work,
                                            List<Future<RepositoryOutcome>> futures,
                                            long start) {
        List<RepositoryOutcome> outcomes = new ArrayList<>(work.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            RepositoryTarget target = work.get(i);
            Future<RepositoryOutcome> future = futures.get(i);
            if (interrupted) {
                future.cancel(true);
                outcomes.add(RepositoryOutcome.aborted(target, "batch cancelled", elapsed(start)));
                continue;
            }
            try {
                outcomes.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                log.warn("Batch interrupted; cancelling remaining repositories");
                outcomes.add(RepositoryOutcome.aborted(target, "batch cancelled", elapsed(start)));
            } catch (ExecutionException e) {
                String reason = sanitizer.sanitize("pipeline aborted: " + e.getCause());
                log.error("Pipeline for {} aborted", target.name(), e.getCause());
                outcomes.add(RepositoryOutcome.aborted(target, reason, elapsed(start)));
            }
        }
        return outcomes;
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pipeline-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Pipeline listener failed", e);
        }
    }

    private List<RepositoryTarget> distinct(List<RepositoryTarget> targets) {
        Map<String, RepositoryTarget> unique = new LinkedHashMap<>();
        for (RepositoryTarget target : targets) {
            RepositoryTarget first = unique.putIfAbsent(target.fullName(), target);
            if (first != null) {
                log.warn("Ignoring duplicate target {}", target);
            }
        }
        return List.copyOf(unique.values());
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
