package statemigrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.CommandInterruptedException;
import statemigrator.exceptions.CommandTimeoutException;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRequest;
import statemigrator.exec.CommandResult;
import statemigrator.exec.CommandRunner;
import statemigrator.logging.MdcContext;
import statemigrator.pipeline.RepositoryTarget;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Base class for stage executors.
 *
 * <p>Handles the parts every stage shares:
 * <ul>
 *   <li>timing: the returned result carries the wall-clock duration</li>
 *   <li>dry-run: {@link #preview} runs instead of {@link #perform}</li>
 *   <li>failure conversion: {@link StageException}, {@link CommandTimeoutException},
 *       {@link CommandInterruptedException} and any other runtime exception become a failed
 *       result; a timeout or interrupt is always fatal</li>
 *   <li>the stage MDC key for the duration of the call</li>
 * </ul>
 */
public abstract class AbstractStageExecutor implements StageExecutor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final CommandRunner runner;

    protected AbstractStageExecutor(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public final StageResult execute(Path repoPath, RepositoryTarget target, PipelineConfig config) {
        StageContext ctx = new StageContext(repoPath, target, config);
        boolean fatal = isFatal(config);
        long start = System.nanoTime();
        MdcContext.setStage(stage().displayName());
        try {
            StageResult result = ctx.dryRun() ? preview(ctx) : perform(ctx);
            return result.withFatal(fatal).withDuration(elapsed(start));
        } catch (StageException e) {
            log.debug("{} failed for {}: {}", stage().displayName(), target.name(), e.getMessage());
            return StageResult.failed(stage(), e.getReason(), fatal).withDuration(elapsed(start));
        } catch (CommandTimeoutException | CommandInterruptedException e) {
            return StageResult.failed(stage(), e.getMessage(), true).withDuration(elapsed(start));
        } catch (RuntimeException e) {
            log.warn("{} threw unexpectedly for {}", stage().displayName(), target.name(), e);
            return StageResult.failed(stage(), "Unexpected error: " + e, fatal).withDuration(elapsed(start));
        } finally {
            MdcContext.clearStage();
        }
    }

    /**
     * Performs the stage against real systems.
     *
     * @throws StageException if the stage's success criterion is not met
     */
    protected abstract StageResult perform(StageContext ctx) throws StageException;

    /**
     * Describes what {@link #perform} would do, without side effects.
     *
     * @throws StageException if the stage can already tell it would fail
     */
    protected abstract StageResult preview(StageContext ctx) throws StageException;

    protected StageResult succeeded(String message) {
        return StageResult.succeeded(stage(), message);
    }

    protected StageResult failed(String message) {
        return StageResult.failed(stage(), message, true);
    }

    /**
     * Runs a command in the clone directory with the ordinary command timeout.
     */
    protected CommandResult run(StageContext ctx, String... argv) {
        return runIn(ctx, ctx.repoPath(), ctx.config().commandTimeout(), argv);
    }

    protected CommandResult runIn(StageContext ctx, Path workingDir, Duration timeout, String... argv) {
        return runner.run(CommandRequest.builder(List.of(argv))
                .workingDir(workingDir)
                .timeout(timeout)
                .build());
    }

    /**
     * Runs a command and converts a non-zero exit into a {@link StageException}.
     */
    protected CommandResult runOrFail(StageContext ctx, String failure, String... argv) throws StageException {
        CommandResult result = run(ctx, argv);
        if (!result.isSuccess()) {
            throw new StageException(failure + ": " + result.failureReason(),
                    stage().displayName(), ctx.target().name(), null);
        }
        return result;
    }

    /**
     * Hands a would-be invocation to the runner in dry-run mode, which logs it without
     * spawning anything, and returns the display form.
     */
    protected String planned(StageContext ctx, String... argv) {
        CommandRequest request = CommandRequest.builder(List.of(argv))
                .workingDir(ctx.repoPath())
                .timeout(ctx.config().commandTimeout())
                .dryRun(true)
                .build();
        runner.run(request);
        return request.display();
    }

    /**
     * Reads a file of the clone for editing or inspection. A file that is not valid UTF-8
     * is left alone: a warning is logged, a line is added to {@code skipped} and the
     * result is empty.
     */
    protected Optional<String> readOrSkip(StageContext ctx, Path file, List<String> skipped) throws StageException {
        Optional<String> text = RepositoryFiles.readIfText(file);
        if (text.isEmpty()) {
            String rel = RepositoryFiles.relative(ctx.repoPath(), file);
            log.warn("{}: skipping {} in {}, not valid UTF-8", stage().displayName(), rel, ctx.target().name());
            skipped.add("skipped " + rel + ": not valid UTF-8");
        }
        return text;
    }

    protected StageException failure(StageContext ctx, String message) {
        return new StageException(message, stage().displayName(), ctx.target().name(), null);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
