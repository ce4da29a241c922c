package statemigrator.stage.impl;

import statemigrator.config.MissingBackendPolicy;
import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.RepositoryFiles;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.transform.ConfigTransformer;
import statemigrator.transform.TextRewrite;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces remote backend blocks with the S3 backend in every configuration file.
 *
 * <p>When no file has a remote backend block the outcome follows
 * {@link PipelineConfig#missingBackendPolicy()}: a fatal failure by default, or a
 * successful no-op for repositories that were already migrated.
 */
public final class BackendUpdateStage extends AbstractStageExecutor {

    public BackendUpdateStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.BACKEND_UPDATE;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        return update(ctx, true);
    }

    @Override
    protected StageResult preview(StageContext ctx) throws StageException {
        if (!ctx.cloneExists()) {
            return succeeded("Would rewrite remote backend blocks to "
                    + StateCopyStage.location(ctx.config(), ctx.target().name()));
        }
        return update(ctx, false);
    }

    private StageResult update(StageContext ctx, boolean write) throws StageException {
        PipelineConfig config = ctx.config();
        ConfigTransformer transformer = new ConfigTransformer(config.vcsHost(), config.registryHost());
        List<Path> files = RepositoryFiles.configurationFiles(ctx.repoPath());
        List<String> changed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Path file : files) {
            Optional<String> read = readOrSkip(ctx, file, skipped);
            if (read.isEmpty()) {
                continue;
            }
            String text = read.get();
            TextRewrite rewrite = transformer.rewriteBackend(text, config.bucket(), config.region(),
                    ctx.target().name(), config.lockTable());
            if (rewrite.changed()) {
                if (write) {
                    RepositoryFiles.write(file, rewrite.text());
                }
                changed.add(RepositoryFiles.relative(ctx.repoPath(), file));
            }
        }
        if (changed.isEmpty()) {
            String msg = "No remote backend block found in " + files.size() + " configuration file(s)";
            if (!skipped.isEmpty()) {
                msg += " (" + skipped.size() + " skipped as not valid UTF-8)";
            }
            if (config.missingBackendPolicy() == MissingBackendPolicy.IGNORE) {
                return succeeded(msg + "; treating repository as already migrated").withDetails(skipped);
            }
            throw failure(ctx, msg);
        }
        String verb = write ? "Rewrote" : "Would rewrite";
        String message = verb + " backend in " + changed.size() + " file(s)";
        changed.addAll(skipped);
        return succeeded(message).withDetails(changed);
    }
}
