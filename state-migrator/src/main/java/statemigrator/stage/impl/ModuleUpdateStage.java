package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.RepositoryFiles;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.transform.ConfigTransformer;
import statemigrator.transform.ModuleRewrite;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites registry module sources to git references. Non-fatal: many repositories
 * have no registry modules.
 */
public final class ModuleUpdateStage extends AbstractStageExecutor {

    public ModuleUpdateStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.MODULE_UPDATE;
    }

    @Override
    public boolean isFatal(PipelineConfig config) {
        return false;
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        return update(ctx, true);
    }

    @Override
    protected StageResult preview(StageContext ctx) throws StageException {
        if (!ctx.cloneExists()) {
            return succeeded("Would rewrite registry module sources to git references under "
                    + ctx.config().organization());
        }
        return update(ctx, false);
    }

    private StageResult update(StageContext ctx, boolean write) throws StageException {
        PipelineConfig config = ctx.config();
        ConfigTransformer transformer = new ConfigTransformer(config.vcsHost(), config.registryHost());
        List<String> details = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int total = 0;
        for (Path file : RepositoryFiles.configurationFiles(ctx.repoPath())) {
            Optional<String> text = readOrSkip(ctx, file, skipped);
            if (text.isEmpty()) {
                continue;
            }
            ModuleRewrite rewrite = transformer.rewriteModuleSources(text.get(), config.organization());
            if (rewrite.changedCount() == 0) {
                continue;
            }
            if (write) {
                RepositoryFiles.write(file, rewrite.text());
            }
            total += rewrite.changedCount();
            details.add(RepositoryFiles.relative(ctx.repoPath(), file) + ": " + String.join(", ", rewrite.modules()));
        }
        if (total == 0) {
            return succeeded("No registry module sources found").withDetails(skipped);
        }
        String verb = write ? "Rewrote" : "Would rewrite";
        String message = verb + " " + total + " module source(s) in " + details.size() + " file(s)";
        details.addAll(skipped);
        return succeeded(message).withDetails(details);
    }
}
