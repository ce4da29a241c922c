package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.RepositoryFiles;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.transform.TextRewrite;
import statemigrator.transform.WorkflowTransformer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adds the read-access secret to CI workflows that run terraform. Non-fatal.
 */
public final class WorkflowUpdateStage extends AbstractStageExecutor {

    public WorkflowUpdateStage(CommandRunner runner) {
        super(runner);
    }

    @Override
    public Stage stage() {
        return Stage.WORKFLOW_UPDATE;
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
            return succeeded("Would add " + ctx.config().workflowEnvVar() + " secret reference to terraform workflows");
        }
        return update(ctx, false);
    }

    private StageResult update(StageContext ctx, boolean write) throws StageException {
        PipelineConfig config = ctx.config();
        WorkflowTransformer transformer = new WorkflowTransformer(config.workflowEnvVar(), config.workflowSecretName());
        List<Path> workflows = RepositoryFiles.workflowFiles(ctx.repoPath());
        if (workflows.isEmpty()) {
            return succeeded("No workflow files found");
        }
        List<String> changed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Path file : workflows) {
            Optional<String> text = readOrSkip(ctx, file, skipped);
            if (text.isEmpty()) {
                continue;
            }
            TextRewrite rewrite = transformer.inject(text.get());
            if (rewrite.changed()) {
                if (write) {
                    RepositoryFiles.write(file, rewrite.text());
                }
                changed.add(RepositoryFiles.relative(ctx.repoPath(), file));
            }
        }
        if (changed.isEmpty()) {
            return succeeded("No workflow updates needed").withDetails(skipped);
        }
        String verb = write ? "Updated" : "Would update";
        String message = verb + " " + changed.size() + " workflow file(s)";
        changed.addAll(skipped);
        return succeeded(message).withDetails(changed);
    }
}
