package statemigrator.stage.impl;

import statemigrator.config.PipelineConfig;
import statemigrator.exceptions.StageException;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.AbstractStageExecutor;
import statemigrator.stage.RepositoryFiles;
import statemigrator.stage.Stage;
import statemigrator.stage.StageContext;
import statemigrator.stage.StageResult;
import statemigrator.version.ModulePin;
import statemigrator.version.ModuleVersionScanner;
import statemigrator.version.VersionComparator;
import statemigrator.version.VersionRange;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks module version pins against the configured requirements.
 *
 * <p>Fatal unless version checking is skipped, in which case violations are still
 * reported but the pipeline continues. Reads files only, so it runs the same way in
 * dry-run mode when a clone is present.
 */
public final class VersionCheckStage extends AbstractStageExecutor {

    private final VersionComparator comparator;

    public VersionCheckStage(CommandRunner runner, VersionComparator comparator) {
        super(runner);
        this.comparator = comparator;
    }

    @Override
    public Stage stage() {
        return Stage.VERSION_CHECK;
    }

    @Override
    public boolean isFatal(PipelineConfig config) {
        return !config.skipVersionCheck();
    }

    @Override
    protected StageResult perform(StageContext ctx) throws StageException {
        Map<String, VersionRange> requirements = ctx.config().versionRequirements();
        if (requirements.isEmpty()) {
            return succeeded("No module version requirements configured");
        }
        List<String> violations = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int checked = 0;
        for (Path file : RepositoryFiles.configurationFiles(ctx.repoPath())) {
            Optional<String> text = readOrSkip(ctx, file, skipped);
            if (text.isEmpty()) {
                continue;
            }
            Path rel = ctx.repoPath().relativize(file);
            for (ModulePin pin : ModuleVersionScanner.scan(rel, text.get())) {
                VersionRange range = requirements.get(pin.moduleName());
                if (range == null) {
                    range = requirements.get(pin.sourceName());
                }
                if (range == null) {
                    continue;
                }
                checked++;
                check(pin, range).ifPresent(violations::add);
            }
        }
        if (!violations.isEmpty()) {
            String message = violations.size() + " module version violation(s)";
            violations.addAll(skipped);
            return failed(message).withDetails(violations);
        }
        return succeeded(checked == 0
                ? "No modules with version requirements found"
                : checked + " module version(s) within required ranges").withDetails(skipped);
    }

    @Override
    protected StageResult preview(StageContext ctx) throws StageException {
        if (ctx.cloneExists()) {
            return perform(ctx);
        }
        return succeeded("Would check " + ctx.config().versionRequirements().size()
                + " module version requirement(s)");
    }

    private Optional<String> check(ModulePin pin, VersionRange range) {
        String where = pin.file() + ": module '" + pin.instance() + "' (" + pin.moduleName() + ")";
        if (!pin.isPinned()) {
            return range.min() != null
                    ? Optional.of(where + " has no pinned version but requires at least " + range.min())
                    : Optional.empty();
        }
        if (!comparator.isComparable(pin.version())) {
            return Optional.of(where + " has unparseable version '" + pin.version() + "'");
        }
        return range.violation(pin.version(), comparator).map(v -> where + " " + v);
    }
}
