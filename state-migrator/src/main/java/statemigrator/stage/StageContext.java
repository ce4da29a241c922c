package statemigrator.stage;

import statemigrator.config.PipelineConfig;
import statemigrator.pipeline.RepositoryTarget;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Arguments of one stage execution, bundled for the stage bodies.
 *
 * @param repoPath the clone directory
 * @param target the repository
 * @param config the run configuration
 */
public record StageContext(Path repoPath, RepositoryTarget target, PipelineConfig config) {

    /** True if the clone directory exists. In dry-run mode it usually does not. */
    public boolean cloneExists() {
        return Files.isDirectory(repoPath);
    }

    public boolean dryRun() {
        return config.dryRun();
    }
}
