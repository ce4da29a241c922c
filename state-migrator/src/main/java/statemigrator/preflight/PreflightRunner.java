package statemigrator.preflight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.config.PipelineConfig;
import statemigrator.exec.CommandRunner;
import statemigrator.stage.impl.StateCopyStage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs environment checks before a batch starts.
 *
 * <p>Every check runs even if an earlier one failed, so the operator sees all problems
 * at once. Results are collected into a {@link PreflightReport}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * PreflightReport report = PreflightRunner.standard(runner, config, scriptsDir).runAll();
 * report.requireSuccess();
 * </pre>
 */
public final class PreflightRunner {

    private static final Logger log = LoggerFactory.getLogger(PreflightRunner.class);

    /** Tools every migration needs. */
    public static final List<String> REQUIRED_TOOLS = List.of("git", "gh", "aws", "terraform");

    private final Map<String, PreflightCheck> checks;

    private PreflightRunner(Map<String, PreflightCheck> checks) {
        this.checks = new LinkedHashMap<>(checks);
    }

    /**
     * Builds the standard set of checks: required tools, the state-copy script, free
     * space for clones, and read-only access to the credential profile, bucket and
     * organization.
     *
     * @param runner command runner
     * @param config run configuration
     * @param scriptsDir located scripts directory, or null if none was found
     */
    public static PreflightRunner standard(CommandRunner runner, PipelineConfig config, Path scriptsDir) {
        Builder b = new Builder();
        for (String tool : REQUIRED_TOOLS) {
            b.addCheck("tool:" + tool, ToolCheck.version(runner, tool));
        }
        b.addCheck("scripts", name -> scriptsCheck(name, scriptsDir));
        b.addCheck("disk-space", new DiskSpaceCheck(config.workDir(), DiskSpaceCheck.DEFAULT_REQUIRED_BYTES));
        b.addCheck("aws-profile", new ToolCheck(runner,
                List.of("aws", "configure", "list", "--profile", config.credentialProfile()),
                "credential profile is not configured"));
        b.addCheck("bucket", new ToolCheck(runner,
                List.of("aws", "s3", "ls", "s3://" + config.bucket() + "/",
                        "--profile", config.credentialProfile(), "--region", config.region()),
                "bucket " + config.bucket() + " is not accessible"));
        b.addCheck("organization", new ToolCheck(runner,
                List.of("gh", "api", "/orgs/" + config.organization()),
                "organization " + config.organization() + " is not accessible"));
        return b.build();
    }

    private static PreflightResult scriptsCheck(String name, Path scriptsDir) {
        if (scriptsDir == null) {
            return PreflightResult.fail(name, StateCopyStage.SCRIPT_NAME + " not found; use --scripts-path or "
                    + ScriptLocator.ENV_VAR, null);
        }
        Path script = scriptsDir.resolve(StateCopyStage.SCRIPT_NAME);
        if (!Files.isRegularFile(script)) {
            return PreflightResult.fail(name, script + " does not exist", null);
        }
        return PreflightResult.ok(name, script.toString());
    }

    /**
     * Runs every registered check.
     *
     * @return a report with one result per check
     */
    public PreflightReport runAll() {
        List<PreflightResult> results = new ArrayList<>();
        for (Map.Entry<String, PreflightCheck> entry : checks.entrySet()) {
            String name = entry.getKey();
            PreflightResult result;
            try {
                result = entry.getValue().run(name);
                if (result == null) {
                    result = PreflightResult.fail(name, "returned null result", null);
                }
            } catch (Exception e) {
                result = PreflightResult.fail(name, "threw: " + e.getMessage(), e);
            }
            if (result.isOk()) {
                log.info("Pre-flight {} ok: {}", name, result.message());
            } else {
                log.error("Pre-flight {} failed: {}", name, result.message());
            }
            results.add(result);
        }
        boolean success = results.stream().allMatch(PreflightResult::isOk);
        return new PreflightReport(success, results);
    }

    /**
     * Builder for constructing {@link PreflightRunner} instances.
     */
    public static final class Builder {
        private final Map<String, PreflightCheck> checks = new LinkedHashMap<>();

        /**
         * Adds a check; a later check with the same name replaces the earlier one.
         *
         * @param name the check name shown in the report
         * @param check the check
         * @return this builder for method chaining
         */
        public Builder addCheck(String name, PreflightCheck check) {
            this.checks.put(name, check);
            return this;
        }

        public PreflightRunner build() {
            return new PreflightRunner(checks);
        }
    }
}
