package statemigrator.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import statemigrator.alert.PipelineAlertLogger;
import statemigrator.batch.BatchScheduler;
import statemigrator.batch.BatchSummary;
import statemigrator.config.AlertLevel;
import statemigrator.config.MissingBackendPolicy;
import statemigrator.config.PipelineConfig;
import statemigrator.config.PipelineConfigException;
import statemigrator.config.PipelineConfigLoader;
import statemigrator.exceptions.EnvironmentException;
import statemigrator.exceptions.ValidationException;
import statemigrator.exec.CommandRunner;
import statemigrator.exec.ProcessCommandRunner;
import statemigrator.pipeline.PipelineListener;
import statemigrator.pipeline.RepositoryTarget;
import statemigrator.preflight.PreflightReport;
import statemigrator.preflight.PreflightRunner;
import statemigrator.preflight.ScriptLocator;
import statemigrator.security.InputValidator;
import statemigrator.security.SecretSanitizer;
import statemigrator.stage.ProposalApprover;
import statemigrator.stage.StagePlan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: statemigrator --repos a,b,c
 * <p>
 * Loads configuration, applies command-line overrides, checks the environment and runs
 * the migration pipeline for every listed repository. Exit code 0 when no repository
 * failed, 1 when any failed, 2 on usage, configuration or environment errors.
 */
@Command(name = "statemigrator", mixinStandardHelpOptions = true, version = "statemigrator 1.0.0",
        description = "Migrate Terraform repositories from Terraform Cloud to an S3 state backend")
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    static final int EXIT_SETUP_ERROR = 2;

    @Option(names = "--repos", required = true, split = ",",
            description = "Comma-separated repository names")
    private List<String> repos;

    @Option(names = "--org", description = "Organization owning the repositories")
    private String organization;

    @Option(names = "--bucket", description = "S3 bucket receiving the state")
    private String bucket;

    @Option(names = "--region", description = "AWS region of the bucket")
    private String region;

    @Option(names = "--aws-profile", description = "AWS credential profile")
    private String awsProfile;

    @Option(names = "--lock-table", description = "DynamoDB lock table")
    private String lockTable;

    @Option(names = {"--concurrency", "--batch-size"}, description = "Repositories migrated in parallel")
    private Integer concurrency;

    @Option(names = "--branch", description = "Migration branch name")
    private String branch;

    @Option(names = "--base-branch", description = "Branch the pull request targets")
    private String baseBranch;

    @Option(names = "--work-dir", description = "Directory holding repository clones")
    private Path workDir;

    @Option(names = "--scripts-path", description = "Directory containing copy_state.sh")
    private Path scriptsPath;

    @Option(names = "--config", description = "Configuration file (.properties or .yml)")
    private Path configFile;

    @Option(names = "--timeout", description = "Per-command timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--missing-backend", description = "FAIL or IGNORE when no remote backend block exists")
    private MissingBackendPolicy missingBackend;

    @Option(names = "--dry-run", description = "Describe every action without performing it")
    private boolean dryRun;

    @Option(names = "--skip-version-check", description = "Report module version violations without failing")
    private boolean skipVersionCheck;

    @Option(names = "--skip-validation", description = "Skip the environment pre-flight checks")
    private boolean skipValidation;

    @Option(names = "--auto-publish", description = "Open pull requests without asking")
    private boolean autoPublish;

    @Option(names = {"-v", "--verbose"}, description = "Debug logging")
    private boolean verbose;

    private final CommandRunner runner;
    private final ProposalApprover approver;

    public MigrateCommand() {
        this(new ProcessCommandRunner(), null);
    }

    /**
     * @param runner runs every external command
     * @param approver asked before each proposal; null for a console prompt
     */
    MigrateCommand(CommandRunner runner, ProposalApprover approver) {
        this.runner = runner;
        this.approver = approver;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new MigrateCommand()).execute(args));
    }

    static CommandLine commandLine(MigrateCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }

        PipelineConfig config;
        List<RepositoryTarget> targets;
        try {
            config = resolveConfig();
            validate(config);
            targets = targets(config);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read configuration: " + e.getMessage());
            return EXIT_SETUP_ERROR;
        } catch (PipelineConfigException | ValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_SETUP_ERROR;
        }

        ConsoleOutput.printBanner(config.dryRun());
        log.info("Configuration: {}", config);

        Path scriptsDir = ScriptLocator.locate(config.scriptsPath()).orElse(null);
        if (config.skipValidation()) {
            log.warn("Environment checks skipped");
        } else {
            PreflightReport report = PreflightRunner.standard(runner, config, scriptsDir).runAll();
            ConsoleOutput.preflight(report);
            try {
                report.requireSuccess();
            } catch (EnvironmentException e) {
                ConsoleOutput.error(e.getMessage());
                return EXIT_SETUP_ERROR;
            }
        }

        ProposalApprover proposalApprover = approver != null
                ? approver
                : new ConsoleConfirmationPrompt(System.in, System.out);
        StagePlan plan = StagePlan.standard(runner, proposalApprover, scriptsDir);
        PipelineListener listener = PipelineListener.compose(
                new PipelineAlertLogger(config.alertLevel()),
                new ConsoleProgressListener(plan.size()));

        BatchSummary summary = new BatchScheduler(plan, listener, SecretSanitizer.INSTANCE)
                .runBatch(targets, config);
        ConsoleOutput.summary(summary, config.dryRun(), config.branchName());
        return summary.exitCode();
    }

    PipelineConfig resolveConfig() throws IOException {
        PipelineConfig base = configFile != null
                ? PipelineConfigLoader.loadFromFile(configFile)
                : PipelineConfigLoader.load();
        PipelineConfig.Builder b = base.toBuilder();
        if (organization != null) b.organization(organization);
        if (bucket != null) b.bucket(bucket);
        if (region != null) b.region(region);
        if (awsProfile != null) b.credentialProfile(awsProfile);
        if (lockTable != null) b.lockTable(lockTable);
        if (concurrency != null) b.concurrency(concurrency);
        if (branch != null) b.branchName(branch);
        if (baseBranch != null) b.baseBranch(baseBranch);
        if (workDir != null) b.workDir(workDir.toAbsolutePath().normalize());
        if (scriptsPath != null) b.scriptsPath(scriptsPath);
        if (timeoutSeconds != null) b.commandTimeoutSeconds(timeoutSeconds);
        if (missingBackend != null) b.missingBackendPolicy(missingBackend);
        if (dryRun) b.dryRun(true);
        if (skipVersionCheck) b.skipVersionCheck(true);
        if (skipValidation) b.skipValidation(true);
        if (autoPublish) b.autoPublish(true);
        if (verbose) b.alertLevel(AlertLevel.DEBUG);
        return b.build();
    }

    private static void validate(PipelineConfig config) throws ValidationException {
        InputValidator.validateOrganization(config.organization());
        InputValidator.validateBucket(config.bucket());
        InputValidator.validateRegion(config.region());
        InputValidator.validateBranchName(config.branchName());
        InputValidator.validateBranchName(config.baseBranch());
        InputValidator.validateBatchSize(config.concurrency(), config.maxRecommendedConcurrency());
    }

    // Repository names are validated again by each pipeline; an invalid one is skipped there.
    private List<RepositoryTarget> targets(PipelineConfig config) throws ValidationException {
        List<RepositoryTarget> targets = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (String repo : repos) {
            String name = repo.trim();
            if (name.isEmpty() || seen.contains(name)) {
                continue;
            }
            seen.add(name);
            targets.add(new RepositoryTarget(config.organization(), name, config.branchName()));
        }
        if (targets.isEmpty()) {
            throw new ValidationException("repos", "no repository names given");
        }
        return targets;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
