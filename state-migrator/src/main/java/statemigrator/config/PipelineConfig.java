package statemigrator.config;

import statemigrator.version.VersionRange;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved run parameters for one invocation.
 *
 * <p>Built once at startup, from {@link PipelineConfigLoader} and CLI overrides, and then
 * handed to every component. Instances are immutable; use {@link #toBuilder()} to derive
 * a modified copy.
 *
 * <p>Groups of settings:
 * <ul>
 *   <li>target backend: bucket, region, credential profile, lock table</li>
 *   <li>repository handling: organization, working directory, branch names, hosts</li>
 *   <li>switches: dry-run, skip version check, skip validation, auto-publish</li>
 *   <li>limits: command and state-copy timeouts, concurrency</li>
 *   <li>content: commit message, proposal title and body, workflow secret</li>
 *   <li>policy: module version requirements, missing-backend policy, alert level</li>
 * </ul>
 *
 * @see PipelineConfigLoader
 */
public final class PipelineConfig {

    public static final String DEFAULT_PROPOSAL_TITLE = "Migrate Terraform backend from Cloud to S3";

    public static final String DEFAULT_PROPOSAL_BODY = String.join("\n",
            "## Summary",
            "",
            "Migrates this repository's Terraform state from Terraform Cloud to the S3 backend.",
            "",
            "## Changes",
            "",
            "- Replaced the `cloud` backend block with an `s3` backend (DynamoDB state locking, encryption on)",
            "- Rewrote registry module sources to direct git references",
            "- Added the read-access token to CI workflows that run terraform",
            "",
            "## Before merging",
            "",
            "- [ ] `terraform init -reconfigure` succeeds",
            "- [ ] `terraform plan` shows no infrastructure changes",
            "- [ ] CI workflows pass");

    public static final PipelineConfig DEFAULTS = builder().build();

    private final String organization;
    private final String bucket;
    private final String region;
    private final String credentialProfile;
    private final String lockTable;
    private final Path workDir;
    private final String branchName;
    private final String baseBranch;
    private final Path scriptsPath;
    private final boolean dryRun;
    private final boolean skipVersionCheck;
    private final boolean skipValidation;
    private final boolean autoPublish;
    private final Duration commandTimeout;
    private final Duration stateCopyTimeout;
    private final int concurrency;
    private final int maxRecommendedConcurrency;
    private final String vcsHost;
    private final String registryHost;
    private final String workflowEnvVar;
    private final String workflowSecretName;
    private final String commitMessage;
    private final String proposalTitle;
    private final String proposalBody;
    private final Map<String, VersionRange> versionRequirements;
    private final MissingBackendPolicy missingBackendPolicy;
    private final AlertLevel alertLevel;

    private PipelineConfig(Builder b) {
        this.organization = b.organization;
        this.bucket = b.bucket;
        this.region = b.region;
        this.credentialProfile = b.credentialProfile;
        this.lockTable = b.lockTable;
        this.workDir = b.workDir;
        this.branchName = b.branchName;
        this.baseBranch = b.baseBranch;
        this.scriptsPath = b.scriptsPath;
        this.dryRun = b.dryRun;
        this.skipVersionCheck = b.skipVersionCheck;
        this.skipValidation = b.skipValidation;
        this.autoPublish = b.autoPublish;
        this.commandTimeout = b.commandTimeout;
        this.stateCopyTimeout = b.stateCopyTimeout;
        this.concurrency = b.concurrency;
        this.maxRecommendedConcurrency = b.maxRecommendedConcurrency;
        this.vcsHost = b.vcsHost;
        this.registryHost = b.registryHost;
        this.workflowEnvVar = b.workflowEnvVar;
        this.workflowSecretName = b.workflowSecretName;
        this.commitMessage = b.commitMessage;
        this.proposalTitle = b.proposalTitle;
        this.proposalBody = b.proposalBody;
        this.versionRequirements = Map.copyOf(b.versionRequirements);
        this.missingBackendPolicy = b.missingBackendPolicy;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.organization = organization;
        b.bucket = bucket;
        b.region = region;
        b.credentialProfile = credentialProfile;
        b.lockTable = lockTable;
        b.workDir = workDir;
        b.branchName = branchName;
        b.baseBranch = baseBranch;
        b.scriptsPath = scriptsPath;
        b.dryRun = dryRun;
        b.skipVersionCheck = skipVersionCheck;
        b.skipValidation = skipValidation;
        b.autoPublish = autoPublish;
        b.commandTimeout = commandTimeout;
        b.stateCopyTimeout = stateCopyTimeout;
        b.concurrency = concurrency;
        b.maxRecommendedConcurrency = maxRecommendedConcurrency;
        b.vcsHost = vcsHost;
        b.registryHost = registryHost;
        b.workflowEnvVar = workflowEnvVar;
        b.workflowSecretName = workflowSecretName;
        b.commitMessage = commitMessage;
        b.proposalTitle = proposalTitle;
        b.proposalBody = proposalBody;
        b.versionRequirements.putAll(versionRequirements);
        b.missingBackendPolicy = missingBackendPolicy;
        b.alertLevel = alertLevel;
        return b;
    }

    /** Organization owning the repositories and the module repositories. */
    public String organization() { return organization; }

    /** Target state bucket. */
    public String bucket() { return bucket; }

    public String region() { return region; }

    /** Credential profile passed to the cloud CLI and the state-copy script. */
    public String credentialProfile() { return credentialProfile; }

    /** State lock table name. */
    public String lockTable() { return lockTable; }

    /** Directory holding one clone per repository. */
    public Path workDir() { return workDir; }

    /** Branch the migration is committed to. */
    public String branchName() { return branchName; }

    /** Branch the proposal targets. */
    public String baseBranch() { return baseBranch; }

    /** Directory containing the state-copy script, or null to search standard locations. */
    public Path scriptsPath() { return scriptsPath; }

    public boolean dryRun() { return dryRun; }

    public boolean skipVersionCheck() { return skipVersionCheck; }

    public boolean skipValidation() { return skipValidation; }

    /** Whether proposals are opened without operator confirmation. */
    public boolean autoPublish() { return autoPublish; }

    /** Timeout for ordinary commands. */
    public Duration commandTimeout() { return commandTimeout; }

    /** Timeout for the state-copy script, which moves real data. */
    public Duration stateCopyTimeout() { return stateCopyTimeout; }

    /** Maximum number of repositories processed at once. */
    public int concurrency() { return concurrency; }

    public int maxRecommendedConcurrency() { return maxRecommendedConcurrency; }

    public String vcsHost() { return vcsHost; }

    public String registryHost() { return registryHost; }

    public String workflowEnvVar() { return workflowEnvVar; }

    public String workflowSecretName() { return workflowSecretName; }

    public String commitMessage() { return commitMessage; }

    public String proposalTitle() { return proposalTitle; }

    public String proposalBody() { return proposalBody; }

    /** Allowed version range per module name. */
    public Map<String, VersionRange> versionRequirements() { return versionRequirements; }

    public MissingBackendPolicy missingBackendPolicy() { return missingBackendPolicy; }

    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the clone directory of {@code repoName}. Callers validate the name first. */
    public Path repositoryDir(String repoName) {
        return workDir.resolve(repoName);
    }

    @Override
    public String toString() {
        // credential profile omitted on purpose: it names an account
        return "PipelineConfig{" +
                "organization=" + organization +
                ", bucket=" + bucket +
                ", region=" + region +
                ", lockTable=" + lockTable +
                ", workDir=" + workDir +
                ", branchName=" + branchName +
                ", dryRun=" + dryRun +
                ", skipVersionCheck=" + skipVersionCheck +
                ", skipValidation=" + skipValidation +
                ", autoPublish=" + autoPublish +
                ", commandTimeout=" + commandTimeout.toSeconds() + "s" +
                ", stateCopyTimeout=" + stateCopyTimeout.toSeconds() + "s" +
                ", concurrency=" + concurrency +
                ", missingBackendPolicy=" + missingBackendPolicy +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link PipelineConfig} instances.
     */
    public static final class Builder {
        private String organization = "your-org";
        private String bucket = "your-org-tfstate-bucket";
        private String region = "us-east-1";
        private String credentialProfile = "default";
        private String lockTable = "terraform-state-lock";
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "statemigrator");
        private String branchName = "migrate-to-s3-backend";
        private String baseBranch = "main";
        private Path scriptsPath;
        private boolean dryRun;
        private boolean skipVersionCheck;
        private boolean skipValidation;
        private boolean autoPublish;
        private Duration commandTimeout = Duration.ofSeconds(300);
        private Duration stateCopyTimeout = Duration.ofSeconds(600);
        private int concurrency = 1;
        private int maxRecommendedConcurrency = 10;
        private String vcsHost = "github.com";
        private String registryHost = "app.terraform.io";
        private String workflowEnvVar = "GITHUB_TOKEN";
        private String workflowSecretName = "gh-readaccess-pat";
        private String commitMessage = DEFAULT_PROPOSAL_TITLE;
        private String proposalTitle = DEFAULT_PROPOSAL_TITLE;
        private String proposalBody = DEFAULT_PROPOSAL_BODY;
        private final Map<String, VersionRange> versionRequirements = new LinkedHashMap<>();
        private MissingBackendPolicy missingBackendPolicy = MissingBackendPolicy.FAIL;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder credentialProfile(String credentialProfile) {
            this.credentialProfile = credentialProfile;
            return this;
        }

        public Builder lockTable(String lockTable) {
            this.lockTable = lockTable;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder branchName(String branchName) {
            this.branchName = branchName;
            return this;
        }

        public Builder baseBranch(String baseBranch) {
            this.baseBranch = baseBranch;
            return this;
        }

        public Builder scriptsPath(Path scriptsPath) {
            this.scriptsPath = scriptsPath;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder skipVersionCheck(boolean skipVersionCheck) {
            this.skipVersionCheck = skipVersionCheck;
            return this;
        }

        public Builder skipValidation(boolean skipValidation) {
            this.skipValidation = skipValidation;
            return this;
        }

        public Builder autoPublish(boolean autoPublish) {
            this.autoPublish = autoPublish;
            return this;
        }

        public Builder commandTimeout(Duration timeout) {
            this.commandTimeout = timeout;
            return this;
        }

        public Builder commandTimeoutSeconds(long seconds) {
            return commandTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder stateCopyTimeout(Duration timeout) {
            this.stateCopyTimeout = timeout;
            return this;
        }

        public Builder stateCopyTimeoutSeconds(long seconds) {
            return stateCopyTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder maxRecommendedConcurrency(int max) {
            this.maxRecommendedConcurrency = max;
            return this;
        }

        public Builder vcsHost(String vcsHost) {
            this.vcsHost = vcsHost;
            return this;
        }

        public Builder registryHost(String registryHost) {
            this.registryHost = registryHost;
            return this;
        }

        public Builder workflowEnvVar(String workflowEnvVar) {
            this.workflowEnvVar = workflowEnvVar;
            return this;
        }

        public Builder workflowSecretName(String workflowSecretName) {
            this.workflowSecretName = workflowSecretName;
            return this;
        }

        public Builder commitMessage(String commitMessage) {
            this.commitMessage = commitMessage;
            return this;
        }

        public Builder proposalTitle(String proposalTitle) {
            this.proposalTitle = proposalTitle;
            return this;
        }

        public Builder proposalBody(String proposalBody) {
            this.proposalBody = proposalBody;
            return this;
        }

        public Builder versionRequirement(String module, VersionRange range) {
            this.versionRequirements.put(module, range);
            return this;
        }

        public Builder missingBackendPolicy(MissingBackendPolicy policy) {
            this.missingBackendPolicy = policy;
            return this;
        }

        public Builder alertLevel(AlertLevel alertLevel) {
            this.alertLevel = alertLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws PipelineConfigException if concurrency is below 1 or a required value is missing
         */
        public PipelineConfig build() {
            if (concurrency < 1) {
                throw new PipelineConfigException("concurrency must be at least 1, got " + concurrency);
            }
            if (workDir == null) {
                throw new PipelineConfigException("workDir is required");
            }
            if (commandTimeout == null || stateCopyTimeout == null) {
                throw new PipelineConfigException("timeouts must not be null");
            }
            return new PipelineConfig(this);
        }
    }
}
