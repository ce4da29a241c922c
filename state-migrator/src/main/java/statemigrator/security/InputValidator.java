package statemigrator.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statemigrator.exceptions.ValidationException;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Rejects malformed identifiers, paths and numeric parameters before they reach
 * any external command.
 *
 * <p>Every check throws {@link ValidationException} naming the rejected field.
 * Values are never echoed back in cleartext beyond what the sanitizer allows.
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>names never contain {@code ..}, shell metacharacters or control characters</li>
 *   <li>repository names follow the hosting platform grammar {@code [A-Za-z0-9_.-]+}</li>
 *   <li>per-repository paths must resolve inside the working directory</li>
 *   <li>concurrency must be at least 1; values above the recommended maximum only warn</li>
 * </ul>
 */
public final class InputValidator {

    private static final Logger log = LoggerFactory.getLogger(InputValidator.class);

    static final int MAX_NAME_LENGTH = 100;

    private static final Pattern REPO_NAME = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern ORG_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
    private static final Pattern REGION = Pattern.compile("^[a-z]{2}(-[a-z]+)+-\\d+$");
    private static final Pattern BUCKET = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");
    private static final Pattern BRANCH_CHARS = Pattern.compile("^[A-Za-z0-9._/-]+$");
    private static final Pattern SHELL_META = Pattern.compile("[;&|`$<>\\\\!*?(){}\\[\\]'\"]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x7f]");

    private InputValidator() {}

    /**
     * Validates a repository name against the hosting platform grammar.
     *
     * @param name the repository name
     * @throws ValidationException if the name is empty, too long or unsafe
     */
    public static void validateRepoName(String name) throws ValidationException {
        requireSafeText("repository", name);
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("repository", "longer than " + MAX_NAME_LENGTH + " characters");
        }
        if (!REPO_NAME.matcher(name).matches()) {
            throw new ValidationException("repository", "'" + name + "' contains characters outside [A-Za-z0-9_.-]");
        }
        if (name.startsWith("-") || name.equals(".")) {
            throw new ValidationException("repository", "'" + name + "' is not a repository name");
        }
    }

    /**
     * Validates an organization name.
     *
     * @param org the organization
     * @throws ValidationException if the name is unsafe or malformed
     */
    public static void validateOrganization(String org) throws ValidationException {
        requireSafeText("organization", org);
        if (org.length() > MAX_NAME_LENGTH || !ORG_NAME.matcher(org).matches()) {
            throw new ValidationException("organization", "'" + org + "' is not a valid organization name");
        }
    }

    /**
     * Validates a branch name using the subset of git ref rules that matter here.
     *
     * @param branch the branch name
     * @throws ValidationException if the branch name is not a safe ref name
     */
    public static void validateBranchName(String branch) throws ValidationException {
        requireSafeText("branch", branch);
        if (!BRANCH_CHARS.matcher(branch).matches()
                || branch.startsWith("-")
                || branch.startsWith("/")
                || branch.endsWith("/")
                || branch.endsWith(".")
                || branch.endsWith(".lock")
                || branch.contains("//")
                || branch.contains("@{")) {
            throw new ValidationException("branch", "'" + branch + "' is not a valid branch name");
        }
    }

    /**
     * Validates a free-form relative path fragment.
     *
     * @param path the path text
     * @throws ValidationException if the path is absolute, escapes upward or carries metacharacters
     */
    public static void validatePath(String path) throws ValidationException {
        requireSafeText("path", path);
        if (path.startsWith("/") || path.startsWith("~")) {
            throw new ValidationException("path", "'" + path + "' must be relative");
        }
    }

    /**
     * Validates that {@code candidate} resolves inside {@code root}.
     *
     * @param root the working directory
     * @param candidate the resolved per-repository path
     * @throws ValidationException if the candidate escapes the root
     */
    public static void validatePathWithin(Path root, Path candidate) throws ValidationException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalized = candidate.toAbsolutePath().normalize();
        if (!normalized.startsWith(normalizedRoot) || normalized.equals(normalizedRoot)) {
            throw new ValidationException("path", "'" + candidate + "' is outside the working directory");
        }
    }

    /**
     * Validates the concurrency bound.
     *
     * @param size the requested concurrency
     * @param recommendedMax the largest value accepted without a warning
     * @throws ValidationException if {@code size} is below 1
     */
    public static void validateBatchSize(int size, int recommendedMax) throws ValidationException {
        if (size < 1) {
            throw new ValidationException("concurrency", "must be at least 1, got " + size);
        }
        if (size > recommendedMax) {
            log.warn("Concurrency {} exceeds recommended maximum {}; expect rate limiting", size, recommendedMax);
        }
    }

    /**
     * Validates a cloud region identifier such as {@code us-east-1}.
     *
     * @param region the region
     * @throws ValidationException if the region is malformed
     */
    public static void validateRegion(String region) throws ValidationException {
        if (region == null || !REGION.matcher(region).matches()) {
            throw new ValidationException("region", "'" + region + "' is not a region identifier");
        }
    }

    /**
     * Validates an object-store bucket name.
     *
     * @param bucket the bucket name
     * @throws ValidationException if the bucket name is malformed
     */
    public static void validateBucket(String bucket) throws ValidationException {
        if (bucket == null || !BUCKET.matcher(bucket).matches() || bucket.contains("..")) {
            throw new ValidationException("bucket", "'" + bucket + "' is not a valid bucket name");
        }
    }

    private static void requireSafeText(String field, String value) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be empty");
        }
        if (CONTROL.matcher(value).find()) {
            throw new ValidationException(field, "contains control characters");
        }
        if (value.contains("..")) {
            throw new ValidationException(field, "'" + value + "' contains a parent-directory segment");
        }
        if (SHELL_META.matcher(value).find()) {
            throw new ValidationException(field, "'" + value + "' contains shell metacharacters");
        }
    }
}
