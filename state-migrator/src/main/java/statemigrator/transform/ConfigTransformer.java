package statemigrator.transform;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text rewrites applied to a repository's configuration files.
 *
 * <p>Two operations:
 * <ul>
 *   <li>{@link #rewriteBackend} replaces a {@code cloud { ... }} or {@code backend "remote" { ... }}
 *       block with an S3 backend block. The keyword is found by regex; the end of the block by
 *       {@link BlockScanner}, so nested braces inside the block are handled.</li>
 *   <li>{@link #rewriteModuleSources} turns registry module sources
 *       ({@code <registry>/<org>/<name>/<provider>[//<subdir>]}) into direct git references and drops the
 *       now-meaningless {@code version} attribute.</li>
 * </ul>
 *
 * <p>Text outside a rewritten span is left byte-identical. Both operations are idempotent.
 */
public final class ConfigTransformer {

    public static final String DEFAULT_VCS_HOST = "github.com";
    public static final String DEFAULT_REGISTRY_HOST = "app.terraform.io";
    public static final String STATE_FILE_NAME = "terraform.tfstate";

    private static final Pattern BACKEND_HEADER =
            Pattern.compile("(?m)(?:^|(?<=[{;]))[ \\t]*(cloud|backend\\s+\"remote\")\\s*\\{");
    private static final Pattern CONSTRAINT_OPERATOR = Pattern.compile("^(~>|>=|<=|!=|=|>|<)\\s*");

    private final String vcsHost;
    private final String registryHost;

    public ConfigTransformer() {
        this(DEFAULT_VCS_HOST, DEFAULT_REGISTRY_HOST);
    }

    /**
     * @param vcsHost host name used in rewritten git sources
     * @param registryHost host name of the legacy module registry
     */
    public ConfigTransformer(String vcsHost, String registryHost) {
        this.vcsHost = vcsHost;
        this.registryHost = registryHost;
    }

    /**
     * Returns the state object key for a repository: {@code <repo>/terraform.tfstate}.
     */
    public static String stateKey(String repoName) {
        return repoName + "/" + STATE_FILE_NAME;
    }

    /**
     * Rewrites remote backend declarations without a lock table entry.
     *
     * @see #rewriteBackend(String, String, String, String, String)
     */
    public TextRewrite rewriteBackend(String fileText, String bucket, String region, String repoName) {
        return rewriteBackend(fileText, bucket, region, repoName, null);
    }

    /**
     * Rewrites every remote backend declaration in {@code fileText} to an S3 backend.
     *
     * <p>If a block's braces are unbalanced, that block and everything after it are left
     * untouched.
     *
     * @param fileText the configuration text
     * @param bucket target bucket
     * @param region target region
     * @param repoName repository name, used to derive the state key
     * @param lockTable lock table name, or null to omit
     * @return the rewritten text and whether anything changed
     */
    public TextRewrite rewriteBackend(String fileText, String bucket, String region,
                                         String repoName, String lockTable) {
        Matcher m = BACKEND_HEADER.matcher(fileText);
        StringBuilder out = new StringBuilder(fileText.length());
        int copied = 0;
        boolean changed = false;
        int searchFrom = 0;
        while (m.find(searchFrom)) {
            int open = m.end() - 1;
            int close = BlockScanner.findClosingBrace(fileText, open);
            if (close < 0) {
                break;
            }
            String indent = lineIndent(fileText, m.start(1));
            out.append(fileText, copied, m.start(1));
            out.append(s3Block(indent, bucket, region, stateKey(repoName), lockTable));
            copied = close + 1;
            searchFrom = close + 1;
            changed = true;
        }
        if (!changed) {
            return new TextRewrite(fileText, false);
        }
        out.append(fileText, copied, fileText.length());
        return new TextRewrite(out.toString(), true);
    }

    /**
     * Returns true if {@code fileText} contains a backend block that {@link #rewriteBackend}
     * would replace.
     */
    public boolean hasLegacyBackend(String fileText) {
        Matcher m = BACKEND_HEADER.matcher(fileText);
        while (m.find()) {
            if (BlockScanner.findClosingBrace(fileText, m.end() - 1) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rewrites registry module sources to direct git references under {@code orgName}.
     *
     * <p>{@code <registry>/<any-org>/<name>/<provider>} with {@code version = "~> 1.2.0"} becomes
     * {@code git::https://<vcs-host>/<orgName>/terraform-<provider>-<name>?ref=v1.2.0}; without a
     * version the ref is {@code main}. A {@code //subdir} suffix is kept after the repository
     * path. Sources already in another form are left alone.
     *
     * @param fileText the configuration text
     * @param orgName organization that hosts the module repositories
     * @return the rewritten text and the number of rewritten modules
     */
    public ModuleRewrite rewriteModuleSources(String fileText, String orgName) {
        List<ModuleBlock> blocks = ModuleBlock.findAll(fileText);
        List<Edit> edits = new ArrayList<>();
        List<String> rewritten = new ArrayList<>();
        for (ModuleBlock block : blocks) {
            RegistrySource registry = RegistrySource.parse(block.source(), registryHost);
            if (registry == null) {
                continue;
            }
            String newSource = "git::https://" + vcsHost + "/" + orgName
                    + "/terraform-" + registry.provider() + "-" + registry.name()
                    + registry.subdirectory()
                    + "?ref=" + toRef(block.version());
            edits.add(new Edit(block.sourceValueStart(), block.sourceValueEnd(), newSource));
            if (block.versionLineStart() >= 0) {
                edits.add(new Edit(block.versionLineStart(), block.versionLineEnd(), ""));
            }
            rewritten.add(block.name());
        }
        if (rewritten.isEmpty()) {
            return new ModuleRewrite(fileText, 0, List.of());
        }
        edits.sort(Comparator.comparingInt(Edit::start));
        StringBuilder out = new StringBuilder(fileText.length());
        int copied = 0;
        for (Edit edit : edits) {
            out.append(fileText, copied, edit.start()).append(edit.replacement());
            copied = edit.end();
        }
        out.append(fileText, copied, fileText.length());
        return new ModuleRewrite(out.toString(), rewritten.size(), rewritten);
    }

    /**
     * Converts a registry version constraint into a git ref: {@code "~> 1.2.0"} becomes
     * {@code v1.2.0}, an absent version becomes {@code main}.
     */
    static String toRef(String constraint) {
        if (constraint == null || constraint.isBlank()) {
            return "main";
        }
        String first = constraint.split(",")[0].trim();
        String version = CONSTRAINT_OPERATOR.matcher(first).replaceFirst("").trim();
        if (version.isEmpty()) {
            return "main";
        }
        return version.startsWith("v") ? version : "v" + version;
    }

    // Leading whitespace of the line containing index.
    private static String lineIndent(String text, int index) {
        int lineStart = text.lastIndexOf('\n', index - 1) + 1;
        int end = lineStart;
        while (end < index && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(lineStart, end);
    }

    private static String s3Block(String indent, String bucket, String region, String key, String lockTable) {
        StringBuilder sb = new StringBuilder();
        sb.append("backend \"s3\" {\n");
        attribute(sb, indent, "bucket", quote(bucket));
        attribute(sb, indent, "key", quote(key));
        attribute(sb, indent, "region", quote(region));
        if (lockTable != null && !lockTable.isBlank()) {
            attribute(sb, indent, "dynamodb_table", quote(lockTable));
        }
        attribute(sb, indent, "encrypt", "true");
        sb.append(indent).append('}');
        return sb.toString();
    }

    private static void attribute(StringBuilder sb, String indent, String name, String value) {
        sb.append(indent).append("  ").append(String.format("%-14s", name)).append(" = ").append(value).append('\n');
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private record Edit(int start, int end, String replacement) {}

    /**
     * Registry coordinates of a module source.
     *
     * @param subdirectory {@code //path} of a submodule, or the empty string
     */
    record RegistrySource(String org, String name, String provider, String subdirectory) {

        static RegistrySource parse(String source, String registryHost) {
            if (source == null) {
                return null;
            }
            String prefix = registryHost + "/";
            if (!source.startsWith(prefix)) {
                return null;
            }
            String coordinates = source.substring(prefix.length());
            String subdirectory = "";
            int split = coordinates.indexOf("//");
            if (split >= 0) {
                subdirectory = coordinates.substring(split);
                coordinates = coordinates.substring(0, split);
                if (subdirectory.length() == 2) {
                    return null;
                }
            }
            String[] parts = coordinates.split("/");
            if (parts.length != 3) {
                return null;
            }
            for (String p : parts) {
                if (p.isEmpty()) return null;
            }
            return new RegistrySource(parts[0], parts[1], parts[2], subdirectory);
        }
    }
}
