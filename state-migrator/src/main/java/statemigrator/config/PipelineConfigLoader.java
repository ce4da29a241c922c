package statemigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import statemigrator.version.VersionRange;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads pipeline configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code statemigrator.properties} on the classpath</li>
 *   <li>{@code statemigrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file values. Use the {@code statemigrator.} prefix
 * (e.g. {@code -Dstatemigrator.concurrency=4}). Invalid values are logged and the
 * default is kept.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code statemigrator.organization}, {@code .bucket}, {@code .region}, {@code .profile}</li>
 *   <li>{@code statemigrator.lock.table} - state lock table</li>
 *   <li>{@code statemigrator.work.dir} - directory for clones</li>
 *   <li>{@code statemigrator.branch}, {@code statemigrator.base.branch}</li>
 *   <li>{@code statemigrator.scripts.path} - directory containing copy_state.sh</li>
 *   <li>{@code statemigrator.dry.run}, {@code .skip.version.check}, {@code .skip.validation},
 *       {@code .auto.publish} - true or false</li>
 *   <li>{@code statemigrator.timeout.command}, {@code statemigrator.timeout.state.copy} - seconds</li>
 *   <li>{@code statemigrator.concurrency}, {@code statemigrator.max.recommended.concurrency}</li>
 *   <li>{@code statemigrator.vcs.host}, {@code statemigrator.registry.host}</li>
 *   <li>{@code statemigrator.workflow.env.var}, {@code statemigrator.workflow.secret.name}</li>
 *   <li>{@code statemigrator.commit.message}, {@code .proposal.title}, {@code .proposal.body}</li>
 *   <li>{@code statemigrator.versions.<module>.min} / {@code .max} - inclusive version bounds</li>
 *   <li>{@code statemigrator.missing.backend} - FAIL or IGNORE</li>
 *   <li>{@code statemigrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see PipelineConfig
 */
public final class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    static final String PREFIX = "statemigrator.";
    static final String VERSIONS_PREFIX = PREFIX + "versions.";

    private PipelineConfigLoader() {}

    /**
     * Load from classpath (statemigrator.properties or statemigrator.yml).
     * @throws PipelineConfigException if no config file found
     */
    public static PipelineConfig load() {
        InputStream is = getResource("statemigrator.properties");
        if (is != null) {
            return loadProperties(is, "statemigrator.properties");
        }

        is = getResource("statemigrator.yml");
        if (is != null) {
            return loadYaml(is, "statemigrator.yml");
        }

        throw new PipelineConfigException(
                "Config file required: statemigrator.properties or statemigrator.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws PipelineConfigException if the configuration is invalid
     */
    public static PipelineConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return PipelineConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static PipelineConfig loadProperties(InputStream is, String source) {
        try (InputStream in = is) {
            Properties props = new Properties();
            props.load(in);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new PipelineConfigException("Failed to load " + source, e);
        }
    }

    private static PipelineConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (InputStream in = is) {
            root = new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new PipelineConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static PipelineConfig parse(Properties props) {
        PipelineConfig.Builder b = PipelineConfig.builder();

        getString(props, "organization").ifPresent(b::organization);
        getString(props, "bucket").ifPresent(b::bucket);
        getString(props, "region").ifPresent(b::region);
        getString(props, "profile").ifPresent(b::credentialProfile);
        getString(props, "lock.table").ifPresent(b::lockTable);
        getString(props, "work.dir").ifPresent(v -> b.workDir(Path.of(v)));
        getString(props, "branch").ifPresent(b::branchName);
        getString(props, "base.branch").ifPresent(b::baseBranch);
        getString(props, "scripts.path").ifPresent(v -> b.scriptsPath(Path.of(v)));

        getBoolean(props, "dry.run").ifPresent(b::dryRun);
        getBoolean(props, "skip.version.check").ifPresent(b::skipVersionCheck);
        getBoolean(props, "skip.validation").ifPresent(b::skipValidation);
        getBoolean(props, "auto.publish").ifPresent(b::autoPublish);

        getLong(props, "timeout.command").ifPresent(v -> {
            if (v > 0) b.commandTimeoutSeconds(v);
            else log.warn("Ignoring non-positive timeout.command: {}", v);
        });
        getLong(props, "timeout.state.copy").ifPresent(v -> {
            if (v > 0) b.stateCopyTimeoutSeconds(v);
            else log.warn("Ignoring non-positive timeout.state.copy: {}", v);
        });
        getInt(props, "concurrency").ifPresent(v -> {
            if (v >= 1) b.concurrency(v);
            else log.warn("Invalid concurrency: {}", v);
        });
        getInt(props, "max.recommended.concurrency").ifPresent(v -> {
            if (v >= 1) b.maxRecommendedConcurrency(v);
        });

        getString(props, "vcs.host").ifPresent(b::vcsHost);
        getString(props, "registry.host").ifPresent(b::registryHost);
        getString(props, "workflow.env.var").ifPresent(b::workflowEnvVar);
        getString(props, "workflow.secret.name").ifPresent(b::workflowSecretName);
        getString(props, "commit.message").ifPresent(b::commitMessage);
        getString(props, "proposal.title").ifPresent(b::proposalTitle);
        getString(props, "proposal.body").ifPresent(b::proposalBody);

        getString(props, "missing.backend").ifPresent(v -> {
            try {
                b.missingBackendPolicy(MissingBackendPolicy.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid missing.backend: {}", v);
            }
        });

        getString(props, "alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        versionRequirements(props).forEach(b::versionRequirement);
        return b.build();
    }

    private static Map<String, VersionRange> versionRequirements(Properties props) {
        Set<String> modules = new TreeSet<>();
        collectModules(props.stringPropertyNames(), modules);
        collectModules(System.getProperties().stringPropertyNames(), modules);

        Map<String, VersionRange> ranges = new LinkedHashMap<>();
        for (String module : modules) {
            String min = getString(props, "versions." + module + ".min").orElse(null);
            String max = getString(props, "versions." + module + ".max").orElse(null);
            ranges.put(module, VersionRange.inclusive(min, max));
        }
        return ranges;
    }

    private static void collectModules(Set<String> names, Set<String> modules) {
        for (String name : names) {
            if (!name.startsWith(VERSIONS_PREFIX)) continue;
            String rest = name.substring(VERSIONS_PREFIX.length());
            int dot = rest.lastIndexOf('.');
            if (dot <= 0) continue;
            String bound = rest.substring(dot + 1);
            if (bound.equals("min") || bound.equals("max")) {
                modules.add(rest.substring(0, dot));
            }
        }
    }

    private static Optional<String> getString(Properties props, String key) {
        String full = PREFIX + key;
        String val = System.getProperty(full);
        if (val == null) val = props.getProperty(full);
        if (val == null || val.isBlank()) return Optional.empty();
        return Optional.of(val.trim());
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
