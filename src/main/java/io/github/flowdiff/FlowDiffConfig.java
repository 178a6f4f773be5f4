package io.github.flowdiff;

import com.google.common.base.Splitter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Settings for analysis, tree building and diffing.
 * <p>
 * Values are layered, later layers winning: the bundled {@code flowdiff-defaults.properties},
 * the project's {@code .flowdiff.properties}, {@code FLOWDIFF_*} environment variables, and finally
 * {@code flowdiff.*} JVM system properties.
 */
public final class FlowDiffConfig {
    private static final Logger logger = LogManager.getLogger(FlowDiffConfig.class);

    public static final String DEFAULTS_RESOURCE = "/flowdiff-defaults.properties";
    public static final String PROJECT_CONFIG_FILE = ".flowdiff.properties";

    public static final String DEFAULT_EXPANSION_DEPTH_KEY = "flowdiff.tree.defaultExpansionDepth";
    public static final String EXCLUDED_DIRECTORIES_KEY = "flowdiff.analysis.excludedDirectories";
    public static final String EXCLUDE_HIDDEN_KEY = "flowdiff.analysis.excludeHiddenDirectories";
    public static final String PARALLEL_KEY = "flowdiff.analysis.parallel";
    public static final String WORKING_TREE_REF_KEY = "flowdiff.git.workingTreeRef";
    public static final String MATERIALIZER_KEY = "flowdiff.git.materializer";
    public static final String ARCHIVE_TIMEOUT_KEY = "flowdiff.git.archiveTimeoutSeconds";

    public static final int DEFAULT_EXPANSION_DEPTH = 6;
    public static final int MIN_EXPANSION_DEPTH = 1;
    public static final int MAX_EXPANSION_DEPTH = 20;
    public static final String DEFAULT_WORKING_TREE_REF = "working";
    public static final int DEFAULT_ARCHIVE_TIMEOUT_SECONDS = 30;

    private final Properties props;

    private FlowDiffConfig(Properties props) {
        this.props = props;
    }

    /**
     * Bundled defaults, then {@code .flowdiff.properties} from the project root if present, then the
     * process environment and system properties.
     */
    public static FlowDiffConfig load(Path projectRoot) {
        return load(projectRoot, System.getenv(), System.getProperties());
    }

    public static FlowDiffConfig load(@Nullable Path projectRoot, Map<String, String> env, Properties systemProps) {
        var props = new Properties();
        try (InputStream in = FlowDiffConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("Bundled {} not found; using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Unable to read bundled {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }

        if (projectRoot != null) {
            var projectConfig = projectRoot.resolve(PROJECT_CONFIG_FILE);
            if (Files.isRegularFile(projectConfig)) {
                try (Reader reader = Files.newBufferedReader(projectConfig, StandardCharsets.UTF_8)) {
                    props.load(reader);
                    logger.debug("Loaded project configuration from {}", projectConfig);
                } catch (IOException e) {
                    logger.warn("Unable to read {}: {}", projectConfig, e.getMessage());
                }
            }
        }

        for (var key : props.stringPropertyNames()) {
            var fromEnv = env.get(toEnvName(key));
            if (fromEnv != null) {
                props.setProperty(key, fromEnv);
            }
        }
        for (var key : systemProps.stringPropertyNames()) {
            if (key.startsWith("flowdiff.")) {
                props.setProperty(key, systemProps.getProperty(key));
            }
        }
        return new FlowDiffConfig(props);
    }

    /**
     * Configuration from explicit values only, for embedding and tests.
     */
    public static FlowDiffConfig of(Map<String, String> values) {
        var base = load(null, Map.of(), new Properties());
        values.forEach(base.props::setProperty);
        return base;
    }

    /** {@code flowdiff.tree.defaultExpansionDepth} becomes {@code FLOWDIFF_TREE_DEFAULTEXPANSIONDEPTH}. */
    static String toEnvName(String key) {
        return key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    public int getDefaultExpansionDepth() {
        int depth = getInt(DEFAULT_EXPANSION_DEPTH_KEY, DEFAULT_EXPANSION_DEPTH);
        return Math.max(MIN_EXPANSION_DEPTH, Math.min(MAX_EXPANSION_DEPTH, depth));
    }

    public Set<String> getExcludedDirectories() {
        var value = props.getProperty(EXCLUDED_DIRECTORIES_KEY, "");
        return new LinkedHashSet<>(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value));
    }

    public boolean isExcludeHiddenDirectories() {
        return Boolean.parseBoolean(props.getProperty(EXCLUDE_HIDDEN_KEY, "true"));
    }

    public boolean isParallel() {
        return Boolean.parseBoolean(props.getProperty(PARALLEL_KEY, "true"));
    }

    /** The reference token meaning "the uncommitted working tree". */
    public String getWorkingTreeRef() {
        var value = props.getProperty(WORKING_TREE_REF_KEY, DEFAULT_WORKING_TREE_REF).trim();
        return value.isEmpty() ? DEFAULT_WORKING_TREE_REF : value;
    }

    public String getMaterializer() {
        return props.getProperty(MATERIALIZER_KEY, "jgit").trim().toLowerCase(Locale.ROOT);
    }

    public int getArchiveTimeoutSeconds() {
        return Math.max(1, getInt(ARCHIVE_TIMEOUT_KEY, DEFAULT_ARCHIVE_TIMEOUT_SECONDS));
    }

    private int getInt(String key, int defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer '{}' for {}; using {}", value, key, defaultValue);
            return defaultValue;
        }
    }
}
