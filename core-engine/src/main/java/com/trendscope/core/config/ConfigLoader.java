package com.trendscope.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads {@link AnalysisConfig} from YAML, applies environment overrides and
 * validates the result.
 *
 * <h3>Source</h3>
 * <p>
 * {@link #load()} reads the file named by {@value #ENV_CONFIG_PATH} when it
 * exists, and the classpath resource {@value #DEFAULT_RESOURCE} otherwise.
 * Unknown keys and duplicate keys make the file malformed.
 * </p>
 *
 * <h3>Overrides</h3>
 * <p>
 * The settings most often tuned per run can be replaced without editing the
 * file. Each one is read from {@code ANALYSIS_<SECTION>_<KEY>}, the key in
 * upper snake case:
 * </p>
 * <ul>
 * <li>{@code ANALYSIS_ANOMALY_STRATEGY}, {@code ANALYSIS_ANOMALY_CONTAMINATION},
 * {@code ANALYSIS_ANOMALY_THRESHOLD}</li>
 * <li>{@code ANALYSIS_BURST_SENSITIVITY}</li>
 * <li>{@code ANALYSIS_FORECAST_HORIZON_DAYS}, {@code ANALYSIS_FORECAST_MODELS}
 * (comma separated)</li>
 * <li>{@code ANALYSIS_EXECUTION_PARALLELISM},
 * {@code ANALYSIS_EXECUTION_TASK_TIMEOUT_SECONDS}</li>
 * </ul>
 * <p>
 * Overrides are applied before validation, so an out-of-range override is
 * reported like an out-of-range file value.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming a config file to read instead of the default. */
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource read when no file is named. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private static final String OVERRIDE_PREFIX = "ANALYSIS_";

    private static final List<SettingOverride> OVERRIDES = List.of(
            new SettingOverride("anomaly", "strategy", (config, value) -> config.getAnomaly().setStrategy(value)),
            new SettingOverride("anomaly", "contamination",
                    (config, value) -> config.getAnomaly().setContamination(Double.parseDouble(value))),
            new SettingOverride("anomaly", "threshold",
                    (config, value) -> config.getAnomaly().setThreshold(Double.parseDouble(value))),
            new SettingOverride("burst", "sensitivity",
                    (config, value) -> config.getBurst().setSensitivity(Double.parseDouble(value))),
            new SettingOverride("forecast", "horizonDays",
                    (config, value) -> config.getForecast().setHorizonDays(Integer.parseInt(value))),
            new SettingOverride("forecast", "models",
                    (config, value) -> config.getForecast().setModels(splitList(value))),
            new SettingOverride("execution", "parallelism",
                    (config, value) -> config.getExecution().setParallelism(Integer.parseInt(value))),
            new SettingOverride("execution", "taskTimeoutSeconds",
                    (config, value) -> config.getExecution().setTaskTimeoutSeconds(Long.parseLong(value))));

    private final Function<String, String> environment;

    /** Loader reading the process environment. */
    public ConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param environment variable lookup, returning {@code null} for an unset
     *                    variable
     */
    public ConfigLoader(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * @return configuration from {@value #ENV_CONFIG_PATH} or the bundled
     *         default, with overrides applied
     * @throws IllegalStateException if the source is malformed or invalid
     */
    public AnalysisConfig load() {
        String path = environment.apply(ENV_CONFIG_PATH);
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            return loadFile(path);
        }
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file is unreadable, malformed or
     *                                  invalid
     */
    public AnalysisConfig loadFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return read(is, "file " + path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource is malformed or invalid
     */
    public AnalysisConfig loadResource(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return read(is, "classpath resource " + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Environment variable that overrides {@code section.key}.
     */
    public static String overrideVariable(String section, String key) {
        String snake = key.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return OVERRIDE_PREFIX + section.toUpperCase(Locale.ROOT) + "_" + snake.toUpperCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AnalysisConfig read(InputStream is, String source) {
        AnalysisConfig config = parse(is, source);
        List<String> applied = applyOverrides(config);
        config.validate();

        LOG.info("Loaded analysis config from {}: strategy={}, correlation={}, models={}, overrides={}", source,
                config.getAnomaly().getStrategy(), config.getCorrelation().getMethod(),
                config.getForecast().getModels(), applied);
        return config;
    }

    private static AnalysisConfig parse(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));
        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis config in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Analysis config in {} is empty; using defaults", source);
            return AnalysisConfig.defaults();
        }
        return config;
    }

    private List<String> applyOverrides(AnalysisConfig config) {
        List<String> applied = new ArrayList<>();
        for (SettingOverride override : OVERRIDES) {
            String value = environment.apply(override.variable);
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                override.setter.accept(config, value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        override.variable + " must be a number for " + override.path + ", got: '" + value + "'", e);
            }
            applied.add(override.variable);
        }
        return applied;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }

    private static final class SettingOverride {
        private final String path;
        private final String variable;
        private final BiConsumer<AnalysisConfig, String> setter;

        SettingOverride(String section, String key, BiConsumer<AnalysisConfig, String> setter) {
            this.path = section + "." + key;
            this.variable = overrideVariable(section, key);
            this.setter = setter;
        }
    }
}
