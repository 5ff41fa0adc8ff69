package com.trendscope.job;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the batch analysis job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * runs unchanged from a shell, a cron entry or a container.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * in tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_INPUT_PATH = "ANALYSIS_INPUT_PATH";
    public static final String ENV_OUTPUT_DIR = "ANALYSIS_OUTPUT_DIR";
    public static final String ENV_ENTITIES = "ANALYSIS_ENTITIES";
    public static final String ENV_TOP_ENTITIES = "ANALYSIS_TOP_ENTITIES";
    public static final String ENV_START_DATE = "ANALYSIS_START_DATE";
    public static final String ENV_END_DATE = "ANALYSIS_END_DATE";
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputDir;

    // ---------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------
    private final List<String> entities;
    private final int topEntities;
    private final LocalDate startDate;
    private final LocalDate endDate;

    // ---------------------------------------------------------------
    // Analysis settings
    // ---------------------------------------------------------------
    private final String analysisConfigPath;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputDir = b.outputDir;
        this.entities = List.copyOf(b.entities);
        this.topEntities = b.topEntities;
        this.startDate = b.startDate;
        this.endDate = b.endDate;
        this.analysisConfigPath = b.analysisConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputPath(env(ENV_INPUT_PATH, ""))
                    .outputDir(env(ENV_OUTPUT_DIR, "results"))
                    .entities(parseList(env(ENV_ENTITIES, "")))
                    .topEntities(Integer.parseInt(env(ENV_TOP_ENTITIES, "10")))
                    .startDate(parseDate(env(ENV_START_DATE, "")))
                    .endDate(parseDate(env(ENV_END_DATE, "")))
                    .analysisConfigPath(env(ENV_CONFIG_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Failed to parse date environment variable (expected yyyy-MM-dd): " + e.getParsedString(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    /** Entities to analyse; empty means the most mentioned ones. */
    public List<String> getEntities() {
        return entities;
    }

    public int getTopEntities() {
        return topEntities;
    }

    /** Inclusive lower bound of the analysed span, or {@code null} for unbounded. */
    public LocalDate getStartDate() {
        return startDate;
    }

    /** Inclusive upper bound of the analysed span, or {@code null} for unbounded. */
    public LocalDate getEndDate() {
        return endDate;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the input path is set, the
     * top-entity count is positive and the start date is not after the end
     * date.
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private String outputDir = "results";
        private List<String> entities = new ArrayList<>();
        private int topEntities = 10;
        private LocalDate startDate;
        private LocalDate endDate;
        private String analysisConfigPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputDir(String v) {
            this.outputDir = v;
            return this;
        }

        public Builder entities(List<String> v) {
            this.entities = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder topEntities(int v) {
            this.topEntities = v;
            return this;
        }

        public Builder startDate(LocalDate v) {
            this.startDate = v;
            return this;
        }

        public Builder endDate(LocalDate v) {
            this.endDate = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath (" + ENV_INPUT_PATH + ")");
            requireNonBlank(outputDir, "outputDir");
            Objects.requireNonNull(analysisConfigPath, "analysisConfigPath required");

            if (topEntities < 1) {
                throw new IllegalArgumentException("topEntities must be >= 1, got: " + topEntities);
            }
            if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
                throw new IllegalArgumentException(
                        "startDate " + startDate + " must not be after endDate " + endDate);
            }
            for (String entity : entities) {
                requireNonBlank(entity, "entity name");
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static LocalDate parseDate(String value) {
        return value.isBlank() ? null : LocalDate.parse(value.trim());
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", entities=" + entities +
                ", topEntities=" + topEntities +
                ", startDate=" + startDate +
                ", endDate=" + endDate +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                '}';
    }
}
