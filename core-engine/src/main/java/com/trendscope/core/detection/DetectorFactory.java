package com.trendscope.core.detection;

import com.trendscope.core.config.AnalysisConfig;
import com.trendscope.core.config.AnomalySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link Detector} instances from an
 * {@link AnalysisConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detector families:
 * add a {@link DetectorKind} constant and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector of the given kind.
     *
     * @param kind   detector family; must not be {@code null}
     * @param config validated configuration; must not be {@code null}
     * @return a detector configured from the matching settings section
     */
    public static Detector create(DetectorKind kind, AnalysisConfig config) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(config, "AnalysisConfig must not be null");

        AnomalySettings anomaly = config.getAnomaly();
        return switch (kind) {
            case ANOMALY -> AnomalyDetector.fromSettings(anomaly);
            case BURST -> BurstDetector.fromSettings(config.getBurst());
            case CHANGE_POINT -> new ChangePointDetector(anomaly.getChangePointWindow(),
                    anomaly.getChangePointThreshold());
            case SEASONAL -> new SeasonalDetector(anomaly.getSeasonalPeriod(), anomaly.getThreshold());
        };
    }

    /**
     * Create one detector of every kind.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     */
    public static List<Detector> createAll(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        LOG.info("Creating {} detector(s) from configuration", DetectorKind.values().length);
        List<Detector> detectors = Arrays.stream(DetectorKind.values())
                .map(kind -> create(kind, config))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
