package com.trendscope.core.event;

import com.trendscope.core.EntityNotFoundException;
import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.AnalysisExecutor;
import com.trendscope.core.concurrent.TaskOutcome;
import com.trendscope.core.config.AnomalySettings;
import com.trendscope.core.detection.AnomalyDetector;
import com.trendscope.core.detection.BurstDetector;
import com.trendscope.core.detection.DetectorKind;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.BurstEvent;
import com.trendscope.core.model.CombinedEvent;
import com.trendscope.core.model.ContextualAnomaly;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.series.TimeSeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Finds the events of a single entity by running the anomaly, burst and
 * change-point detectors over its series and merging what they report.
 *
 * <h3>Merging</h3>
 * <p>
 * All raw detections are sorted by date. A detection no more than
 * {@code maxDaysGap} days after the latest date of the open group joins it;
 * otherwise it opens a new group. Each group becomes one
 * {@link CombinedEvent}: date, value and description of its highest-scoring
 * detection, the set of contributing methods, and the mean over methods of
 * each method's best score.
 * </p>
 *
 * @since 1.0.0
 */
public class EntityEventDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EntityEventDetector.class);

    /** Detectors run when the caller does not choose. */
    public static final Set<DetectorKind> DEFAULT_METHODS =
            EnumSet.of(DetectorKind.ANOMALY, DetectorKind.BURST, DetectorKind.CHANGE_POINT);

    private final TimeSeriesProvider provider;
    private final AnomalySettings anomalySettings;
    private final BurstDetector burstDetector;
    private final int maxDaysGap;
    private final AnalysisExecutor executor;

    /**
     * @param anomalySettings settings of the per-call anomaly detector
     * @param executor        worker pool for multi-entity runs, or {@code null}
     *                        to run on the calling thread
     */
    public EntityEventDetector(TimeSeriesProvider provider, AnomalySettings anomalySettings,
            BurstDetector burstDetector, int maxDaysGap, AnalysisExecutor executor) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.anomalySettings = Objects.requireNonNull(anomalySettings, "anomalySettings must not be null");
        this.burstDetector = Objects.requireNonNull(burstDetector, "burstDetector must not be null");
        this.maxDaysGap = InvalidParameterException.requireAtLeast("maxDaysGap", maxDaysGap, 0);
        this.executor = executor;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public Optional<EntityEventReport> detectEntityEvents(String entity, LocalDate start, LocalDate end) {
        return detectEntityEvents(entity, start, end, DEFAULT_METHODS);
    }

    /**
     * Detect the events of one entity.
     *
     * @param methods detectors to run; {@code SEASONAL} is ignored
     * @return the report, or empty when the entity has no mentions in range
     * @throws EntityNotFoundException if the entity is unknown
     */
    public Optional<EntityEventReport> detectEntityEvents(String entity, LocalDate start, LocalDate end,
            Set<DetectorKind> methods) {
        Objects.requireNonNull(methods, "methods must not be null");
        LOG.info("Detecting events for entity '{}'", entity);
        EntityTimeSeries series = provider.getEntityTimeSeries(entity, start, end);
        if (series.isEmpty()) {
            LOG.warn("No data available for entity '{}'", entity);
            return Optional.empty();
        }

        List<RawDetection> anomalies = methods.contains(DetectorKind.ANOMALY) ? anomalyEvents(series) : List.of();
        List<RawDetection> bursts = methods.contains(DetectorKind.BURST) ? burstEvents(series) : List.of();
        List<RawDetection> changePoints = methods.contains(DetectorKind.CHANGE_POINT)
                ? changePointEvents(series) : List.of();

        List<RawDetection> all = new ArrayList<>(anomalies);
        all.addAll(bursts);
        all.addAll(changePoints);
        List<CombinedEvent> events = combineEvents(entity, all, maxDaysGap);

        double[] values = series.values();
        long max = 0;
        for (double value : values) {
            max = Math.max(max, (long) value);
        }
        LOG.info("Entity '{}': {} anomaly, {} burst, {} change-point detection(s) -> {} event(s)",
                entity, anomalies.size(), bursts.size(), changePoints.size(), events.size());

        return Optional.of(EntityEventReport.builder()
                .entity(entity)
                .startDate(series.getStartDate())
                .endDate(series.getEndDate())
                .totalMentions(series.total())
                .averageDailyMentions((double) series.total() / series.size())
                .maxDailyMentions(max)
                .anomalyEvents(anomalies)
                .burstEvents(bursts)
                .changePointEvents(changePoints)
                .events(events)
                .build());
    }

    /**
     * Run {@link #detectEntityEvents(String, LocalDate, LocalDate, Set)} for
     * several entities.
     *
     * @return reports keyed by entity in input order; entities that are
     *         unknown, have no data or whose task failed are left out
     */
    public Map<String, EntityEventReport> detectEventsForMultipleEntities(List<String> entities, LocalDate start,
            LocalDate end, Set<DetectorKind> methods) {
        Objects.requireNonNull(entities, "entities must not be null");
        Map<String, Callable<Optional<EntityEventReport>>> tasks = new LinkedHashMap<>();
        for (String entity : entities) {
            tasks.put(entity, () -> detectOrSkip(entity, start, end, methods));
        }

        Map<String, EntityEventReport> reports = new LinkedHashMap<>();
        if (executor == null) {
            for (String entity : entities) {
                detectOrSkip(entity, start, end, methods).ifPresent(r -> reports.put(entity, r));
            }
            return reports;
        }

        Map<String, TaskOutcome<Optional<EntityEventReport>>> outcomes = executor.invokeAll(tasks);
        outcomes.forEach((entity, outcome) -> {
            if (outcome.isSuccess()) {
                outcome.getValue().flatMap(report -> report).ifPresent(r -> reports.put(entity, r));
            } else {
                LOG.warn("Skipping entity '{}': {}", entity, outcome.describeFailure());
            }
        });
        return reports;
    }

    private Optional<EntityEventReport> detectOrSkip(String entity, LocalDate start, LocalDate end,
            Set<DetectorKind> methods) {
        try {
            return detectEntityEvents(entity, start, end, methods);
        } catch (EntityNotFoundException e) {
            LOG.warn("Skipping entity '{}': {}", entity, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Merge raw detections that lie within {@code maxDaysGap} days of each
     * other into combined events.
     *
     * @return combined events in date order
     */
    public static List<CombinedEvent> combineEvents(String entity, List<RawDetection> detections, int maxDaysGap) {
        Objects.requireNonNull(detections, "detections must not be null");
        if (detections.isEmpty()) {
            return List.of();
        }
        List<RawDetection> sorted = new ArrayList<>(detections);
        sorted.sort(Comparator.comparing(RawDetection::getDate));

        List<CombinedEvent> events = new ArrayList<>();
        List<RawDetection> group = new ArrayList<>();
        LocalDate latest = null;
        for (RawDetection detection : sorted) {
            if (latest != null && ChronoUnit.DAYS.between(latest, detection.getDate()) > maxDaysGap) {
                events.add(merge(entity, group));
                group = new ArrayList<>();
            }
            group.add(detection);
            latest = detection.getDate();
        }
        events.add(merge(entity, group));
        return events;
    }

    private static CombinedEvent merge(String entity, List<RawDetection> group) {
        RawDetection top = group.get(0);
        Map<DetectionMethod, Double> bestByMethod = new EnumMap<>(DetectionMethod.class);
        for (RawDetection detection : group) {
            if (detection.getScore() > top.getScore()) {
                top = detection;
            }
            bestByMethod.merge(detection.getMethod(), detection.getScore(), Math::max);
        }
        double score = bestByMethod.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new CombinedEvent(entity, top.getDate(), top.getValue(), bestByMethod.keySet(), score,
                top.getDescription());
    }

    // ---------------------------------------------------------------
    // Raw detections
    // ---------------------------------------------------------------

    private List<RawDetection> anomalyEvents(EntityTimeSeries series) {
        AnomalyDetector detector = AnomalyDetector.fromSettings(anomalySettings).fit(series);
        List<RawDetection> result = new ArrayList<>();
        for (ContextualAnomaly anomaly : detector.detectAnomaliesWithContext(series)) {
            if (anomaly.isCombinedAnomaly()) {
                AnomalyRecord base = anomaly.getBase();
                result.add(new RawDetection(base.getDate(), base.getValue(), anomaly.getCombinedScore(),
                        base.getMethod(), "Anomalous mention count for " + series.getEntity()));
            }
        }
        LOG.debug("Entity '{}': {} anomaly detection(s)", series.getEntity(), result.size());
        return result;
    }

    private List<RawDetection> burstEvents(EntityTimeSeries series) {
        List<RawDetection> result = new ArrayList<>();
        for (BurstEvent burst : burstDetector.detectBurstEvents(series)) {
            result.add(new RawDetection(burst.getPeakDate(), burst.getPeakValue(), burst.getPeakScore(),
                    DetectionMethod.BURST, "Burst in mentions for " + series.getEntity()
                            + " (duration: " + burst.getDurationDays() + " days)"));
        }
        return result;
    }

    private List<RawDetection> changePointEvents(EntityTimeSeries series) {
        AnomalyDetector detector = AnomalyDetector.fromSettings(anomalySettings);
        List<RawDetection> result = new ArrayList<>();
        for (AnomalyRecord record : detector.detectChangePoints(series)) {
            if (record.isAnomaly()) {
                result.add(new RawDetection(record.getDate(), record.getValue(), record.getScore(),
                        DetectionMethod.CHANGE_POINT, "Change point in mention pattern for " + series.getEntity()));
            }
        }
        return result;
    }

    public int getMaxDaysGap() {
        return maxDaysGap;
    }
}
