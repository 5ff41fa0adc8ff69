package com.trendscope.core.detection;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.config.AnomalySettings;
import com.trendscope.core.detection.model.IsolationForestModel;
import com.trendscope.core.detection.model.LocalOutlierFactor;
import com.trendscope.core.detection.model.OneClassSvm;
import com.trendscope.core.detection.model.OutlierModel;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.CombinedDetection;
import com.trendscope.core.model.CombinedDetection.Signal;
import com.trendscope.core.model.ContextualAnomaly;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Anomaly detector for a single entity's daily mention counts.
 *
 * <p>
 * The configured strategy decides how each day is scored:
 * </p>
 * <ul>
 * <li>{@code isolation_forest}, {@code local_outlier_factor},
 * {@code one_class_svm}: an {@link OutlierModel} is trained on the
 * {@link FeatureMatrix} of the series. The score is the negated decision
 * value, so a day is anomalous exactly when its score is positive.</li>
 * <li>{@code z_score}: each day against the mean and standard deviation of
 * all the other days.</li>
 * <li>{@code iqr}: distance beyond the 1.5 IQR fences, in IQR units.</li>
 * <li>{@code moving_average}: each day against the 7 days before it.</li>
 * </ul>
 *
 * <h3>State</h3>
 * <p>
 * {@link #fit(EntityTimeSeries)} keeps the trained model and
 * {@link #detectAnomalies(EntityTimeSeries)} reuses it, fitting on the scored
 * series first when no model has been trained yet. The feature width depends
 * on the series length, so a series whose rows are wider or narrower than the
 * training rows is scored by a model fitted on that series alone; the kept
 * model is left untouched.
 * {@link #detect(EntityTimeSeries)} always trains a fresh local model and is
 * safe to call from several threads.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    static final long RANDOM_SEED = 42L;
    static final int MOVING_AVERAGE_WINDOW = 7;
    static final int MIN_HISTORY_SIZE = 2;
    static final int DEFAULT_BURST_WINDOW = 3;
    static final double DEFAULT_BURST_THRESHOLD = 2.0;
    private static final double IQR_FENCE = 1.5;

    private final DetectionMethod strategy;
    private final double contamination;
    private final double threshold;
    private final int changePointWindow;
    private final double changePointThreshold;
    private final int seasonalPeriod;

    private volatile OutlierModel fittedModel;

    /**
     * Detector with the default threshold (3.0), change-point window (7),
     * change-point threshold (2.0) and seasonal period (7).
     */
    public AnomalyDetector(DetectionMethod strategy, double contamination) {
        this(strategy, contamination, 3.0, 7, 2.0, 7);
    }

    /**
     * @throws InvalidParameterException if the strategy is not an anomaly
     *                                   strategy or a numeric parameter is out
     *                                   of range
     */
    public AnomalyDetector(DetectionMethod strategy, double contamination, double threshold,
            int changePointWindow, double changePointThreshold, int seasonalPeriod) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (!strategy.isAnomalyStrategy()) {
            throw new InvalidParameterException("strategy", "must be an anomaly strategy, got: " + strategy);
        }
        this.strategy = strategy;
        this.contamination = InvalidParameterException.requireInRange("contamination", contamination, 0.0, 0.5);
        this.threshold = InvalidParameterException.requirePositive("threshold", threshold);
        this.changePointWindow = InvalidParameterException.requireAtLeast("changePointWindow", changePointWindow, 2);
        this.changePointThreshold = InvalidParameterException.requirePositive("changePointThreshold",
                changePointThreshold);
        this.seasonalPeriod = InvalidParameterException.requireAtLeast("seasonalPeriod", seasonalPeriod, 2);
    }

    public static AnomalyDetector fromSettings(AnomalySettings settings) {
        Objects.requireNonNull(settings, "AnomalySettings must not be null");
        return new AnomalyDetector(settings.strategyMethod(), settings.getContamination(),
                settings.getThreshold(), settings.getChangePointWindow(),
                settings.getChangePointThreshold(), settings.getSeasonalPeriod());
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ANOMALY;
    }

    @Override
    public DetectionMethod method() {
        return strategy;
    }

    // ---------------------------------------------------------------
    // Core strategies
    // ---------------------------------------------------------------

    /**
     * Train the strategy's model on a series. A no-op for the formula-based
     * strategies.
     *
     * @return this detector
     */
    public AnomalyDetector fit(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (!strategy.isModelBased()) {
            return this;
        }
        FeatureMatrix features = FeatureMatrix.of(series);
        if (features.rowCount() < 2) {
            LOG.warn("Entity '{}': only {} feature row(s), model left untrained",
                    series.getEntity(), features.rowCount());
            return this;
        }
        OutlierModel model = newModel();
        model.fit(features.rows());
        fittedModel = model;
        LOG.debug("Entity '{}': trained {} on {} rows", series.getEntity(), strategy, features.rowCount());
        return this;
    }

    public boolean isFitted() {
        return fittedModel != null;
    }

    /**
     * Score a series with the trained model, or with the formula of a
     * formula-based strategy.
     *
     * @return one record per scored day; empty for an empty series or when
     *         fewer than two feature rows exist
     */
    public List<AnomalyRecord> detectAnomalies(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (!strategy.isModelBased()) {
            return detect(series);
        }
        OutlierModel model = fittedModel;
        if (model == null) {
            LOG.debug("Entity '{}': no trained model, fitting on the scored series", series.getEntity());
            fit(series);
            model = fittedModel;
            return model == null ? List.of() : scoreWithModel(series, FeatureMatrix.of(series), model);
        }
        FeatureMatrix features = FeatureMatrix.of(series);
        if (features.columnCount() != model.featureCount()) {
            LOG.debug("Entity '{}': {} feature column(s) but the model was trained on {}, fitting a local model",
                    series.getEntity(), features.columnCount(), model.featureCount());
            return scoreWithModel(series, features, null);
        }
        return scoreWithModel(series, features, model);
    }

    @Override
    public List<AnomalyRecord> detect(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.isEmpty()) {
            return List.of();
        }
        return switch (strategy) {
            case ISOLATION_FOREST, LOCAL_OUTLIER_FACTOR, ONE_CLASS_SVM ->
                    scoreWithModel(series, FeatureMatrix.of(series), null);
            case Z_SCORE -> zScore(series);
            case IQR -> interquartile(series);
            case MOVING_AVERAGE -> movingAverage(series);
            default -> throw new IllegalStateException("Unsupported strategy: " + strategy);
        };
    }

    private OutlierModel newModel() {
        return switch (strategy) {
            case ISOLATION_FOREST -> new IsolationForestModel(contamination, RANDOM_SEED);
            case LOCAL_OUTLIER_FACTOR -> new LocalOutlierFactor(contamination);
            case ONE_CLASS_SVM -> new OneClassSvm(contamination);
            default -> throw new IllegalStateException("Strategy " + strategy + " does not train a model");
        };
    }

    /** @param trained model to use, or {@code null} to train a local one */
    private List<AnomalyRecord> scoreWithModel(EntityTimeSeries series, FeatureMatrix features,
            OutlierModel trained) {
        if (features.rowCount() < 2) {
            LOG.warn("Entity '{}': too few days ({}) for {}", series.getEntity(), series.size(), strategy);
            return List.of();
        }
        OutlierModel model = trained;
        if (model == null) {
            model = newModel();
            model.fit(features.rows());
        }
        double[] decisions = model.decisionFunction(features.rows());

        List<AnomalyRecord> records = new ArrayList<>(decisions.length);
        for (int row = 0; row < decisions.length; row++) {
            int i = features.seriesIndex(row);
            records.add(new AnomalyRecord(series.dateAt(i), series.valueAt(i), -decisions[row],
                    decisions[row] < 0, strategy));
        }
        return records;
    }

    private List<AnomalyRecord> zScore(EntityTimeSeries series) {
        double[] values = series.values();
        int n = values.length;
        List<AnomalyRecord> records = new ArrayList<>(n);
        double[] others = new double[Math.max(0, n - 1)];

        for (int i = 0; i < n; i++) {
            double score = 0.0;
            if (n >= 3) {
                // leave the scored day out of its own reference
                System.arraycopy(values, 0, others, 0, i);
                System.arraycopy(values, i + 1, others, i, n - i - 1);
                double mean = RollingStatistics.mean(others);
                score = Math.abs(values[i] - mean)
                        / (RollingStatistics.populationStd(others) + RollingStatistics.EPSILON);
            }
            records.add(new AnomalyRecord(series.dateAt(i), values[i], score, score > threshold, strategy));
        }
        return records;
    }

    private List<AnomalyRecord> interquartile(EntityTimeSeries series) {
        double[] values = series.values();
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double q1 = percentile.evaluate(values, 25.0);
        double q3 = percentile.evaluate(values, 75.0);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FENCE * iqr;
        double upper = q3 + IQR_FENCE * iqr;

        List<AnomalyRecord> records = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double beyond = values[i] > upper ? values[i] - upper
                    : values[i] < lower ? lower - values[i]
                    : 0.0;
            double score = iqr > 0 ? beyond / iqr : beyond;
            boolean anomaly = values[i] > upper || values[i] < lower;
            records.add(new AnomalyRecord(series.dateAt(i), values[i], score, anomaly, strategy));
        }
        return records;
    }

    private List<AnomalyRecord> movingAverage(EntityTimeSeries series) {
        double[] values = series.values();
        RollingStatistics.Baseline baseline = RollingStatistics.trailing(values, MOVING_AVERAGE_WINDOW,
                MIN_HISTORY_SIZE);
        List<AnomalyRecord> records = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double score = 0.0;
            if (baseline.isDefined(i)) {
                score = Math.abs(RollingStatistics.standardScore(values[i], baseline.mean(i), baseline.std(i)));
            }
            records.add(new AnomalyRecord(series.dateAt(i), values[i], score, score > threshold, strategy));
        }
        return records;
    }

    // ---------------------------------------------------------------
    // Context and auxiliary signals
    // ---------------------------------------------------------------

    /**
     * Anomalies annotated with how unusual each day is for its day of the
     * week.
     */
    public List<ContextualAnomaly> detectAnomaliesWithContext(EntityTimeSeries series) {
        List<AnomalyRecord> base = detectAnomalies(series);
        if (base.isEmpty()) {
            return List.of();
        }

        Map<DayOfWeek, List<Double>> byDay = new EnumMap<>(DayOfWeek.class);
        for (AnomalyRecord record : base) {
            byDay.computeIfAbsent(record.getDate().getDayOfWeek(), d -> new ArrayList<>()).add(record.getValue());
        }
        Map<DayOfWeek, double[]> stats = new EnumMap<>(DayOfWeek.class);
        byDay.forEach((day, values) -> {
            double[] array = values.stream().mapToDouble(Double::doubleValue).toArray();
            double std = array.length > 1 ? RollingStatistics.sampleStd(array) : 0.0;
            stats.put(day, new double[] { RollingStatistics.mean(array), std });
        });

        List<ContextualAnomaly> result = new ArrayList<>(base.size());
        for (AnomalyRecord record : base) {
            double[] dayStats = stats.get(record.getDate().getDayOfWeek());
            double score = Math.abs(record.getValue() - dayStats[0]) / (dayStats[1] + RollingStatistics.EPSILON);
            result.add(new ContextualAnomaly(record, score, score > threshold));
        }
        return result;
    }

    public List<AnomalyRecord> detectChangePoints(EntityTimeSeries series) {
        return detectChangePoints(series, changePointWindow, changePointThreshold);
    }

    public List<AnomalyRecord> detectChangePoints(EntityTimeSeries series, int window, double changeThreshold) {
        return new ChangePointDetector(window, changeThreshold).detect(series);
    }

    public List<AnomalyRecord> detectSeasonalAnomalies(EntityTimeSeries series) {
        return detectSeasonalAnomalies(series, seasonalPeriod);
    }

    public List<AnomalyRecord> detectSeasonalAnomalies(EntityTimeSeries series, int period) {
        return new SeasonalDetector(period, threshold).detect(series);
    }

    /**
     * Burst scores of a series with the given baseline window; minimum
     * duration and merge gap are one day.
     */
    public List<AnomalyRecord> detectBurstPatterns(EntityTimeSeries series, int window, double burstThreshold) {
        return new BurstDetector(burstThreshold, window, 1, 1).detectBursts(series);
    }

    /**
     * Every day the anomaly strategy scored, with the change-point, seasonal
     * and burst signals of the same day attached.
     */
    public List<CombinedDetection> combineDetectionMethods(EntityTimeSeries series) {
        List<AnomalyRecord> anomalies = detectAnomalies(series);
        if (anomalies.isEmpty()) {
            return List.of();
        }
        List<AnomalyRecord> changePoints = detectChangePoints(series);
        List<AnomalyRecord> seasonal = detectSeasonalAnomalies(series);
        List<AnomalyRecord> bursts = detectBurstPatterns(series, DEFAULT_BURST_WINDOW, DEFAULT_BURST_THRESHOLD);

        List<CombinedDetection> combined = new ArrayList<>(anomalies.size());
        for (AnomalyRecord anomaly : anomalies) {
            int i = series.indexOf(anomaly.getDate());
            Map<Signal, Double> scores = new EnumMap<>(Signal.class);
            Map<Signal, Boolean> flags = new EnumMap<>(Signal.class);
            put(scores, flags, Signal.ANOMALY, anomaly);
            put(scores, flags, Signal.CHANGE_POINT, changePoints.get(i));
            put(scores, flags, Signal.SEASONAL, seasonal.get(i));
            put(scores, flags, Signal.BURST, bursts.get(i));
            combined.add(new CombinedDetection(anomaly.getDate(), anomaly.getValue(), scores, flags));
        }
        return combined;
    }

    private static void put(Map<Signal, Double> scores, Map<Signal, Boolean> flags, Signal signal,
            AnomalyRecord record) {
        scores.put(signal, record.getScore());
        flags.put(signal, record.isAnomaly());
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public DetectionMethod getStrategy() {
        return strategy;
    }

    public double getContamination() {
        return contamination;
    }

    public double getThreshold() {
        return threshold;
    }
}
