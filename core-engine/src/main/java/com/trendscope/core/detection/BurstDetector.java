package com.trendscope.core.detection;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.config.BurstSettings;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.BurstEvent;
import com.trendscope.core.model.CoOccurringBurst;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;
import com.trendscope.core.model.MultiScaleBurst;
import com.trendscope.core.model.Peak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rolling-baseline burst detector.
 *
 * <p>
 * The baseline of a day is the mean and population standard deviation of
 * the {@code windowSize} days before it. A day bursts when its standard score
 * against that baseline exceeds {@code sensitivity} <em>and</em> its value is
 * at least the baseline mean: a drop is never a burst. Days without a full
 * baseline window score zero.
 * </p>
 *
 * <p>
 * A flat baseline has a standard deviation of zero, so any change against it
 * yields a score in the order of {@code 1e10}. The flag is decided on that raw
 * score; the reported score is clamped to {@code [-MAX_SCORE, MAX_SCORE]} so
 * sparse counts do not swamp the averages built from it.
 * </p>
 *
 * <h3>Events</h3>
 * <p>
 * Flagged days no more than {@code maxBurstGap} days apart are merged into one
 * {@link BurstEvent}. Events shorter than {@code minBurstDuration} days are
 * dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class BurstDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(BurstDetector.class);

    /** Height at which peak widths are measured, relative to the prominence. */
    static final double PEAK_REL_HEIGHT = 0.5;

    /** Largest magnitude a reported burst score can have. */
    public static final double MAX_SCORE = 10.0;

    private final double sensitivity;
    private final int windowSize;
    private final int minBurstDuration;
    private final int maxBurstGap;

    /**
     * @throws InvalidParameterException if sensitivity is not positive or any
     *                                   window, duration or gap is below one
     */
    public BurstDetector(double sensitivity, int windowSize, int minBurstDuration, int maxBurstGap) {
        this.sensitivity = InvalidParameterException.requirePositive("sensitivity", sensitivity);
        this.windowSize = InvalidParameterException.requireAtLeast("windowSize", windowSize, 1);
        this.minBurstDuration = InvalidParameterException.requireAtLeast("minBurstDuration", minBurstDuration, 1);
        this.maxBurstGap = InvalidParameterException.requireAtLeast("maxBurstGap", maxBurstGap, 1);
    }

    public static BurstDetector fromSettings(BurstSettings settings) {
        Objects.requireNonNull(settings, "BurstSettings must not be null");
        return new BurstDetector(settings.getSensitivity(), settings.getWindowSize(),
                settings.getMinBurstDuration(), settings.getMaxBurstGap());
    }

    @Override
    public List<AnomalyRecord> detect(EntityTimeSeries series) {
        return detectBursts(series);
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.BURST;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.BURST;
    }

    // ---------------------------------------------------------------
    // Daily scores
    // ---------------------------------------------------------------

    /**
     * Burst score and flag of every day.
     *
     * @return one record per day; all zero when the series is not longer than
     *         the window
     */
    public List<AnomalyRecord> detectBursts(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return score(series, windowSize);
    }

    private List<AnomalyRecord> score(EntityTimeSeries series, int window) {
        double[] values = series.values();
        List<AnomalyRecord> records = new ArrayList<>(values.length);
        RollingStatistics.Baseline baseline = values.length > window
                ? RollingStatistics.trailing(values, window, window)
                : null;

        for (int i = 0; i < values.length; i++) {
            double score = 0.0;
            boolean burst = false;
            if (baseline != null && baseline.isDefined(i)) {
                double mean = baseline.mean(i);
                double raw = RollingStatistics.standardScore(values[i], mean, baseline.std(i));
                burst = raw > sensitivity && values[i] >= mean;
                score = Math.max(-MAX_SCORE, Math.min(MAX_SCORE, raw));
            }
            records.add(new AnomalyRecord(series.dateAt(i), values[i], score, burst, DetectionMethod.BURST));
        }
        return records;
    }

    // ---------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------

    /**
     * Merge flagged days into burst events.
     *
     * @return events in date order, each lasting at least
     *         {@code minBurstDuration} days
     */
    public List<BurstEvent> detectBurstEvents(EntityTimeSeries series) {
        List<BurstEvent> events = new ArrayList<>();
        BurstEvent.Builder open = null;

        for (AnomalyRecord day : detectBursts(series)) {
            if (!day.isAnomaly()) {
                continue;
            }
            if (open != null && ChronoUnit.DAYS.between(open.getEndDate(), day.getDate()) > maxBurstGap) {
                close(open, events);
                open = null;
            }
            if (open == null) {
                open = BurstEvent.builder();
            }
            open.addDay(day.getDate(), day.getValue(), day.getScore());
        }
        if (open != null) {
            close(open, events);
        }

        LOG.debug("Entity '{}': {} burst event(s)", series.getEntity(), events.size());
        return events;
    }

    private void close(BurstEvent.Builder open, List<BurstEvent> events) {
        if (open.durationDays() >= minBurstDuration) {
            events.add(open.build());
        } else {
            LOG.trace("Dropping burst shorter than {} day(s)", minBurstDuration);
        }
    }

    // ---------------------------------------------------------------
    // Peaks
    // ---------------------------------------------------------------

    /**
     * Local maxima with at least the given prominence and width.
     *
     * <p>
     * Prominence is the height of a peak above the higher of the two lowest
     * points reachable on either side before climbing above the peak. Width
     * is measured, with linear interpolation, at half the prominence. Flat
     * peaks are reported at the middle of their plateau.
     * </p>
     *
     * @return peaks, most prominent first
     */
    public List<Peak> detectPeaks(EntityTimeSeries series, double minProminence, double minWidth) {
        InvalidParameterException.requireNonNegative("prominence", minProminence);
        InvalidParameterException.requireNonNegative("width", minWidth);
        double[] x = series.values();

        List<Peak> peaks = new ArrayList<>();
        for (int peak : localMaxima(x)) {
            int leftBase = peak;
            double leftMin = x[peak];
            for (int i = peak; i >= 0 && x[i] <= x[peak]; i--) {
                if (x[i] < leftMin) {
                    leftMin = x[i];
                    leftBase = i;
                }
            }
            int rightBase = peak;
            double rightMin = x[peak];
            for (int i = peak; i < x.length && x[i] <= x[peak]; i++) {
                if (x[i] < rightMin) {
                    rightMin = x[i];
                    rightBase = i;
                }
            }
            double prominence = x[peak] - Math.max(leftMin, rightMin);
            double width = widthAt(x, peak, leftBase, rightBase, x[peak] - prominence * PEAK_REL_HEIGHT);

            if (prominence >= minProminence && width >= minWidth) {
                peaks.add(new Peak(series.dateAt(peak), x[peak], prominence, width));
            }
        }
        peaks.sort(Comparator.comparingDouble(Peak::getProminence).reversed());
        return peaks;
    }

    private static List<Integer> localMaxima(double[] x) {
        List<Integer> maxima = new ArrayList<>();
        int i = 1;
        int last = x.length - 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    maxima.add((i + ahead - 1) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return maxima;
    }

    private static double widthAt(double[] x, int peak, int leftBase, int rightBase, double height) {
        int i = peak;
        while (i > leftBase && x[i] > height) {
            i--;
        }
        double left = i;
        if (x[i] < height) {
            left += (height - x[i]) / (x[i + 1] - x[i]);
        }

        i = peak;
        while (i < rightBase && x[i] > height) {
            i++;
        }
        double right = i;
        if (x[i] < height) {
            right -= (height - x[i]) / (x[i - 1] - x[i]);
        }
        return right - left;
    }

    // ---------------------------------------------------------------
    // Multi-scale and cross-entity
    // ---------------------------------------------------------------

    /**
     * Burst scores at several baseline window sizes.
     *
     * @param scales window sizes; at least one, each at least one day
     * @return one record per day with the per-scale scores and flags
     */
    public List<MultiScaleBurst> detectMultiScaleBursts(EntityTimeSeries series, List<Integer> scales) {
        Objects.requireNonNull(scales, "scales must not be null");
        if (scales.isEmpty()) {
            throw new InvalidParameterException("scales", "must contain at least one window size");
        }
        Map<Integer, List<AnomalyRecord>> perScale = new LinkedHashMap<>();
        for (Integer scale : scales) {
            InvalidParameterException.requireAtLeast("scale", scale, 1);
            perScale.put(scale, score(series, scale));
        }

        List<MultiScaleBurst> result = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            Map<Integer, Double> scores = new LinkedHashMap<>();
            Map<Integer, Boolean> flags = new LinkedHashMap<>();
            for (Map.Entry<Integer, List<AnomalyRecord>> entry : perScale.entrySet()) {
                AnomalyRecord day = entry.getValue().get(i);
                scores.put(entry.getKey(), day.getScore());
                flags.put(entry.getKey(), day.isAnomaly());
            }
            result.add(new MultiScaleBurst(series.dateAt(i), series.valueAt(i), scores, flags));
        }
        return result;
    }

    /**
     * Dates on which at least two entities are inside a burst event, merged
     * into cross-entity records when no more than {@code maxBurstGap} days
     * apart.
     *
     * @param seriesByEntity series keyed by entity
     * @return co-occurring bursts in date order, numbered from 1
     */
    public List<CoOccurringBurst> detectEntityCorrelationBursts(Map<String, EntityTimeSeries> seriesByEntity) {
        Objects.requireNonNull(seriesByEntity, "seriesByEntity must not be null");

        TreeMap<LocalDate, SortedSet<String>> burstingEntities = new TreeMap<>();
        seriesByEntity.forEach((entity, series) -> {
            for (BurstEvent event : detectBurstEvents(series)) {
                for (LocalDate date : event.getDates()) {
                    burstingEntities.computeIfAbsent(date, d -> new TreeSet<>()).add(entity);
                }
            }
        });
        burstingEntities.values().removeIf(entities -> entities.size() < 2);

        List<CoOccurringBurst> result = new ArrayList<>();
        SortedSet<String> entities = null;
        List<LocalDate> dates = null;
        for (Map.Entry<LocalDate, SortedSet<String>> entry : burstingEntities.entrySet()) {
            LocalDate date = entry.getKey();
            if (dates != null && ChronoUnit.DAYS.between(dates.get(dates.size() - 1), date) > maxBurstGap) {
                result.add(new CoOccurringBurst(result.size() + 1, entities, dates));
                dates = null;
            }
            if (dates == null) {
                entities = new TreeSet<>();
                dates = new ArrayList<>();
            }
            entities.addAll(entry.getValue());
            dates.add(date);
        }
        if (dates != null) {
            result.add(new CoOccurringBurst(result.size() + 1, entities, dates));
        }

        LOG.debug("{} co-occurring burst(s) across {} entities", result.size(), seriesByEntity.size());
        return result;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getSensitivity() {
        return sensitivity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMinBurstDuration() {
        return minBurstDuration;
    }

    public int getMaxBurstGap() {
        return maxBurstGap;
    }
}
