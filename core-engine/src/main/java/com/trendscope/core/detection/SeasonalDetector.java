package com.trendscope.core.detection;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags days that deviate from the usual level of their position in the
 * seasonal cycle.
 *
 * <p>
 * Days are bucketed by {@code index mod period}; on a contiguous daily series
 * with a period of seven this is exactly the day-of-week grouping. Each day is
 * scored against the mean and sample deviation of its bucket (raw distance
 * for a constant bucket). Only series longer than two full periods are
 * scored.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDetector implements Detector {

    private final int period;
    private final double threshold;

    public SeasonalDetector(int period, double threshold) {
        this.period = InvalidParameterException.requireAtLeast("seasonalPeriod", period, 2);
        this.threshold = InvalidParameterException.requirePositive("threshold", threshold);
    }

    @Override
    public List<AnomalyRecord> detect(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        int n = values.length;
        double[] scores = new double[n];

        if (n > 2 * period) {
            double[] bucketMean = new double[period];
            double[] bucketStd = new double[period];
            for (int bucket = 0; bucket < period; bucket++) {
                double[] members = bucketValues(values, bucket);
                bucketMean[bucket] = RollingStatistics.mean(members);
                bucketStd[bucket] = RollingStatistics.sampleStd(members);
            }
            for (int i = 0; i < n; i++) {
                int bucket = i % period;
                double distance = Math.abs(values[i] - bucketMean[bucket]);
                scores[i] = bucketStd[bucket] > 0 ? distance / bucketStd[bucket] : distance;
            }
        }

        List<AnomalyRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(new AnomalyRecord(series.dateAt(i), values[i], scores[i], scores[i] > threshold,
                    DetectionMethod.SEASONAL));
        }
        return records;
    }

    private double[] bucketValues(double[] values, int bucket) {
        int count = (values.length - bucket + period - 1) / period;
        double[] members = new double[count];
        for (int k = 0, i = bucket; i < values.length; i += period, k++) {
            members[k] = values[i];
        }
        return members;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.SEASONAL;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL;
    }

    public int getPeriod() {
        return period;
    }
}
