package com.trendscope.core.detection;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.model.AnomalyRecord;
import com.trendscope.core.model.DetectionMethod;
import com.trendscope.core.model.EntityTimeSeries;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects shifts in the mean level of a series.
 *
 * <p>
 * For each day {@code i} the window of {@code windowSize} days before it is
 * compared with the window starting at it. The score is the distance between
 * the two means divided by {@code sqrt(s1^2 + s2^2)} (sample deviations), or
 * the raw distance when either window is constant. Only series longer than
 * twice the window are scored; edge days score zero.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector implements Detector {

    private final int windowSize;
    private final double threshold;

    public ChangePointDetector(int windowSize, double threshold) {
        this.windowSize = InvalidParameterException.requireAtLeast("changePointWindow", windowSize, 2);
        this.threshold = InvalidParameterException.requirePositive("changePointThreshold", threshold);
    }

    @Override
    public List<AnomalyRecord> detect(EntityTimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        int n = values.length;
        double[] scores = new double[n];

        if (n > 2 * windowSize) {
            Mean mean = new Mean();
            StandardDeviation std = new StandardDeviation(true);
            for (int i = windowSize; i < n - windowSize; i++) {
                double mean1 = mean.evaluate(values, i - windowSize, windowSize);
                double mean2 = mean.evaluate(values, i, windowSize);
                double std1 = std.evaluate(values, i - windowSize, windowSize);
                double std2 = std.evaluate(values, i, windowSize);
                double distance = Math.abs(mean2 - mean1);
                scores[i] = std1 > 0 && std2 > 0 ? distance / Math.sqrt(std1 * std1 + std2 * std2) : distance;
            }
        }

        List<AnomalyRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(new AnomalyRecord(series.dateAt(i), values[i], scores[i], scores[i] > threshold,
                    DetectionMethod.CHANGE_POINT));
        }
        return records;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.CHANGE_POINT;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.CHANGE_POINT;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getThreshold() {
        return threshold;
    }
}
