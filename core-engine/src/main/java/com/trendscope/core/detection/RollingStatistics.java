package com.trendscope.core.detection;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Rolling-window statistics shared by the burst, moving-average and feature
 * code.
 *
 * <p>
 * Two window flavours exist. A <em>trailing</em> baseline for day {@code i}
 * covers the days strictly before {@code i}, so a value never influences its
 * own baseline. An <em>inclusive</em> window ends at day {@code i} and is
 * used for descriptive features only.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingStatistics {

    /** Added to standard deviations before dividing by them. */
    public static final double EPSILON = 1e-10;

    private RollingStatistics() {
        // utility class, not instantiable
    }

    /**
     * Mean and population standard deviation of the trailing window of each
     * day.
     */
    public static final class Baseline {
        private final double[] mean;
        private final double[] std;

        private Baseline(double[] mean, double[] std) {
            this.mean = mean;
            this.std = std;
        }

        /** @return {@code true} when day {@code i} had enough history */
        public boolean isDefined(int i) {
            return !Double.isNaN(mean[i]);
        }

        public double mean(int i) {
            return mean[i];
        }

        public double std(int i) {
            return std[i];
        }
    }

    /**
     * Trailing baseline over up to {@code window} preceding values.
     *
     * @param values     series values
     * @param window     maximum number of preceding days in the baseline
     * @param minHistory fewest preceding days for which a baseline is defined
     * @return baseline; undefined entries are {@code NaN}
     */
    public static Baseline trailing(double[] values, int window, int minHistory) {
        int n = values.length;
        double[] mean = new double[n];
        double[] std = new double[n];
        Arrays.fill(mean, Double.NaN);
        Arrays.fill(std, Double.NaN);

        Mean meanStat = new Mean();
        StandardDeviation stdStat = new StandardDeviation(false);
        for (int i = 0; i < n; i++) {
            int length = Math.min(window, i);
            if (length < minHistory || length == 0) {
                continue;
            }
            mean[i] = meanStat.evaluate(values, i - length, length);
            std[i] = stdStat.evaluate(values, i - length, length);
        }
        return new Baseline(mean, std);
    }

    /**
     * Mean of the window ending at each day, over however many days are
     * available (at least one).
     */
    public static double[] inclusiveMean(double[] values, int window) {
        double[] result = new double[values.length];
        Mean meanStat = new Mean();
        for (int i = 0; i < values.length; i++) {
            int length = Math.min(window, i + 1);
            result[i] = meanStat.evaluate(values, i + 1 - length, length);
        }
        return result;
    }

    /**
     * Sample standard deviation of the window ending at each day; {@code NaN}
     * where the window holds a single value.
     */
    public static double[] inclusiveSampleStd(double[] values, int window) {
        double[] result = new double[values.length];
        StandardDeviation stdStat = new StandardDeviation(true);
        for (int i = 0; i < values.length; i++) {
            int length = Math.min(window, i + 1);
            result[i] = length < 2 ? Double.NaN : stdStat.evaluate(values, i + 1 - length, length);
        }
        return result;
    }

    /**
     * Signed deviation of {@code value} from a baseline in units of its
     * standard deviation. Exactly zero when the value equals the mean.
     */
    public static double standardScore(double value, double mean, double std) {
        return (value - mean) / (std + EPSILON);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : new Mean().evaluate(values);
    }

    public static double sampleStd(double[] values) {
        return values.length < 2 ? Double.NaN : new StandardDeviation(true).evaluate(values);
    }

    public static double populationStd(double[] values) {
        return values.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(values);
    }
}
