package com.trendscope.core.detection.model;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.concurrent.Cancellation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

import java.util.Arrays;

/**
 * Local outlier factor: compares the local reachability density of a row with
 * that of its {@code k} nearest training rows.
 *
 * <p>
 * Neighbours come from a Smile {@link KDTree} over the training rows. The
 * tree skips a query that is the very array it indexed, so a query row equal
 * to a training row is looked up through that training array: the match is
 * treated as the query itself and left out of its neighbourhood, and scoring
 * the training rows reproduces the classic fit-and-predict result.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocalOutlierFactor implements OutlierModel {

    static final int DEFAULT_NEIGHBORS = 20;
    private static final double DENSITY_EPSILON = 1e-10;

    private final int neighbors;
    private final double contamination;

    private double[][] training;
    private KDTree<double[]> index;
    private int k;
    private double[] kDistance;
    private double[] density;
    private double offset;

    public LocalOutlierFactor(double contamination) {
        this(DEFAULT_NEIGHBORS, contamination);
    }

    public LocalOutlierFactor(int neighbors, double contamination) {
        this.neighbors = InvalidParameterException.requireAtLeast("neighbors", neighbors, 1);
        this.contamination = InvalidParameterException.requireInRange("contamination", contamination, 0.0, 0.5);
    }

    @Override
    public void fit(double[][] rows) {
        OutlierModel.checkTrainingRows("Local outlier factor", rows);
        training = rows;
        index = new KDTree<>(rows, rows);
        k = Math.max(1, Math.min(neighbors, rows.length - 1));

        Neighbor<double[], double[]>[][] neighbourhoods = new Neighbor[rows.length][];
        kDistance = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            Cancellation.checkpoint();
            neighbourhoods[i] = index.search(rows[i], k);
            kDistance[i] = farthest(neighbourhoods[i]);
        }
        density = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            density[i] = reachabilityDensity(neighbourhoods[i]);
        }

        double[] negativeFactors = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            negativeFactors[i] = -outlierFactor(density[i], neighbourhoods[i]);
        }
        offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negativeFactors, contamination * 100.0);
    }

    @Override
    public double[] decisionFunction(double[][] rows) {
        if (!isFitted()) {
            throw new IllegalStateException("Local outlier factor has not been fitted");
        }
        OutlierModel.checkWidth("Local outlier factor", featureCount(), rows);
        double[] decisions = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            Cancellation.checkpoint();
            Neighbor<double[], double[]>[] neighbourhood = index.search(queryKey(rows[i]), k);
            decisions[i] = -outlierFactor(reachabilityDensity(neighbourhood), neighbourhood) - offset;
        }
        return decisions;
    }

    @Override
    public boolean isFitted() {
        return training != null;
    }

    @Override
    public int featureCount() {
        return training == null ? 0 : training[0].length;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double reachabilityDensity(Neighbor<double[], double[]>[] neighbourhood) {
        double sum = 0;
        for (Neighbor<double[], double[]> o : neighbourhood) {
            sum += Math.max(kDistance[o.index], o.distance);
        }
        return 1.0 / (sum / neighbourhood.length + DENSITY_EPSILON);
    }

    private double outlierFactor(double rowDensity, Neighbor<double[], double[]>[] neighbourhood) {
        double sum = 0;
        for (Neighbor<double[], double[]> o : neighbourhood) {
            sum += density[o.index];
        }
        return (sum / neighbourhood.length) / rowDensity;
    }

    private static double farthest(Neighbor<double[], double[]>[] neighbourhood) {
        double max = 0;
        for (Neighbor<double[], double[]> o : neighbourhood) {
            max = Math.max(max, o.distance);
        }
        return max;
    }

    /** The training array equal to {@code row}, or {@code row} itself. */
    private double[] queryKey(double[] row) {
        for (double[] candidate : training) {
            if (Arrays.equals(row, candidate)) {
                return candidate;
            }
        }
        return row;
    }
}
