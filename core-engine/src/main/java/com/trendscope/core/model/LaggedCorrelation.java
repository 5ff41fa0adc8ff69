package com.trendscope.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Correlation curve of two entities over a range of day shifts, with the
 * shift of maximum absolute correlation singled out as the best lag.
 *
 * @since 1.0.0
 */
public final class LaggedCorrelation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Which series moves first at the best lag. */
    public enum Direction {
        FIRST_LEADS, SECOND_LEADS, SIMULTANEOUS;

        public static Direction ofLag(int lag) {
            if (lag > 0) {
                return FIRST_LEADS;
            }
            return lag < 0 ? SECOND_LEADS : SIMULTANEOUS;
        }
    }

    /** Correlation measured at one shift. */
    public static final class LagPoint implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int lag;
        private final double correlation;
        private final double pValue;

        public LagPoint(int lag, double correlation, double pValue) {
            this.lag = lag;
            this.correlation = correlation;
            this.pValue = pValue;
        }

        public int getLag() {
            return lag;
        }

        public double getCorrelation() {
            return correlation;
        }

        public double getPValue() {
            return pValue;
        }

        @Override
        public String toString() {
            return "LagPoint{lag=" + lag + ", r=" + correlation + ", p=" + pValue + '}';
        }
    }

    private final String entity1;
    private final String entity2;
    private final List<LagPoint> curve;
    private final LagPoint best;

    /**
     * @param curve correlations ordered by lag; must not be empty
     * @throws IllegalArgumentException if {@code curve} is empty
     */
    public LaggedCorrelation(String entity1, String entity2, List<LagPoint> curve) {
        this.entity1 = Objects.requireNonNull(entity1, "entity1 must not be null");
        this.entity2 = Objects.requireNonNull(entity2, "entity2 must not be null");
        Objects.requireNonNull(curve, "curve must not be null");
        if (curve.isEmpty()) {
            throw new IllegalArgumentException("Lag curve must contain at least one point");
        }
        this.curve = List.copyOf(curve);
        // first point wins ties
        LagPoint top = this.curve.get(0);
        for (LagPoint point : this.curve) {
            if (Math.abs(point.getCorrelation()) > Math.abs(top.getCorrelation())) {
                top = point;
            }
        }
        this.best = top;
    }

    public String getEntity1() {
        return entity1;
    }

    public String getEntity2() {
        return entity2;
    }

    public List<LagPoint> getCurve() {
        return curve;
    }

    public LagPoint getBest() {
        return best;
    }

    public Direction getDirection() {
        return Direction.ofLag(best.getLag());
    }

    /**
     * @return the best lag as a lag-tagged {@link CorrelationResult}
     */
    public CorrelationResult toResult() {
        return new CorrelationResult(entity1, entity2, best.getCorrelation(), best.getPValue(), best.getLag());
    }

    @Override
    public String toString() {
        return "LaggedCorrelation{" + entity1 + " ~ " + entity2 + ", best=" + best + '}';
    }
}
