package com.trendscope.core.correlation;

import java.io.Serializable;

/**
 * One edge of an {@link EntityGraph}. Endpoints are node indices; the lag is
 * only present on edges of a directed lead/lag graph.
 *
 * @since 1.0.0
 */
public final class GraphEdge implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int source;
    private final int target;
    private final String sourceEntity;
    private final String targetEntity;
    private final double weight;
    private final double pValue;
    private final Integer lag;

    GraphEdge(int source, int target, String sourceEntity, String targetEntity,
            double weight, double pValue, Integer lag) {
        this.source = source;
        this.target = target;
        this.sourceEntity = sourceEntity;
        this.targetEntity = targetEntity;
        this.weight = weight;
        this.pValue = pValue;
        this.lag = lag;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public String getSourceEntity() {
        return sourceEntity;
    }

    public String getTargetEntity() {
        return targetEntity;
    }

    /** @return the correlation coefficient of the pair */
    public double getWeight() {
        return weight;
    }

    public double getPValue() {
        return pValue;
    }

    /** @return lead in days of the source over the target, or {@code null} */
    public Integer getLag() {
        return lag;
    }

    @Override
    public String toString() {
        return sourceEntity + (lag != null ? " -> " : " -- ") + targetEntity
                + " (r=" + weight + ", p=" + pValue + (lag != null ? ", lag=" + lag : "") + ')';
    }
}
