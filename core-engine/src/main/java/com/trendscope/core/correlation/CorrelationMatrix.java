package com.trendscope.core.correlation;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Symmetric pairwise correlations and p-values of a set of entities.
 *
 * <p>
 * The diagonal holds a correlation of {@code 1.0} and a p-value of
 * {@code 0.0}. Rows and columns follow the order of {@link #getEntities()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationMatrix implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> entities;
    private final double[][] correlations;
    private final double[][] pValues;

    CorrelationMatrix(List<String> entities, double[][] correlations, double[][] pValues) {
        this.entities = List.copyOf(entities);
        this.correlations = correlations;
        this.pValues = pValues;
    }

    static CorrelationMatrix empty() {
        return new CorrelationMatrix(List.of(), new double[0][0], new double[0][0]);
    }

    public List<String> getEntities() {
        return entities;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public double correlation(String entity1, String entity2) {
        return correlations[index(entity1)][index(entity2)];
    }

    public double pValue(String entity1, String entity2) {
        return pValues[index(entity1)][index(entity2)];
    }

    public double correlationAt(int i, int j) {
        return correlations[i][j];
    }

    public double pValueAt(int i, int j) {
        return pValues[i][j];
    }

    /** @return a copy of the correlation rows */
    public double[][] getCorrelations() {
        return copy(correlations);
    }

    /** @return a copy of the p-value rows */
    public double[][] getPValues() {
        return copy(pValues);
    }

    private int index(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        int i = entities.indexOf(entity);
        if (i < 0) {
            throw new IllegalArgumentException("Entity not in matrix: '" + entity + "'");
        }
        return i;
    }

    private static double[][] copy(double[][] rows) {
        double[][] result = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            result[i] = rows[i].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return "CorrelationMatrix{entities=" + entities + '}';
    }
}
