package com.trendscope.core.event;

import com.trendscope.core.correlation.CorrelationMatrix;
import com.trendscope.core.correlation.EntityGraph;
import com.trendscope.core.model.CorrelationResult;

import java.io.Serializable;
import java.util.List;
import java.util.SortedSet;

/**
 * Static correlation structure of a set of entities: the full matrix, the
 * strongly correlated pairs, the correlation network and its communities.
 *
 * @since 1.0.0
 */
public final class CorrelatedEventsReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> entities;
    private final double minCorrelation;
    private final CorrelationMatrix correlationMatrix;
    private final List<SortedSet<String>> communities;
    private final List<CorrelationResult> correlatedPairs;
    private final EntityGraph network;

    public CorrelatedEventsReport(List<String> entities, double minCorrelation, CorrelationMatrix correlationMatrix,
            List<SortedSet<String>> communities, List<CorrelationResult> correlatedPairs, EntityGraph network) {
        this.entities = List.copyOf(entities);
        this.minCorrelation = minCorrelation;
        this.correlationMatrix = correlationMatrix;
        this.communities = List.copyOf(communities);
        this.correlatedPairs = List.copyOf(correlatedPairs);
        this.network = network;
    }

    public List<String> getEntities() {
        return entities;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public CorrelationMatrix getCorrelationMatrix() {
        return correlationMatrix;
    }

    public List<SortedSet<String>> getCommunities() {
        return communities;
    }

    public List<CorrelationResult> getCorrelatedPairs() {
        return correlatedPairs;
    }

    public EntityGraph getNetwork() {
        return network;
    }

    @Override
    public String toString() {
        return "CorrelatedEventsReport{entities=" + entities.size() + ", pairs=" + correlatedPairs.size()
                + ", communities=" + communities.size() + '}';
    }
}
