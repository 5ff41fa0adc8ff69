package com.trendscope.core.event;

import com.trendscope.core.correlation.EntityGraph;
import com.trendscope.core.model.CausalRelationship;

import java.io.Serializable;
import java.util.List;

/**
 * Lead/lag relationships among a set of entities and the directed network
 * they form.
 *
 * @since 1.0.0
 */
public final class CausalEventsReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> entities;
    private final int maxLag;
    private final double minCorrelation;
    private final List<CausalRelationship> causalRelationships;
    private final EntityGraph network;

    public CausalEventsReport(List<String> entities, int maxLag, double minCorrelation,
            List<CausalRelationship> causalRelationships, EntityGraph network) {
        this.entities = List.copyOf(entities);
        this.maxLag = maxLag;
        this.minCorrelation = minCorrelation;
        this.causalRelationships = List.copyOf(causalRelationships);
        this.network = network;
    }

    public List<String> getEntities() {
        return entities;
    }

    public int getMaxLag() {
        return maxLag;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public List<CausalRelationship> getCausalRelationships() {
        return causalRelationships;
    }

    public EntityGraph getNetwork() {
        return network;
    }

    @Override
    public String toString() {
        return "CausalEventsReport{entities=" + entities.size()
                + ", relationships=" + causalRelationships.size() + '}';
    }
}
