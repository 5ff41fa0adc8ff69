package com.trendscope.core.event;

import com.trendscope.core.model.CoOccurringBurst;

import java.io.Serializable;
import java.util.List;

/**
 * Bursts that several entities went through at the same time.
 *
 * @since 1.0.0
 */
public final class CoOccurringEventsReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> entities;
    private final int maxDaysGap;
    private final List<CoOccurringBurst> coOccurringEvents;

    public CoOccurringEventsReport(List<String> entities, int maxDaysGap, List<CoOccurringBurst> coOccurringEvents) {
        this.entities = List.copyOf(entities);
        this.maxDaysGap = maxDaysGap;
        this.coOccurringEvents = List.copyOf(coOccurringEvents);
    }

    public List<String> getEntities() {
        return entities;
    }

    public int getMaxDaysGap() {
        return maxDaysGap;
    }

    public List<CoOccurringBurst> getCoOccurringEvents() {
        return coOccurringEvents;
    }

    @Override
    public String toString() {
        return "CoOccurringEventsReport{entities=" + entities.size() + ", events=" + coOccurringEvents.size() + '}';
    }
}
