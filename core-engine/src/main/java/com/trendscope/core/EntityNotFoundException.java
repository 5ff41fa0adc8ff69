package com.trendscope.core;

/**
 * Thrown when an analysis is requested for an entity that has no stored
 * mentions at all.
 *
 * <p>
 * This is the one hard failure surfaced by the time-series layer: it points
 * at a caller-side data reference error. An entity that exists but has no
 * mentions inside the requested range yields an empty series instead.
 * </p>
 *
 * @since 1.0.0
 */
public class EntityNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String entity;

    public EntityNotFoundException(String entity) {
        super("Entity not found: '" + entity + "'");
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
