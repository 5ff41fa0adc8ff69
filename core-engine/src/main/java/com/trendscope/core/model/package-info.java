/**
 * Immutable input and result structures of the analysis core.
 *
 * <p>
 * {@link com.trendscope.core.model.MentionRecord} rows come in from the
 * persistence collaborator and are folded into
 * {@link com.trendscope.core.model.EntityTimeSeries} snapshots; every other
 * type here is a result handed back to reporting collaborators. All types are
 * {@link java.io.Serializable} and expose plain getters so they serialize to
 * JSON without custom serializers.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendscope.core.model;
