/**
 * Batch runner of the entity analysis.
 *
 * <p>
 * {@link com.trendscope.job.EntityAnalysisJob} loads a mentions export,
 * runs {@link com.trendscope.core.AnalysisEngine} over the selected entities
 * and writes one JSON report per analysis. Settings are resolved by
 * {@link com.trendscope.job.JobConfig}.
 * </p>
 */
package com.trendscope.job;
