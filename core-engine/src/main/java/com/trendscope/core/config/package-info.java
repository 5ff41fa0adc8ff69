/**
 * YAML-backed analysis settings.
 *
 * <p>
 * {@link com.trendscope.core.config.ConfigLoader} parses the file into
 * {@link com.trendscope.core.config.AnalysisConfig}, one settings bean per
 * component, applies {@code ANALYSIS_<SECTION>_<KEY>} environment overrides
 * and validates it before anything runs.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendscope.core.config;
