/**
 * Access to stored mentions and their daily count series.
 *
 * @since 1.0.0
 */
package com.trendscope.core.series;
