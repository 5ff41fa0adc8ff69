/**
 * Bounded parallel execution with a per-task time budget and cooperative
 * cancellation.
 *
 * @since 1.0.0
 */
package com.trendscope.core.concurrent;
