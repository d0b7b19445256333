/**
 * Domain model of the census.
 *
 * <ul>
 * <li>{@link com.keypointcensus.core.model.Detection}: one detector's
 * responses for one image</li>
 * <li>{@link com.keypointcensus.core.model.AggregateNode}: all responses of
 * one detector within a directory scope</li>
 * <li>{@link com.keypointcensus.core.model.SummaryRecord}: one report
 * row</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.keypointcensus.core.model;
