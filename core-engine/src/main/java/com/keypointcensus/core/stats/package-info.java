/**
 * Descriptive statistics over response samples.
 */
package com.keypointcensus.core.stats;
