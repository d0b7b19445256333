/**
 * CSV outputs: per-directory statistics files and the feature-count table.
 *
 * @since 1.0.0
 */
package com.keypointcensus.core.report;
