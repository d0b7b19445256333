/**
 * Feature detector contract and detector selection.
 *
 * <p>
 * Detectors implement
 * {@link com.keypointcensus.core.detection.FeatureDetector}; their identity is
 * a {@link com.keypointcensus.core.detection.DetectorType}. Selection strings
 * such as {@code desc} or {@code all} are resolved by
 * {@link com.keypointcensus.core.detection.DetectorSelector}.
 * </p>
 *
 * @since 1.0.0
 */
package com.keypointcensus.core.detection;
