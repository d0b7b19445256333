/**
 * Directory traversal and its collaborators.
 *
 * <p>
 * {@link com.keypointcensus.core.traversal.DirectoryStatsEngine} walks the
 * tree; images come from an
 * {@link com.keypointcensus.core.traversal.ImageSource}, directory entries
 * from a {@link com.keypointcensus.core.traversal.DirectoryLister}.
 * </p>
 *
 * @since 1.0.0
 */
package com.keypointcensus.core.traversal;
