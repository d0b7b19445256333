/**
 * Configuration loading and validation for the census.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.keypointcensus.core.config.CensusConfigLoader} into a
 * {@link com.keypointcensus.core.config.CensusConfig} instance. Validation is
 * performed automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.keypointcensus.core.config;
