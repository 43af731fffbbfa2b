/**
 * Configuration loading: YAML file, CLI overrides and embedded defaults merged into {@link
 * ca.gc.nrc.pyxis.config.PipelineConfig}.
 */
package ca.gc.nrc.pyxis.config;
