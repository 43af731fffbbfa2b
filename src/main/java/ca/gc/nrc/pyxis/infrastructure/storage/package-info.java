/**
 * N5 container storage for datasets, attributes and pipeline settings.
 */
package ca.gc.nrc.pyxis.infrastructure.storage;
