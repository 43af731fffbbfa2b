/**
 * Dataset value types: shapes, element types, frame ranges and in-memory frame blocks.
 */
package ca.gc.nrc.pyxis.domain.dataset;
