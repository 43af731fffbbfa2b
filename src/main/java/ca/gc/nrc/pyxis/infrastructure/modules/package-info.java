/**
 * Reference modules: synthetic and raw-stack readers, raw-stack writer, frame selection, scaling and mean-frame
 * background subtraction.
 */
package ca.gc.nrc.pyxis.infrastructure.modules;
