/**
 * Ports through which the pipeline reaches storage, metrics, time and lifecycle listeners.
 */
package ca.gc.nrc.pyxis.application.port;
