/**
 * Runtime logging configuration for the command-line tools.
 */
package ca.gc.nrc.pyxis.logging;
