/**
 * Time source adapters.
 */
package ca.gc.nrc.pyxis.infrastructure.time;
