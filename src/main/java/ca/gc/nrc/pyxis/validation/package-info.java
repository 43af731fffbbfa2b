/**
 * Input validation helpers shared by configuration, CLI and modules.
 */
package ca.gc.nrc.pyxis.validation;
