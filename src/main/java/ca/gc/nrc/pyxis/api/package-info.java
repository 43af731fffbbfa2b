/**
 * Command-line entry points: the {@code pyxis} dispatcher with its {@code run} and {@code inspect} commands,
 * argument parsing, console output and exit codes.
 */
package ca.gc.nrc.pyxis.api;
