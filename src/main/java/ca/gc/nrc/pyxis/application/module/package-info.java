/**
 * Contract between the pipeline and its modules: capability interfaces, ports, context, chunk loop and attribute
 * propagation.
 */
package ca.gc.nrc.pyxis.application.module;
