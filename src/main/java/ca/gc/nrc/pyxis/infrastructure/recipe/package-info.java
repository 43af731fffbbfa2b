/**
 * Recipe files: YAML module lists and the factory that turns them into configured modules.
 */
package ca.gc.nrc.pyxis.infrastructure.recipe;
