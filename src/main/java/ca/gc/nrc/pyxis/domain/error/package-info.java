/**
 * Failure taxonomy for storage, attribute, binding, validation, and module errors.
 * <p>All types are unchecked and extend {@link ca.gc.nrc.pyxis.domain.error.PyxisException}; messages
 * name the module, tag, or key involved so CLI output identifies the failure without a stack trace.</p>
 *
 * @since 0.1.0
 */
package ca.gc.nrc.pyxis.domain.error;
