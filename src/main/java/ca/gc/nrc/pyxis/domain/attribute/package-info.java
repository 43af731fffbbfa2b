/**
 * Static and per-frame attribute values attached to datasets.
 *
 * <p>Static attributes hold one value per key; non-static attributes hold one value per frame and must
 * stay aligned with the frame axis.</p>
 */
package ca.gc.nrc.pyxis.domain.attribute;
