package ca.gc.nrc.pyxis.application.module;

/** How attributes of a processing module's primary input reach its outputs. */
public enum AttributePolicy {
  /** Copy static and non-static attributes, subsetting non-static ones after a recorded selection. */
  COPY,
  /** Leave outputs with only the attributes the module set itself. */
  NONE
}
