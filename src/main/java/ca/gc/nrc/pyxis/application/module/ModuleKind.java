package ca.gc.nrc.pyxis.application.module;

/** Capability of a pipeline module with respect to storage. */
public enum ModuleKind {
  /** Imports data into storage; declares outputs only. */
  READING,
  /** Exports data out of storage; declares inputs only. */
  WRITING,
  /** Transforms stored datasets into other datasets; declares inputs and outputs. */
  PROCESSING
}
