package ca.gc.nrc.pyxis.application.port;

import ca.gc.nrc.pyxis.application.pipeline.ModuleRunRecord;

/**
 * Callback for pipeline lifecycle events. Methods run synchronously on the pipeline thread.
 *
 * @since 0.1.0
 */
public interface PipelineListener {

  /**
   * Called right before a module runs.
   *
   * @param moduleName module about to run
   */
  default void moduleStarted(String moduleName) {}

  /**
   * Called after a module finished and attribute bookkeeping completed.
   *
   * @param record run record of the module
   */
  default void moduleCompleted(ModuleRunRecord record) {}

  /**
   * Called when a module failed; remaining modules will be skipped.
   *
   * @param moduleName failing module
   * @param failure failure raised by the module or by its bookkeeping
   */
  default void moduleFailed(String moduleName, Throwable failure) {}

  /** Listener ignoring all events. */
  PipelineListener NO_OP = new PipelineListener() {};
}
