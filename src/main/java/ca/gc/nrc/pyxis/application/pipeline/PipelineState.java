package ca.gc.nrc.pyxis.application.pipeline;

/**
 * Lifecycle of a {@link Pipeline}: {@code IDLE -> VALIDATING -> RUNNING -> COMPLETED | FAILED}.
 * A new run may start from {@link #COMPLETED} or {@link #FAILED}.
 */
public enum PipelineState {
  IDLE,
  VALIDATING,
  RUNNING,
  COMPLETED,
  FAILED;

  /**
   * Whether a validation or run may start from this state.
   *
   * @return {@code false} while validating or running
   */
  public boolean canStart() {
    return this != VALIDATING && this != RUNNING;
  }
}
