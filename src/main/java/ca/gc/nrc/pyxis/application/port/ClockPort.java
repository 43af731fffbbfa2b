package ca.gc.nrc.pyxis.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock and monotonic time to the pipeline.
 * <p><strong>Why:</strong> Module durations and run timestamps come from one injectable source so tests stay
 * deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.nrc.pyxis.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic timestamp for measuring elapsed time.
   *
   * @return nanoseconds from an arbitrary origin
   */
  long nanoTime();

  /**
   * Default {@link ClockPort} backed by the JVM clocks.
   */
  ClockPort SYSTEM = new ClockPort() {
    @Override
    public long nowMillis() {
      return System.currentTimeMillis();
    }

    @Override
    public long nanoTime() {
      return System.nanoTime();
    }
  };
}
