package ca.gc.nrc.pyxis.infrastructure.time;

import ca.gc.nrc.pyxis.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the JVM wall clock and monotonic timer.
 */
public final class SystemClockAdapter implements ClockPort {

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
