package io.tessera.conv.application.port;

/**
 * Supplies wall-clock time for result timing and container timestamps. Tests inject fixed clocks.
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default clock delegating to {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
