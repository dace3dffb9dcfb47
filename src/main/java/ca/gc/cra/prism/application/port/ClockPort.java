package ca.gc.cra.prism.application.port;

/**
 * <strong>What:</strong> Time source for pool refresh deadlines, default record timestamps, and delivery latency.
 * <p><strong>Why:</strong> Tests step the wall clock past a refresh deadline without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns wall-clock time.
   *
   * @return milliseconds since the epoch; may jump when the system clock is adjusted
   */
  long nowMillis();

  /**
   * Returns a monotonic reading for measuring elapsed time; only differences are meaningful.
   *
   * @return nanoseconds from an arbitrary origin
   */
  default long monotonicNanos() {
    return System.nanoTime();
  }

  /** Clock backed by the JVM's wall and monotonic clocks. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
