package io.tessera.conv.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for conversion runs.
 * <p><strong>Why:</strong> Lets pipelines and the orchestrator count sessions, chunks, and bytes without
 * binding the core to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from session and stream workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code convert.session.success},
 * {@code convert.write.bytes}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds an arbitrary non-negative amount to the named counter.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param delta amount to add
   */
  default void incrementBy(String key, long delta) {
    for (long i = 0; i < delta; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation such as a latency in nanoseconds or a byte count.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void incrementBy(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
