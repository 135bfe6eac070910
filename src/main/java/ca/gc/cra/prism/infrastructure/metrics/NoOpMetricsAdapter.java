package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metrics.exporter=none}.
 *
 * @since PRISM 0.1
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
