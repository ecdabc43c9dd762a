package io.scalecube.graphite.metrics;

@FunctionalInterface
public interface HistogramMetric extends Metric {

  /**
   * Captures current state of the distribution. Returned snapshot must not change afterwards.
   *
   * @return {@link HistogramSnapshot} instance
   */
  HistogramSnapshot snapshot();
}
