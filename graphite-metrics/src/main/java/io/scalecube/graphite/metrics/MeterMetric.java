package io.scalecube.graphite.metrics;

@FunctionalInterface
public interface MeterMetric extends Metric {

  /**
   * Captures current event rates.
   *
   * @return {@link MeterSnapshot} instance
   */
  MeterSnapshot snapshot();
}
