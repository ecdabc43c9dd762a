package io.scalecube.graphite.metrics;

@FunctionalInterface
public interface TimerMetric extends Metric {

  /**
   * Captures current durations distribution together with event rates.
   *
   * @return {@link TimerSnapshot} instance
   */
  TimerSnapshot snapshot();
}
