package io.scalecube.graphite.metrics;

/** Monotonic integer count. */
@FunctionalInterface
public interface CounterMetric extends Metric {

  long count();
}
