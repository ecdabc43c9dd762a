package io.scalecube.graphite.metrics;

/** Instantaneous floating-point value. */
@FunctionalInterface
public interface DoubleGaugeMetric extends Metric {

  double value();
}
