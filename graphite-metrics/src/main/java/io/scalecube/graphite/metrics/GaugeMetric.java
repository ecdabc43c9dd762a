package io.scalecube.graphite.metrics;

/** Instantaneous integer value. */
@FunctionalInterface
public interface GaugeMetric extends Metric {

  long value();
}
