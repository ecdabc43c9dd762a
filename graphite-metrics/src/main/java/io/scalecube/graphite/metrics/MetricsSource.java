package io.scalecube.graphite.metrics;

/**
 * Read-only view over a set of named metrics. Implementations decide on enumeration order and on
 * how enumeration interacts with concurrent registration.
 *
 * @see MetricsRegistry
 */
@FunctionalInterface
public interface MetricsSource {

  /**
   * Invokes visitor once per currently registered metric.
   *
   * @param visitor visitor
   */
  void forEach(MetricVisitor visitor);
}
