package io.scalecube.graphite.metrics;

/**
 * Callback interface for visiting metrics of a {@link MetricsSource}.
 *
 * @see MetricsSource#forEach(MetricVisitor)
 */
@FunctionalInterface
public interface MetricVisitor {

  /**
   * Callback for one registered metric.
   *
   * @param name raw metric name, may carry graphite tags ({@code name;k1=v1;k2=v2})
   * @param metric metric
   */
  void visit(String name, Metric metric);
}
