package io.scalecube.graphite.metrics;

import java.util.Objects;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;

/**
 * Thread-safe {@link MetricsSource} holding metrics by name. Metrics are visited in ascending name
 * order. Enumeration is weakly consistent: it never fails on concurrent registration, and may or
 * may not observe metrics registered while it is in progress.
 */
public class MetricsRegistry implements MetricsSource {

  private final ConcurrentNavigableMap<String, Metric> metrics = new ConcurrentSkipListMap<>();

  /**
   * Registers metric under given name.
   *
   * @param name name, may carry graphite tags ({@code name;k1=v1})
   * @param metric metric
   * @param <T> type of metric
   * @return registered metric
   * @throws IllegalArgumentException if metric with the same name is already registered
   */
  public <T extends Metric> T register(String name, T metric) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(metric, "metric");
    if (metrics.putIfAbsent(name, metric) != null) {
      throw new IllegalArgumentException("Duplicate metric: " + name);
    }
    return metric;
  }

  /**
   * Returns metric registered under given name, or registers the one produced by supplier.
   *
   * @param name name
   * @param type expected type of metric
   * @param supplier supplier of a new metric
   * @param <T> type of metric
   * @return existing or newly registered metric
   * @throws ClassCastException if existing metric is not of expected type
   */
  public <T extends Metric> T getOrRegister(
      String name, Class<T> type, Supplier<? extends T> supplier) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    return type.cast(metrics.computeIfAbsent(name, k -> supplier.get()));
  }

  /**
   * Returns metric by name.
   *
   * @param name name
   * @return metric, or null
   */
  public Metric get(String name) {
    return metrics.get(name);
  }

  /**
   * Removes metric by name.
   *
   * @param name name
   * @return removed metric, or null
   */
  public Metric unregister(String name) {
    return metrics.remove(name);
  }

  public int size() {
    return metrics.size();
  }

  @Override
  public void forEach(MetricVisitor visitor) {
    metrics.forEach(visitor::visit);
  }
}
