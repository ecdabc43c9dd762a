package io.scalecube.graphite.metrics;

/**
 * Marker interface for everything that can be held by a {@link MetricsSource}. Exporters
 * recognize the kinds declared in this package ({@link CounterMetric}, {@link GaugeMetric}, {@link
 * DoubleGaugeMetric}, {@link HistogramMetric}, {@link MeterMetric}, {@link TimerMetric}), other
 * implementations are reported and skipped.
 */
public interface Metric {}
