package io.scalecube.graphite.publisher;

import io.scalecube.graphite.metrics.CounterMetric;
import io.scalecube.graphite.metrics.DoubleGaugeMetric;
import io.scalecube.graphite.metrics.GaugeMetric;
import io.scalecube.graphite.metrics.HistogramMetric;
import io.scalecube.graphite.metrics.HistogramSnapshot;
import io.scalecube.graphite.metrics.MeterMetric;
import io.scalecube.graphite.metrics.Metric;
import io.scalecube.graphite.metrics.TimerMetric;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializer of metrics into the Graphite plaintext protocol. Each field of a metric becomes one
 * line:
 *
 * <pre>{@code
 * <prefix>.<name>.<field><tags> <value> <timestamp>
 * }</pre>
 *
 * <p>Lines are returned without line terminator. Supported metric kinds and their fields:
 *
 * <ul>
 *   <li>{@link CounterMetric}: {@code count}, {@code count_ps}
 *   <li>{@link GaugeMetric}, {@link DoubleGaugeMetric}: {@code value}
 *   <li>{@link HistogramMetric}: {@code count}, {@code min}, {@code max}, {@code mean}, {@code
 *       std-dev}, {@code <key>-percentile}
 *   <li>{@link MeterMetric}: {@code count}, {@code one-minute}, {@code five-minute}, {@code
 *       fifteen-minute}, {@code mean}
 *   <li>{@link TimerMetric}: {@code count}, {@code count_ps}, {@code min}, {@code max}, {@code
 *       mean}, {@code std-dev}, {@code <key>-percentile}, {@code one-minute}, {@code
 *       five-minute}, {@code fifteen-minute}, {@code mean-rate}
 * </ul>
 *
 * <p>Timer durations (min, max, mean, std-dev, percentiles) are converted into duration unit,
 * rates are not.
 */
public class GraphiteSerializer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphiteSerializer.class);

  private final String prefix;
  private final double flushIntervalSeconds;
  private final long durationUnitNanos;
  private final double[] percentiles;
  private final String[] percentileKeys;

  /**
   * Constructor.
   *
   * @param prefix prefix to be prepended to metric names
   * @param flushInterval flush interval, used to compute per-second counts
   * @param durationUnit unit for timer durations
   * @param percentiles percentiles (as fractions) to export from histograms and timers
   */
  public GraphiteSerializer(
      String prefix, Duration flushInterval, Duration durationUnit, double[] percentiles) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("flushInterval must be positive: " + flushInterval);
    }
    if (durationUnit.isNegative() || durationUnit.isZero()) {
      throw new IllegalArgumentException("durationUnit must be positive: " + durationUnit);
    }
    this.flushIntervalSeconds = flushInterval.toNanos() / 1e9;
    this.durationUnitNanos = durationUnit.toNanos();
    this.percentiles = percentiles.clone();
    this.percentileKeys = new String[percentiles.length];
    for (int i = 0; i < percentiles.length; i++) {
      percentileKeys[i] = percentileKey(percentiles[i]);
    }
  }

  /**
   * Formats metric into graphite lines.
   *
   * @param name raw metric name, may carry graphite tags
   * @param metric metric
   * @param timestamp timestamp (epoch seconds)
   * @return lines, or empty list if metric kind is not supported
   */
  public List<String> format(String name, Metric metric, long timestamp) {
    return format(MetricName.parse(name), metric, timestamp);
  }

  /**
   * Formats metric into graphite lines.
   *
   * @param metricName metric name with tags
   * @param metric metric
   * @param timestamp timestamp (epoch seconds)
   * @return lines, or empty list if metric kind is not supported
   */
  public List<String> format(MetricName metricName, Metric metric, long timestamp) {
    final var lines = new Lines(metricName, timestamp);

    if (metric instanceof CounterMetric counter) {
      final var count = counter.count();
      lines.add("count", count);
      lines.add("count_ps", fixed(count / flushIntervalSeconds));
    } else if (metric instanceof GaugeMetric gauge) {
      lines.add("value", gauge.value());
    } else if (metric instanceof DoubleGaugeMetric gauge) {
      lines.add("value", fixed(gauge.value(), 6));
    } else if (metric instanceof HistogramMetric histogram) {
      final var snapshot = histogram.snapshot();
      lines.add("count", snapshot.count());
      lines.add("min", snapshot.min());
      lines.add("max", snapshot.max());
      lines.add("mean", fixed(snapshot.mean()));
      lines.add("std-dev", fixed(snapshot.stdDev()));
      addPercentiles(lines, snapshot, 1.0);
    } else if (metric instanceof MeterMetric meter) {
      final var snapshot = meter.snapshot();
      lines.add("count", snapshot.count());
      lines.add("one-minute", fixed(snapshot.rate1()));
      lines.add("five-minute", fixed(snapshot.rate5()));
      lines.add("fifteen-minute", fixed(snapshot.rate15()));
      lines.add("mean", fixed(snapshot.rateMean()));
    } else if (metric instanceof TimerMetric timer) {
      final var snapshot = timer.snapshot();
      final var durations = snapshot.durations();
      final var rates = snapshot.rates();
      final var count = snapshot.count();
      final var du = (double) durationUnitNanos;
      lines.add("count", count);
      lines.add("count_ps", fixed(count / flushIntervalSeconds));
      lines.add("min", durations.min() / durationUnitNanos);
      lines.add("max", durations.max() / durationUnitNanos);
      lines.add("mean", fixed(durations.mean() / du));
      lines.add("std-dev", fixed(durations.stdDev() / du));
      addPercentiles(lines, durations, du);
      lines.add("one-minute", fixed(rates.rate1()));
      lines.add("five-minute", fixed(rates.rate5()));
      lines.add("fifteen-minute", fixed(rates.rate15()));
      lines.add("mean-rate", fixed(rates.rateMean()));
    } else {
      LOGGER.warn(
          "Unable to record metric {} of type {}",
          metricName.name(),
          metric != null ? metric.getClass().getName() : null);
    }

    return lines.list;
  }

  private void addPercentiles(Lines lines, HistogramSnapshot snapshot, double divisor) {
    final var values = snapshot.percentiles(percentiles);
    for (int i = 0; i < percentileKeys.length; i++) {
      lines.add(percentileKeys[i] + "-percentile", fixed(values[i] / divisor));
    }
  }

  /**
   * Returns compact key for percentile: {@code fraction * 100} rendered with minimal number of
   * digits, with the first decimal point removed ({@code 0.5 -> 50}, {@code 0.999 -> 999}).
   *
   * @param fraction percentile as fraction
   * @return percentile key
   */
  static String percentileKey(double fraction) {
    final var value = BigDecimal.valueOf(fraction * 100.0).stripTrailingZeros().toPlainString();
    final var index = value.indexOf('.');
    return index < 0 ? value : value.substring(0, index) + value.substring(index + 1);
  }

  private static String fixed(double value) {
    return fixed(value, 2);
  }

  /**
   * Renders exact binary value of the double with given number of fraction digits, rounding
   * half-to-even. Sign is kept when the value rounds to zero ({@code -0.001 -> -0.00}).
   */
  static String fixed(double value, int scale) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    final var result =
        new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    if (result.charAt(0) != '-' && (value < 0 || 1.0 / value < 0)) {
      return "-" + result;
    }
    return result;
  }

  private class Lines {

    private final List<String> list = new ArrayList<>();
    private final String base;
    private final String tags;
    private final String suffix;

    private Lines(MetricName metricName, long timestamp) {
      this.base = prefix + "." + metricName.name() + ".";
      this.tags = metricName.tags();
      this.suffix = " " + timestamp;
    }

    private void add(String field, long value) {
      add(field, String.valueOf(value));
    }

    private void add(String field, String value) {
      list.add(base + field + tags + " " + value + suffix);
    }
  }
}
