package io.scalecube.graphite.publisher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.scalecube.graphite.metrics.CounterMetric;
import io.scalecube.graphite.metrics.DoubleGaugeMetric;
import io.scalecube.graphite.metrics.GaugeMetric;
import io.scalecube.graphite.metrics.HistogramMetric;
import io.scalecube.graphite.metrics.HistogramSnapshot;
import io.scalecube.graphite.metrics.MeterMetric;
import io.scalecube.graphite.metrics.MeterSnapshot;
import io.scalecube.graphite.metrics.Metric;
import io.scalecube.graphite.metrics.TimerMetric;
import io.scalecube.graphite.metrics.TimerSnapshot;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GraphiteSerializerTest {

  private static final long TIMESTAMP = 1700000000L;
  private static final double[] PERCENTILES = {0.5, 0.75, 0.95, 0.99, 0.999};

  private final GraphiteSerializer serializer =
      new GraphiteSerializer("app", Duration.ofSeconds(10), Duration.ofMillis(1), PERCENTILES);

  @Nested
  class Counter {

    @Test
    void testFormat() {
      final var lines = serializer.format("requests", (CounterMetric) () -> 42, TIMESTAMP);

      assertEquals(
          List.of(
              "app.requests.count 42 1700000000", //
              "app.requests.count_ps 4.20 1700000000"),
          lines);
    }

    @Test
    void testFormatWithTags() {
      final var lines =
          serializer.format(
              "disk.used;datacenter=dc1;rack=a1;server=web01", (CounterMetric) () -> 5, TIMESTAMP);

      assertEquals(
          List.of(
              "app.disk.used.count;datacenter=dc1;rack=a1;server=web01 5 1700000000",
              "app.disk.used.count_ps;datacenter=dc1;rack=a1;server=web01 0.50 1700000000"),
          lines);
    }

    @Test
    void testCountPerSecondWithFractionalInterval() {
      final var serializer =
          new GraphiteSerializer("app", Duration.ofMillis(2500), Duration.ofNanos(1), PERCENTILES);

      final var lines = serializer.format("requests", (CounterMetric) () -> 10, TIMESTAMP);

      assertEquals("app.requests.count_ps 4.00 1700000000", lines.get(1));
    }
  }

  @Nested
  class Gauge {

    @Test
    void testFormat() {
      final var lines = serializer.format("queue.size", (GaugeMetric) () -> -7, TIMESTAMP);

      assertEquals(List.of("app.queue.size.value -7 1700000000"), lines);
    }

    @Test
    void testFormatDouble() {
      final var lines = serializer.format("load", (DoubleGaugeMetric) () -> 0.5, TIMESTAMP);

      assertEquals(List.of("app.load.value 0.500000 1700000000"), lines);
    }

    @Test
    void testFormatDoubleWithTags() {
      final var lines =
          serializer.format("load;host=web01", (DoubleGaugeMetric) () -> 1234.5678, TIMESTAMP);

      assertEquals(List.of("app.load.value;host=web01 1234.567800 1700000000"), lines);
    }
  }

  @Nested
  class Histogram {

    @Test
    void testFormat() {
      final var snapshot = new HistogramValues(5, 1, 9, 4.567, 2.0, 3, 4, 8.5, 9, 9);

      final var lines =
          serializer.format("payload;dc=dc1", (HistogramMetric) () -> snapshot, TIMESTAMP);

      assertEquals(
          List.of(
              "app.payload.count;dc=dc1 5 1700000000",
              "app.payload.min;dc=dc1 1 1700000000",
              "app.payload.max;dc=dc1 9 1700000000",
              "app.payload.mean;dc=dc1 4.57 1700000000",
              "app.payload.std-dev;dc=dc1 2.00 1700000000",
              "app.payload.50-percentile;dc=dc1 3.00 1700000000",
              "app.payload.75-percentile;dc=dc1 4.00 1700000000",
              "app.payload.95-percentile;dc=dc1 8.50 1700000000",
              "app.payload.99-percentile;dc=dc1 9.00 1700000000",
              "app.payload.999-percentile;dc=dc1 9.00 1700000000"),
          lines);
    }

    @Test
    void testPercentilesFollowConfiguredOrder() {
      final var serializer =
          new GraphiteSerializer(
              "app", Duration.ofSeconds(1), Duration.ofNanos(1), new double[] {0.99, 0.5});
      final var snapshot = new HistogramValues(2, 1, 2, 1.5, 0.5, 2, 1);

      final var lines = serializer.format("h", (HistogramMetric) () -> snapshot, TIMESTAMP);

      assertEquals("app.h.99-percentile 2.00 1700000000", lines.get(5));
      assertEquals("app.h.50-percentile 1.00 1700000000", lines.get(6));
    }

    @Test
    void testWithoutPercentiles() {
      final var serializer =
          new GraphiteSerializer("app", Duration.ofSeconds(1), Duration.ofNanos(1), new double[0]);
      final var snapshot = new HistogramValues(0, 0, 0, 0, 0);

      final var lines = serializer.format("h", (HistogramMetric) () -> snapshot, TIMESTAMP);

      assertEquals(5, lines.size());
    }
  }

  @Nested
  class Meter {

    @Test
    void testFormat() {
      final var snapshot = new MeterSnapshot(10, 1.234, 0.5, 0.1, 2.0);

      final var lines = serializer.format("events", (MeterMetric) () -> snapshot, TIMESTAMP);

      assertEquals(
          List.of(
              "app.events.count 10 1700000000",
              "app.events.one-minute 1.23 1700000000",
              "app.events.five-minute 0.50 1700000000",
              "app.events.fifteen-minute 0.10 1700000000",
              "app.events.mean 2.00 1700000000"),
          lines);
    }
  }

  @Nested
  class Timer {

    @Test
    void testFormat() {
      final var durations =
          new HistogramValues(
              4, 1_500_000, 9_999_999, 2_500_000.0, 1_250_000.0, 2_000_000, 3_000_000, 5_500_000,
              9_000_000, 9_999_999);
      final var rates = new MeterSnapshot(4, 0.2, 0.1, 0.05, 0.4);
      final var snapshot = new TimerSnapshot(durations, rates);

      final var lines = serializer.format("latency", (TimerMetric) () -> snapshot, TIMESTAMP);

      assertEquals(
          List.of(
              "app.latency.count 4 1700000000",
              "app.latency.count_ps 0.40 1700000000",
              "app.latency.min 1 1700000000",
              "app.latency.max 9 1700000000",
              "app.latency.mean 2.50 1700000000",
              "app.latency.std-dev 1.25 1700000000",
              "app.latency.50-percentile 2.00 1700000000",
              "app.latency.75-percentile 3.00 1700000000",
              "app.latency.95-percentile 5.50 1700000000",
              "app.latency.99-percentile 9.00 1700000000",
              "app.latency.999-percentile 10.00 1700000000",
              "app.latency.one-minute 0.20 1700000000",
              "app.latency.five-minute 0.10 1700000000",
              "app.latency.fifteen-minute 0.05 1700000000",
              "app.latency.mean-rate 0.40 1700000000"),
          lines);
    }

    @Test
    void testMinMaxUseIntegerDivision() {
      final var serializer =
          new GraphiteSerializer(
              "app", Duration.ofSeconds(1), Duration.ofMillis(1), new double[] {0.5});
      final var durations = new HistogramValues(1, 1_999_999, 2_999_999, 1_999_999.0, 0, 1_999_999);
      final var snapshot = new TimerSnapshot(durations, new MeterSnapshot(1, 0, 0, 0, 0));

      final var lines = serializer.format("t", (TimerMetric) () -> snapshot, TIMESTAMP);

      assertEquals("app.t.min 1 1700000000", lines.get(2));
      assertEquals("app.t.max 2 1700000000", lines.get(3));
      assertEquals("app.t.mean 2.00 1700000000", lines.get(4));
      assertEquals("app.t.50-percentile 2.00 1700000000", lines.get(6));
    }
  }

  @Nested
  class Rounding {

    @Test
    void testCountPerSecondTieRoundsToEven() {
      final var serializer =
          new GraphiteSerializer("app", Duration.ofSeconds(40), Duration.ofNanos(1), PERCENTILES);

      final var lines = serializer.format("requests", (CounterMetric) () -> 5, TIMESTAMP);

      assertEquals("app.requests.count_ps 0.12 1700000000", lines.get(1));
    }

    @Test
    void testRatesUseExactBinaryValue() {
      final var snapshot = new MeterSnapshot(1, 1.005, 0.125, 2.675, 0.375);

      final var lines = serializer.format("events", (MeterMetric) () -> snapshot, TIMESTAMP);

      assertEquals(
          List.of(
              "app.events.count 1 1700000000",
              "app.events.one-minute 1.00 1700000000",
              "app.events.five-minute 0.12 1700000000",
              "app.events.fifteen-minute 2.67 1700000000",
              "app.events.mean 0.38 1700000000"),
          lines);
    }

    @Test
    void testFixed() {
      assertEquals("0.12", GraphiteSerializer.fixed(0.125, 2));
      assertEquals("1.00", GraphiteSerializer.fixed(1.005, 2));
      assertEquals("2.67", GraphiteSerializer.fixed(2.675, 2));
      assertEquals("-0.00", GraphiteSerializer.fixed(-0.001, 2));
      assertEquals("0.100000", GraphiteSerializer.fixed(0.1, 6));
      assertEquals("NaN", GraphiteSerializer.fixed(Double.NaN, 2));
      assertEquals("+Inf", GraphiteSerializer.fixed(Double.POSITIVE_INFINITY, 2));
      assertEquals("-Inf", GraphiteSerializer.fixed(Double.NEGATIVE_INFINITY, 6));
    }
  }

  @Nested
  class PercentileKey {

    @Test
    void testWholeNumbers() {
      assertEquals("50", GraphiteSerializer.percentileKey(0.5));
      assertEquals("75", GraphiteSerializer.percentileKey(0.75));
      assertEquals("95", GraphiteSerializer.percentileKey(0.95));
      assertEquals("99", GraphiteSerializer.percentileKey(0.99));
      assertEquals("100", GraphiteSerializer.percentileKey(1.0));
      assertEquals("0", GraphiteSerializer.percentileKey(0.0));
    }

    @Test
    void testDecimalPointRemoved() {
      assertEquals("999", GraphiteSerializer.percentileKey(0.999));
      assertEquals("995", GraphiteSerializer.percentileKey(0.995));
      assertEquals("05", GraphiteSerializer.percentileKey(0.005));
    }
  }

  @Test
  void testUnknownMetricKind() {
    final var lines = serializer.format("custom", new Metric() {}, TIMESTAMP);

    assertTrue(lines.isEmpty());
  }

  @Test
  void testEmptyPrefix() {
    final var serializer =
        new GraphiteSerializer("", Duration.ofSeconds(1), Duration.ofNanos(1), PERCENTILES);

    final var lines = serializer.format("queue", (GaugeMetric) () -> 1, TIMESTAMP);

    assertEquals(List.of(".queue.value 1 1700000000"), lines);
  }

  @Test
  void testRejectsNonPositiveFlushInterval() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new GraphiteSerializer("app", Duration.ZERO, Duration.ofNanos(1), PERCENTILES));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new GraphiteSerializer(
                "app", Duration.ofSeconds(-1), Duration.ofNanos(1), PERCENTILES));
  }

  @Test
  void testRejectsNonPositiveDurationUnit() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new GraphiteSerializer("app", Duration.ofSeconds(1), Duration.ZERO, PERCENTILES));
  }

  private record HistogramValues(
      long count, long min, long max, double mean, double stdDev, double... values)
      implements HistogramSnapshot {

    @Override
    public double[] percentiles(double[] fractions) {
      final var result = new double[fractions.length];
      System.arraycopy(values, 0, result, 0, fractions.length);
      return result;
    }
  }
}
