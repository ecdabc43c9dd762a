package io.scalecube.graphite.metrics;

import java.util.Objects;

/**
 * Immutable view of a timer: distribution of raw durations (in nanoseconds) plus rate of timed
 * events.
 *
 * @param durations distribution of durations, in nanoseconds
 * @param rates event rates
 */
public record TimerSnapshot(HistogramSnapshot durations, MeterSnapshot rates) {

  public TimerSnapshot {
    Objects.requireNonNull(durations, "durations");
    Objects.requireNonNull(rates, "rates");
  }

  /**
   * Returns number of timed events (taken from the durations distribution).
   *
   * @return number of timed events
   */
  public long count() {
    return durations.count();
  }
}
