package io.scalecube.graphite.metrics;

/**
 * Immutable view of event rates.
 *
 * @param count total number of events
 * @param rate1 one-minute moving average rate (events/second)
 * @param rate5 five-minute moving average rate (events/second)
 * @param rate15 fifteen-minute moving average rate (events/second)
 * @param rateMean mean rate since the meter was created (events/second)
 */
public record MeterSnapshot(long count, double rate1, double rate5, double rate15, double rateMean) {}
