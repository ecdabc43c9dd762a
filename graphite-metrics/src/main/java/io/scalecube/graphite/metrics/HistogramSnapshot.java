package io.scalecube.graphite.metrics;

/**
 * Immutable point-in-time view of a distribution of long values.
 *
 * @see HdrHistogramSnapshot
 */
public interface HistogramSnapshot {

  long count();

  long min();

  long max();

  double mean();

  double stdDev();

  /**
   * Returns values at given percentiles.
   *
   * @param fractions percentiles expressed as fractions in range [0, 1], like {@code 0.99}
   * @return values, one per requested fraction, in the same order
   */
  double[] percentiles(double[] fractions);
}
