package io.scalecube.graphite.metrics;

import org.HdrHistogram.AbstractHistogram;

/**
 * {@link HistogramSnapshot} backed by a private copy of HdrHistogram. Values are reported at
 * histogram precision (equivalent value ranges), empty histogram reports zeros.
 */
public class HdrHistogramSnapshot implements HistogramSnapshot {

  private final AbstractHistogram histogram;

  /**
   * Constructor. Takes a copy of given histogram, so further recordings into it are not visible
   * through this snapshot.
   *
   * @param histogram histogram
   */
  public HdrHistogramSnapshot(AbstractHistogram histogram) {
    this.histogram = histogram.copy();
  }

  @Override
  public long count() {
    return histogram.getTotalCount();
  }

  @Override
  public long min() {
    return histogram.getMinValue();
  }

  @Override
  public long max() {
    return histogram.getMaxValue();
  }

  @Override
  public double mean() {
    return histogram.getTotalCount() > 0 ? histogram.getMean() : 0.0;
  }

  @Override
  public double stdDev() {
    return histogram.getTotalCount() > 0 ? histogram.getStdDeviation() : 0.0;
  }

  @Override
  public double[] percentiles(double[] fractions) {
    final var values = new double[fractions.length];
    if (histogram.getTotalCount() == 0) {
      return values;
    }
    for (int i = 0; i < fractions.length; i++) {
      values[i] = histogram.getValueAtPercentile(fractions[i] * 100.0);
    }
    return values;
  }
}
