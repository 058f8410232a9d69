package com.typepulse.anomaly.stats;

import java.util.Collection;

/**
 * Population statistics over a sample of timing values (milliseconds).
 * An empty sample reports count 0 with mean and variance 0; callers decide whether
 * the sample is large enough to be meaningful.
 */
public record SampleStats(int count, double mean, double variance) {

  public static SampleStats of(Collection<? extends Number> values) {
    int n = values.size();
    if (n == 0) return new SampleStats(0, 0.0, 0.0);
    double sum = 0.0;
    for (Number v : values) sum += v.doubleValue();
    double mean = sum / n;
    double var = 0.0;
    for (Number v : values) {
      double d = v.doubleValue() - mean;
      var += d * d;
    }
    // population variance (n), not sample variance (n-1)
    return new SampleStats(n, mean, var / n);
  }

  public double stddev() {
    return Math.sqrt(variance);
  }

  /** stddev / mean, or NaN when the mean is zero. */
  public double coefficientOfVariation() {
    return mean == 0.0 ? Double.NaN : stddev() / mean;
  }

  public boolean isEmpty() {
    return count == 0;
  }
}
