package com.mk.fx.qa.latency.harness.analysis;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Order statistics over latency samples. Every method rejects an empty sample set; callers only
 * aggregate groups that hold at least one successful result.
 */
public final class LatencyStatistics {

  private LatencyStatistics() {
    // Utility class, no instantiation
  }

  /** Median; for an even count the mean of the two middle values. */
  public static double median(Collection<Double> samples) {
    double[] sorted = sorted(samples);
    int n = sorted.length;
    int mid = n / 2;
    if (n % 2 == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  /**
   * Nearest-rank 99th percentile: the sorted value at index {@code floor(n * 0.99)}, clamped to
   * the last index. For 100 samples this is the maximum, for one sample the sample itself.
   */
  public static double p99(Collection<Double> samples) {
    double[] sorted = sorted(samples);
    int idx = Math.min(sorted.length - 1, (int) Math.floor(sorted.length * 0.99));
    return sorted[idx];
  }

  public static double min(Collection<Double> samples) {
    return sorted(samples)[0];
  }

  public static double max(Collection<Double> samples) {
    double[] sorted = sorted(samples);
    return sorted[sorted.length - 1];
  }

  /** Sample standard deviation (n - 1 denominator); zero below two samples. */
  public static double stdDev(Collection<Double> samples) {
    double[] values = sorted(samples);
    int n = values.length;
    if (n < 2) {
      return 0.0;
    }
    double mean = Arrays.stream(values).average().orElse(0.0);
    double squares = 0.0;
    for (double v : values) {
      squares += (v - mean) * (v - mean);
    }
    return Math.sqrt(squares / (n - 1));
  }

  /** {@code (current - baseline) / baseline * 100}, rounded to two decimals. */
  public static double changePercent(double baseline, double current) {
    if (baseline == 0.0) {
      throw new IllegalArgumentException("Baseline value must be non-zero");
    }
    return round2((current - baseline) / baseline * 100.0);
  }

  public static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }

  private static double[] sorted(Collection<Double> samples) {
    Objects.requireNonNull(samples, "Samples cannot be null");
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("At least one sample is required");
    }
    double[] values = samples.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(values);
    return values;
  }
}
