package org.preempt.anomaly.detector.forest;

import com.google.common.base.Preconditions;
import java.util.Arrays;

final class Percentiles {

  private Percentiles() {}

  /** Percentile in {@code [0, 100]} with linear interpolation between closest ranks. */
  static double percentile(double[] values, double percentile) {
    Preconditions.checkArgument(values.length > 0, "percentile of an empty array");
    Preconditions.checkArgument(
        percentile >= 0 && percentile <= 100, "percentile out of range: %s", percentile);
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double rank = percentile / 100.0 * (sorted.length - 1);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
  }
}
