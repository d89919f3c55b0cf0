package org.preempt.anomaly.detector.forest;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import lombok.Getter;

/**
 * Unsupervised outlier detector based on random space partitioning.
 *
 * <p>{@link #fit(double[])} grows {@code ensembleSize} trees, each over a subsample of at most
 * {@code maxSamples} values drawn without replacement. A value isolated after few splits on
 * average is anomalous. The decision threshold is placed so that a {@code contamination}
 * fraction of the fitted values falls below it, which makes the threshold depend on the value
 * distribution of each fit.
 *
 * <p>All random choices come from a single generator seeded with {@code seed}, so fitting the
 * same values twice yields identical models.
 */
@Getter
public class IsolationForest {
  private final int ensembleSize;
  private final int maxSamples;
  private final double contamination;
  private final long seed;

  public IsolationForest(int ensembleSize, int maxSamples, double contamination, long seed) {
    Preconditions.checkArgument(ensembleSize > 0, "ensembleSize must be positive");
    Preconditions.checkArgument(maxSamples > 1, "maxSamples must be greater than 1");
    Preconditions.checkArgument(
        contamination > 0 && contamination <= 0.5,
        "contamination must be in (0, 0.5], got %s",
        contamination);
    this.ensembleSize = ensembleSize;
    this.maxSamples = maxSamples;
    this.contamination = contamination;
    this.seed = seed;
  }

  public IsolationForestModel fit(double[] values) {
    Preconditions.checkArgument(
        values.length >= 2, "need at least 2 values, got %s", values.length);
    Preconditions.checkArgument(
        Arrays.stream(values).allMatch(Double::isFinite), "values must be finite");

    Random random = new Random(seed);
    int subsampleSize = Math.min(maxSamples, values.length);
    List<IsolationTree> trees = new ArrayList<>(ensembleSize);
    for (int i = 0; i < ensembleSize; i++) {
      trees.add(IsolationTree.grow(subsample(values, subsampleSize, random), random));
    }

    IsolationForestModel unthresholded = new IsolationForestModel(trees, subsampleSize, 0.0);
    double[] opposite = Arrays.stream(unthresholded.anomalyScores(values)).map(s -> -s).toArray();
    double offset = Percentiles.percentile(opposite, 100.0 * contamination);
    return new IsolationForestModel(trees, subsampleSize, offset);
  }

  private static double[] subsample(double[] values, int size, Random random) {
    if (size == values.length) {
      return values.clone();
    }
    // partial Fisher-Yates over indices
    int[] indices = new int[values.length];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = i;
    }
    double[] sample = new double[size];
    for (int i = 0; i < size; i++) {
      int j = i + random.nextInt(indices.length - i);
      int swap = indices[i];
      indices[i] = indices[j];
      indices[j] = swap;
      sample[i] = values[indices[i]];
    }
    return sample;
  }
}
