package org.preempt.anomaly.detector.forest;

import java.util.List;
import lombok.Getter;

/** A fitted {@link IsolationForest}. Immutable. */
@Getter
public class IsolationForestModel {
  private final List<IsolationTree> trees;
  private final int subsampleSize;
  private final double offset;

  IsolationForestModel(List<IsolationTree> trees, int subsampleSize, double offset) {
    this.trees = List.copyOf(trees);
    this.subsampleSize = subsampleSize;
    this.offset = offset;
  }

  /**
   * Normalized isolation scores in {@code (0, 1]}: {@code 2^(-meanPathLength / c(subsample))}.
   * Values close to 1 are isolated quickly; values well below 0.5 are deep inside the data.
   */
  public double[] anomalyScores(double[] values) {
    double normalizer = PathLengths.averagePathLength(subsampleSize);
    double[] scores = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      double total = 0;
      for (IsolationTree tree : trees) {
        total += tree.pathLength(values[i]);
      }
      double meanPathLength = total / trees.size();
      scores[i] = Math.pow(2, -meanPathLength / normalizer);
    }
    return scores;
  }

  /** Raw decision scores aligned with {@code values}; negative means anomalous. */
  public double[] decisionFunction(double[] values) {
    double[] scores = anomalyScores(values);
    for (int i = 0; i < scores.length; i++) {
      scores[i] = decisionScore(scores[i]);
    }
    return scores;
  }

  /** Shifts a normalized score so that the contamination threshold sits at zero. */
  public double decisionScore(double anomalyScore) {
    return -anomalyScore - offset;
  }

  public static boolean isAnomalous(double decisionScore) {
    return decisionScore < 0;
  }
}
