package org.preempt.anomaly.detector.forest;

import java.util.Arrays;
import java.util.Random;
import lombok.Getter;

/** One randomized partitioning tree grown over a subsample of scalar values. */
@Getter
public class IsolationTree {
  private final IsolationTreeNode root;
  private final int heightLimit;

  IsolationTree(IsolationTreeNode root, int heightLimit) {
    this.root = root;
    this.heightLimit = heightLimit;
  }

  static IsolationTree grow(double[] sample, Random random) {
    int heightLimit = PathLengths.heightLimit(sample.length);
    return new IsolationTree(growNode(sample, 0, heightLimit, random), heightLimit);
  }

  /** Isolation depth of {@code value}, corrected for the points left unsplit in its leaf. */
  double pathLength(double value) {
    IsolationTreeNode node = root;
    int depth = 0;
    while (!node.isLeaf()) {
      node = value < node.getSplitValue() ? node.getLeft() : node.getRight();
      depth++;
    }
    return depth + PathLengths.averagePathLength(node.getSize());
  }

  private static IsolationTreeNode growNode(
      double[] values, int depth, int heightLimit, Random random) {
    if (depth >= heightLimit || values.length <= 1) {
      return IsolationTreeNode.leaf(values.length);
    }

    double min = Arrays.stream(values).min().getAsDouble();
    double max = Arrays.stream(values).max().getAsDouble();
    if (min == max) {
      return IsolationTreeNode.leaf(values.length);
    }

    double splitValue = min + random.nextDouble() * (max - min);
    if (splitValue <= min) {
      // keeps both sides non-empty
      splitValue = Math.nextUp(min);
    }

    double threshold = splitValue;
    double[] left = Arrays.stream(values).filter(v -> v < threshold).toArray();
    double[] right = Arrays.stream(values).filter(v -> v >= threshold).toArray();
    return IsolationTreeNode.split(
        splitValue,
        growNode(left, depth + 1, heightLimit, random),
        growNode(right, depth + 1, heightLimit, random));
  }
}
