package org.preempt.anomaly.detector.forest;

final class PathLengths {
  private static final double EULER_MASCHERONI = 0.5772156649;

  private PathLengths() {}

  /**
   * Average path length of an unsuccessful search in a binary search tree of {@code n} points,
   * used both to normalize depths and to credit the unexpanded part of a leaf.
   */
  static double averagePathLength(int n) {
    if (n <= 1) {
      return 0.0;
    }
    if (n == 2) {
      return 1.0;
    }
    return 2.0 * (Math.log(n - 1.0) + EULER_MASCHERONI) - 2.0 * (n - 1.0) / n;
  }

  static int heightLimit(int subsampleSize) {
    return (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2));
  }
}
