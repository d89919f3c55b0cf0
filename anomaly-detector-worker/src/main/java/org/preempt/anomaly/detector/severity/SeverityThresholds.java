package org.preempt.anomaly.detector.severity;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import lombok.Getter;
import lombok.ToString;

/**
 * Pair of score thresholds separating the severity tiers. The defaults suit normalized isolation
 * scores; lower pairs such as 0.1 / 0.15 are set through config.
 */
@Getter
@ToString
public class SeverityThresholds {
  static final String MEDIUM_THRESHOLD_CONFIG = "medium.threshold";
  static final String HIGH_THRESHOLD_CONFIG = "high.threshold";

  public static final double DEFAULT_MEDIUM_THRESHOLD = 0.3;
  public static final double DEFAULT_HIGH_THRESHOLD = 0.5;

  private final double mediumThreshold;
  private final double highThreshold;

  public SeverityThresholds(double mediumThreshold, double highThreshold) {
    Preconditions.checkArgument(
        mediumThreshold >= 0, "medium threshold must not be negative: %s", mediumThreshold);
    Preconditions.checkArgument(
        mediumThreshold <= highThreshold,
        "medium threshold %s is above high threshold %s",
        mediumThreshold,
        highThreshold);
    this.mediumThreshold = mediumThreshold;
    this.highThreshold = highThreshold;
  }

  public static SeverityThresholds defaults() {
    return new SeverityThresholds(DEFAULT_MEDIUM_THRESHOLD, DEFAULT_HIGH_THRESHOLD);
  }

  public static SeverityThresholds from(Config severityConfig) {
    return new SeverityThresholds(
        severityConfig.hasPath(MEDIUM_THRESHOLD_CONFIG)
            ? severityConfig.getDouble(MEDIUM_THRESHOLD_CONFIG)
            : DEFAULT_MEDIUM_THRESHOLD,
        severityConfig.hasPath(HIGH_THRESHOLD_CONFIG)
            ? severityConfig.getDouble(HIGH_THRESHOLD_CONFIG)
            : DEFAULT_HIGH_THRESHOLD);
  }
}
