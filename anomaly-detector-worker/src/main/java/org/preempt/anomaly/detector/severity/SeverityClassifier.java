package org.preempt.anomaly.detector.severity;

import org.preempt.anomaly.datamodel.Severity;

public class SeverityClassifier {

  private final SeverityThresholds thresholds;

  public SeverityClassifier(SeverityThresholds thresholds) {
    this.thresholds = thresholds;
  }

  /** Classifies {@code |score|}: above high is HIGH, above medium is MEDIUM, otherwise LOW. */
  public Severity classify(double score) {
    double magnitude = Math.abs(score);
    if (magnitude > thresholds.getHighThreshold()) {
      return Severity.HIGH;
    } else if (magnitude > thresholds.getMediumThreshold()) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  public SeverityThresholds getThresholds() {
    return thresholds;
  }
}
