package org.preempt.anomaly.detector;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.preempt.anomaly.detector.forest.IsolationForestModel;

/**
 * Labels and scores for the samples of one metric type, positionally aligned with the samples the
 * model was fitted on.
 *
 * <p>{@code scores} are raw decision scores, negative for anomalous samples. {@code
 * anomalyScores} are normalized isolation scores in {@code (0, 1]} that grow as a sample gets
 * easier to isolate; these are the scores published with anomalies.
 */
@Getter
public class DetectionResult {
  private final String metricType;
  private final List<Label> labels;
  private final double[] scores;
  private final double[] anomalyScores;
  private final IsolationForestModel model;

  @Builder
  private DetectionResult(
      String metricType,
      List<Label> labels,
      double[] scores,
      double[] anomalyScores,
      IsolationForestModel model) {
    this.metricType = metricType;
    this.labels = List.copyOf(labels);
    this.scores = scores.clone();
    this.anomalyScores = anomalyScores.clone();
    this.model = model;
  }

  public double[] getScores() {
    return scores.clone();
  }

  public double[] getAnomalyScores() {
    return anomalyScores.clone();
  }

  public double getAnomalyScore(int index) {
    return anomalyScores[index];
  }

  public int size() {
    return labels.size();
  }

  public boolean isAnomalous(int index) {
    return labels.get(index) == Label.ANOMALOUS;
  }

  public enum Label {
    NORMAL,
    ANOMALOUS
  }
}
