package org.preempt.anomaly.detector;

import java.util.ArrayList;
import java.util.List;
import org.preempt.anomaly.datamodel.MetricSample;
import org.preempt.anomaly.detector.DetectionResult.Label;
import org.preempt.anomaly.detector.forest.IsolationForest;
import org.preempt.anomaly.detector.forest.IsolationForestModel;

/** Fits a fresh isolation forest over the values of one metric type and labels each sample. */
public class MetricDetector {

  private final DetectorConfig detectorConfig;
  private final IsolationForest isolationForest;

  public MetricDetector(DetectorConfig detectorConfig) {
    this.detectorConfig = detectorConfig;
    this.isolationForest =
        new IsolationForest(
            detectorConfig.getEnsembleSize(),
            detectorConfig.getMaxSamples(),
            detectorConfig.getContamination(),
            detectorConfig.getRandomSeed());
  }

  /** Whether the samples are numerous and varied enough to fit a model on. */
  public boolean isEligible(List<MetricSample> samples) {
    return samples.size() >= detectorConfig.getMinSamples()
        && distinctValues(samples) >= detectorConfig.getMinDistinctValues();
  }

  public DetectionResult detect(String metricType, List<MetricSample> samples) {
    double[] values = samples.stream().mapToDouble(MetricSample::getValue).toArray();
    IsolationForestModel model = isolationForest.fit(values);
    double[] anomalyScores = model.anomalyScores(values);

    double[] scores = new double[anomalyScores.length];
    List<Label> labels = new ArrayList<>(scores.length);
    for (int i = 0; i < anomalyScores.length; i++) {
      scores[i] = model.decisionScore(anomalyScores[i]);
      labels.add(IsolationForestModel.isAnomalous(scores[i]) ? Label.ANOMALOUS : Label.NORMAL);
    }
    return DetectionResult.builder()
        .metricType(metricType)
        .labels(labels)
        .scores(scores)
        .anomalyScores(anomalyScores)
        .model(model)
        .build();
  }

  public DetectorConfig getDetectorConfig() {
    return detectorConfig;
  }

  static long distinctValues(List<MetricSample> samples) {
    return samples.stream().mapToDouble(MetricSample::getValue).distinct().count();
  }
}
