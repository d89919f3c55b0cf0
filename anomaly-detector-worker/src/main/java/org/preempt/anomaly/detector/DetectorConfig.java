package org.preempt.anomaly.detector;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.preempt.anomaly.detector.severity.SeverityThresholds;

/** Settings of the {@code detector} config section. */
@Getter
@ToString
public class DetectorConfig {
  static final String MIN_SAMPLES_CONFIG = "min.samples";
  static final String MIN_DISTINCT_VALUES_CONFIG = "min.distinct.values";
  static final String CONTAMINATION_CONFIG = "contamination";
  static final String ENSEMBLE_SIZE_CONFIG = "ensemble.size";
  static final String MAX_SAMPLES_CONFIG = "max.samples";
  static final String RANDOM_SEED_CONFIG = "random.seed";
  static final String MONITORED_METRICS_CONFIG = "monitored.metrics";
  static final String SEVERITY_CONFIG = "severity";

  static final int DEFAULT_MIN_SAMPLES = 10;
  static final int DEFAULT_MIN_DISTINCT_VALUES = 2;
  static final double DEFAULT_CONTAMINATION = 0.05;
  static final int DEFAULT_ENSEMBLE_SIZE = 100;
  static final int DEFAULT_MAX_SAMPLES = 256;
  static final long DEFAULT_RANDOM_SEED = 42L;

  private final int minSamples;
  private final int minDistinctValues;
  private final double contamination;
  private final int ensembleSize;
  private final int maxSamples;
  private final long randomSeed;
  // empty means every metric type is processed
  private final List<String> monitoredMetrics;
  private final SeverityThresholds severityThresholds;

  @Builder
  private DetectorConfig(
      Integer minSamples,
      Integer minDistinctValues,
      Double contamination,
      Integer ensembleSize,
      Integer maxSamples,
      Long randomSeed,
      List<String> monitoredMetrics,
      SeverityThresholds severityThresholds) {
    this.minSamples = minSamples != null ? minSamples : DEFAULT_MIN_SAMPLES;
    this.minDistinctValues =
        minDistinctValues != null ? minDistinctValues : DEFAULT_MIN_DISTINCT_VALUES;
    this.contamination = contamination != null ? contamination : DEFAULT_CONTAMINATION;
    this.ensembleSize = ensembleSize != null ? ensembleSize : DEFAULT_ENSEMBLE_SIZE;
    this.maxSamples = maxSamples != null ? maxSamples : DEFAULT_MAX_SAMPLES;
    this.randomSeed = randomSeed != null ? randomSeed : DEFAULT_RANDOM_SEED;
    this.monitoredMetrics = monitoredMetrics != null ? List.copyOf(monitoredMetrics) : List.of();
    this.severityThresholds =
        severityThresholds != null ? severityThresholds : SeverityThresholds.defaults();

    Preconditions.checkArgument(this.minSamples >= 2, "min.samples must be at least 2");
    Preconditions.checkArgument(
        this.minDistinctValues >= 1, "min.distinct.values must be at least 1");
    Preconditions.checkArgument(
        this.contamination > 0 && this.contamination <= 0.5,
        "contamination must be in (0, 0.5], got %s",
        this.contamination);
    Preconditions.checkArgument(this.ensembleSize > 0, "ensemble.size must be positive");
    Preconditions.checkArgument(this.maxSamples > 1, "max.samples must be greater than 1");
  }

  public static DetectorConfig defaults() {
    return DetectorConfig.builder().build();
  }

  public static DetectorConfig from(Config detectorConfig) {
    return DetectorConfig.builder()
        .minSamples(
            detectorConfig.hasPath(MIN_SAMPLES_CONFIG)
                ? detectorConfig.getInt(MIN_SAMPLES_CONFIG)
                : null)
        .minDistinctValues(
            detectorConfig.hasPath(MIN_DISTINCT_VALUES_CONFIG)
                ? detectorConfig.getInt(MIN_DISTINCT_VALUES_CONFIG)
                : null)
        .contamination(
            detectorConfig.hasPath(CONTAMINATION_CONFIG)
                ? detectorConfig.getDouble(CONTAMINATION_CONFIG)
                : null)
        .ensembleSize(
            detectorConfig.hasPath(ENSEMBLE_SIZE_CONFIG)
                ? detectorConfig.getInt(ENSEMBLE_SIZE_CONFIG)
                : null)
        .maxSamples(
            detectorConfig.hasPath(MAX_SAMPLES_CONFIG)
                ? detectorConfig.getInt(MAX_SAMPLES_CONFIG)
                : null)
        .randomSeed(
            detectorConfig.hasPath(RANDOM_SEED_CONFIG)
                ? detectorConfig.getLong(RANDOM_SEED_CONFIG)
                : null)
        .monitoredMetrics(
            detectorConfig.hasPath(MONITORED_METRICS_CONFIG)
                ? detectorConfig.getStringList(MONITORED_METRICS_CONFIG)
                : null)
        .severityThresholds(
            detectorConfig.hasPath(SEVERITY_CONFIG)
                ? SeverityThresholds.from(detectorConfig.getConfig(SEVERITY_CONFIG))
                : null)
        .build();
  }

  public boolean isMonitored(String metricType) {
    return monitoredMetrics.isEmpty() || monitoredMetrics.contains(metricType);
  }
}
