package org.preempt.anomaly.detector;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.math.Stats;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.preempt.anomaly.datamodel.AnomalyRecord;
import org.preempt.anomaly.datamodel.Job;
import org.preempt.anomaly.datamodel.JobResult;
import org.preempt.anomaly.datamodel.MetricSample;
import org.preempt.anomaly.detector.persistence.ModelArtifact;
import org.preempt.anomaly.detector.persistence.ModelPersistenceException;
import org.preempt.anomaly.detector.persistence.ModelStore;
import org.preempt.anomaly.detector.severity.SeverityClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs detection over every eligible metric type of a job and aggregates the outcome.
 *
 * <p>Metric types are handled in the order they first appear in the job. A type that fails to fit
 * is left out of the result; a model that fails to persist only lowers {@code models_saved}.
 */
public class JobProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobProcessor.class);

  private static final String DETECTION_TIMER = "preempt.anomaly.worker.detection.latency";
  private static final ConcurrentMap<String, Timer> detectionTimers = new ConcurrentHashMap<>();

  private final DetectorConfig detectorConfig;
  private final MetricDetector metricDetector;
  private final SeverityClassifier severityClassifier;
  private final ModelStore modelStore;
  private final Clock clock;

  public JobProcessor(DetectorConfig detectorConfig, ModelStore modelStore) {
    this(
        detectorConfig,
        new MetricDetector(detectorConfig),
        new SeverityClassifier(detectorConfig.getSeverityThresholds()),
        modelStore,
        Clock.systemUTC());
  }

  JobProcessor(
      DetectorConfig detectorConfig,
      MetricDetector metricDetector,
      SeverityClassifier severityClassifier,
      ModelStore modelStore,
      Clock clock) {
    this.detectorConfig = detectorConfig;
    this.metricDetector = metricDetector;
    this.severityClassifier = severityClassifier;
    this.modelStore = modelStore;
    this.clock = clock;
  }

  public JobResult process(Job job) {
    ListMultimap<String, MetricSample> samplesByType =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (MetricSample sample : job.getSamples()) {
      if (detectorConfig.isMonitored(sample.getMetricType())) {
        samplesByType.put(sample.getMetricType(), sample);
      }
    }

    JobResult.JobResultBuilder resultBuilder =
        JobResult.builder().jobId(job.getJobId()).location(job.getLocation());
    int modelsSaved = 0;

    for (String metricType : samplesByType.keySet()) {
      List<MetricSample> samples = samplesByType.get(metricType);
      if (!metricDetector.isEligible(samples)) {
        LOGGER.warn(
            "Skipping {} for job {}: {} samples with {} distinct values",
            metricType,
            job.getJobId(),
            samples.size(),
            MetricDetector.distinctValues(samples));
        continue;
      }

      DetectionResult detectionResult;
      List<AnomalyRecord> anomalies;
      try {
        Instant startTime = Instant.now();
        detectionResult = metricDetector.detect(metricType, samples);
        anomalies = toAnomalyRecords(samples, detectionResult);
        detectionTimers
            .computeIfAbsent(
                metricType, k -> Metrics.timer(DETECTION_TIMER, "metricType", k))
            .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
      } catch (RuntimeException e) {
        LOGGER.error("Failed detecting anomalies in {} for job {}", metricType, job.getJobId(), e);
        continue;
      }

      resultBuilder.metricProcessed(metricType).anomalies(anomalies);
      logSummary(job, metricType, samples, anomalies.size());

      if (persist(job, metricType, samples.size(), detectionResult)) {
        modelsSaved++;
      }
    }

    JobResult jobResult = resultBuilder.modelsSaved(modelsSaved).build();
    LOGGER.info(
        "Processed job {} at {}: metrics {}, {} anomalies, {} models saved",
        jobResult.getJobId(),
        jobResult.getLocation(),
        jobResult.getMetricsProcessed(),
        jobResult.getTotalAnomaliesFound(),
        jobResult.getModelsSaved());
    return jobResult;
  }

  private List<AnomalyRecord> toAnomalyRecords(
      List<MetricSample> samples, DetectionResult detectionResult) {
    List<AnomalyRecord> anomalies = new ArrayList<>();
    for (int i = 0; i < detectionResult.size(); i++) {
      if (!detectionResult.isAnomalous(i)) {
        continue;
      }
      MetricSample sample = samples.get(i);
      double anomalyScore = detectionResult.getAnomalyScore(i);
      AnomalyRecord anomalyRecord =
          AnomalyRecord.builder()
              .timestamp(sample.getTimestamp())
              .metricType(sample.getMetricType())
              .value(sample.getValue())
              .anomalyScore(anomalyScore)
              .severity(severityClassifier.classify(anomalyScore))
              .build();
      LOGGER.debug("Anomaly {}", anomalyRecord);
      anomalies.add(anomalyRecord);
    }
    return anomalies;
  }

  private boolean persist(
      Job job, String metricType, int sampleCount, DetectionResult detectionResult) {
    ModelArtifact artifact =
        ModelArtifact.builder()
            .metricType(metricType)
            .jobId(job.getJobId())
            .location(job.getLocation())
            .trainedAt(clock.instant())
            .sampleCount(sampleCount)
            .ensembleSize(detectorConfig.getEnsembleSize())
            .maxSamples(detectorConfig.getMaxSamples())
            .contamination(detectorConfig.getContamination())
            .randomSeed(detectorConfig.getRandomSeed())
            .model(detectionResult.getModel())
            .build();
    try {
      String slot = modelStore.save(artifact);
      LOGGER.debug("Model of {} for job {} saved to slot {}", metricType, job.getJobId(), slot);
      return true;
    } catch (ModelPersistenceException | RuntimeException e) {
      LOGGER.warn("Failed saving model of {} for job {}", metricType, job.getJobId(), e);
      return false;
    }
  }

  private static void logSummary(
      Job job, String metricType, List<MetricSample> samples, int anomalyCount) {
    Stats stats = Stats.of(samples.stream().mapToDouble(MetricSample::getValue).toArray());
    LOGGER.info(
        "Job {} {}: count {}, mean {}, std {}, anomalies {}",
        job.getJobId(),
        metricType,
        stats.count(),
        String.format("%.2f", stats.mean()),
        String.format("%.2f", stats.populationStandardDeviation()),
        anomalyCount);
  }
}
