package org.preempt.anomaly.detector.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.preempt.anomaly.detector.forest.IsolationForestModel;

/** Audit copy of a model trained for one metric type of one job. Written, never read back. */
@Builder
@Getter
@JsonPropertyOrder({
  "metric_type",
  "job_id",
  "location",
  "trained_at",
  "sample_count",
  "ensemble_size",
  "max_samples",
  "contamination",
  "random_seed",
  "model"
})
public class ModelArtifact {
  @NonNull
  @JsonProperty("metric_type")
  private final String metricType;

  @NonNull
  @JsonProperty("job_id")
  private final String jobId;

  @JsonProperty("location")
  private final String location;

  @JsonProperty("trained_at")
  private final Instant trainedAt;

  @JsonProperty("sample_count")
  private final int sampleCount;

  @JsonProperty("ensemble_size")
  private final int ensembleSize;

  @JsonProperty("max_samples")
  private final int maxSamples;

  @JsonProperty("contamination")
  private final double contamination;

  @JsonProperty("random_seed")
  private final long randomSeed;

  @NonNull
  @JsonProperty("model")
  private final IsolationForestModel model;
}
