package org.preempt.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Outcome of processing one {@link Job}. Published as a single entry on the output stream.
 *
 * <p>{@code totalAnomaliesFound} always equals the number of anomaly records. {@code modelsSaved}
 * equals the number of processed metric types unless a model write failed.
 */
@Builder
@Getter
@ToString(exclude = "anomalies")
@JsonPropertyOrder({
  "job_id",
  "location",
  "models_saved",
  "total_anomalies_found",
  "anomalies",
  "metrics_processed"
})
public class JobResult {
  @JsonProperty("job_id")
  private final String jobId;

  @JsonProperty("location")
  private final String location;

  @JsonProperty("models_saved")
  private final int modelsSaved;

  @JsonProperty("anomalies")
  @Singular
  private final List<AnomalyRecord> anomalies;

  @JsonProperty("metrics_processed")
  @Singular("metricProcessed")
  private final List<String> metricsProcessed;

  @JsonProperty("total_anomalies_found")
  public int getTotalAnomaliesFound() {
    return anomalies.size();
  }
}
