package org.preempt.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
@JsonPropertyOrder({"timestamp", "metric_type", "value", "anomaly_score", "severity"})
public class AnomalyRecord {
  @JsonProperty("timestamp")
  private final Instant timestamp;

  @JsonProperty("metric_type")
  private final String metricType;

  @JsonProperty("value")
  private final double value;

  // normalized isolation score in (0, 1], higher is more anomalous
  @JsonProperty("anomaly_score")
  private final double anomalyScore;

  @JsonProperty("severity")
  private final Severity severity;
}
