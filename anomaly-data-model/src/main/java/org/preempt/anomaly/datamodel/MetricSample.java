package org.preempt.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** A single reading of one metric type, as decoded from a job message. */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class MetricSample {
  @NonNull private final Instant timestamp;
  @NonNull private final String metricType;
  private final double value;
}
