package org.preempt.anomaly.datamodel;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

@Builder
@Getter
@ToString(exclude = "samples")
public class Job {
  @NonNull private final String jobId;
  @NonNull private final String location;

  @Singular private final List<MetricSample> samples;
}
