package org.preempt.anomaly.detector;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

/** Settings of the {@code consumer} config section. */
@Getter
@Builder
public class StreamConsumerSettings {
  static final String BATCH_SIZE_CONFIG = "batch.size";
  static final String POLL_TIMEOUT_CONFIG = "poll.timeout";
  static final String BACKOFF_INITIAL_CONFIG = "backoff.initial";
  static final String BACKOFF_MAX_CONFIG = "backoff.max";

  @Builder.Default private final int batchSize = 50;
  @Builder.Default private final Duration pollTimeout = Duration.ofSeconds(1);
  @Builder.Default private final Duration backoffInitial = Duration.ofSeconds(1);
  @Builder.Default private final Duration backoffMax = Duration.ofSeconds(30);

  public static StreamConsumerSettings defaults() {
    return StreamConsumerSettings.builder().build();
  }

  public static StreamConsumerSettings from(Config consumerConfig) {
    StreamConsumerSettingsBuilder builder = StreamConsumerSettings.builder();
    if (consumerConfig.hasPath(BATCH_SIZE_CONFIG)) {
      int batchSize = consumerConfig.getInt(BATCH_SIZE_CONFIG);
      Preconditions.checkArgument(batchSize > 0, "batch.size must be positive");
      builder.batchSize(batchSize);
    }
    if (consumerConfig.hasPath(POLL_TIMEOUT_CONFIG)) {
      builder.pollTimeout(consumerConfig.getDuration(POLL_TIMEOUT_CONFIG));
    }
    if (consumerConfig.hasPath(BACKOFF_INITIAL_CONFIG)) {
      builder.backoffInitial(consumerConfig.getDuration(BACKOFF_INITIAL_CONFIG));
    }
    if (consumerConfig.hasPath(BACKOFF_MAX_CONFIG)) {
      builder.backoffMax(consumerConfig.getDuration(BACKOFF_MAX_CONFIG));
    }
    return builder.build();
  }

  public BackoffPolicy newBackoffPolicy() {
    return new BackoffPolicy(backoffInitial, backoffMax);
  }
}
