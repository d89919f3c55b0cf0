package org.preempt.anomaly.datamodel.queue;

import com.typesafe.config.Config;

public class JobQueueProvider {
  private static final String QUEUE_SOURCE_TYPE = "type";
  private static final String QUEUE_SOURCE_TYPE_KAFKA = "kafka";

  public static JobMessageSource getMessageSource(Config queueConfig) {
    JobMessageSource messageSource;
    String queueType = queueConfig.getString(QUEUE_SOURCE_TYPE);
    switch (queueType) {
      case QUEUE_SOURCE_TYPE_KAFKA:
        messageSource = new KafkaJobMessageSource();
        messageSource.init(queueConfig.getConfig(QUEUE_SOURCE_TYPE_KAFKA));
        break;
      default:
        throw new IllegalArgumentException(
            String.format("Invalid queue configuration: %s", queueType));
    }
    return messageSource;
  }

  public static JobResultSink getResultSink(Config queueConfig) {
    JobResultSink resultSink;
    String queueType = queueConfig.getString(QUEUE_SOURCE_TYPE);
    switch (queueType) {
      case QUEUE_SOURCE_TYPE_KAFKA:
        resultSink = new KafkaJobResultSink();
        resultSink.init(queueConfig.getConfig(QUEUE_SOURCE_TYPE_KAFKA));
        break;
      default:
        throw new IllegalArgumentException(
            String.format("Invalid queue configuration: %s", queueType));
    }
    return resultSink;
  }
}
