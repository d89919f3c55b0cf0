package org.preempt.anomaly.detector.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.concurrent.CountDownLatch;
import org.preempt.anomaly.datamodel.queue.JobMessageSource;
import org.preempt.anomaly.datamodel.queue.JobQueueProvider;
import org.preempt.anomaly.datamodel.queue.JobResultSink;
import org.preempt.anomaly.detector.DetectorConfig;
import org.preempt.anomaly.detector.JobProcessor;
import org.preempt.anomaly.detector.JobResultPublisher;
import org.preempt.anomaly.detector.JobStreamConsumer;
import org.preempt.anomaly.detector.StreamConsumerSettings;
import org.preempt.anomaly.detector.persistence.ModelStore;
import org.preempt.anomaly.detector.persistence.ModelStoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AnomalyDetectorWorkerService extends WorkerService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetectorWorkerService.class);

  static final String QUEUE_CONFIG = "queue.config";
  static final String CONSUMER_CONFIG = "consumer";
  static final String DETECTOR_CONFIG = "detector";
  static final String MODEL_STORE_CONFIG = "model.store";

  private JobMessageSource messageSource;
  private JobResultSink resultSink;
  private ModelStore modelStore;
  private JobStreamConsumer streamConsumer;
  private final CountDownLatch stopped = new CountDownLatch(1);
  private volatile boolean consuming;

  public AnomalyDetectorWorkerService(Config appConfig) {
    super(appConfig);
  }

  // used for testing with in-memory transports
  AnomalyDetectorWorkerService(
      Config appConfig,
      JobMessageSource messageSource,
      JobResultSink resultSink,
      ModelStore modelStore) {
    super(appConfig);
    this.messageSource = messageSource;
    this.resultSink = resultSink;
    this.modelStore = modelStore;
  }

  @Override
  protected void doInit() {
    Config appConfig = getAppConfig();
    DetectorConfig detectorConfig =
        DetectorConfig.from(subConfig(appConfig, DETECTOR_CONFIG));
    StreamConsumerSettings consumerSettings =
        StreamConsumerSettings.from(subConfig(appConfig, CONSUMER_CONFIG));
    LOGGER.info("Detector config {}", detectorConfig);

    if (modelStore == null) {
      modelStore = ModelStoreProvider.getModelStore(appConfig.getConfig(MODEL_STORE_CONFIG));
    }
    if (messageSource == null) {
      messageSource = JobQueueProvider.getMessageSource(appConfig.getConfig(QUEUE_CONFIG));
    }
    if (resultSink == null) {
      resultSink = JobQueueProvider.getResultSink(appConfig.getConfig(QUEUE_CONFIG));
    }

    streamConsumer =
        new JobStreamConsumer(
            messageSource,
            new JobProcessor(detectorConfig, modelStore),
            new JobResultPublisher(resultSink),
            consumerSettings);
  }

  @Override
  protected void doStart() {
    consuming = true;
    try {
      streamConsumer.run();
    } finally {
      try {
        closeTransports();
      } finally {
        consuming = false;
        stopped.countDown();
      }
    }
  }

  private void closeTransports() {
    try {
      messageSource.close();
    } finally {
      resultSink.close();
    }
  }

  @Override
  protected void doStop() {
    if (streamConsumer == null) {
      return;
    }
    streamConsumer.stop();
    if (!consuming) {
      closeTransports();
      return;
    }
    try {
      stopped.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for the in-flight job to finish");
    }
  }

  @Override
  public boolean healthCheck() {
    return streamConsumer != null && streamConsumer.isRunning();
  }

  JobStreamConsumer getStreamConsumer() {
    return streamConsumer;
  }

  private static Config subConfig(Config appConfig, String path) {
    return appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty();
  }
}
