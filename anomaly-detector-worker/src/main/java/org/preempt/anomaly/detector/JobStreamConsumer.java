package org.preempt.anomaly.detector;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.List;
import org.preempt.anomaly.datamodel.Job;
import org.preempt.anomaly.datamodel.JobResult;
import org.preempt.anomaly.datamodel.codec.JobDecodeException;
import org.preempt.anomaly.datamodel.codec.JobDecoder;
import org.preempt.anomaly.datamodel.queue.JobMessage;
import org.preempt.anomaly.datamodel.queue.JobMessageSource;
import org.preempt.anomaly.datamodel.queue.StreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker loop: polls the job stream, processes each message in arrival order and publishes its
 * result. A failing message is logged and skipped; a failing poll is retried after a backoff.
 *
 * <p>The cursor holds the id of the last message taken off the stream. It lives in memory only,
 * so a restarted worker starts again from newly arriving messages.
 */
public class JobStreamConsumer implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStreamConsumer.class);

  private static final Counter messagesConsumed =
      Metrics.counter("preempt.anomaly.worker.messages.consumed");
  private static final Counter messagesFailed =
      Metrics.counter("preempt.anomaly.worker.messages.failed");
  private static final Counter pollFailures =
      Metrics.counter("preempt.anomaly.worker.poll.failures");

  private final JobMessageSource messageSource;
  private final JobDecoder decoder;
  private final JobProcessor jobProcessor;
  private final JobResultPublisher resultPublisher;
  private final StreamConsumerSettings settings;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;

  private volatile boolean running = true;
  private volatile String cursor;

  public JobStreamConsumer(
      JobMessageSource messageSource,
      JobProcessor jobProcessor,
      JobResultPublisher resultPublisher,
      StreamConsumerSettings settings) {
    this(
        messageSource,
        new JobDecoder(),
        jobProcessor,
        resultPublisher,
        settings,
        settings.newBackoffPolicy(),
        Sleeper.SYSTEM);
  }

  JobStreamConsumer(
      JobMessageSource messageSource,
      JobDecoder decoder,
      JobProcessor jobProcessor,
      JobResultPublisher resultPublisher,
      StreamConsumerSettings settings,
      BackoffPolicy backoffPolicy,
      Sleeper sleeper) {
    this.messageSource = messageSource;
    this.decoder = decoder;
    this.jobProcessor = jobProcessor;
    this.resultPublisher = resultPublisher;
    this.settings = settings;
    this.backoffPolicy = backoffPolicy;
    this.sleeper = sleeper;
  }

  @Override
  public void run() {
    LOGGER.info("Job stream consumer started");
    while (running) {
      try {
        pollOnce();
      } catch (StreamUnavailableException e) {
        pollFailures.increment();
        Duration delay = backoffPolicy.nextDelay();
        LOGGER.warn("Job stream unavailable, retrying in {} ms", delay.toMillis(), e);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          LOGGER.info("Interrupted while backing off, stopping");
          running = false;
        }
      }
    }
    LOGGER.info("Job stream consumer stopped at cursor {}", cursor);
  }

  /**
   * Polls one batch and handles every message in it.
   *
   * @return the number of messages handled
   */
  int pollOnce() throws StreamUnavailableException {
    List<JobMessage> messages =
        messageSource.poll(settings.getBatchSize(), settings.getPollTimeout());
    backoffPolicy.reset();
    for (JobMessage message : messages) {
      handle(message);
    }
    return messages.size();
  }

  void handle(JobMessage message) {
    cursor = message.getId();
    messagesConsumed.increment();
    try {
      Job job = decoder.decode(message.getPayload());
      JobResult jobResult = jobProcessor.process(job);
      resultPublisher.publish(jobResult);
    } catch (JobDecodeException e) {
      messagesFailed.increment();
      LOGGER.error("Skipping undecodable message {}", message.getId(), e);
    } catch (RuntimeException e) {
      messagesFailed.increment();
      LOGGER.error("Failed processing message {}", message.getId(), e);
    }
  }

  public void stop() {
    running = false;
  }

  public boolean isRunning() {
    return running;
  }

  public String getCursor() {
    return cursor;
  }
}
