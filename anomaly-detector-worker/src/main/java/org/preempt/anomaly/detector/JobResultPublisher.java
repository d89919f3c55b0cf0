package org.preempt.anomaly.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.preempt.anomaly.datamodel.JobResult;
import org.preempt.anomaly.datamodel.codec.JobResultEncoder;
import org.preempt.anomaly.datamodel.queue.JobResultSink;
import org.preempt.anomaly.datamodel.queue.StreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends each job result to the output stream once. Failed publishes are logged and dropped. */
public class JobResultPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobResultPublisher.class);

  private final JobResultSink resultSink;
  private final JobResultEncoder encoder;

  public JobResultPublisher(JobResultSink resultSink) {
    this(resultSink, new JobResultEncoder());
  }

  JobResultPublisher(JobResultSink resultSink, JobResultEncoder encoder) {
    this.resultSink = resultSink;
    this.encoder = encoder;
  }

  public boolean publish(JobResult jobResult) {
    String payload;
    try {
      payload = encoder.encode(jobResult);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Failed encoding result of job {}, result dropped", jobResult.getJobId(), e);
      return false;
    }

    try {
      resultSink.append(jobResult.getJobId(), payload);
    } catch (StreamUnavailableException e) {
      LOGGER.warn("Failed publishing result of job {}, result dropped", jobResult.getJobId(), e);
      return false;
    }
    LOGGER.debug("Published result of job {}", jobResult.getJobId());
    return true;
  }
}
