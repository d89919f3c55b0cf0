package org.preempt.anomaly.datamodel.queue;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.List;

/**
 * Input side of the job stream. Messages are returned in stream order; a source never replays a
 * message it has already returned.
 */
public interface JobMessageSource {
  void init(Config sourceConfig);

  /**
   * Returns up to {@code maxMessages} messages, waiting at most {@code timeout} for the first one.
   * An empty list means nothing arrived in time.
   */
  List<JobMessage> poll(int maxMessages, Duration timeout) throws StreamUnavailableException;

  void close();
}
