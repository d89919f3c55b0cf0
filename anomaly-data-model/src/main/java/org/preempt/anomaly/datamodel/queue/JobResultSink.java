package org.preempt.anomaly.datamodel.queue;

import com.typesafe.config.Config;

/** Output side of the job stream. */
public interface JobResultSink {
  void init(Config sinkConfig);

  /** Appends one entry and returns once the stream has acknowledged it. */
  void append(String key, String payload) throws StreamUnavailableException;

  void close();
}
