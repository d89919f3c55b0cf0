package org.preempt.anomaly.datamodel.queue;

import java.io.IOException;

/** The input or output stream could not be reached. Always safe to retry. */
public class StreamUnavailableException extends IOException {

  public StreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
