package org.preempt.anomaly.datamodel.codec;

/** Raised when a job payload is not valid JSON or misses a required field. */
public class JobDecodeException extends Exception {

  public JobDecodeException(String message) {
    super(message);
  }

  public JobDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
