package org.preempt.anomaly.detector.persistence;

public class ModelPersistenceException extends Exception {

  public ModelPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
