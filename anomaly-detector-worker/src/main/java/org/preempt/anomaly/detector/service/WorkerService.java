package org.preempt.anomaly.detector.service;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of a long running worker: {@link #initialize()} once, then {@link #start()} which
 * blocks for as long as the worker runs, and {@link #shutdown()} from another thread.
 */
public abstract class WorkerService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

  static final String SERVICE_NAME_CONFIG = "service.name";

  public enum State {
    NOT_STARTED,
    INITIALIZED,
    STARTED,
    STOPPING,
    STOPPED
  }

  private final Config appConfig;
  private volatile State serviceState = State.NOT_STARTED;

  protected WorkerService(Config appConfig) {
    this.appConfig = appConfig;
  }

  protected abstract void doInit();

  protected abstract void doStart();

  protected abstract void doStop();

  public abstract boolean healthCheck();

  public synchronized void initialize() {
    if (serviceState != State.NOT_STARTED) {
      throw new IllegalStateException("Service " + getServiceName() + " is " + serviceState);
    }
    LOGGER.info("Initializing service {}", getServiceName());
    doInit();
    serviceState = State.INITIALIZED;
  }

  public void start() {
    synchronized (this) {
      if (serviceState != State.INITIALIZED) {
        throw new IllegalStateException("Service " + getServiceName() + " is " + serviceState);
      }
      serviceState = State.STARTED;
    }
    LOGGER.info("Starting service {}", getServiceName());
    doStart();
  }

  public void shutdown() {
    synchronized (this) {
      if (serviceState == State.STOPPING || serviceState == State.STOPPED) {
        return;
      }
      serviceState = State.STOPPING;
    }
    LOGGER.info("Stopping service {}", getServiceName());
    doStop();
    serviceState = State.STOPPED;
    LOGGER.info("Service {} stopped", getServiceName());
  }

  public Config getAppConfig() {
    return appConfig;
  }

  public String getServiceName() {
    return appConfig.hasPath(SERVICE_NAME_CONFIG)
        ? appConfig.getString(SERVICE_NAME_CONFIG)
        : getClass().getSimpleName();
  }

  public State getServiceState() {
    return serviceState;
  }
}
