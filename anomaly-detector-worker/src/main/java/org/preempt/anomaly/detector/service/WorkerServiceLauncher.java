package org.preempt.anomaly.detector.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WorkerServiceLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerServiceLauncher.class);

  static final String SERVICE_NAME_ENV = "SERVICE_NAME";
  static final String DEFAULT_SERVICE_NAME = "anomaly-detector-worker";
  private static final String CONFIG_RESOURCE_FORMAT = "configs/%s/application.conf";

  public static void main(String[] args) {
    String serviceName = System.getenv().getOrDefault(SERVICE_NAME_ENV, DEFAULT_SERVICE_NAME);
    Config appConfig = loadConfig(serviceName);

    WorkerService service = new AnomalyDetectorWorkerService(appConfig);
    Runtime.getRuntime()
        .addShutdownHook(new Thread(service::shutdown, serviceName + "-shutdown-hook"));

    try {
      service.initialize();
      service.start();
    } catch (RuntimeException e) {
      LOGGER.error("Service {} failed", serviceName, e);
      System.exit(1);
    }
  }

  static Config loadConfig(String serviceName) {
    String resource = String.format(CONFIG_RESOURCE_FORMAT, serviceName);
    LOGGER.info("Loading config from classpath resource {}", resource);
    return ConfigFactory.systemProperties()
        .withFallback(ConfigFactory.parseResources(resource))
        .resolve();
  }
}
