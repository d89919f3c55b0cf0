package org.preempt.anomaly.detector.persistence;

import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import java.util.Arrays;

/** How an artifact slot is named. */
public enum SlotNaming {
  /** One slot per metric type, overwritten by every job that trains it. */
  METRIC_TYPE("metric-type"),
  /** One slot per job and metric type. */
  JOB_AND_METRIC_TYPE("job-and-metric-type");

  private static final Escaper SLOT_ESCAPER = new PercentEscaper("._-", false);
  private static final String ESCAPED_DOT = "%2E";
  private static final String MODEL_SUFFIX = "_model";

  private final String configValue;

  SlotNaming(String configValue) {
    this.configValue = configValue;
  }

  public String getConfigValue() {
    return configValue;
  }

  String slotName(String jobId, String metricType) {
    String metricSlot = sanitize(metricType) + MODEL_SUFFIX;
    switch (this) {
      case METRIC_TYPE:
        return metricSlot;
      case JOB_AND_METRIC_TYPE:
        return sanitize(jobId) + "/" + metricSlot;
      default:
        throw new UnsupportedOperationException("Unsupported slot naming: " + this);
    }
  }

  public static SlotNaming fromConfigValue(String value) {
    return Arrays.stream(values())
        .filter(naming -> naming.configValue.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown slot naming: " + value));
  }

  /**
   * Percent-encodes every character outside {@code [A-Za-z0-9._-]}, including {@code %} itself and
   * a leading dot, so distinct names always map to distinct file names inside the store directory.
   */
  static String sanitize(String name) {
    String escaped = SLOT_ESCAPER.escape(name);
    return escaped.startsWith(".") ? ESCAPED_DOT + escaped.substring(1) : escaped;
  }
}
