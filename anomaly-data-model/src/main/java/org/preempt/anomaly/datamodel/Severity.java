package org.preempt.anomaly.datamodel;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity tiers, declared in increasing order of severity. */
public enum Severity {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  private final String value;

  Severity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
