package org.preempt.anomaly.datamodel.queue;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One raw entry read from the input stream: its stream position id and its payload. */
@AllArgsConstructor
@Getter
@ToString
@EqualsAndHashCode
public class JobMessage {
  private final String id;
  private final String payload;
}
