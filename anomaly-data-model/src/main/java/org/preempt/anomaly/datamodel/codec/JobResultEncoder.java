package org.preempt.anomaly.datamodel.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.preempt.anomaly.datamodel.JobResult;

public class JobResultEncoder {

  private final ObjectMapper objectMapper;

  public JobResultEncoder() {
    this(ObjectMapperProvider.get());
  }

  JobResultEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(JobResult jobResult) throws JsonProcessingException {
    return objectMapper.writeValueAsString(jobResult);
  }
}
