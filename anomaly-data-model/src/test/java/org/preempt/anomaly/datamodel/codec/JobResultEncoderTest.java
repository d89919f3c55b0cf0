package org.preempt.anomaly.datamodel.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.preempt.anomaly.datamodel.AnomalyRecord;
import org.preempt.anomaly.datamodel.JobResult;
import org.preempt.anomaly.datamodel.Severity;

class JobResultEncoderTest {

  @Test
  void testEncodeJobResult() throws JsonProcessingException {
    JobResult jobResult =
        JobResult.builder()
            .jobId("job-1")
            .location("Berlin")
            .modelsSaved(1)
            .anomaly(
                AnomalyRecord.builder()
                    .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                    .metricType("temperature")
                    .value(50.0)
                    .anomalyScore(0.21)
                    .severity(Severity.HIGH)
                    .build())
            .metricProcessed("temperature")
            .build();

    String json = new JobResultEncoder().encode(jobResult);
    JsonNode root = ObjectMapperProvider.get().readTree(json);

    List<String> fields = new ArrayList<>();
    Iterator<String> names = root.fieldNames();
    names.forEachRemaining(fields::add);
    assertEquals(
        List.of(
            "job_id",
            "location",
            "models_saved",
            "total_anomalies_found",
            "anomalies",
            "metrics_processed"),
        fields);

    assertEquals("job-1", root.get("job_id").textValue());
    assertEquals(1, root.get("models_saved").intValue());
    assertEquals(1, root.get("total_anomalies_found").intValue());
    assertEquals("temperature", root.get("metrics_processed").get(0).textValue());

    JsonNode anomaly = root.get("anomalies").get(0);
    assertEquals("2024-05-01T10:00:00Z", anomaly.get("timestamp").textValue());
    assertEquals("temperature", anomaly.get("metric_type").textValue());
    assertEquals(50.0, anomaly.get("value").doubleValue());
    assertEquals(0.21, anomaly.get("anomaly_score").doubleValue());
    assertEquals("high", anomaly.get("severity").textValue());
  }

  @Test
  void testEncodeEmptyJobResult() throws JsonProcessingException {
    JobResult jobResult = JobResult.builder().jobId("job-2").location("Oslo").build();

    JsonNode root = ObjectMapperProvider.get().readTree(new JobResultEncoder().encode(jobResult));

    assertEquals(0, root.get("total_anomalies_found").intValue());
    assertEquals(0, root.get("models_saved").intValue());
    assertTrue(root.get("anomalies").isArray());
    assertTrue(root.get("anomalies").isEmpty());
    assertTrue(root.get("metrics_processed").isEmpty());
  }
}
