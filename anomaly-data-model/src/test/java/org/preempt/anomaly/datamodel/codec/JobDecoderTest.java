package org.preempt.anomaly.datamodel.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.preempt.anomaly.datamodel.Job;
import org.preempt.anomaly.datamodel.MetricSample;

class JobDecoderTest {

  private final JobDecoder decoder = new JobDecoder();

  @Test
  void testDecodeJob() throws JobDecodeException {
    String payload =
        "{\"job_id\": \"job-1\", \"location\": \"Berlin\", \"metrics\": ["
            + "{\"timestamp\": \"2024-05-01T10:00:00Z\", \"metric_type\": \"temperature\", \"value\": 21.5},"
            + "{\"timestamp\": \"2024-05-01T11:00:00\", \"metric_type\": \"humidity\", \"value\": 60}"
            + "]}";

    Job job = decoder.decode(payload);

    assertEquals("job-1", job.getJobId());
    assertEquals("Berlin", job.getLocation());
    assertEquals(2, job.getSamples().size());
    MetricSample first = job.getSamples().get(0);
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), first.getTimestamp());
    assertEquals("temperature", first.getMetricType());
    assertEquals(21.5, first.getValue());
    MetricSample second = job.getSamples().get(1);
    assertEquals(Instant.parse("2024-05-01T11:00:00Z"), second.getTimestamp());
    assertEquals(60.0, second.getValue());
  }

  @Test
  void testDecodeTimestampWithOffset() throws JobDecodeException {
    assertEquals(
        Instant.parse("2024-05-01T08:00:00Z"),
        JobDecoder.parseTimestamp("2024-05-01T10:00:00+02:00", 0));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "   ",
        "not json",
        "[1, 2]",
        "{\"location\": \"x\", \"metrics\": [{\"timestamp\": \"2024-05-01T10:00:00Z\", \"metric_type\": \"t\", \"value\": 1}]}",
        "{\"job_id\": \"j\", \"metrics\": [{\"timestamp\": \"2024-05-01T10:00:00Z\", \"metric_type\": \"t\", \"value\": 1}]}",
        "{\"job_id\": \"j\", \"location\": \"x\"}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": []}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": {}}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": [42]}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": [{\"timestamp\": \"2024-05-01T10:00:00Z\", \"metric_type\": \"t\", \"value\": \"1\"}]}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": [{\"timestamp\": \"yesterday\", \"metric_type\": \"t\", \"value\": 1}]}",
        "{\"job_id\": \"j\", \"location\": \"x\", \"metrics\": [{\"timestamp\": \"2024-05-01T10:00:00Z\", \"value\": 1}]}",
        "{\"job_id\": 7, \"location\": \"x\", \"metrics\": [{\"timestamp\": \"2024-05-01T10:00:00Z\", \"metric_type\": \"t\", \"value\": 1}]}"
      })
  void testRejectInvalidPayload(String payload) {
    assertThrows(JobDecodeException.class, () -> decoder.decode(payload));
  }

  @Test
  void testRejectNullPayload() {
    assertThrows(JobDecodeException.class, () -> decoder.decode(null));
  }
}
