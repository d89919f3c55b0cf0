package org.preempt.anomaly.datamodel.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.preempt.anomaly.datamodel.Job;
import org.preempt.anomaly.datamodel.MetricSample;

/**
 * Decodes the JSON payload of an input stream message into a {@link Job}.
 *
 * <p>The payload must carry {@code job_id}, {@code location} and a non-empty {@code metrics}
 * array whose elements each hold {@code timestamp}, {@code metric_type} and a numeric {@code
 * value}. Timestamps without a zone offset are read as UTC.
 */
public class JobDecoder {
  static final String JOB_ID = "job_id";
  static final String LOCATION = "location";
  static final String METRICS = "metrics";
  static final String TIMESTAMP = "timestamp";
  static final String METRIC_TYPE = "metric_type";
  static final String VALUE = "value";

  private final ObjectMapper objectMapper;

  public JobDecoder() {
    this(ObjectMapperProvider.get());
  }

  JobDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Job decode(String payload) throws JobDecodeException {
    if (payload == null || payload.isBlank()) {
      throw new JobDecodeException("Empty job payload");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new JobDecodeException("Job payload is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new JobDecodeException("Job payload must be a JSON object");
    }

    Job.JobBuilder builder =
        Job.builder()
            .jobId(requireText(root, JOB_ID))
            .location(requireText(root, LOCATION));

    JsonNode metrics = root.get(METRICS);
    if (metrics == null || !metrics.isArray()) {
      throw new JobDecodeException("Missing or non-array field: " + METRICS);
    }
    if (metrics.isEmpty()) {
      throw new JobDecodeException("Field " + METRICS + " must not be empty");
    }

    int index = 0;
    for (JsonNode metric : metrics) {
      builder.sample(toSample(metric, index++));
    }
    return builder.build();
  }

  private MetricSample toSample(JsonNode metric, int index) throws JobDecodeException {
    if (!metric.isObject()) {
      throw new JobDecodeException(String.format("%s[%d] is not an object", METRICS, index));
    }
    JsonNode value = metric.get(VALUE);
    if (value == null || !value.isNumber()) {
      throw new JobDecodeException(
          String.format("%s[%d] has a missing or non-numeric %s", METRICS, index, VALUE));
    }
    return MetricSample.builder()
        .timestamp(parseTimestamp(requireText(metric, TIMESTAMP), index))
        .metricType(requireText(metric, METRIC_TYPE))
        .value(value.doubleValue())
        .build();
  }

  static Instant parseTimestamp(String text, int index) throws JobDecodeException {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
      } catch (DateTimeException inner) {
        throw new JobDecodeException(
            String.format("%s[%d] has an invalid %s: %s", METRICS, index, TIMESTAMP, text), inner);
      }
    }
  }

  private static String requireText(JsonNode node, String field) throws JobDecodeException {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.textValue().isEmpty()) {
      throw new JobDecodeException("Missing or non-string field: " + field);
    }
    return value.textValue();
  }
}
