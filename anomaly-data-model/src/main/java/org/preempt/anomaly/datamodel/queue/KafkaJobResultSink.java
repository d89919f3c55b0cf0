package org.preempt.anomaly.datamodel.queue;

import com.typesafe.config.Config;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;

public class KafkaJobResultSink implements JobResultSink {
  private static final long SEND_TIMEOUT_SECONDS = 30;

  private Producer<String, String> producer;
  private String topicName;

  public KafkaJobResultSink() {}

  // used for testing with a mock producer
  KafkaJobResultSink(Producer<String, String> producer, String topicName) {
    this.producer = producer;
    this.topicName = topicName;
  }

  @Override
  public void init(Config kafkaQueueConfig) {
    KafkaConfigReader kafkaConfigReader = new KafkaConfigReader(kafkaQueueConfig);
    Properties props = new Properties();
    props.putAll(kafkaConfigReader.getProducerConfig());
    producer = new KafkaProducer<>(props);
    topicName = kafkaConfigReader.getProducerTopicName();
  }

  @Override
  public void append(String key, String payload) throws StreamUnavailableException {
    try {
      producer
          .send(new ProducerRecord<>(topicName, key, payload))
          .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StreamUnavailableException("Interrupted while appending to " + topicName, e);
    } catch (ExecutionException | TimeoutException | KafkaException e) {
      throw new StreamUnavailableException("Failed appending to " + topicName, e);
    }
  }

  @Override
  public void close() {
    producer.close();
  }
}
