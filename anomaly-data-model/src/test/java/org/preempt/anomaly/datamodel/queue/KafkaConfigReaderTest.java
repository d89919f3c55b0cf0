package org.preempt.anomaly.datamodel.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;

class KafkaConfigReaderTest {

  private static final Config QUEUE_CONFIG =
      ConfigFactory.parseString(
          "type = kafka\n"
              + "kafka {\n"
              + "  bootstrap.servers = \"broker:9092\"\n"
              + "  consumer { topic = ml_input, group.id = workers, max.poll.records = 20 }\n"
              + "  producer { topic = ml_output }\n"
              + "}");

  @Test
  void testReadTopicsAndServers() {
    KafkaConfigReader reader = new KafkaConfigReader(QUEUE_CONFIG.getConfig("kafka"));

    assertEquals("ml_input", reader.getConsumerTopicName());
    assertEquals("ml_output", reader.getProducerTopicName());
    assertEquals("broker:9092", reader.getBootstrapServer());
  }

  @Test
  void testConsumerConfig() {
    Map<String, Object> consumerConfig =
        new KafkaConfigReader(QUEUE_CONFIG.getConfig("kafka")).getConsumerConfig();

    assertEquals("broker:9092", consumerConfig.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("workers", consumerConfig.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals("20", consumerConfig.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    assertEquals("latest", consumerConfig.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    assertEquals("false", consumerConfig.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
    assertFalse(consumerConfig.containsKey(KafkaConfigReader.TOPIC_NAME_CONFIG));
  }

  @Test
  void testProducerConfig() {
    Map<String, Object> producerConfig =
        new KafkaConfigReader(QUEUE_CONFIG.getConfig("kafka")).getProducerConfig();

    assertEquals("all", producerConfig.get(ProducerConfig.ACKS_CONFIG));
    assertFalse(producerConfig.containsKey(KafkaConfigReader.TOPIC_NAME_CONFIG));
  }

  @Test
  void testDefaultGroupId() {
    Config kafkaConfig =
        ConfigFactory.parseString(
            "bootstrap.servers = \"localhost:9092\"\n"
                + "consumer.topic = ml_input\n"
                + "producer.topic = ml_output");

    Map<String, Object> consumerConfig = new KafkaConfigReader(kafkaConfig).getConsumerConfig();

    assertEquals(
        KafkaConfigReader.DEFAULT_GROUP_ID, consumerConfig.get(ConsumerConfig.GROUP_ID_CONFIG));
  }

  @Test
  void testUnknownQueueType() {
    Config queueConfig = ConfigFactory.parseString("type = redis");

    assertThrows(
        IllegalArgumentException.class, () -> JobQueueProvider.getMessageSource(queueConfig));
    assertThrows(IllegalArgumentException.class, () -> JobQueueProvider.getResultSink(queueConfig));
  }
}
