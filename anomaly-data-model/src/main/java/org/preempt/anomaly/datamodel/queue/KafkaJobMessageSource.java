package org.preempt.anomaly.datamodel.queue;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaJobMessageSource implements JobMessageSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaJobMessageSource.class);

  private Consumer<String, String> consumer;
  private final LinkedList<ConsumerRecord<String, String>> linkedList = new LinkedList<>();

  public KafkaJobMessageSource() {}

  // used for testing with a mock consumer
  KafkaJobMessageSource(Consumer<String, String> consumer) {
    this.consumer = consumer;
  }

  @Override
  public void init(Config kafkaQueueConfig) {
    KafkaConfigReader kafkaConfigReader = new KafkaConfigReader(kafkaQueueConfig);
    Properties props = new Properties();
    props.putAll(kafkaConfigReader.getConsumerConfig());
    consumer = new KafkaConsumer<>(props);
    consumer.subscribe(Collections.singletonList(kafkaConfigReader.getConsumerTopicName()));
    LOGGER.info(
        "Subscribed to topic {} on {}",
        kafkaConfigReader.getConsumerTopicName(),
        kafkaConfigReader.getBootstrapServer());
  }

  @Override
  public List<JobMessage> poll(int maxMessages, Duration timeout)
      throws StreamUnavailableException {
    if (linkedList.isEmpty()) {
      ConsumerRecords<String, String> records;
      try {
        records = consumer.poll(timeout);
      } catch (KafkaException e) {
        throw new StreamUnavailableException("Failed polling job topic", e);
      }
      records.forEach(linkedList::addLast);
    }

    List<JobMessage> messages = new ArrayList<>(Math.min(maxMessages, linkedList.size()));
    while (!linkedList.isEmpty() && messages.size() < maxMessages) {
      ConsumerRecord<String, String> record = linkedList.remove();
      LOGGER.debug(
          "partition = {}, offset = {}, key = {}",
          record.partition(),
          record.offset(),
          record.key());
      messages.add(new JobMessage(messageId(record), record.value()));
    }
    return messages;
  }

  @Override
  public void close() {
    consumer.close();
  }

  static String messageId(ConsumerRecord<?, ?> record) {
    return String.format("%s-%d@%d", record.topic(), record.partition(), record.offset());
  }
}
