package com.github.adamzv.proton.adapters.kafka;

import com.github.adamzv.proton.domain.ConsumedMessage;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.PartitionReader;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class KafkaPartitionReader implements PartitionReader {

  private static final Logger log = LoggerFactory.getLogger(KafkaPartitionReader.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

  private final Consumer<byte[], byte[]> consumer;
  private final TopicPartition topicPartition;

  KafkaPartitionReader(Consumer<byte[], byte[]> consumer, TopicPartition topicPartition) {
    this.consumer = consumer;
    this.topicPartition = topicPartition;
  }

  @Override
  public List<ConsumedMessage> poll(Duration timeout) {
    ConsumerRecords<byte[], byte[]> records;
    try {
      records = consumer.poll(timeout);
    } catch (WakeupException ex) {
      return List.of();
    } catch (InterruptException ex) {
      Thread.currentThread().interrupt();
      return List.of();
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable(
          "Kafka poll failed",
          Map.of(
              "topic", topicPartition.topic(),
              "partition", topicPartition.partition(),
              "error", ex.getClass().getSimpleName()
          )
      );
    }

    List<ConsumerRecord<byte[], byte[]>> partitionRecords = records.records(topicPartition);
    if (partitionRecords.isEmpty()) {
      return List.of();
    }

    List<ConsumedMessage> messages = new ArrayList<>(partitionRecords.size());
    for (ConsumerRecord<byte[], byte[]> record : partitionRecords) {
      messages.add(new ConsumedMessage(
          record.key(),
          record.value(),
          record.partition(),
          record.offset(),
          Instant.ofEpochMilli(record.timestamp())
      ));
    }
    return List.copyOf(messages);
  }

  @Override
  public OptionalLong highWatermark() {
    try {
      OptionalLong lag = consumer.currentLag(topicPartition);
      if (lag.isEmpty()) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(consumer.position(topicPartition) + lag.getAsLong());
    } catch (KafkaException | IllegalStateException ex) {
      log.debug("high_watermark_unavailable partition={} error={}", topicPartition, ex.toString());
      return OptionalLong.empty();
    }
  }

  @Override
  public void wakeup() {
    consumer.wakeup();
  }

  @Override
  public void close() {
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("consumer_close_failed partition={} error={}", topicPartition, ex.toString());
    }
  }
}
