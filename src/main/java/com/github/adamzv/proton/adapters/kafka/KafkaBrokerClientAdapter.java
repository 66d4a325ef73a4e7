package com.github.adamzv.proton.adapters.kafka;

import com.github.adamzv.proton.domain.Offset;
import com.github.adamzv.proton.domain.OffsetBound;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.BrokerClientPort;
import com.github.adamzv.proton.ports.PartitionReader;
import com.github.adamzv.proton.support.KafkaProperties;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.DescribeTopicsResult;
import org.apache.kafka.clients.admin.ListOffsetsOptions;
import org.apache.kafka.clients.admin.ListOffsetsResult.ListOffsetsResultInfo;
import org.apache.kafka.clients.admin.OffsetSpec;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.IsolationLevel;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.springframework.stereotype.Component;

@Component
public class KafkaBrokerClientAdapter implements BrokerClientPort {

  private static final Duration ADMIN_TIMEOUT = Duration.ofSeconds(5);

  private final AdminClient adminClient;
  private final PartitionConsumerFactory consumerFactory;
  private final KafkaProperties kafkaProperties;

  public KafkaBrokerClientAdapter(AdminClient adminClient, PartitionConsumerFactory consumerFactory,
                                  KafkaProperties kafkaProperties) {
    this.adminClient = adminClient;
    this.consumerFactory = consumerFactory;
    this.kafkaProperties = kafkaProperties;
  }

  @Override
  public List<Integer> listPartitions(String topic) {
    DescribeTopicsOptions options = new DescribeTopicsOptions()
        .timeoutMs(Math.toIntExact(ADMIN_TIMEOUT.toMillis()))
        .includeAuthorizedOperations(false);

    DescribeTopicsResult result = adminClient.describeTopics(List.of(topic), options);
    Map<String, TopicDescription> descriptions = await(
        result.allTopicNames(),
        "describeTopic",
        Map.of("topic", topic)
    );

    TopicDescription description = descriptions.get(topic);
    if (description == null) {
      throw Problems.notFound("Topic not found", Map.of("topic", topic));
    }

    return description.partitions().stream()
        .map(info -> info.partition())
        .sorted()
        .toList();
  }

  @Override
  public Offset resolveOffset(String topic, int partition, OffsetBound bound) {
    if (!bound.isTimestamp()) {
      return bound.sentinel();
    }

    TopicPartition topicPartition = new TopicPartition(topic, partition);
    ListOffsetsOptions options = new ListOffsetsOptions(IsolationLevel.READ_COMMITTED)
        .timeoutMs(Math.toIntExact(ADMIN_TIMEOUT.toMillis()));

    ListOffsetsResultInfo info = await(
        adminClient.listOffsets(Map.of(topicPartition, OffsetSpec.forTimestamp(bound.timestampMillis())), options)
            .partitionResult(topicPartition),
        "listOffsets",
        Map.of("topic", topic, "partition", partition, "timestamp", bound.timestampMillis())
    );

    // no message at or after the timestamp yet
    if (info.offset() < 0) {
      return Offset.NEWEST;
    }
    return Offset.of(info.offset());
  }

  @Override
  public PartitionReader openPartitionReader(String topic, int partition, Offset from) {
    TopicPartition topicPartition = new TopicPartition(topic, partition);
    Consumer<byte[], byte[]> consumer = null;
    try {
      consumer = consumerFactory.create(topic, partition);
      consumer.assign(List.of(topicPartition));
      if (from.isOldest()) {
        consumer.seekToBeginning(List.of(topicPartition));
      } else if (from.isNewest()) {
        consumer.seekToEnd(List.of(topicPartition));
      } else {
        consumer.seek(topicPartition, from.value());
      }
      return new KafkaPartitionReader(consumer, topicPartition);
    } catch (KafkaException | IllegalStateException | IllegalArgumentException ex) {
      if (consumer != null) {
        consumer.close();
      }
      throw Problems.partitionUnavailable(
          "Unable to open partition",
          mergeContext(
              Map.of("topic", topic, "partition", partition, "offset", from.toString()),
              ex.getClass().getSimpleName(),
              ex.getMessage()
          ),
          ex
      );
    }
  }

  private <T> T await(KafkaFuture<T> future, String operation, Map<String, Object> context) {
    try {
      return future.get(ADMIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing " + operation, context);
    } catch (TimeoutException ex) {
      throw Problems.kafkaUnavailable(
          "Timed out contacting Kafka during " + operation,
          mergeContext(context, "TimeoutException", ex.getMessage())
      );
    } catch (ExecutionException ex) {
      throw translate(operation, ex.getCause(), context);
    }
  }

  private ProblemException translate(String operation, Throwable cause, Map<String, Object> context) {
    if (cause instanceof UnknownTopicOrPartitionException) {
      return Problems.notFound(
          "Kafka topic not found during " + operation,
          mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage())
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable(
          "Kafka operation failed: " + operation,
          mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage())
      );
    }
    return Problems.operationFailed(
        "Unexpected failure during " + operation,
        mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage())
    );
  }

  private Map<String, Object> mergeContext(Map<String, Object> base, String error, String message) {
    Map<String, Object> merged = new HashMap<>(base);
    merged.put("bootstrapServers", kafkaProperties.bootstrapServers());
    merged.put("error", error);
    if (message != null) {
      merged.put("message", message);
    }
    return Collections.unmodifiableMap(merged);
  }
}
