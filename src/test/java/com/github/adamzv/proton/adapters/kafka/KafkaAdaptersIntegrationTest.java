package com.github.adamzv.proton.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.proton.application.ConsumeTopicUseCase;
import com.github.adamzv.proton.application.ConsumptionMetrics;
import com.github.adamzv.proton.application.ConsumptionRun;
import com.github.adamzv.proton.application.OffsetResolver;
import com.github.adamzv.proton.domain.ConsumeSettings;
import com.github.adamzv.proton.domain.DecodedResult;
import com.github.adamzv.proton.domain.Offset;
import com.github.adamzv.proton.domain.OffsetBound;
import com.github.adamzv.proton.domain.TaskState;
import com.github.adamzv.proton.support.ApplicationConfig;
import com.github.adamzv.proton.support.KafkaProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
class KafkaAdaptersIntegrationTest {

  private static final DockerImageName KAFKA_IMAGE = DockerImageName.parse("confluentinc/cp-kafka:7.5.0");

  @Container
  static final KafkaContainer KAFKA = new KafkaContainer(KAFKA_IMAGE)
      .withReuse(false);

  private static AdminClient adminClient;
  private static KafkaProducer<byte[], byte[]> producer;
  private static KafkaBrokerClientAdapter brokerClient;

  @BeforeAll
  static void setUp() {
    ApplicationConfig config = new ApplicationConfig();
    KafkaProperties kafkaProperties = new KafkaProperties(KAFKA.getBootstrapServers(), "proton-itest");

    adminClient = config.adminClient(kafkaProperties);
    brokerClient = new KafkaBrokerClientAdapter(
        adminClient,
        config.partitionConsumerFactory(kafkaProperties),
        kafkaProperties
    );

    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.brokerAddresses());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    producer = new KafkaProducer<>(props);
  }

  @AfterAll
  static void tearDown() {
    if (producer != null) {
      producer.close(Duration.ofSeconds(1));
    }
    if (adminClient != null) {
      adminClient.close(Duration.ofSeconds(1));
    }
  }

  @Test
  void listsPartitionsInOrder() throws Exception {
    createTopic("partitions-demo", 3);

    assertEquals(List.of(0, 1, 2), brokerClient.listPartitions("partitions-demo"));
  }

  @Test
  void resolvesTimestampsToOffsets() throws Exception {
    String topic = "timestamps-demo";
    createTopic(topic, 1);
    send(topic, 0, 1_000L, "a", "first");
    send(topic, 0, 2_000L, "b", "second");

    assertEquals(Offset.of(0), brokerClient.resolveOffset(topic, 0, OffsetBound.at(500L)));
    assertEquals(Offset.of(1), brokerClient.resolveOffset(topic, 0, OffsetBound.at(1_500L)));
    assertEquals(Offset.NEWEST, brokerClient.resolveOffset(topic, 0, OffsetBound.at(9_000L)));
  }

  @Test
  void consumesEveryPartitionUpToResolvedEnd() throws Exception {
    String topic = "consume-demo";
    createTopic(topic, 2);
    for (int partition = 0; partition < 2; partition++) {
      send(topic, partition, 1_000L, "keep-" + partition, "one");
      send(topic, partition, 2_000L, "skip-" + partition, "two");
      send(topic, partition, 3_000L, "keep-" + partition, "three");
      send(topic, partition, 4_000L, "keep-" + partition, "four");
    }

    ConsumeTopicUseCase useCase = new ConsumeTopicUseCase(
        brokerClient,
        new OffsetResolver(brokerClient),
        new ConsumptionMetrics(new SimpleMeterRegistry())
    );
    List<DecodedResult> results = new CopyOnWriteArrayList<>();

    ConsumptionRun run = useCase.start(
        new ConsumeSettings(topic, OffsetBound.OLDEST, OffsetBound.at(3_000L), "^keep", false),
        payload -> new String(payload, StandardCharsets.UTF_8),
        results::add
    );

    assertTrue(run.awaitTermination(Duration.ofSeconds(30)));
    assertEquals(Map.of(0, TaskState.REACHED, 1, TaskState.REACHED), run.states());
    assertTrue(run.errors().isEmpty());
    assertEquals(4, results.size());
    for (DecodedResult result : results) {
      DecodedResult.Decoded decoded = assertInstanceOf(DecodedResult.Decoded.class, result);
      assertTrue(decoded.key().startsWith("keep-"));
      assertTrue(decoded.offset() <= 2);
    }
    assertEquals(6, useCase.summary(topic).consumed());
  }

  private static void createTopic(String topic, int partitions) throws Exception {
    adminClient.createTopics(List.of(new NewTopic(topic, partitions, (short) 1)))
        .all()
        .get(10, TimeUnit.SECONDS);
  }

  private static void send(String topic, int partition, long timestamp, String key, String value)
      throws Exception {
    producer.send(new ProducerRecord<>(
        topic,
        partition,
        timestamp,
        key.getBytes(StandardCharsets.UTF_8),
        value.getBytes(StandardCharsets.UTF_8)
    )).get(10, TimeUnit.SECONDS);
  }
}
