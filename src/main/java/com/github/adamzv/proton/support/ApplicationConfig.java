package com.github.adamzv.proton.support;

import com.github.adamzv.proton.adapters.kafka.PartitionConsumerFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Properties;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.IsolationLevel;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    KafkaProperties.class,
    ConsumeProperties.class,
    SchemaProperties.class,
    FramingProperties.class
})
public class ApplicationConfig {

  private static final Duration CLIENT_TIMEOUT = Duration.ofSeconds(5);

  @Bean(destroyMethod = "close")
  public AdminClient adminClient(KafkaProperties kafkaProperties) {
    Properties props = new Properties();
    int timeoutMs = Math.toIntExact(CLIENT_TIMEOUT.toMillis());
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.brokerAddresses());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-admin");
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
    return AdminClient.create(props);
  }

  @Bean
  public PartitionConsumerFactory partitionConsumerFactory(KafkaProperties kafkaProperties) {
    return (topic, partition) -> {
      Properties props = new Properties();
      props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.brokerAddresses());
      props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-" + topic + "-" + partition);
      props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
      props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
      props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
      props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
      props.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, IsolationLevel.READ_COMMITTED.toString());
      return new KafkaConsumer<>(props);
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  public ConsoleStreams consoleStreams() {
    return ConsoleStreams.system();
  }
}
