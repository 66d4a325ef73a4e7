package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.ConsumeSettings;
import com.github.adamzv.proton.domain.PartitionOffsetRange;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.BrokerClientPort;
import com.github.adamzv.proton.ports.MessageSinkPort;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConsumeTopicUseCase {

  private static final Logger log = LoggerFactory.getLogger(ConsumeTopicUseCase.class);

  private final BrokerClientPort brokerClient;
  private final OffsetResolver offsetResolver;
  private final ConsumptionMetrics metrics;

  public ConsumeTopicUseCase(BrokerClientPort brokerClient, OffsetResolver offsetResolver,
                             ConsumptionMetrics metrics) {
    this.brokerClient = brokerClient;
    this.offsetResolver = offsetResolver;
    this.metrics = metrics;
  }

  /**
   * Validates the settings, resolves per-partition offsets and starts one task per partition. Every
   * startup failure is raised before any partition is consumed.
   */
  public ConsumptionRun start(ConsumeSettings settings, SchemaDecoderPort decoder, MessageSinkPort sink) {
    if (settings == null) {
      throw Problems.invalidArgument("Consume settings are required", Map.of());
    }
    String topic = settings.topic();
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
    if (decoder == null || sink == null) {
      throw Problems.invalidArgument("Decoder and sink are required", Map.of("topic", topic));
    }

    ConsumptionScheduler scheduler = new ConsumptionScheduler(settings, brokerClient, decoder, sink, metrics);

    if (settings.verbose()) {
      log.info("# Spinning the wheel... Connecting, gathering partitions data and stuff...");
    }
    List<PartitionOffsetRange> ranges = offsetResolver.resolve(topic, settings.start(), settings.end());
    if (ranges.isEmpty()) {
      throw Problems.notFound("Topic has no partitions", Map.of("topic", topic));
    }

    log.debug("consume_start topic={} partitions={} start={} end={} key={}",
        topic, ranges.size(), settings.start(), settings.end(), scheduler.keyFilter().pattern());
    return scheduler.start(ranges);
  }

  public ConsumptionMetrics.Summary summary(String topic) {
    return metrics.summary(topic);
  }
}
