package com.github.adamzv.proton.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class ConsumptionMetrics {

  static final String CONSUMED = "proton.messages.consumed";
  static final String FILTERED = "proton.messages.filtered";
  static final String DECODED = "proton.messages.decoded";
  static final String DECODE_ERRORS = "proton.messages.decode.errors";

  private final MeterRegistry meterRegistry;

  public ConsumptionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void consumed(String topic, int partition) {
    counter(CONSUMED, topic, partition).increment();
  }

  public void filtered(String topic, int partition) {
    counter(FILTERED, topic, partition).increment();
  }

  public void decoded(String topic, int partition) {
    counter(DECODED, topic, partition).increment();
  }

  public void decodeFailed(String topic, int partition) {
    counter(DECODE_ERRORS, topic, partition).increment();
  }

  public Summary summary(String topic) {
    return new Summary(
        total(CONSUMED, topic),
        total(FILTERED, topic),
        total(DECODED, topic),
        total(DECODE_ERRORS, topic)
    );
  }

  private Counter counter(String name, String topic, int partition) {
    return Counter.builder(name)
        .tag("topic", topic)
        .tag("partition", Integer.toString(partition))
        .register(meterRegistry);
  }

  private long total(String name, String topic) {
    return (long) meterRegistry.find(name)
        .tag("topic", topic)
        .counters()
        .stream()
        .mapToDouble(Counter::count)
        .sum();
  }

  public record Summary(long consumed, long filtered, long decoded, long decodeErrors) {}
}
