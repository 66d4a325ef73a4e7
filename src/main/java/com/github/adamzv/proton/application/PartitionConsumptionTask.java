package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.ConsumedMessage;
import com.github.adamzv.proton.domain.DecodedResult;
import com.github.adamzv.proton.domain.PartitionOffsetRange;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.domain.TaskState;
import com.github.adamzv.proton.ports.BrokerClientPort;
import com.github.adamzv.proton.ports.MessageSinkPort;
import com.github.adamzv.proton.ports.PartitionReader;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one partition from its start offset until the resolved end offset is processed or the run
 * is cancelled.
 */
final class PartitionConsumptionTask {

  private static final Logger log = LoggerFactory.getLogger(PartitionConsumptionTask.class);

  static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  private final String topic;
  private final PartitionOffsetRange range;
  private final BrokerClientPort brokerClient;
  private final KeyFilter keyFilter;
  private final SchemaDecoderPort decoder;
  private final MessageSinkPort sink;
  private final CancellationSignal cancellation;
  private final Consumer<ProblemException> errorReporter;
  private final ConsumptionMetrics metrics;
  private final boolean verbose;

  PartitionConsumptionTask(
      String topic,
      PartitionOffsetRange range,
      BrokerClientPort brokerClient,
      KeyFilter keyFilter,
      SchemaDecoderPort decoder,
      MessageSinkPort sink,
      CancellationSignal cancellation,
      Consumer<ProblemException> errorReporter,
      ConsumptionMetrics metrics,
      boolean verbose) {
    this.topic = topic;
    this.range = range;
    this.brokerClient = brokerClient;
    this.keyFilter = keyFilter;
    this.decoder = decoder;
    this.sink = sink;
    this.cancellation = cancellation;
    this.errorReporter = errorReporter;
    this.metrics = metrics;
    this.verbose = verbose;
  }

  TaskState run() {
    if (cancellation.isCancelled()) {
      return TaskState.CANCELLED;
    }

    PartitionReader reader = openReader();
    if (reader == null) {
      return TaskState.FAILED;
    }

    verbose("# Going to consume from {} until {}", describe(range.start().toString()),
        describe(range.end().toString()));

    try (reader; CancellationSignal.Registration ignored = cancellation.onCancel(reader::wakeup)) {
      return consume(reader);
    } catch (ProblemException ex) {
      errorReporter.accept(ex);
      return TaskState.FAILED;
    }
  }

  private PartitionReader openReader() {
    try {
      return brokerClient.openPartitionReader(topic, range.partition(), range.start());
    } catch (ProblemException ex) {
      errorReporter.accept(ex);
    } catch (RuntimeException ex) {
      errorReporter.accept(Problems.partitionUnavailable(
          "Unable to open partition reader",
          Map.of("topic", topic, "partition", range.partition()),
          ex
      ));
    }
    return null;
  }

  private TaskState consume(PartitionReader reader) {
    while (!cancellation.isCancelled()) {
      if (Thread.currentThread().isInterrupted()) {
        log.debug("partition_interrupted topic={} partition={}", topic, range.partition());
        return TaskState.CANCELLED;
      }
      for (ConsumedMessage message : reader.poll(POLL_TIMEOUT)) {
        if (cancellation.isCancelled()) {
          return TaskState.CANCELLED;
        }
        if (isPastEnd(message.offset())) {
          verbose("# Passed stop offset for {}: exiting", describe(range.end().toString()));
          return TaskState.REACHED;
        }

        process(message);

        if (isAtEnd(message.offset())) {
          verbose("# Reached stop offset for {}: exiting", describe(range.end().toString()));
          return TaskState.REACHED;
        }
        logIfCaughtUp(reader, message.offset());
      }
    }
    return TaskState.CANCELLED;
  }

  private void process(ConsumedMessage message) {
    metrics.consumed(topic, message.partition());
    if (!keyFilter.matches(message.key())) {
      metrics.filtered(topic, message.partition());
      return;
    }

    DecodedResult result;
    try {
      String text = decoder.decode(message.payload());
      result = new DecodedResult.Decoded(
          message.key() == null ? "" : new String(message.key(), StandardCharsets.UTF_8),
          text,
          topic,
          message.partition(),
          message.offset(),
          message.timestamp()
      );
      metrics.decoded(topic, message.partition());
    } catch (ProblemException ex) {
      result = new DecodedResult.DecodeError(topic, message.partition(), message.offset(), ex);
      metrics.decodeFailed(topic, message.partition());
    }

    if (!cancellation.isCancelled()) {
      sink.emit(result);
    }
  }

  private boolean isAtEnd(long offset) {
    return range.hasConcreteEnd() && offset == range.end().value();
  }

  private boolean isPastEnd(long offset) {
    return range.hasConcreteEnd() && offset > range.end().value();
  }

  private void logIfCaughtUp(PartitionReader reader, long offset) {
    if (!verbose) {
      return;
    }
    OptionalLong highWatermark = reader.highWatermark();
    if (highWatermark.isPresent() && offset + 1 == highWatermark.getAsLong()) {
      verbose("# Reached current end of {}, waiting for new messages", describe(Long.toString(offset)));
    }
  }

  private String describe(String offset) {
    return String.format("%s [%d] at offset %s", topic, range.partition(), offset);
  }

  private void verbose(String message, Object... args) {
    if (verbose) {
      log.info(message, args);
    }
  }
}
