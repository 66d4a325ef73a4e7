package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.ConsumeSettings;
import com.github.adamzv.proton.domain.PartitionOffsetRange;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.domain.TaskState;
import com.github.adamzv.proton.ports.BrokerClientPort;
import com.github.adamzv.proton.ports.MessageSinkPort;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ConsumptionScheduler {

  private final ConsumeSettings settings;
  private final KeyFilter keyFilter;
  private final BrokerClientPort brokerClient;
  private final SchemaDecoderPort decoder;
  private final MessageSinkPort sink;
  private final ConsumptionMetrics metrics;

  public ConsumptionScheduler(
      ConsumeSettings settings,
      BrokerClientPort brokerClient,
      SchemaDecoderPort decoder,
      MessageSinkPort sink,
      ConsumptionMetrics metrics) {
    this.settings = settings;
    this.keyFilter = KeyFilter.compile(settings.keyPattern());
    this.brokerClient = brokerClient;
    this.decoder = decoder;
    this.sink = sink;
    this.metrics = metrics;
  }

  public ConsumptionRun start(List<PartitionOffsetRange> ranges) {
    requireOneRangePerPartition(ranges);

    CancellationSignal cancellation = new CancellationSignal();
    BlockingQueue<ProblemException> errors = new LinkedBlockingQueue<>();
    Map<Integer, TaskState> states = new ConcurrentHashMap<>();
    ExecutorService executor = Executors.newFixedThreadPool(
        Math.max(1, ranges.size()),
        threadFactory(settings.topic())
    );

    List<CompletableFuture<Void>> tasks = new ArrayList<>(ranges.size());
    for (PartitionOffsetRange range : ranges) {
      states.put(range.partition(), TaskState.RUNNING);
      PartitionConsumptionTask task = new PartitionConsumptionTask(
          settings.topic(),
          range,
          brokerClient,
          keyFilter,
          decoder,
          sink,
          cancellation,
          errors::add,
          metrics,
          settings.verbose()
      );
      tasks.add(CompletableFuture.supplyAsync(task::run, executor)
          .handle((state, failure) -> {
            TaskState terminal = state;
            if (failure != null) {
              errors.add(unexpected(range, failure));
              terminal = TaskState.FAILED;
            }
            states.put(range.partition(), terminal);
            return null;
          }));
    }

    CompletableFuture<Void> completion = CompletableFuture
        .allOf(tasks.toArray(new CompletableFuture<?>[0]))
        .whenComplete((ignored, failure) -> executor.shutdown());

    return new ConsumptionRun(cancellation, errors, states, completion);
  }

  public KeyFilter keyFilter() {
    return keyFilter;
  }

  private void requireOneRangePerPartition(List<PartitionOffsetRange> ranges) {
    Set<Integer> seen = new HashSet<>();
    for (PartitionOffsetRange range : ranges) {
      if (!seen.add(range.partition())) {
        throw Problems.invalidArgument(
            "Duplicate offset range for partition",
            Map.of("topic", settings.topic(), "partition", range.partition())
        );
      }
    }
  }

  private ProblemException unexpected(PartitionOffsetRange range, Throwable failure) {
    Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
    if (cause instanceof ProblemException problem) {
      return problem;
    }
    return Problems.operationFailed(
        "Partition consumption failed",
        Map.of("topic", settings.topic(), "partition", range.partition()),
        cause
    );
  }

  private static ThreadFactory threadFactory(String topic) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "proton-" + topic + "-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }
}
