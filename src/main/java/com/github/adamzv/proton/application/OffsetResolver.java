package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.Offset;
import com.github.adamzv.proton.domain.OffsetBound;
import com.github.adamzv.proton.domain.PartitionOffsetRange;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.BrokerClientPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OffsetResolver {

  private final BrokerClientPort brokerClient;

  public OffsetResolver(BrokerClientPort brokerClient) {
    this.brokerClient = brokerClient;
  }

  public List<PartitionOffsetRange> resolve(String topic, OffsetBound startBound, OffsetBound endBound) {
    List<Integer> partitions = listPartitions(topic);

    List<PartitionOffsetRange> ranges = new ArrayList<>(partitions.size());
    for (int partition : partitions.stream().sorted().distinct().toList()) {
      Offset start = resolveBound(topic, partition, startBound);
      Offset end = resolveBound(topic, partition, endBound);
      ranges.add(new PartitionOffsetRange(partition, start, end));
    }
    return List.copyOf(ranges);
  }

  private List<Integer> listPartitions(String topic) {
    try {
      return brokerClient.listPartitions(topic);
    } catch (ProblemException ex) {
      throw Problems.resolutionFailed(
          "Unable to list partitions",
          Map.of("topic", topic, "reason", String.valueOf(ex.code())),
          ex
      );
    }
  }

  private Offset resolveBound(String topic, int partition, OffsetBound bound) {
    if (!bound.isTimestamp()) {
      return bound.sentinel();
    }
    try {
      return brokerClient.resolveOffset(topic, partition, bound);
    } catch (ProblemException ex) {
      throw Problems.resolutionFailed(
          "Unable to resolve offset for timestamp",
          Map.of(
              "topic", topic,
              "partition", partition,
              "timestamp", bound.timestampMillis(),
              "reason", String.valueOf(ex.code())
          ),
          ex
      );
    }
  }
}
