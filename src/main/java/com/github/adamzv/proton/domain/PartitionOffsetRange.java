package com.github.adamzv.proton.domain;

import java.util.Map;

public record PartitionOffsetRange(
    int partition,
    Offset start,
    Offset end
) {

  public PartitionOffsetRange {
    if (partition < 0) {
      throw Problems.invalidArgument("Partition must be non-negative", Map.of("partition", partition));
    }
    if (start == null || end == null) {
      throw Problems.invalidArgument("Start and end offsets are required", Map.of("partition", partition));
    }
  }

  public boolean hasConcreteEnd() {
    return end.isConcrete();
  }
}
