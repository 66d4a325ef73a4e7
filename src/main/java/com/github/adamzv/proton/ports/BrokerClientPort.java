package com.github.adamzv.proton.ports;

import com.github.adamzv.proton.domain.Offset;
import com.github.adamzv.proton.domain.OffsetBound;
import com.github.adamzv.proton.domain.ProblemException;
import java.util.List;

public interface BrokerClientPort {

  List<Integer> listPartitions(String topic) throws ProblemException;

  /**
   * Resolves a timestamp bound to the first offset at or after it. Answers {@link Offset#NEWEST} when the
   * partition holds no message that recent.
   */
  Offset resolveOffset(String topic, int partition, OffsetBound bound) throws ProblemException;

  PartitionReader openPartitionReader(String topic, int partition, Offset from) throws ProblemException;
}
